package com.onthegomap.toastiler.geo;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

class TilePosTest {

  @ParameterizedTest
  @CsvSource({
    "1, 0, 0",
    "1, 1, 1",
    "2, 3, 1",
    "5, 17, 30",
    "12, 3837, 1918",
  })
  void testParentChildRoundTrip(int n, int x, int y) {
    TilePos pos = new TilePos(n, x, y);
    TilePos.Parent parent = pos.parent();
    assertEquals(n - 1, parent.pos().n());
    assertEquals(pos, parent.pos().children().get(parent.quadrant()));
    assertEquals(x % 2, parent.quadrantX());
    assertEquals(y % 2, parent.quadrantY());
  }

  @Test
  void testChildrenOrder() {
    assertEquals(List.of(
      new TilePos(2, 2, 0),
      new TilePos(2, 3, 0),
      new TilePos(2, 2, 1),
      new TilePos(2, 3, 1)
    ), new TilePos(1, 1, 0).children());
  }

  @Test
  void testRootHasNoParent() {
    assertThrows(IllegalArgumentException.class, TilePos.ROOT::parent);
  }

  @Test
  void testInvalidPositions() {
    assertThrows(IllegalArgumentException.class, () -> new TilePos(-1, 0, 0));
    assertThrows(IllegalArgumentException.class, () -> new TilePos(1, 2, 0));
    assertThrows(IllegalArgumentException.class, () -> new TilePos(1, 0, -1));
  }

  @Test
  void testIsDescendantOf() {
    TilePos region = new TilePos(1, 1, 0);
    assertTrue(region.isDescendantOf(region));
    assertTrue(new TilePos(3, 7, 3).isDescendantOf(region));
    assertTrue(new TilePos(3, 7, 3).isDescendantOf(TilePos.ROOT));
    assertFalse(new TilePos(3, 3, 3).isDescendantOf(region));
    assertThrows(IllegalArgumentException.class, () -> region.isDescendantOf(new TilePos(2, 0, 0)));
  }

  @Test
  void testParse() {
    assertEquals(new TilePos(3, 7, 3), TilePos.parse("3/7/3"));
    assertEquals(new TilePos(3, 7, 3), TilePos.parse(" 3, 7, 3 "));
    assertEquals("3/7/3", new TilePos(3, 7, 3).toNxy());
    assertThrows(IllegalArgumentException.class, () -> TilePos.parse("3/7"));
    assertThrows(IllegalArgumentException.class, () -> TilePos.parse("a/b/c"));
  }

  @Test
  void testOrdering() {
    List<TilePos> sorted = new ArrayList<>(List.of(
      new TilePos(1, 1, 1),
      new TilePos(0, 0, 0),
      new TilePos(1, 1, 0),
      new TilePos(1, 0, 1)
    ));
    sorted.sort(null);
    assertEquals(List.of(
      new TilePos(0, 0, 0),
      new TilePos(1, 1, 0),
      new TilePos(1, 0, 1),
      new TilePos(1, 1, 1)
    ), sorted);
  }

  @ParameterizedTest
  @ValueSource(ints = {0, 1, 2, 4})
  void testGeneratePostfix(int depth) {
    List<TilePos> all = new ArrayList<>();
    TilePos.generatePostfix(depth).forEachRemaining(all::add);
    assertEquals(Toast.tileCount(depth), all.size());
    assertEquals(all.size(), new HashSet<>(all).size());
    assertEquals(TilePos.ROOT, all.get(all.size() - 1));
    for (int i = 0; i < all.size(); i++) {
      TilePos pos = all.get(i);
      if (pos.n() < depth) {
        // all 4 children come before their parent
        for (TilePos child : pos.children()) {
          assertTrue(all.indexOf(child) < i, child + " after " + pos);
        }
      }
    }
  }

  @Test
  void testGeneratePostfixStartsDeepest() {
    var iter = TilePos.generatePostfix(2);
    assertEquals(new TilePos(2, 0, 0), iter.next());
    assertEquals(new TilePos(2, 1, 0), iter.next());
    assertEquals(new TilePos(2, 0, 1), iter.next());
    assertEquals(new TilePos(2, 1, 1), iter.next());
    assertEquals(new TilePos(1, 0, 0), iter.next());
  }
}
