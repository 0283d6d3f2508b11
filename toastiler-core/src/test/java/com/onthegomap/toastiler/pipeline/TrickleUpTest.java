package com.onthegomap.toastiler.pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.onthegomap.toastiler.files.TileSchemeEncoding;
import com.onthegomap.toastiler.geo.TilePos;
import com.onthegomap.toastiler.image.ImageMode;
import com.onthegomap.toastiler.image.TileImage;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class TrickleUpTest {

  private final List<RenderedTile> emitted = new ArrayList<>();

  private TrickleUp trickleUp(int depth, int top, MergePolicy merge) {
    return new TrickleUp(depth, top, merge, new MergeAccumulator(), TileSchemeEncoding.defaultScheme(), "png");
  }

  private static TileImage constant(double value) {
    return TileImage.filled(ImageMode.U8, 2, 2, value);
  }

  private List<TilePos> emittedPositions() {
    return emitted.stream().map(RenderedTile::pos).toList();
  }

  @Test
  void testCascadesToRoot() {
    TrickleUp reducer = trickleUp(1, 0, MergePolicy.average());
    reducer.add(new TilePos(1, 0, 0), constant(10), emitted::add);
    reducer.add(new TilePos(1, 1, 0), constant(20), emitted::add);
    reducer.add(new TilePos(1, 0, 1), constant(30), emitted::add);
    reducer.add(new TilePos(1, 1, 1), constant(40), emitted::add);
    assertEquals(List.of(
      new TilePos(1, 0, 0),
      new TilePos(1, 1, 0),
      new TilePos(1, 0, 1),
      new TilePos(1, 1, 1),
      TilePos.ROOT
    ), emittedPositions());
    RenderedTile root = emitted.get(4);
    assertEquals("0/0/0_0.png", root.path());
    assertEquals(10, root.image().get(0, 0));
    assertEquals(20, root.image().get(1, 0));
    assertEquals(30, root.image().get(0, 1));
    assertEquals(40, root.image().get(1, 1));
  }

  @Test
  void testStopsAtTop() {
    TrickleUp reducer = trickleUp(2, 1, MergePolicy.average());
    for (TilePos child : new TilePos(1, 0, 0).children()) {
      reducer.add(child, constant(1), emitted::add);
    }
    assertEquals(5, emitted.size());
    assertEquals(new TilePos(1, 0, 0), emitted.get(4).pos());
    assertEquals(0, reducer.accumulator().pendingParents());
  }

  @Test
  void testTopEqualsDepthOnlyEmits() {
    TrickleUp reducer = trickleUp(2, 2, MergePolicy.average());
    reducer.add(new TilePos(2, 0, 0), constant(1), emitted::add);
    assertEquals(List.of(new TilePos(2, 0, 0)), emittedPositions());
    assertEquals(0, reducer.accumulator().pendingParents());
  }

  @Test
  void testMergeDisabledOnlyBuildsRoot() {
    TrickleUp reducer = trickleUp(2, 0, MergePolicy.disabled());
    reducer.add(new TilePos(2, 0, 0), constant(1), emitted::add);
    assertEquals(0, reducer.accumulator().pendingParents());
    for (TilePos base : TilePos.ROOT.children()) {
      reducer.add(base, constant(8), emitted::add);
    }
    assertEquals(new TilePos(2, 0, 0), emitted.get(0).pos());
    RenderedTile root = emitted.get(emitted.size() - 1);
    assertEquals(TilePos.ROOT, root.pos());
    assertEquals(8, root.image().get(1, 1));
  }

  @Test
  void testAllAbsentChildrenGiveAbsentParent() {
    TrickleUp reducer = trickleUp(1, 0, MergePolicy.average());
    for (TilePos base : TilePos.ROOT.children()) {
      reducer.add(base, null, emitted::add);
    }
    assertEquals(5, emitted.size());
    assertNull(emitted.get(4).image());
  }

  @Test
  void testDeeperTilesFeedParentsWithoutEmitting() {
    TrickleUp reducer = trickleUp(0, 0, MergePolicy.average());
    for (TilePos base : TilePos.ROOT.children()) {
      reducer.add(base, constant(4), emitted::add);
    }
    assertEquals(List.of(TilePos.ROOT), emittedPositions());
  }

  @Test
  void testCustomMerger() {
    TrickleUp reducer = trickleUp(1, 0, MergePolicy.custom(mosaic -> constant(mosaic.width())));
    for (TilePos base : TilePos.ROOT.children()) {
      reducer.add(base, constant(4), emitted::add);
    }
    assertEquals(4, emitted.get(4).image().get(0, 0));
  }

  @Test
  void testInvalidTop() {
    assertThrows(IllegalArgumentException.class, () -> trickleUp(1, 2, MergePolicy.average()));
    assertThrows(IllegalArgumentException.class, () -> trickleUp(1, -1, MergePolicy.average()));
  }
}
