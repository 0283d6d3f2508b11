package com.onthegomap.toastiler.geo;

import static com.google.common.base.Preconditions.checkArgument;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * The address of a tile in a TOAST pyramid: depth {@code n} and coordinates {@code 0 <= x, y < 2^n}.
 * <p>
 * Depth 0 is the single root tile, depth 1 holds the four base tiles of the projection.
 */
public record TilePos(int n, int x, int y) implements Comparable<TilePos> {

  /** Deepest level where coordinates still fit in an int. */
  public static final int MAX_DEPTH = 30;
  public static final TilePos ROOT = new TilePos(0, 0, 0);

  public TilePos {
    checkArgument(n >= 0 && n <= MAX_DEPTH, "depth must be in [0, %s], got %s", MAX_DEPTH, n);
    int size = 1 << n;
    checkArgument(x >= 0 && x < size && y >= 0 && y < size, "invalid tile position %s/%s/%s", n, x, y);
  }

  /**
   * Parses a position from {@code n/x/y}.
   *
   * @throws IllegalArgumentException if the string is not 3 integers or does not describe a valid tile
   */
  public static TilePos parse(String nxy) {
    String[] parts = nxy.trim().split("[/,\\s]+");
    checkArgument(parts.length == 3, "expected n/x/y, got %s", nxy);
    try {
      return new TilePos(Integer.parseInt(parts[0]), Integer.parseInt(parts[1]), Integer.parseInt(parts[2]));
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("expected n/x/y, got " + nxy, e);
    }
  }

  /** Returns the 4 tiles one level deeper, in top-left, top-right, bottom-left, bottom-right order. */
  public List<TilePos> children() {
    int cn = n + 1;
    int cx = x * 2;
    int cy = y * 2;
    return List.of(
      new TilePos(cn, cx, cy),
      new TilePos(cn, cx + 1, cy),
      new TilePos(cn, cx, cy + 1),
      new TilePos(cn, cx + 1, cy + 1)
    );
  }

  /**
   * Returns the tile one level up and where this tile sits inside it.
   *
   * @throws IllegalArgumentException for the root tile
   */
  public Parent parent() {
    checkArgument(n > 0, "the root tile has no parent");
    return new Parent(new TilePos(n - 1, x / 2, y / 2), x % 2, y % 2);
  }

  /**
   * Returns true if this tile is {@code shallower} or lies inside it.
   *
   * @throws IllegalArgumentException if {@code shallower} is deeper than this tile
   */
  public boolean isDescendantOf(TilePos shallower) {
    checkArgument(n >= shallower.n, "%s is deeper than %s", shallower, this);
    int levels = n - shallower.n;
    return (x >> levels) == shallower.x && (y >> levels) == shallower.y;
  }

  /** Returns {@code n/x/y}. */
  public String toNxy() {
    return n + "/" + x + "/" + y;
  }

  @Override
  public int compareTo(TilePos o) {
    int result = Integer.compare(n, o.n);
    if (result == 0) {
      result = Integer.compare(y, o.y);
    }
    if (result == 0) {
      result = Integer.compare(x, o.x);
    }
    return result;
  }

  /**
   * Returns every position from the root down to {@code depth} in postfix order: the 4 children of a tile, each with
   * its own subtree, come before the tile itself, and the root comes last.
   */
  public static Iterator<TilePos> generatePostfix(int depth) {
    checkArgument(depth >= 0 && depth <= MAX_DEPTH, "invalid depth %s", depth);
    return new Iterator<>() {
      // entries are visited once on the way down (expanded=false) and once on the way up
      private final Deque<TilePos> stack = new ArrayDeque<>(List.of(ROOT));
      private final Deque<Boolean> expanded = new ArrayDeque<>(List.of(false));

      @Override
      public boolean hasNext() {
        return !stack.isEmpty();
      }

      @Override
      public TilePos next() {
        if (stack.isEmpty()) {
          throw new NoSuchElementException();
        }
        while (true) {
          TilePos top = stack.peek();
          if (expanded.peek() || top.n >= depth) {
            stack.pop();
            expanded.pop();
            return top;
          }
          expanded.pop();
          expanded.push(true);
          List<TilePos> children = top.children();
          for (int i = children.size() - 1; i >= 0; i--) {
            stack.push(children.get(i));
            expanded.push(false);
          }
        }
      }
    };
  }

  /**
   * A tile's parent with the quadrant ({@code 0} or {@code 1} on each axis) of the child inside it.
   */
  public record Parent(TilePos pos, int quadrantX, int quadrantY) {

    /** Returns {@code quadrantX + 2 * quadrantY}: 0 top-left, 1 top-right, 2 bottom-left, 3 bottom-right. */
    public int quadrant() {
      return quadrantX + 2 * quadrantY;
    }
  }
}
