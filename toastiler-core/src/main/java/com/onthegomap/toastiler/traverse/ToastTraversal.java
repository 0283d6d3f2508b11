package com.onthegomap.toastiler.traverse;

import static com.google.common.base.Preconditions.checkArgument;

import com.onthegomap.toastiler.geo.Toast;
import com.onthegomap.toastiler.geo.ToastTile;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.function.BooleanSupplier;
import javax.annotation.concurrent.NotThreadSafe;

/**
 * Lazily walks the TOAST quadtree from the 4 base tiles down to {@code maxDepth}, emitting deepest tiles first.
 * <p>
 * Each accepted tile is emitted after all of its children (postfix order). A tile rejected by the filter is skipped
 * together with its subtree. With {@code bottomOnly} only tiles at {@code maxDepth} are emitted. The depth-0 root is
 * never emitted.
 */
@NotThreadSafe
public class ToastTraversal implements Iterator<ToastTile> {

  private final int maxDepth;
  private final boolean bottomOnly;
  private final TileFilter filter;
  private final BooleanSupplier cancelled;
  private final Deque<Frame> stack = new ArrayDeque<>();
  private ToastTile next = null;
  private boolean done = false;

  private record Frame(ToastTile tile, boolean expanded) {}

  /**
   * @param maxDepth   deepest level to visit, at least 1
   * @param bottomOnly only emit tiles at {@code maxDepth}
   * @param filter     tiles to visit
   * @param cancelled  checked before each emission, iteration ends once it returns true
   */
  public ToastTraversal(int maxDepth, boolean bottomOnly, TileFilter filter, BooleanSupplier cancelled) {
    checkArgument(maxDepth >= 1, "max depth must be >= 1, got %s", maxDepth);
    this.maxDepth = maxDepth;
    this.bottomOnly = bottomOnly;
    this.filter = filter == null ? TileFilters.all() : filter;
    this.cancelled = cancelled == null ? () -> false : cancelled;
    List<ToastTile> base = Toast.BASE_TILES;
    for (int i = base.size() - 1; i >= 0; i--) {
      stack.push(new Frame(base.get(i), false));
    }
  }

  public ToastTraversal(int maxDepth, boolean bottomOnly, TileFilter filter) {
    this(maxDepth, bottomOnly, filter, null);
  }

  public ToastTraversal(int maxDepth, boolean bottomOnly) {
    this(maxDepth, bottomOnly, null, null);
  }

  private ToastTile advance() {
    while (!stack.isEmpty()) {
      Frame frame = stack.pop();
      ToastTile tile = frame.tile;
      int n = tile.pos().n();
      if (frame.expanded) {
        if (n == maxDepth || !bottomOnly) {
          return tile;
        }
      } else if (filter.accept(tile)) {
        if (n < maxDepth) {
          stack.push(new Frame(tile, true));
          List<ToastTile> children = tile.subdivide();
          for (int i = children.size() - 1; i >= 0; i--) {
            stack.push(new Frame(children.get(i), false));
          }
        } else {
          return tile;
        }
      }
    }
    return null;
  }

  @Override
  public boolean hasNext() {
    if (done) {
      return false;
    }
    if (next == null) {
      if (cancelled.getAsBoolean()) {
        done = true;
        stack.clear();
        return false;
      }
      next = advance();
      if (next == null) {
        done = true;
      }
    }
    return next != null;
  }

  @Override
  public ToastTile next() {
    if (!hasNext()) {
      throw new NoSuchElementException();
    }
    ToastTile result = next;
    next = null;
    return result;
  }
}
