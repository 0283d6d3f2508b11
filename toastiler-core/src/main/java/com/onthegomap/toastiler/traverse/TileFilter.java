package com.onthegomap.toastiler.traverse;

import com.onthegomap.toastiler.geo.ToastTile;

/**
 * Decides whether a tile, and everything beneath it, should be visited.
 * <p>
 * Rejecting a tile skips its whole subtree, so a filter must never reject a tile that has an accepted descendant.
 */
@FunctionalInterface
public interface TileFilter {

  boolean accept(ToastTile tile);

  /** Returns a filter that only accepts tiles both this and {@code other} accept. */
  default TileFilter and(TileFilter other) {
    return tile -> accept(tile) && other.accept(tile);
  }
}
