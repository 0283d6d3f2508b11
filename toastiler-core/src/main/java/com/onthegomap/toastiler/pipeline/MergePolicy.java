package com.onthegomap.toastiler.pipeline;

import com.onthegomap.toastiler.geo.TilePos;
import com.onthegomap.toastiler.image.TileMerger;
import com.onthegomap.toastiler.image.TileMergers;
import java.util.Objects;

/**
 * How tiles above the deepest level are made.
 * <p>
 * When merging is enabled only the deepest level is sampled and each parent is reduced from its 4 children by
 * {@code merger}. When disabled every level is sampled directly and only the root is merged, with the average merger.
 */
public record MergePolicy(boolean enabled, TileMerger merger) {

  private static final MergePolicy AVERAGE = new MergePolicy(true, TileMergers.average());
  private static final MergePolicy DISABLED = new MergePolicy(false, TileMergers.average());

  public MergePolicy {
    Objects.requireNonNull(merger, "merger");
  }

  /** Merge with the 2x2 block average. */
  public static MergePolicy average() {
    return AVERAGE;
  }

  /** Sample every level. */
  public static MergePolicy disabled() {
    return DISABLED;
  }

  public static MergePolicy custom(TileMerger merger) {
    return new MergePolicy(true, merger);
  }

  /** Returns the merger that builds {@code parent} from its children. */
  public TileMerger mergerFor(TilePos parent) {
    return enabled ? merger : TileMergers.average();
  }
}
