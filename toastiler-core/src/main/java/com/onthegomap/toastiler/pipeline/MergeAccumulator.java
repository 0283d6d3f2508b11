package com.onthegomap.toastiler.pipeline;

import com.onthegomap.toastiler.geo.TilePos;
import com.onthegomap.toastiler.image.TileImage;
import com.onthegomap.toastiler.image.TileMerger;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import net.jcip.annotations.GuardedBy;
import net.jcip.annotations.ThreadSafe;

/**
 * Holds child tiles until all 4 children of a parent have arrived.
 * <p>
 * An entry is created when the first child of a parent arrives and removed, atomically with the 4th arrival, when the
 * complete {@link Quad} is handed back to the caller. A {@code null} image counts as an arrival with no data.
 */
@ThreadSafe
public class MergeAccumulator {

  @GuardedBy("this")
  private final Map<TilePos, Slots> pending = new HashMap<>();
  @GuardedBy("this")
  private int buffered = 0;
  @GuardedBy("this")
  private int maxBuffered = 0;

  private static final class Slots {
    final TileImage[] images = new TileImage[4];
    final boolean[] filled = new boolean[4];
    int count = 0;
  }

  /**
   * Records that the child in {@code quadrant} (0 top-left, 1 top-right, 2 bottom-left, 3 bottom-right) of
   * {@code parent} is {@code image}.
   *
   * @return the complete set of children if this was the 4th, otherwise empty
   * @throws IllegalStateException if that quadrant already arrived
   */
  public synchronized Optional<Quad> register(TilePos parent, int quadrant, TileImage image) {
    if (quadrant < 0 || quadrant > 3) {
      throw new IllegalArgumentException("quadrant must be 0-3, got " + quadrant);
    }
    Slots slots = pending.computeIfAbsent(parent, p -> new Slots());
    if (slots.filled[quadrant]) {
      throw new IllegalStateException("quadrant " + quadrant + " of " + parent + " registered twice");
    }
    slots.filled[quadrant] = true;
    slots.images[quadrant] = image;
    slots.count++;
    buffered++;
    maxBuffered = Math.max(maxBuffered, buffered);
    if (slots.count < 4) {
      return Optional.empty();
    }
    pending.remove(parent);
    buffered -= 4;
    return Optional.of(new Quad(parent, slots.images[0], slots.images[1], slots.images[2], slots.images[3]));
  }

  /** Returns the number of child images currently held. */
  public synchronized int bufferedImages() {
    return buffered;
  }

  /** Returns the largest number of child images held at once, counting the 4th arrival of each parent. */
  public synchronized int maxBufferedImages() {
    return maxBuffered;
  }

  /** Returns the number of parents that are waiting for more children. */
  public synchronized int pendingParents() {
    return pending.size();
  }

  /**
   * The 4 children of {@code parent}, any of which may be {@code null}.
   */
  public record Quad(TilePos parent, TileImage ul, TileImage ur, TileImage bl, TileImage br) {

    /**
     * Builds the parent image from the children.
     * <p>
     * Returns {@code null} if every child is {@code null}. Otherwise missing children are replaced with all-zero
     * images like the present ones, and the 2x2 mosaic is passed to {@code merger}.
     */
    public TileImage merge(TileMerger merger) {
      TileImage template = ul != null ? ul : ur != null ? ur : bl != null ? bl : br;
      if (template == null) {
        return null;
      }
      return merger.merge(TileImage.mosaic(
        orZeros(ul, template),
        orZeros(ur, template),
        orZeros(bl, template),
        orZeros(br, template)
      ));
    }

    private static TileImage orZeros(TileImage image, TileImage template) {
      return image != null ? image : TileImage.zerosLike(template);
    }
  }
}
