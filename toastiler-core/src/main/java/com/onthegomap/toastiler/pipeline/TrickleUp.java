package com.onthegomap.toastiler.pipeline;

import static com.google.common.base.Preconditions.checkArgument;

import com.onthegomap.toastiler.files.TileSchemeEncoding;
import com.onthegomap.toastiler.geo.TilePos;
import com.onthegomap.toastiler.image.TileImage;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Propagates each finished tile up the pyramid: emits it, then hands it to its parent, and when a parent has all 4
 * children merges them and repeats with the parent.
 */
public class TrickleUp {

  private final int depth;
  private final int top;
  private final MergePolicy merge;
  private final MergeAccumulator accumulator;
  private final TileSchemeEncoding scheme;
  private final String extension;

  /**
   * @param depth       deepest level that is emitted
   * @param top         shallowest level to build, propagation stops there
   * @param merge       how parents are built from their children
   * @param accumulator where children wait for their siblings
   * @param scheme      layout used to name emitted tiles
   * @param extension   file extension of emitted tiles
   */
  public TrickleUp(int depth, int top, MergePolicy merge, MergeAccumulator accumulator, TileSchemeEncoding scheme,
    String extension) {
    checkArgument(top >= 0 && top <= depth, "top %s must be between 0 and depth %s", top, depth);
    this.depth = depth;
    this.top = top;
    this.merge = merge;
    this.accumulator = accumulator;
    this.scheme = scheme;
    this.extension = extension;
  }

  /**
   * Accepts the image of {@code pos} and passes it, plus every ancestor it completes, to {@code emit}.
   * <p>
   * Tiles deeper than {@code depth} are not emitted but still feed their parents.
   */
  public void add(TilePos pos, TileImage image, Consumer<RenderedTile> emit) {
    while (true) {
      if (pos.n() <= depth) {
        emit.accept(new RenderedTile(pos, scheme.encode(pos, extension), image));
      }
      if (pos.n() <= top) {
        return;
      }
      if (!merge.enabled() && pos.n() > 1) {
        return;
      }
      TilePos.Parent parent = pos.parent();
      Optional<MergeAccumulator.Quad> quad = accumulator.register(parent.pos(), parent.quadrant(), image);
      if (quad.isEmpty()) {
        return;
      }
      image = quad.get().merge(merge.mergerFor(parent.pos()));
      pos = parent.pos();
    }
  }

  public MergeAccumulator accumulator() {
    return accumulator;
  }
}
