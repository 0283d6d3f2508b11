package com.onthegomap.toastiler.pipeline;

import static com.google.common.base.Preconditions.checkArgument;

import com.onthegomap.toastiler.files.MissingTilePolicy;
import com.onthegomap.toastiler.files.TileDirectory;
import com.onthegomap.toastiler.files.TileSchemeEncoding;
import com.onthegomap.toastiler.geo.Toast;
import com.onthegomap.toastiler.geo.ToastTile;
import com.onthegomap.toastiler.image.TileImage;
import com.onthegomap.toastiler.image.TileImageFormat;
import com.onthegomap.toastiler.traverse.TileFilter;
import com.onthegomap.toastiler.traverse.TileFilters;
import com.onthegomap.toastiler.traverse.ToastTraversal;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.function.BooleanSupplier;
import java.util.function.Consumer;
import javax.annotation.concurrent.NotThreadSafe;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Lazily produces every tile of a pyramid, deepest first.
 * <p>
 * Tiles are visited by a {@link ToastTraversal}. Each visited tile gets its image from the {@link SamplerSource}
 * unless a restart directory already holds it, then goes through {@link TrickleUp} which emits it and builds its
 * ancestors. In base-level-only mode visited tiles with data are emitted directly and nothing is merged.
 * <p>
 * The individual steps ({@link #traversal()}, {@link #render(ToastTile)}, {@link #reduce}) are public so a
 * multi-threaded runner can spread rendering over several threads while reducing in one.
 */
@NotThreadSafe
public class ToastPipeline implements Iterator<RenderedTile> {

  private static final Logger LOGGER = LoggerFactory.getLogger(ToastPipeline.class);

  private final SamplerSource source;
  private final int depth;
  private final boolean baseLevelOnly;
  private final boolean merging;
  private final TileDirectory restart;
  private final TileFilter filter;
  private final int tileSize;
  private final TileImageFormat format;
  private final TileSchemeEncoding scheme;
  private final BooleanSupplier cancelled;
  private final TrickleUp trickleUp;
  private final Deque<RenderedTile> ready = new ArrayDeque<>();
  private Iterator<ToastTile> tiles = null;

  private ToastPipeline(Builder builder) {
    this.source = Objects.requireNonNull(builder.source, "source");
    this.depth = builder.depth;
    this.baseLevelOnly = builder.baseLevelOnly;
    // base level only never merges, but still only visits the deepest level
    this.merging = builder.merge.enabled() || builder.baseLevelOnly;
    this.restart = builder.restart;
    this.filter = builder.filter;
    this.tileSize = builder.tileSize;
    this.format = builder.format;
    this.scheme = builder.scheme;
    this.cancelled = builder.cancelled;
    this.trickleUp = new TrickleUp(depth, builder.top, builder.merge, new MergeAccumulator(), scheme,
      format.extension());
  }

  public static Builder builder(SamplerSource source, int depth) {
    return new Builder(source, depth);
  }

  /** Returns a new traversal over the tiles this pipeline visits. */
  public ToastTraversal traversal() {
    return new ToastTraversal(Math.max(depth, 1), merging, filter, cancelled);
  }

  /**
   * Returns the image for a visited tile: read from the source directory, {@code null} if the restart directory
   * already has it, or sampled.
   */
  public TileImage render(ToastTile tile) {
    if (source instanceof SamplerSource.ExistingDirectory existing) {
      return existing.directory().read(tile.pos(), format, MissingTilePolicy.NONE);
    } else if (restart != null && restart.exists(tile.pos(), format)) {
      LOGGER.trace("Skipping {}, already exists", tile.pos());
      return null;
    } else if (source instanceof SamplerSource.Callback callback) {
      return callback.sampler().sample(Toast.sampleGrid(tile, tileSize));
    }
    throw new IllegalStateException("Unknown sampler source " + source);
  }

  /** Passes the image of a visited tile, and any tiles it completes, to {@code emit}. */
  public void reduce(ToastTile tile, TileImage image, Consumer<RenderedTile> emit) {
    if (baseLevelOnly) {
      if (image != null) {
        emit.accept(new RenderedTile(tile.pos(), scheme.encode(tile.pos(), format.extension()), image));
      }
    } else {
      trickleUp.add(tile.pos(), image, emit);
    }
  }

  public MergeAccumulator accumulator() {
    return trickleUp.accumulator();
  }

  @Override
  public boolean hasNext() {
    if (tiles == null) {
      tiles = traversal();
    }
    while (ready.isEmpty() && tiles.hasNext()) {
      ToastTile tile = tiles.next();
      reduce(tile, render(tile), ready::add);
    }
    return !ready.isEmpty();
  }

  @Override
  public RenderedTile next() {
    if (!hasNext()) {
      throw new NoSuchElementException();
    }
    return ready.poll();
  }

  /** Settings for a {@link ToastPipeline}, all optional except the source and depth. */
  public static class Builder {

    private final SamplerSource source;
    private final int depth;
    private int top = 0;
    private MergePolicy merge = MergePolicy.average();
    private boolean baseLevelOnly = false;
    private TileDirectory restart = null;
    private TileFilter filter = TileFilters.all();
    private int tileSize = Toast.DEFAULT_TILE_SIZE;
    private TileImageFormat format = TileImageFormat.PNG;
    private TileSchemeEncoding scheme = TileSchemeEncoding.defaultScheme();
    private BooleanSupplier cancelled = () -> false;

    private Builder(SamplerSource source, int depth) {
      checkArgument(depth >= 0, "depth must be >= 0, got %s", depth);
      this.source = source;
      this.depth = depth;
    }

    /** Shallowest level to build, 0 for the whole pyramid. */
    public Builder setTop(int top) {
      this.top = top;
      return this;
    }

    public Builder setMergePolicy(MergePolicy merge) {
      this.merge = Objects.requireNonNull(merge);
      return this;
    }

    /** Only produce the deepest level. */
    public Builder setBaseLevelOnly(boolean baseLevelOnly) {
      this.baseLevelOnly = baseLevelOnly;
      return this;
    }

    /** Skip sampling tiles that already exist in {@code restart}, or {@code null} to always sample. */
    public Builder setRestart(TileDirectory restart) {
      this.restart = restart;
      return this;
    }

    public Builder setFilter(TileFilter filter) {
      this.filter = filter == null ? TileFilters.all() : filter;
      return this;
    }

    public Builder setTileSize(int tileSize) {
      checkArgument(tileSize > 0 && Integer.bitCount(tileSize) == 1, "tile size must be a power of 2, got %s",
        tileSize);
      this.tileSize = tileSize;
      return this;
    }

    public Builder setFormat(TileImageFormat format) {
      this.format = Objects.requireNonNull(format);
      return this;
    }

    public Builder setScheme(TileSchemeEncoding scheme) {
      this.scheme = Objects.requireNonNull(scheme);
      return this;
    }

    /** Stop visiting tiles once {@code cancelled} returns true. */
    public Builder setCancelled(BooleanSupplier cancelled) {
      this.cancelled = cancelled == null ? () -> false : cancelled;
      return this;
    }

    public ToastPipeline build() {
      return new ToastPipeline(this);
    }
  }
}
