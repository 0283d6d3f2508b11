package com.onthegomap.toastiler;

import com.onthegomap.toastiler.config.Arguments;
import com.onthegomap.toastiler.config.SkyBounds;
import com.onthegomap.toastiler.config.ToastilerConfig;
import com.onthegomap.toastiler.files.TileDirectory;
import com.onthegomap.toastiler.files.TileSchemeEncoding;
import com.onthegomap.toastiler.geo.Toast;
import com.onthegomap.toastiler.geo.TilePos;
import com.onthegomap.toastiler.geo.ToastTile;
import com.onthegomap.toastiler.image.TileImage;
import com.onthegomap.toastiler.metadata.PyramidMetadata;
import com.onthegomap.toastiler.metadata.WtmlDescriptor;
import com.onthegomap.toastiler.pipeline.MergePolicy;
import com.onthegomap.toastiler.pipeline.RenderedTile;
import com.onthegomap.toastiler.pipeline.SamplerSource;
import com.onthegomap.toastiler.pipeline.TileSampler;
import com.onthegomap.toastiler.pipeline.ToastPipeline;
import com.onthegomap.toastiler.stats.Counter;
import com.onthegomap.toastiler.stats.ProgressLoggers;
import com.onthegomap.toastiler.stats.Stats;
import com.onthegomap.toastiler.stats.Timers;
import com.onthegomap.toastiler.traverse.TileFilter;
import com.onthegomap.toastiler.util.FileUtils;
import com.onthegomap.toastiler.worker.Worker;
import com.onthegomap.toastiler.worker.WorkerPipeline;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * High-level API for building a TOAST tile pyramid that wires together the sampler, traversal, merging, and tile
 * writing.
 * <p>
 * Example usage:
 *
 * <pre>
 * {@code
 * Toastiler.create(arguments)
 *   .setSampler(PlateCarreeSampler.fromFile(Path.of("world.png")))
 *   .setOutput(Path.of("data", "toast"))
 *   .setWtmlOutput(Path.of("data", "toast.wtml"), "http://example.com/toast")
 *   .run();
 * }
 * </pre>
 */
public class Toastiler {

  private static final Logger LOGGER = LoggerFactory.getLogger(Toastiler.class);
  private static final int QUEUE_SIZE = 1_000;

  private final Arguments arguments;
  private final Stats stats;
  private final Timers.Finishable overallTimer;
  private final ToastilerConfig config;
  private final AtomicBoolean cancelled = new AtomicBoolean(false);
  private SamplerSource source = null;
  private Path mergeBaseDir = null;
  private Path output = null;
  private MergePolicy mergePolicy;
  private TileFilter extraFilter = null;
  private Path wtmlOutput = null;
  private String wtmlUrl = null;
  private WtmlDescriptor wtml;
  private TileSchemeEncoding scheme;

  private Toastiler(Arguments arguments) {
    this.arguments = arguments;
    stats = arguments.getStats();
    overallTimer = stats.startStageQuietly("overall");
    config = ToastilerConfig.from(arguments);
    mergePolicy = config.merge() ? MergePolicy.average() : MergePolicy.disabled();
    wtml = WtmlDescriptor.fromArguments(arguments);
    scheme = arguments.getObject("tile_scheme", "layout of tile files under the output directory",
      TileSchemeEncoding.defaultScheme(), TileSchemeEncoding::new);
  }

  /** Returns a new empty runner that will get configuration from {@code arguments}. */
  public static Toastiler create(Arguments arguments) {
    return new Toastiler(arguments);
  }

  /** Samples each tile of the deepest level (or every level when merging is disabled) from {@code sampler}. */
  public Toastiler setSampler(TileSampler sampler) {
    this.source = SamplerSource.of(sampler);
    this.mergeBaseDir = null;
    return this;
  }

  /**
   * Rebuilds upper levels from the deepest level of an existing pyramid in {@code baseDir} instead of sampling.
   * <p>
   * Tiles are read using the scheme in effect when {@link #run()} starts.
   */
  public Toastiler setMergeBaseDirectory(Path baseDir) {
    this.mergeBaseDir = baseDir;
    this.source = null;
    return this;
  }

  /**
   * Sets the directory to write tiles to, overridden by the {@code output} argument.
   *
   * @param defaultOutput directory to use when the {@code output} argument is absent
   */
  public Toastiler setOutput(Path defaultOutput) {
    this.output = arguments.file("output", "output directory", defaultOutput);
    return this;
  }

  public Toastiler setMergePolicy(MergePolicy mergePolicy) {
    this.mergePolicy = mergePolicy;
    return this;
  }

  /** Only builds tiles that pass {@code filter} as well as the configured region and bounds. */
  public Toastiler setTileFilter(TileFilter filter) {
    this.extraFilter = filter;
    return this;
  }

  public Toastiler setScheme(TileSchemeEncoding scheme) {
    this.scheme = scheme;
    return this;
  }

  /**
   * Writes a WTML record for the pyramid to {@code path}, with tile URLs under {@code baseUrl}, or under the output
   * directory if {@code baseUrl} is {@code null}.
   */
  public Toastiler setWtmlOutput(Path path, String baseUrl) {
    this.wtmlOutput = path;
    this.wtmlUrl = baseUrl;
    return this;
  }

  /** Overrides WTML fields like {@code Name} or {@code Credits}. */
  public Toastiler setWtmlFields(Map<String, String> fields) {
    this.wtml = wtml.withFields(fields);
    return this;
  }

  /** Asks a running {@link #run()} to stop after the tile it is working on. */
  public void cancel() {
    cancelled.set(true);
  }

  public ToastilerConfig config() {
    return config;
  }

  public Stats stats() {
    return stats;
  }

  /**
   * Builds the pyramid.
   *
   * @return counts of what was written
   * @throws IllegalArgumentException if no sampler or output was set
   * @throws UncheckedIOException     if a tile cannot be written and {@code fail_on_write_error} is set, or the WTML
   *                                  or metadata file cannot be written
   * @throws IllegalArgumentException if a tile cannot be encoded in the output format and {@code fail_on_write_error}
   *                                  is set
   */
  public PyramidResult run() {
    if (mergeBaseDir != null) {
      source = SamplerSource.of(new TileDirectory(mergeBaseDir, scheme, config.tileSize()));
    }
    if (source == null) {
      throw new IllegalArgumentException("No sampler or merge base directory set, call setSampler first");
    }
    if (output == null) {
      throw new IllegalArgumentException("No output directory set, call setOutput first");
    }
    LOGGER.info("Building TOAST pyramid depth={} top={} tile_size={} format={} merge={} threads={} -> {}",
      config.depth(), config.top(), config.tileSize(), config.format().extension(), mergePolicy.enabled(),
      config.threads(), output);

    if (wtmlOutput != null) {
      writeWtml();
    }

    FileUtils.createDirectory(output);
    TileDirectory outputDirectory = new TileDirectory(output, scheme, config.tileSize());
    TileFilter filter = extraFilter == null ? config.tileFilter() : config.tileFilter().and(extraFilter);
    ToastPipeline pipeline = ToastPipeline.builder(source, config.depth())
      .setTop(config.top())
      .setMergePolicy(mergePolicy)
      .setBaseLevelOnly(config.baseLevelOnly())
      .setRestart(config.restart() ? outputDirectory : null)
      .setFilter(filter)
      .setTileSize(config.tileSize())
      .setFormat(config.format())
      .setScheme(scheme)
      .setCancelled(cancelled::get)
      .build();
    stats.gauge("merge_buffered_images", () -> pipeline.accumulator().bufferedImages());

    long total = Toast.tileCount(config.depth());
    Counter.MultiThreadCounter emitted = stats.longCounter("tiles_emitted");
    Counter.MultiThreadCounter written = stats.longCounter("tiles_written");
    Counter.MultiThreadCounter skipped = stats.longCounter("tiles_skipped");
    Counter.MultiThreadCounter failed = stats.longCounter("tiles_failed");
    List<TilePos> failedPositions = new CopyOnWriteArrayList<>();

    Consumer<RenderedTile> writer = tile -> {
      emitted.inc();
      if (!tile.hasImage()) {
        skipped.inc();
      } else {
        try {
          long bytes = outputDirectory.write(tile.pos(), tile.image(), config.format());
          stats.wroteTile(tile.pos().n(), bytes);
          written.inc();
        } catch (UncheckedIOException | IllegalArgumentException e) {
          // IllegalArgumentException when the format cannot encode the tile, like a float image as png
          if (config.failOnWriteError()) {
            throw e;
          }
          LOGGER.warn("Unable to write {}: {}", tile.pos(), e.getMessage());
          stats.dataError("tile_write_failed");
          failed.inc();
          failedPositions.add(tile.pos());
        }
      }
      long count = emitted.get();
      if (count % 10 == 0) {
        LOGGER.info("Finished {} of {} tiles", count, total);
      }
    };

    ProgressLoggers loggers = ProgressLoggers.create()
      .addRatePercentCounter("tiles", total, emitted::get)
      .addRateCounter("written", written::get)
      .addCounter("skipped", skipped::get)
      .addCounter("failed", failed::get)
      .add(() -> " buffered: " + pipeline.accumulator().bufferedImages())
      .newLine()
      .addProcessStats();

    var timer = stats.startStage("pyramid");
    if (config.threads() <= 1) {
      // one thread keeps tiles in traversal order
      new Worker("pyramid", stats, 1, () -> {
        while (pipeline.hasNext()) {
          writer.accept(pipeline.next());
        }
      }).awaitAndLog(loggers, config.logInterval());
    } else {
      WorkerPipeline<Sampled> workers = WorkerPipeline.start("pyramid", stats)
        .readFrom("traverse", pipeline.traversal())
        .addBuffer("tile_queue", QUEUE_SIZE)
        .<Sampled>addWorker("sample", config.threads(), (prev, next) -> {
          for (ToastTile tile : prev) {
            next.accept(new Sampled(tile, pipeline.render(tile)));
          }
        })
        .addBuffer("sampled_queue", QUEUE_SIZE)
        .sinkToConsumer("write", 1, sampled -> pipeline.reduce(sampled.tile, sampled.image, writer));
      loggers.newLine().addPipelineStats(workers);
      workers.awaitAndLog(loggers, config.logInterval());
    }
    loggers.log();
    timer.stop();

    boolean wasCancelled = cancelled.get();
    if (wasCancelled) {
      LOGGER.warn("Cancelled after {} of {} tiles", emitted.get(), total);
    } else if (config.writeMetadata()) {
      metadata().write(output);
    }
    if (!failedPositions.isEmpty()) {
      LOGGER.warn("{} tiles could not be written", failedPositions.size());
    }

    overallTimer.stop();
    LOGGER.info("FINISHED!");
    stats.printSummary();
    stats.close();
    return new PyramidResult(emitted.get(), written.get(), skipped.get(), failed.get(), failedPositions,
      wasCancelled);
  }

  private void writeWtml() {
    String content = wtml.toWtml(wtmlUrl == null ? output.toString() : wtmlUrl, config.depth(), scheme);
    try {
      FileUtils.createParentDirectories(wtmlOutput);
      FileUtils.writeAtomically(wtmlOutput, content.getBytes(StandardCharsets.UTF_8));
    } catch (IOException e) {
      throw new UncheckedIOException("Unable to write " + wtmlOutput, e);
    }
    LOGGER.info("Wrote {}", wtmlOutput);
  }

  private PyramidMetadata metadata() {
    var region = config.region();
    var bounds = config.bounds();
    return new PyramidMetadata(
      wtml.name(),
      PyramidMetadata.PROJECTION,
      config.depth(),
      config.top(),
      config.tileSize(),
      config.format().extension(),
      scheme.tileScheme(),
      mergePolicy.enabled(),
      Optional.ofNullable(region).map(TilePos::toNxy),
      Optional.ofNullable(bounds).flatMap(SkyBounds::raRange).map(SkyBounds.Interval::toDegrees),
      Optional.ofNullable(bounds).flatMap(SkyBounds::decRange).map(SkyBounds.Interval::toDegrees)
    );
  }

  private record Sampled(ToastTile tile, TileImage image) {}
}
