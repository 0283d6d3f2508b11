package com.onthegomap.toastiler.files;

import com.onthegomap.toastiler.geo.Toast;
import com.onthegomap.toastiler.geo.TilePos;
import com.onthegomap.toastiler.image.TileImage;
import com.onthegomap.toastiler.image.TileImageFormat;
import com.onthegomap.toastiler.util.FileUtils;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.StreamSupport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A directory of tile image files laid out by a {@link TileSchemeEncoding}.
 * <p>
 * Writes are atomic: a tile is written to a temp file next to its destination then moved into place, so a reader or a
 * restarted job never sees a partial tile.
 */
public class TileDirectory {

  private static final Logger LOGGER = LoggerFactory.getLogger(TileDirectory.class);

  private final Path baseDir;
  private final TileSchemeEncoding scheme;
  private final int tileSize;

  public TileDirectory(Path baseDir, TileSchemeEncoding scheme, int tileSize) {
    this.baseDir = baseDir;
    this.scheme = scheme;
    this.tileSize = tileSize;
  }

  /** Returns a directory using the {@code {n}/{y}/{y}_{x}.{ext}} layout with 256 pixel tiles. */
  public TileDirectory(Path baseDir) {
    this(baseDir, TileSchemeEncoding.defaultScheme(), Toast.DEFAULT_TILE_SIZE);
  }

  public Path baseDir() {
    return baseDir;
  }

  public TileSchemeEncoding scheme() {
    return scheme;
  }

  /** Returns where {@code pos} is stored, without touching the file system. */
  public Path resolve(TilePos pos, TileImageFormat format) {
    return baseDir.resolve(scheme.encode(pos, format.extension()));
  }

  /**
   * Returns where {@code pos} is stored, creating its parent directories if they do not exist yet.
   *
   * @throws IllegalStateException if the directories cannot be created
   */
  public Path tilePath(TilePos pos, TileImageFormat format) {
    Path path = resolve(pos, format);
    FileUtils.createParentDirectories(path);
    return path;
  }

  public boolean exists(TilePos pos, TileImageFormat format) {
    return Files.isRegularFile(resolve(pos, format));
  }

  /**
   * Reads the tile at {@code pos}, returning the {@code missing} policy's placeholder if there is no such file.
   *
   * @throws UncheckedIOException if the file exists but cannot be read or decoded
   */
  public TileImage read(TilePos pos, TileImageFormat format, MissingTilePolicy missing) {
    Path path = resolve(pos, format);
    byte[] bytes = FileUtils.readIfExists(path);
    if (bytes == null) {
      return missing.missingImage(tileSize);
    }
    try {
      return format.decode(bytes);
    } catch (IOException e) {
      throw new UncheckedIOException("Unable to decode " + path, e);
    }
  }

  /** Reads the tile at {@code pos}, or {@code null} if there is no such file. */
  public TileImage read(TilePos pos, TileImageFormat format) {
    return read(pos, format, MissingTilePolicy.NONE);
  }

  /**
   * Encodes and atomically writes {@code image} to the tile file for {@code pos}.
   *
   * @return the number of bytes written
   * @throws UncheckedIOException if the write fails
   */
  public long write(TilePos pos, TileImage image, TileImageFormat format) {
    byte[] bytes = format.encode(image);
    Path path = resolve(pos, format);
    try {
      Files.createDirectories(path.getParent());
      FileUtils.writeAtomically(path, bytes);
    } catch (IOException e) {
      throw new UncheckedIOException("Unable to write " + path, e);
    }
    LOGGER.trace("Wrote {} ({} bytes)", path, bytes.length);
    return bytes.length;
  }

  /** Returns the positions of all {@code format} tiles in this directory, sorted by depth then row then column. */
  public List<TilePos> existingPositions(TileImageFormat format) {
    var decoder = scheme.decoder(format.extension());
    try (var walker = Files.walk(baseDir, scheme.searchDepth())) {
      return walker
        .filter(Files::isRegularFile)
        .filter(path -> !FileUtils.isTempFile(path))
        .map(path -> StreamSupport.stream(baseDir.relativize(path).spliterator(), false)
          .map(Path::toString)
          .collect(Collectors.joining("/")))
        .map(decoder)
        .flatMap(Optional::stream)
        .sorted()
        .toList();
    } catch (NoSuchFileException e) {
      return List.of();
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }

  @Override
  public String toString() {
    return "TileDirectory[" + baseDir + ", " + scheme.tileScheme() + "]";
  }
}
