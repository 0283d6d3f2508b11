package com.onthegomap.toastiler.image;

import static com.google.common.base.Preconditions.checkArgument;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Stream;

/**
 * A source of input images, each with an identifier that is unique within the collection.
 */
public interface ImageCollection {

  /** Returns the images in this collection, loaded lazily as the stream is consumed. */
  Stream<CollectionImage> images();

  /**
   * Returns a collection of PNG or NPY files identified by their file name.
   *
   * @throws IllegalArgumentException if two files share a name or a file has an unknown extension
   */
  static ImageCollection fromFiles(List<Path> paths) {
    Set<String> ids = new HashSet<>();
    for (Path path : paths) {
      String id = path.getFileName().toString();
      checkArgument(ids.add(id), "duplicate image id %s", id);
      TileImageFormat.forPath(path);
    }
    List<Path> files = List.copyOf(paths);
    return () -> files.stream().map(path -> {
      try {
        byte[] bytes = Files.readAllBytes(path);
        return new CollectionImage(path.getFileName().toString(), TileImageFormat.forPath(path).decode(bytes));
      } catch (IOException e) {
        throw new UncheckedIOException("Unable to read " + path, e);
      }
    });
  }

  /** An input image and its unique id within its collection. */
  record CollectionImage(String collectionId, TileImage image) {}
}
