package com.onthegomap.toastiler.metadata;

import static com.fasterxml.jackson.annotation.JsonInclude.Include.NON_ABSENT;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jdk8.Jdk8Module;
import com.onthegomap.toastiler.util.FileUtils;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Summary of a generated pyramid, stored as {@code metadata.json} at the root of the output directory.
 */
public record PyramidMetadata(
  @JsonProperty("name") String name,
  @JsonProperty("projection") String projection,
  @JsonProperty("depth") int depth,
  @JsonProperty("top") int top,
  @JsonProperty("tile_size") int tileSize,
  @JsonProperty("format") String format,
  @JsonProperty("tile_scheme") String tileScheme,
  @JsonProperty("merged") boolean merged,
  @JsonProperty("region") Optional<String> region,
  @JsonProperty("ra_range") Optional<List<Double>> raRange,
  @JsonProperty("dec_range") Optional<List<Double>> decRange
) {

  public static final String FILE_NAME = "metadata.json";
  public static final String PROJECTION = "toast";

  private static final JsonMapper MAPPER = JsonMapper.builder()
    .addModule(new Jdk8Module())
    .serializationInclusion(NON_ABSENT)
    .enable(SerializationFeature.INDENT_OUTPUT)
    .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
    .build();

  public PyramidMetadata {
    region = region == null ? Optional.empty() : region;
    raRange = raRange == null ? Optional.empty() : raRange;
    decRange = decRange == null ? Optional.empty() : decRange;
  }

  public String toJson() {
    try {
      return MAPPER.writeValueAsString(this);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Unable to encode pyramid metadata", e);
    }
  }

  public static PyramidMetadata fromJson(String json) {
    try {
      return MAPPER.readValue(json, PyramidMetadata.class);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Invalid pyramid metadata: " + e.getMessage(), e);
    }
  }

  /** Atomically writes this metadata to {@value #FILE_NAME} in {@code outputDir}. */
  public Path write(Path outputDir) {
    Path path = outputDir.resolve(FILE_NAME);
    FileUtils.createDirectory(outputDir);
    try {
      FileUtils.writeAtomically(path, toJson().getBytes(StandardCharsets.UTF_8));
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
    return path;
  }

  /** Reads {@value #FILE_NAME} from {@code outputDir}, or returns empty if it does not exist. */
  public static Optional<PyramidMetadata> read(Path outputDir) {
    Path path = outputDir.resolve(FILE_NAME);
    if (!Files.exists(path)) {
      return Optional.empty();
    }
    try {
      return Optional.of(fromJson(Files.readString(path)));
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }
}
