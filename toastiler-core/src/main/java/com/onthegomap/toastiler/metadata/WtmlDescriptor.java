package com.onthegomap.toastiler.metadata;

import com.onthegomap.toastiler.config.Arguments;
import com.onthegomap.toastiler.files.TileSchemeEncoding;
import java.util.Map;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.text.StringEscapeUtils;

/**
 * The descriptive fields of a WorldWide Telescope WTML record that points at a TOAST pyramid.
 */
public record WtmlDescriptor(
  String folderName,
  String bandPass,
  String name,
  String credits,
  String creditsUrl,
  String thumbnailUrl
) {

  public static final String DEFAULT_FOLDER_NAME = "Toasty";
  public static final String DEFAULT_BAND_PASS = "Visible";
  public static final String DEFAULT_NAME = "Toasty map";
  public static final String DEFAULT_CREDITS = "Toasty";
  public static final String DEFAULT_CREDITS_URL = "http://github.com/ChrisBeaumont/toasty";

  private static final String TEMPLATE = """
    <Folder Name="%s">
    <ImageSet Generic="False" DataSetType="Sky" BandPass="%s" Name="%s" Url="%s/%s.png" BaseTileLevel="0" \
    TileLevels="%d" BaseDegreesPerTile="180" FileType=".png" BottomsUp="False" Projection="Toast" QuadTreeMap="" \
    CenterX="0" CenterY="0" OffsetX="0" OffsetY="0" Rotation="0" Sparse="False" ElevationModel="False">
    <Credits> %s </Credits>
    <CreditsUrl>%s</CreditsUrl>
    <ThumbnailUrl>%s</ThumbnailUrl>
    <Description/>
    </ImageSet>
    </Folder>""";

  public WtmlDescriptor {
    folderName = StringUtils.defaultString(folderName, DEFAULT_FOLDER_NAME);
    bandPass = StringUtils.defaultString(bandPass, DEFAULT_BAND_PASS);
    name = StringUtils.defaultString(name, DEFAULT_NAME);
    credits = StringUtils.defaultString(credits, DEFAULT_CREDITS);
    creditsUrl = StringUtils.defaultString(creditsUrl, DEFAULT_CREDITS_URL);
    thumbnailUrl = StringUtils.defaultString(thumbnailUrl);
  }

  public static WtmlDescriptor defaults() {
    return new WtmlDescriptor(null, null, null, null, null, null);
  }

  /**
   * Returns a copy with any of {@code FolderName}, {@code BandPass}, {@code Name}, {@code Credits},
   * {@code CreditsUrl}, or {@code ThumbnailUrl} replaced by the values in {@code fields}. Other keys are ignored.
   */
  public WtmlDescriptor withFields(Map<String, String> fields) {
    return new WtmlDescriptor(
      fields.getOrDefault("FolderName", folderName),
      fields.getOrDefault("BandPass", bandPass),
      fields.getOrDefault("Name", name),
      fields.getOrDefault("Credits", credits),
      fields.getOrDefault("CreditsUrl", creditsUrl),
      fields.getOrDefault("ThumbnailUrl", thumbnailUrl)
    );
  }

  /** Reads the descriptor from {@code folder_name}, {@code band_pass}, {@code name}, and similar arguments. */
  public static WtmlDescriptor fromArguments(Arguments arguments) {
    return new WtmlDescriptor(
      arguments.getString("folder_name", "WTML folder name", DEFAULT_FOLDER_NAME),
      arguments.getString("band_pass", "WTML band pass", DEFAULT_BAND_PASS),
      arguments.getString("name", "name of the image set", DEFAULT_NAME),
      arguments.getString("credits", "credits for the image set", DEFAULT_CREDITS),
      arguments.getString("credits_url", "link for the credits", DEFAULT_CREDITS_URL),
      arguments.getString("thumbnail_url", "URL of a thumbnail image", "")
    );
  }

  /**
   * Returns the WTML record for a pyramid of {@code depth} levels served from {@code baseUrl} with the default
   * {@code {n}/{y}/{y}_{x}} layout.
   */
  public String toWtml(String baseUrl, int depth) {
    return toWtml(baseUrl, depth, TileSchemeEncoding.defaultScheme());
  }

  public String toWtml(String baseUrl, int depth, TileSchemeEncoding scheme) {
    return TEMPLATE.formatted(
      escape(folderName),
      escape(bandPass),
      escape(name),
      escape(baseUrl),
      scheme.wwtUrlTemplate(),
      depth,
      escape(credits),
      escape(creditsUrl),
      escape(thumbnailUrl)
    );
  }

  private static String escape(String value) {
    return StringEscapeUtils.escapeXml10(value);
  }
}
