package se.alipsa.jrecmap;

import java.io.File;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Properties;
import java.util.Set;
import java.util.TreeSet;
import org.apache.parquet.hadoop.metadata.CompressionCodecName;
import se.alipsa.jrecmap.helper.JRecMapUtil;

/**
 * Settings for a {@link RecordSession}: where saved tables live, how keys are mapped and how Parquet files are
 * compressed.
 *
 * <p>
 * A configuration can be read from {@link Properties}, from a properties file or from a URL of the form
 * {@code jrecmap:/abs/path/to/dir?keyConvention=identity&compression=snappy}. Recognised keys are
 * {@value #BASE_DIR}, {@value #KEY_CONVENTION} ({@code default}, {@code identity}, {@code lower} or {@code upper})
 * and {@value #COMPRESSION} (a Parquet codec name). Unknown keys are rejected.
 * </p>
 */
public final class SessionConfig {

  /** URL prefix accepted by {@link #fromUrl(String)}. */
  public static final String URL_PREFIX = "jrecmap:";

  /** Directory holding the Parquet files of saved tables. */
  public static final String BASE_DIR = "baseDir";

  /** Name of the key convention to use. */
  public static final String KEY_CONVENTION = "keyConvention";

  /** Parquet compression codec for saved tables. */
  public static final String COMPRESSION = "compression";

  /**
   * The key mapper used when none is configured: storage names are upper case and application keys lower case.
   */
  public static final KeyMapper DEFAULT_KEY_MAPPER = KeyMapper.of(s -> s.toLowerCase(Locale.ROOT),
      s -> s.toUpperCase(Locale.ROOT));

  private static final KeyMapper LOWER_CASE = KeyMapper.of(s -> s.toLowerCase(Locale.ROOT),
      s -> s.toLowerCase(Locale.ROOT));

  private static final KeyMapper UPPER_CASE = KeyMapper.of(s -> s.toUpperCase(Locale.ROOT),
      s -> s.toUpperCase(Locale.ROOT));

  private static final Set<String> KNOWN_KEYS = Set.of(BASE_DIR, KEY_CONVENTION, COMPRESSION);

  private final File baseDir;
  private final KeyMapper keyMapper;
  private final CompressionCodecName compression;

  private SessionConfig(File baseDir, KeyMapper keyMapper, CompressionCodecName compression) {
    this.baseDir = baseDir;
    this.keyMapper = keyMapper;
    this.compression = compression;
  }

  /**
   * Start building a configuration for the supplied base directory.
   *
   * @param baseDir
   *          the directory holding saved tables
   * @return a new builder
   */
  public static Builder builder(Path baseDir) {
    return new Builder(baseDir);
  }

  /**
   * Create a configuration from properties.
   *
   * @param props
   *          the configuration properties
   * @return the configuration
   * @throws IllegalArgumentException
   *           if a key is unknown, {@value #BASE_DIR} is missing or a value is invalid
   */
  public static SessionConfig fromProperties(Properties props) {
    return fromProperties(props, null);
  }

  private static SessionConfig fromProperties(Properties props, Path relativeTo) {
    Objects.requireNonNull(props, "props");
    List<String> problems = new ArrayList<>();
    Set<String> unknown = new TreeSet<>(props.stringPropertyNames());
    unknown.removeAll(KNOWN_KEYS);
    if (!unknown.isEmpty()) {
      problems.add("unknown keys " + unknown);
    }
    String dir = props.getProperty(BASE_DIR);
    if (dir == null || dir.isBlank()) {
      problems.add(BASE_DIR + " is required");
    }
    if (!problems.isEmpty()) {
      throw invalid(String.join(", ", problems));
    }
    Path basePath = Path.of(dir.trim());
    if (relativeTo != null && !basePath.isAbsolute()) {
      basePath = relativeTo.resolve(basePath);
    }
    return builder(basePath).keyMapper(keyMapperFor(props.getProperty(KEY_CONVENTION, "default")))
        .compression(compressionFor(props.getProperty(COMPRESSION, CompressionCodecName.UNCOMPRESSED.name())))
        .build();
  }

  /**
   * Create a configuration from a URL such as {@code jrecmap:/data?keyConvention=identity} or
   * {@code jrecmap:file:///data}.
   *
   * @param url
   *          the configuration URL
   * @return the configuration
   * @throws IllegalArgumentException
   *           if the URL does not start with {@value #URL_PREFIX} or the configuration is invalid
   */
  public static SessionConfig fromUrl(String url) {
    Objects.requireNonNull(url, "url");
    if (!url.startsWith(URL_PREFIX)) {
      throw invalid("URL must start with " + URL_PREFIX + ": " + url);
    }
    String path = url.substring(URL_PREFIX.length());
    Properties props = new Properties();
    int q = path.indexOf('?');
    if (q >= 0) {
      props.putAll(JRecMapUtil.parseUrlQuery(path.substring(q + 1)));
      path = path.substring(0, q);
    }
    if (path.startsWith("file://")) {
      path = path.substring("file://".length());
    }
    props.setProperty(BASE_DIR, path);
    return fromProperties(props);
  }

  /**
   * Read a configuration from a properties file. A relative {@value #BASE_DIR} is resolved against the directory
   * of the file.
   *
   * @param propertiesFile
   *          the properties file
   * @return the configuration
   * @throws IOException
   *           if the file cannot be read
   * @throws IllegalArgumentException
   *           if the configuration is invalid
   */
  public static SessionConfig load(Path propertiesFile) throws IOException {
    Properties props = new Properties();
    try (Reader reader = Files.newBufferedReader(propertiesFile, StandardCharsets.UTF_8)) {
      props.load(reader);
    }
    return fromProperties(props, propertiesFile.toAbsolutePath().getParent());
  }

  /**
   * Look up a named key convention.
   *
   * @param convention
   *          {@code default}, {@code identity}, {@code lower} or {@code upper}
   * @return the matching key mapper
   * @throws IllegalArgumentException
   *           if the name is unknown
   */
  public static KeyMapper keyMapperFor(String convention) {
    String name = convention == null ? "" : convention.trim().toLowerCase(Locale.ROOT);
    return switch (name) {
      case "default" -> DEFAULT_KEY_MAPPER;
      case "identity" -> KeyMapper.identity();
      case "lower" -> LOWER_CASE;
      case "upper" -> UPPER_CASE;
      default -> throw invalid("unknown " + KEY_CONVENTION + " '" + convention + "'");
    };
  }

  private static CompressionCodecName compressionFor(String codec) {
    try {
      return CompressionCodecName.valueOf(codec.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      throw invalid("unknown " + COMPRESSION + " '" + codec + "'");
    }
  }

  private static IllegalArgumentException invalid(String message) {
    return new IllegalArgumentException("Invalid config: " + message);
  }

  /**
   * The directory holding saved tables.
   *
   * @return the base directory
   */
  public File getBaseDir() {
    return baseDir;
  }

  /**
   * The key mapper sessions created from this configuration use.
   *
   * @return the key mapper
   */
  public KeyMapper getKeyMapper() {
    return keyMapper;
  }

  /**
   * The compression codec for saved tables.
   *
   * @return the codec
   */
  public CompressionCodecName getCompression() {
    return compression;
  }

  @Override
  public String toString() {
    return "SessionConfig[baseDir=" + baseDir + ", compression=" + compression + "]";
  }

  /** Builder for {@link SessionConfig}. */
  public static final class Builder {

    private final Path baseDir;
    private KeyMapper keyMapper = DEFAULT_KEY_MAPPER;
    private CompressionCodecName compression = CompressionCodecName.UNCOMPRESSED;

    private Builder(Path baseDir) {
      this.baseDir = Objects.requireNonNull(baseDir, "baseDir");
    }

    /**
     * Set the key mapper.
     *
     * @param keyMapper
     *          the key mapper
     * @return this builder
     */
    public Builder keyMapper(KeyMapper keyMapper) {
      this.keyMapper = Objects.requireNonNull(keyMapper, "keyMapper");
      return this;
    }

    /**
     * Set the compression codec.
     *
     * @param compression
     *          the codec
     * @return this builder
     */
    public Builder compression(CompressionCodecName compression) {
      this.compression = Objects.requireNonNull(compression, "compression");
      return this;
    }

    /**
     * Build the configuration.
     *
     * @return the configuration
     * @throws IllegalArgumentException
     *           if the base directory does not exist
     */
    public SessionConfig build() {
      File dir = baseDir.toFile();
      if (!dir.isDirectory()) {
        throw invalid(BASE_DIR + " is not a directory: " + dir);
      }
      return new SessionConfig(dir, keyMapper, compression);
    }
  }
}
