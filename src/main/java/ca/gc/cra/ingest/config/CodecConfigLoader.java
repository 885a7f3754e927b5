package ca.gc.cra.ingest.config;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves {@link CodecConfig} from an optional YAML file, falling back to defaults.
 *
 * @since 0.1.0
 */
public final class CodecConfigLoader {
  private static final Logger log = LoggerFactory.getLogger(CodecConfigLoader.class);

  private CodecConfigLoader() {}

  /**
   * Reads codec configuration from {@code path}.
   *
   * @param path YAML file; {@code null} or a missing file yields {@link CodecConfig#defaults()}
   * @return resolved configuration
   * @throws IOException if the file exists but cannot be read
   * @throws IllegalArgumentException if the YAML or any value is invalid
   */
  public static CodecConfig load(Path path) throws IOException {
    if (path == null) {
      return CodecConfig.defaults();
    }
    Optional<Map<String, String>> values = YamlConfigLoader.load(path);
    if (values.isEmpty()) {
      log.info("Codec config {} not found; using defaults", path);
      return CodecConfig.defaults();
    }
    CodecConfig config = CodecConfig.fromMap(values.get());
    log.debug("Loaded codec config from {}: {}", path, config);
    return config;
  }
}
