package ca.gc.cra.ingest.config;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Reads the codec's YAML configuration into the flat key map the config records parse.
 *
 * <p>The document is a mapping of sections, one per component: {@code decompress} (read by
 * {@link DecompressionConfig}), {@code xml} ({@link XmlStreamConfig}) and {@code hec} ({@link HecBatchConfig}).
 * Nesting becomes dot-separated keys, so</p>
 * <pre>
 * hec:
 *   maxBatchBytes: 500000
 *   escapeControlChars: true
 * </pre>
 * <p>yields {@code hec.maxBatchBytes=500000} and {@code hec.escapeControlChars=true}. Scalars keep their YAML
 * text form, a key with no value maps to an empty string (which the records treat as "use the default"), and
 * sequences are rejected because no codec setting is list-valued. Keys outside the three sections are carried
 * through and ignored by the records.</p>
 */
public final class YamlConfigLoader {

  private YamlConfigLoader() {}

  /**
   * Loads codec settings from {@code path}.
   *
   * @param path location of the YAML configuration
   * @return optional flat map, empty when the file does not exist
   * @throws IOException when the file cannot be read
   * @throws IllegalArgumentException when the YAML structure is invalid
   */
  public static Optional<Map<String, String>> load(Path path) throws IOException {
    Objects.requireNonNull(path, "path");
    if (!Files.exists(path)) {
      return Optional.empty();
    }
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      return Optional.of(load(reader, path.toString()));
    }
  }

  /**
   * Parses YAML from an open reader.
   *
   * @param reader YAML source; not closed by this method
   * @param origin description of the source used in error messages
   * @return flat map of dotted keys to string values
   * @throws IllegalArgumentException when the YAML is malformed or not a mapping
   */
  public static Map<String, String> load(Reader reader, String origin) {
    Objects.requireNonNull(reader, "reader");
    try {
      Object document = new Yaml().load(reader);
      if (document == null) {
        return Map.of();
      }
      Map<String, String> flattened = new LinkedHashMap<>();
      flatten(asMap(document, "root"), "", flattened);
      return Map.copyOf(flattened);
    } catch (YAMLException ex) {
      throw new IllegalArgumentException("Failed to parse YAML config at " + origin, ex);
    }
  }

  private static Map<String, Object> asMap(Object node, String context) {
    if (!(node instanceof Map<?, ?> raw)) {
      throw new IllegalArgumentException(context + " section must be a mapping");
    }
    Map<String, Object> map = new LinkedHashMap<>();
    for (Map.Entry<?, ?> entry : raw.entrySet()) {
      if (!(entry.getKey() instanceof String key)) {
        throw new IllegalArgumentException(context + " section contains non-string key");
      }
      map.put(key, entry.getValue());
    }
    return map;
  }

  private static void flatten(Map<String, Object> source, String prefix, Map<String, String> target) {
    for (Map.Entry<String, Object> entry : source.entrySet()) {
      String key = entry.getKey();
      if (key == null || key.isBlank()) {
        throw new IllegalArgumentException("YAML contains blank keys");
      }
      String composite = prefix.isEmpty() ? key.trim() : prefix + '.' + key.trim();
      Object value = entry.getValue();
      if (value == null) {
        target.put(composite, "");
      } else if (value instanceof Map<?, ?> nested) {
        flatten(asMap(nested, composite), composite, target);
      } else if (value instanceof Iterable<?>) {
        throw new IllegalArgumentException("YAML arrays are not supported for key " + composite);
      } else {
        target.put(composite, value.toString());
      }
    }
  }
}
