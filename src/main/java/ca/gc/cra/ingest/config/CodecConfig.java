package ca.gc.cra.ingest.config;

import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> Aggregate configuration for the decompression gate and both event formatters.
 * <p><strong>Role:</strong> Configuration record handed to composition code that builds decompressors and
 * formatters.</p>
 * <p><strong>Thread-safety:</strong> Record is immutable; safe for concurrent reads.</p>
 *
 * @param decompression decompressor limits
 * @param xml XML stream batching policy
 * @param hec HEC batching policy
 * @since 0.1.0
 */
public record CodecConfig(DecompressionConfig decompression, XmlStreamConfig xml, HecBatchConfig hec) {

  /**
   * Validates that every section is present.
   */
  public CodecConfig {
    decompression = Objects.requireNonNull(decompression, "decompression");
    xml = Objects.requireNonNull(xml, "xml");
    hec = Objects.requireNonNull(hec, "hec");
  }

  public static CodecConfig defaults() {
    return new CodecConfig(
        DecompressionConfig.defaults(), XmlStreamConfig.defaults(), HecBatchConfig.defaults());
  }

  /**
   * Builds every section from one flattened key/value map.
   *
   * @param values flattened configuration such as {@code hec.maxBatchBytes=500000}; must not be {@code null}
   * @return configuration with defaults for absent keys
   * @throws IllegalArgumentException if any value is malformed or out of range
   */
  public static CodecConfig fromMap(Map<String, String> values) {
    return new CodecConfig(
        DecompressionConfig.fromMap(values), XmlStreamConfig.fromMap(values), HecBatchConfig.fromMap(values));
  }
}
