package ca.gc.cra.ingest.config;

import ca.gc.cra.ingest.validation.Numbers;
import java.util.Map;
import java.util.Objects;

/**
 * Limits applied by the gzip and zip decompressors.
 *
 * @param maxDecompressedBytes ceiling on inflated output per payload, in bytes; must be positive
 * @since 0.1.0
 */
public record DecompressionConfig(long maxDecompressedBytes) {
  /** Default ceiling of 256 MiB. */
  public static final long DEFAULT_MAX_DECOMPRESSED_BYTES = 256L * 1024 * 1024;

  /**
   * Validates the byte ceiling.
   *
   * @throws IllegalArgumentException if {@code maxDecompressedBytes} is not positive
   */
  public DecompressionConfig {
    Numbers.requireRange("maxDecompressedBytes", maxDecompressedBytes, 1, Long.MAX_VALUE);
  }

  public static DecompressionConfig defaults() {
    return new DecompressionConfig(DEFAULT_MAX_DECOMPRESSED_BYTES);
  }

  /**
   * Builds the configuration from flattened keys ({@code decompress.maxBytes}).
   *
   * @param values flattened configuration; must not be {@code null}
   * @return configuration with defaults for absent keys
   * @throws IllegalArgumentException if a value is malformed or out of range
   */
  public static DecompressionConfig fromMap(Map<String, String> values) {
    Objects.requireNonNull(values, "values");
    return new DecompressionConfig(ConfigValues.longValue(
        values, "decompress.maxBytes", DEFAULT_MAX_DECOMPRESSED_BYTES, 1, Long.MAX_VALUE));
  }
}
