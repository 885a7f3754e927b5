package ca.gc.cra.ingest.config;

import ca.gc.cra.ingest.validation.Numbers;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> Batching policy for the HEC JSON formatter.
 * <p><strong>Thread-safety:</strong> Immutable record.</p>
 *
 * @param maxBatchBytes a batch is closed before its UTF-8 size (objects plus newline separators) would reach this
 *     value; must be positive. A single oversized event forms its own batch.
 * @param maxEventsPerBatch events per batch; {@code 0} means unlimited
 * @param escapeControlChars apply {@code ControlChars.escapeJsonControlChars} to event data before encoding
 * @since 0.1.0
 */
public record HecBatchConfig(long maxBatchBytes, int maxEventsPerBatch, boolean escapeControlChars) {
  /** Largest batch the receiving endpoint accepts by default. */
  public static final long DEFAULT_MAX_BATCH_BYTES = 1_000_000L;

  /**
   * Validates limits.
   *
   * @throws IllegalArgumentException if {@code maxBatchBytes} is not positive or {@code maxEventsPerBatch} is
   *     negative
   */
  public HecBatchConfig {
    Numbers.requireRange("maxBatchBytes", maxBatchBytes, 1, Long.MAX_VALUE);
    Numbers.requireRange("maxEventsPerBatch", maxEventsPerBatch, 0, Integer.MAX_VALUE);
  }

  public static HecBatchConfig defaults() {
    return new HecBatchConfig(DEFAULT_MAX_BATCH_BYTES, 0, false);
  }

  /**
   * Builds the policy from flattened keys under {@code hec.}.
   *
   * @param values flattened configuration; must not be {@code null}
   * @return policy with defaults for absent keys
   * @throws IllegalArgumentException if a value is malformed or out of range
   */
  public static HecBatchConfig fromMap(Map<String, String> values) {
    Objects.requireNonNull(values, "values");
    return new HecBatchConfig(
        ConfigValues.longValue(values, "hec.maxBatchBytes", DEFAULT_MAX_BATCH_BYTES, 1, Long.MAX_VALUE),
        ConfigValues.intValue(values, "hec.maxEventsPerBatch", 0, 0, Integer.MAX_VALUE),
        ConfigValues.booleanValue(values, "hec.escapeControlChars", false));
  }
}
