package ca.gc.cra.ingest.config;

import ca.gc.cra.ingest.validation.Numbers;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> Batching policy for the XML stream formatter.
 * <p><strong>Why:</strong> Receiving endpoints differ in how large a single {@code <stream>} document may be;
 * callers pick the split points while event order stays fixed.</p>
 * <p><strong>Thread-safety:</strong> Immutable record.</p>
 *
 * @param maxEventsPerStream events per {@code <stream>} document; {@code 0} means unlimited
 * @param maxStreamBytes UTF-8 size ceiling per document; {@code 0} means unlimited. A single event larger than
 *     the ceiling still gets its own document.
 * @param splitOnStanzaChange start a new document whenever the stanza differs from the previous event's
 * @since 0.1.0
 */
public record XmlStreamConfig(int maxEventsPerStream, long maxStreamBytes, boolean splitOnStanzaChange) {

  /**
   * Validates that limits are non-negative.
   *
   * @throws IllegalArgumentException if a limit is negative
   */
  public XmlStreamConfig {
    Numbers.requireRange("maxEventsPerStream", maxEventsPerStream, 0, Integer.MAX_VALUE);
    Numbers.requireRange("maxStreamBytes", maxStreamBytes, 0, Long.MAX_VALUE);
  }

  /**
   * One {@code <stream>} document per contiguous stanza run, with no count or size limit.
   *
   * @return default policy
   */
  public static XmlStreamConfig defaults() {
    return new XmlStreamConfig(0, 0L, true);
  }

  /**
   * Builds the policy from flattened keys under {@code xml.}.
   *
   * @param values flattened configuration; must not be {@code null}
   * @return policy with defaults for absent keys
   * @throws IllegalArgumentException if a value is malformed or out of range
   */
  public static XmlStreamConfig fromMap(Map<String, String> values) {
    Objects.requireNonNull(values, "values");
    return new XmlStreamConfig(
        ConfigValues.intValue(values, "xml.maxEventsPerStream", 0, 0, Integer.MAX_VALUE),
        ConfigValues.longValue(values, "xml.maxStreamBytes", 0L, 0, Long.MAX_VALUE),
        ConfigValues.booleanValue(values, "xml.splitOnStanzaChange", true));
  }
}
