package ca.gc.cra.ingest.logging;

import java.nio.charset.StandardCharsets;

/**
 * <strong>What:</strong> Logging hygiene helpers that limit how much collected text reaches logs and
 * exception messages.
 * <p><strong>Why:</strong> Event data and archive entry names come from untrusted input and can be arbitrarily
 * long; diagnostics only ever see a bounded preview.</p>
 * <p><strong>Thread-safety:</strong> Stateless utilities safe for concurrent use.</p>
 *
 * @since 0.1.0
 */
public final class Logs {
  private static final String NULL_PLACEHOLDER = "<null>";

  private Logs() {
    // Utility
  }

  /**
   * Cuts {@code value} to at most {@code maxBytes} UTF-8 bytes on a character boundary and appends the
   * original length, e.g. {@code abcd... (truncated, 4 of 10 bytes)}.
   *
   * @param value text to preview; {@code null} results in {@code "<null>"}
   * @param maxBytes maximum number of UTF-8 bytes to keep; must be positive
   * @return {@code value} itself when it already fits, otherwise the truncated preview
   * @throws IllegalArgumentException if {@code maxBytes} is not positive
   */
  public static String truncate(String value, int maxBytes) {
    if (maxBytes <= 0) {
      throw new IllegalArgumentException("maxBytes must be positive");
    }
    if (value == null) {
      return NULL_PLACEHOLDER;
    }
    byte[] bytes = value.getBytes(StandardCharsets.UTF_8);
    if (bytes.length <= maxBytes) {
      return value;
    }
    int cut = maxBytes;
    while (cut > 0 && (bytes[cut] & 0xC0) == 0x80) {
      cut--;
    }
    return new String(bytes, 0, cut, StandardCharsets.UTF_8)
        + "... (truncated, " + cut + " of " + bytes.length + " bytes)";
  }
}
