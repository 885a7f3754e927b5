package ca.gc.cra.ingest.domain.util;

/**
 * Pre-serialization normalization for text that already contains backslash escape sequences.
 *
 * <p>Collected text such as {@code hello\nworld} (a literal backslash followed by {@code n}) would be read
 * back as a newline once embedded in hand-assembled JSON. Doubling the backslash keeps the two characters
 * literal. The transform is single-pass: applying it twice doubles the backslash again.</p>
 *
 * @since 0.1.0
 */
public final class ControlChars {
  private ControlChars() {
    // Utility
  }

  /**
   * Doubles the backslash in every literal {@code \n} and {@code \r} sequence.
   *
   * @param text text to normalize; {@code null} is returned unchanged
   * @return normalized text
   */
  public static String escapeJsonControlChars(String text) {
    if (text == null || text.indexOf('\\') < 0) {
      return text;
    }
    return text.replace("\\n", "\\\\n").replace("\\r", "\\\\r");
  }
}
