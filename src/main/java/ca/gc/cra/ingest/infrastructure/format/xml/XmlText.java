package ca.gc.cra.ingest.infrastructure.format.xml;

/**
 * XML 1.0 escaping for element text and attribute values.
 *
 * <p>Element text escapes {@code &}, {@code <} and {@code >} and keeps quotes, newlines and non-ASCII
 * characters literal. Attribute values also escape {@code "} and encode tab, newline and carriage return as
 * character references so attribute-value normalization does not rewrite them. Code points XML 1.0 forbids
 * (most C0 controls, unpaired surrogates, U+FFFE/U+FFFF) become U+FFFD.</p>
 */
final class XmlText {
  private static final char REPLACEMENT = '\uFFFD';

  private XmlText() {}

  /**
   * Appends escaped element text.
   *
   * @return number of code points replaced with U+FFFD
   */
  static int appendText(StringBuilder out, String text) {
    return append(out, text, false);
  }

  /**
   * Appends an escaped attribute value (without surrounding quotes).
   *
   * @return number of code points replaced with U+FFFD
   */
  static int appendAttribute(StringBuilder out, String value) {
    return append(out, value, true);
  }

  private static int append(StringBuilder out, String text, boolean attribute) {
    int replaced = 0;
    int i = 0;
    while (i < text.length()) {
      int cp = text.codePointAt(i);
      i += Character.charCount(cp);
      switch (cp) {
        case '&' -> out.append("&amp;");
        case '<' -> out.append("&lt;");
        case '>' -> out.append("&gt;");
        case '"' -> out.append(attribute ? "&quot;" : "\"");
        case '\n' -> out.append(attribute ? "&#10;" : "\n");
        case '\r' -> out.append(attribute ? "&#13;" : "\r");
        case '\t' -> out.append(attribute ? "&#9;" : "\t");
        default -> {
          if (isLegal(cp)) {
            out.appendCodePoint(cp);
          } else {
            out.append(REPLACEMENT);
            replaced++;
          }
        }
      }
    }
    return replaced;
  }

  private static boolean isLegal(int cp) {
    return (cp >= 0x20 && cp <= 0xD7FF)
        || (cp >= 0xE000 && cp <= 0xFFFD)
        || (cp >= 0x10000 && cp <= 0x10FFFF);
  }
}
