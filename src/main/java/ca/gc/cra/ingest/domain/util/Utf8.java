package ca.gc.cra.ingest.domain.util;

import java.nio.charset.StandardCharsets;

/**
 * <strong>What:</strong> UTF-8 helpers for turning decompressed bytes into text and sizing wire payloads.
 * <p><strong>Why:</strong> Batch limits are expressed in encoded bytes, so formatters need the UTF-8 length of
 * a fragment without encoding it first.</p>
 * <p><strong>Thread-safety:</strong> Stateless; safe for concurrent use.</p>
 *
 * @since 0.1.0
 */
public final class Utf8 {
  private Utf8() {}

  /**
   * Decodes a UTF-8 buffer, substituting U+FFFD for malformed sequences.
   *
   * @param data encoded bytes; may be {@code null}
   * @return decoded string or an empty string when {@code data} is {@code null} or empty
   */
  public static String decode(byte[] data) {
    if (data == null || data.length == 0) {
      return "";
    }
    return new String(data, StandardCharsets.UTF_8);
  }

  /**
   * Computes the number of bytes {@code text} occupies once encoded as UTF-8.
   *
   * <p>Unpaired surrogates count as one byte, matching the {@code ?} replacement the JDK encoder emits.</p>
   *
   * @param text text to measure; {@code null} counts as zero
   * @return encoded length in bytes
   */
  public static long encodedLength(CharSequence text) {
    if (text == null) {
      return 0L;
    }
    long bytes = 0L;
    int length = text.length();
    for (int i = 0; i < length; i++) {
      char c = text.charAt(i);
      if (c < 0x80) {
        bytes += 1;
      } else if (c < 0x800) {
        bytes += 2;
      } else if (Character.isHighSurrogate(c)
          && i + 1 < length
          && Character.isLowSurrogate(text.charAt(i + 1))) {
        bytes += 4;
        i++;
      } else if (Character.isSurrogate(c)) {
        bytes += 1;
      } else {
        bytes += 3;
      }
    }
    return bytes;
  }
}
