package ca.gc.cra.ingest.domain.util;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.Test;

class Utf8Test {

  @Test
  void decodeReturnsEmptyForNullOrEmpty() {
    assertEquals("", Utf8.decode(null));
    assertEquals("", Utf8.decode(new byte[0]));
  }

  @Test
  void decodeReplacesMalformedSequences() {
    byte[] data = {'o', 'k', (byte) 0xC3};
    assertEquals("ok\uFFFD", Utf8.decode(data));
  }

  @Test
  void encodedLengthMatchesJdkEncoder() {
    String[] samples = {"", "ascii", "café", "☃", "😀 smile", "mixed é☃😀"};
    for (String sample : samples) {
      assertEquals(sample.getBytes(StandardCharsets.UTF_8).length, Utf8.encodedLength(sample), sample);
    }
  }

  @Test
  void encodedLengthCountsUnpairedSurrogateAsOneByte() {
    String lone = "a\uD800b";
    assertEquals(lone.getBytes(StandardCharsets.UTF_8).length, Utf8.encodedLength(lone));
    assertEquals(0L, Utf8.encodedLength(null));
  }
}
