package ca.gc.cra.ingest.domain.compress;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class CompressedPayloadTest {

  @Test
  void bufferIsCopiedOnConstructionAndAccess() {
    byte[] source = {1, 2, 3};
    CompressedPayload payload = new CompressedPayload(CompressionFormat.GZIP, source);

    source[0] = 9;
    byte[] view = payload.bytes();
    view[1] = 9;

    assertArrayEquals(new byte[] {1, 2, 3}, payload.bytes());
    assertEquals(3, payload.length());
  }

  @Test
  void equalityComparesContent() {
    CompressedPayload a = new CompressedPayload(CompressionFormat.ZIP, new byte[] {1, 2});
    CompressedPayload b = new CompressedPayload(CompressionFormat.ZIP, new byte[] {1, 2});
    CompressedPayload c = new CompressedPayload(CompressionFormat.GZIP, new byte[] {1, 2});

    assertEquals(a, b);
    assertEquals(a.hashCode(), b.hashCode());
    assertNotEquals(a, c);
  }

  @Test
  void toStringOmitsContent() {
    CompressedPayload payload = new CompressedPayload(CompressionFormat.ZIP, new byte[4]);
    assertTrue(payload.toString().contains("length=4"));
  }

  @Test
  void rejectsNullArguments() {
    assertThrows(NullPointerException.class, () -> new CompressedPayload(null, new byte[0]));
    assertThrows(NullPointerException.class, () -> new CompressedPayload(CompressionFormat.GZIP, null));
  }

  @Test
  void formatLabelIsLowerCase() {
    assertEquals("gzip", CompressionFormat.GZIP.label());
    assertEquals("zip", CompressionFormat.ZIP.label());
  }
}
