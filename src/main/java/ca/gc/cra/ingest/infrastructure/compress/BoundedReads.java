package ca.gc.cra.ingest.infrastructure.compress;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;

/**
 * Drains inflating streams into memory while enforcing an output byte ceiling.
 */
final class BoundedReads {
  private static final int CHUNK = 8192;
  private static final int MAX_INITIAL_CAPACITY = 1 << 20;

  private BoundedReads() {}

  /**
   * Reads {@code in} to exhaustion.
   *
   * @param in inflating stream; not closed by this method
   * @param maxBytes maximum number of bytes the stream may produce
   * @param sizeHint expected output size used to size the buffer; may be zero
   * @return bytes read
   * @throws OutputLimitException when the stream produces more than {@code maxBytes}
   * @throws IOException when the underlying stream fails
   */
  static byte[] readAll(InputStream in, long maxBytes, long sizeHint) throws IOException {
    int initial = (int) Math.max(CHUNK, Math.min(MAX_INITIAL_CAPACITY, Math.min(sizeHint, maxBytes)));
    ByteArrayOutputStream out = new ByteArrayOutputStream(initial);
    byte[] chunk = new byte[CHUNK];
    long total = 0L;
    int read;
    while ((read = in.read(chunk)) != -1) {
      total += read;
      if (total > maxBytes) {
        throw new OutputLimitException(maxBytes);
      }
      out.write(chunk, 0, read);
    }
    return out.toByteArray();
  }

  /**
   * Signals that inflated output passed the configured ceiling.
   */
  static final class OutputLimitException extends IOException {
    private static final long serialVersionUID = 1L;

    private final long limit;

    OutputLimitException(long limit) {
      super("decompressed output exceeds " + limit + " bytes");
      this.limit = limit;
    }

    long limit() {
      return limit;
    }
  }
}
