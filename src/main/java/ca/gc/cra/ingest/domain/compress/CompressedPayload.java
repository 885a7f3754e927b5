package ca.gc.cra.ingest.domain.compress;

import java.util.Arrays;
import java.util.Objects;

/**
 * <strong>What:</strong> Compressed byte buffer tagged with the container format the caller claims it uses.
 * <p><strong>Why:</strong> Lets decoding code dispatch on a declared format while each decompressor still
 * verifies the bytes before inflating them.</p>
 * <p><strong>Thread-safety:</strong> Immutable; the buffer is copied on construction and on access.</p>
 *
 * @param format claimed container format; never {@code null}
 * @param bytes compressed content; never {@code null}
 *
 * @since 0.1.0
 */
public record CompressedPayload(CompressionFormat format, byte[] bytes) {

  /**
   * Validates arguments and copies the buffer.
   */
  public CompressedPayload {
    format = Objects.requireNonNull(format, "format");
    bytes = Objects.requireNonNull(bytes, "bytes").clone();
  }

  /**
   * Returns a copy of the compressed content.
   *
   * @return compressed bytes; caller owns the returned array
   */
  @Override
  public byte[] bytes() {
    return bytes.clone();
  }

  /**
   * Number of compressed bytes.
   *
   * @return buffer length
   */
  public int length() {
    return bytes.length;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof CompressedPayload other)) {
      return false;
    }
    return format == other.format && Arrays.equals(bytes, other.bytes);
  }

  @Override
  public int hashCode() {
    return 31 * format.hashCode() + Arrays.hashCode(bytes);
  }

  @Override
  public String toString() {
    return "CompressedPayload[format=" + format + ", length=" + bytes.length + "]";
  }
}
