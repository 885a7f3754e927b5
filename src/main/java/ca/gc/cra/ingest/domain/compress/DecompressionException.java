package ca.gc.cra.ingest.domain.compress;

import java.util.Objects;

/**
 * Checked exception thrown when a compressed payload is rejected or cannot be inflated.
 *
 * <p>Each failure carries a {@link Reason} so callers can decide whether to skip, alert, or re-request the
 * payload without parsing messages.</p>
 *
 * @since 0.1.0
 */
public final class DecompressionException extends Exception {
  private static final long serialVersionUID = 1L;

  /**
   * Distinct failure kinds reported by the decompression gate.
   */
  public enum Reason {
    /** Bytes do not carry the signature or structure of the claimed container, or the stream is corrupt. */
    INVALID_FORMAT,
    /** Zip archive holds more than one entry. */
    EXCESS_ENTRIES,
    /** The single zip entry could not be decoded. */
    EXTRACTION_FAILED,
    /** Extracted length differs from the size recorded in the archive. */
    SIZE_MISMATCH,
    /** Inflated output exceeded the configured byte limit. */
    LIMIT_EXCEEDED
  }

  private final CompressionFormat format;
  private final Reason reason;

  /**
   * Creates an exception with a descriptive message.
   *
   * @param format container format being decoded
   * @param reason failure kind
   * @param message human-readable error
   */
  public DecompressionException(CompressionFormat format, Reason reason, String message) {
    this(format, reason, message, null);
  }

  /**
   * Creates an exception with a message and underlying cause.
   *
   * @param format container format being decoded
   * @param reason failure kind
   * @param message human-readable error
   * @param cause low-level codec failure; may be {@code null}
   */
  public DecompressionException(
      CompressionFormat format, Reason reason, String message, Throwable cause) {
    super(message, cause);
    this.format = Objects.requireNonNull(format, "format");
    this.reason = Objects.requireNonNull(reason, "reason");
  }

  public CompressionFormat format() {
    return format;
  }

  public Reason reason() {
    return reason;
  }
}
