package ca.gc.cra.ingest.domain.compress;

import java.util.Locale;

/**
 * Single-file container formats accepted by the decompression gate.
 *
 * @since 0.1.0
 */
public enum CompressionFormat {
  /** RFC 1952 gzip stream, possibly with multiple members. */
  GZIP,
  /** PKZIP archive holding exactly one entry. */
  ZIP;

  /**
   * Lower-case label used in metric names and log messages.
   *
   * @return label such as {@code gzip}
   */
  public String label() {
    return name().toLowerCase(Locale.ROOT);
  }
}
