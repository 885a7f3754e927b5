package ca.gc.cra.ingest.application.port;

import ca.gc.cra.ingest.domain.compress.CompressionFormat;
import ca.gc.cra.ingest.domain.compress.DecompressionException;

/**
 * <strong>What:</strong> Port for validating and inflating one single-file container format.
 * <p><strong>Why:</strong> Separates format sniffing from decoding so callers can branch on content type before
 * committing to a decode attempt.</p>
 * <p><strong>Thread-safety:</strong> Implementations are stateless apart from immutable limits and must be safe
 * for concurrent use.</p>
 *
 * @since 0.1.0
 */
public interface PayloadDecompressor {
  /**
   * Container format handled by this decompressor.
   *
   * @return handled format; never {@code null}
   */
  CompressionFormat format();

  /**
   * Checks whether {@code data} looks like this decompressor's container format.
   *
   * @param data candidate bytes; may be {@code null}
   * @return {@code true} when the signature or structure matches; never throws
   */
  boolean matches(byte[] data);

  /**
   * Validates and inflates {@code data}.
   *
   * @param data compressed bytes; must not be {@code null}
   * @return decompressed content; caller owns the returned array
   * @throws DecompressionException when validation or decoding fails; {@link DecompressionException#reason()}
   *     identifies the failed check
   */
  byte[] decompress(byte[] data) throws DecompressionException;
}
