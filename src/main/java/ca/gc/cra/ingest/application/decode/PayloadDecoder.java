package ca.gc.cra.ingest.application.decode;

import ca.gc.cra.ingest.application.port.PayloadDecompressor;
import ca.gc.cra.ingest.domain.compress.CompressedPayload;
import ca.gc.cra.ingest.domain.compress.CompressionFormat;
import ca.gc.cra.ingest.domain.compress.DecompressionException;
import ca.gc.cra.ingest.domain.util.Utf8;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Use case that recovers raw bytes or text from a compressed payload.
 * <p><strong>Why:</strong> Callers either know the container format up front or need to sniff it before
 * committing to a decode attempt; both paths go through the same decompressors.</p>
 * <p><strong>Role:</strong> Application service composed from {@link PayloadDecompressor} adapters.</p>
 * <p><strong>Thread-safety:</strong> Immutable after construction; safe for concurrent use when the supplied
 * decompressors are.</p>
 *
 * @since 0.1.0
 */
public final class PayloadDecoder {
  private final List<PayloadDecompressor> decompressors;
  private final Map<CompressionFormat, PayloadDecompressor> byFormat;

  /**
   * Creates a decoder over the supplied decompressors; sniffing tries them in list order.
   *
   * @param decompressors one decompressor per format; must not be {@code null} or contain duplicates
   * @throws IllegalArgumentException when two decompressors claim the same format
   */
  public PayloadDecoder(List<PayloadDecompressor> decompressors) {
    this.decompressors = List.copyOf(Objects.requireNonNull(decompressors, "decompressors"));
    Map<CompressionFormat, PayloadDecompressor> map = new EnumMap<>(CompressionFormat.class);
    for (PayloadDecompressor decompressor : this.decompressors) {
      if (map.put(decompressor.format(), decompressor) != null) {
        throw new IllegalArgumentException("duplicate decompressor for " + decompressor.format());
      }
    }
    this.byFormat = map;
  }

  /**
   * Detects the container format of {@code data}.
   *
   * @param data candidate bytes; may be {@code null}
   * @return first matching format, or empty when no decompressor recognizes the bytes
   */
  public Optional<CompressionFormat> sniff(byte[] data) {
    for (PayloadDecompressor decompressor : decompressors) {
      if (decompressor.matches(data)) {
        return Optional.of(decompressor.format());
      }
    }
    return Optional.empty();
  }

  /**
   * Decompresses a payload using the decompressor registered for its declared format.
   *
   * @param payload tagged compressed bytes; must not be {@code null}
   * @return decompressed bytes
   * @throws DecompressionException when the payload fails validation or decoding
   * @throws IllegalStateException when no decompressor is registered for the payload's format
   */
  public byte[] decode(CompressedPayload payload) throws DecompressionException {
    Objects.requireNonNull(payload, "payload");
    PayloadDecompressor decompressor = byFormat.get(payload.format());
    if (decompressor == null) {
      throw new IllegalStateException("no decompressor registered for " + payload.format());
    }
    return decompressor.decompress(payload.bytes());
  }

  /**
   * Decompresses a payload and decodes the result as UTF-8 text.
   *
   * @param payload tagged compressed bytes; must not be {@code null}
   * @return decoded text; malformed sequences become U+FFFD
   * @throws DecompressionException when the payload fails validation or decoding
   */
  public String decodeText(CompressedPayload payload) throws DecompressionException {
    return Utf8.decode(decode(payload));
  }
}
