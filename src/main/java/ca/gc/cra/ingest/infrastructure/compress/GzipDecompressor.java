package ca.gc.cra.ingest.infrastructure.compress;

import ca.gc.cra.ingest.application.port.MetricsPort;
import ca.gc.cra.ingest.application.port.PayloadDecompressor;
import ca.gc.cra.ingest.config.DecompressionConfig;
import ca.gc.cra.ingest.domain.compress.CompressionFormat;
import ca.gc.cra.ingest.domain.compress.DecompressionException;
import ca.gc.cra.ingest.domain.compress.DecompressionException.Reason;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.Locale;
import java.util.Objects;
import java.util.zip.GZIPInputStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Validates and inflates gzip-formatted payloads.
 * <p><strong>Why:</strong> Collected files often arrive gzip-compressed; corrupt or mislabelled buffers must be
 * rejected with a distinct reason instead of producing partial text.</p>
 * <p><strong>Thread-safety:</strong> Immutable; safe for concurrent use.</p>
 * <p><strong>Observability:</strong> Counts {@code decompress.gzip.success} and
 * {@code decompress.gzip.failure.<reason>}; observes {@code decompress.gzip.bytes}.</p>
 *
 * @since 0.1.0
 */
public final class GzipDecompressor implements PayloadDecompressor {
  private static final Logger log = LoggerFactory.getLogger(GzipDecompressor.class);
  private static final byte MAGIC_FIRST = (byte) 0x1f;
  private static final byte MAGIC_SECOND = (byte) 0x8b;

  private final long maxDecompressedBytes;
  private final MetricsPort metrics;
  private final String metricPrefix;

  /**
   * Creates a decompressor with default limits and no metrics.
   */
  public GzipDecompressor() {
    this(DecompressionConfig.defaults(), MetricsPort.NO_OP);
  }

  /**
   * Creates a decompressor with explicit limits.
   *
   * @param config decompression limits; must not be {@code null}
   * @param metrics metrics adapter; falls back to {@link MetricsPort#NO_OP} when {@code null}
   */
  public GzipDecompressor(DecompressionConfig config, MetricsPort metrics) {
    this.maxDecompressedBytes = Objects.requireNonNull(config, "config").maxDecompressedBytes();
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
    this.metricPrefix = "decompress." + CompressionFormat.GZIP.label();
  }

  /**
   * Checks the RFC 1952 magic bytes: {@code data[0] == 0x1f} and {@code data[1] == 0x8b}.
   *
   * @param data candidate bytes; may be {@code null}
   * @return {@code true} when the buffer starts with the gzip signature
   */
  public static boolean isGzip(byte[] data) {
    return data != null && data.length >= 2 && data[0] == MAGIC_FIRST && data[1] == MAGIC_SECOND;
  }

  @Override
  public CompressionFormat format() {
    return CompressionFormat.GZIP;
  }

  @Override
  public boolean matches(byte[] data) {
    return isGzip(data);
  }

  @Override
  public byte[] decompress(byte[] data) throws DecompressionException {
    Objects.requireNonNull(data, "data");
    if (!isGzip(data)) {
      throw failure(Reason.INVALID_FORMAT, "payload is not gzip format", null);
    }
    try (GZIPInputStream in = new GZIPInputStream(new ByteArrayInputStream(data))) {
      byte[] inflated = BoundedReads.readAll(in, maxDecompressedBytes, (long) data.length * 4);
      metrics.increment(metricPrefix + ".success");
      metrics.observe(metricPrefix + ".bytes", inflated.length);
      log.debug("Inflated gzip payload {} -> {} bytes", data.length, inflated.length);
      return inflated;
    } catch (BoundedReads.OutputLimitException ex) {
      throw failure(Reason.LIMIT_EXCEEDED,
          "gzip payload inflates beyond " + ex.limit() + " bytes", ex);
    } catch (IOException ex) {
      throw failure(Reason.INVALID_FORMAT, "gzip stream is corrupt: " + ex.getMessage(), ex);
    }
  }

  private DecompressionException failure(Reason reason, String message, Throwable cause) {
    metrics.increment(metricPrefix + ".failure." + reason.name().toLowerCase(Locale.ROOT));
    log.debug("Rejected gzip payload ({}): {}", reason, message);
    return new DecompressionException(CompressionFormat.GZIP, reason, message, cause);
  }
}
