package ca.gc.cra.ingest.infrastructure.compress;

import ca.gc.cra.ingest.application.port.MetricsPort;
import ca.gc.cra.ingest.application.port.PayloadDecompressor;
import ca.gc.cra.ingest.config.DecompressionConfig;
import ca.gc.cra.ingest.domain.compress.CompressionFormat;
import ca.gc.cra.ingest.domain.compress.DecompressionException;
import ca.gc.cra.ingest.domain.compress.DecompressionException.Reason;
import ca.gc.cra.ingest.logging.Logs;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.zip.CRC32;
import java.util.zip.Inflater;
import java.util.zip.InflaterInputStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Validates and extracts single-file zip archives.
 * <p><strong>Why:</strong> Accepting multi-file archives would silently drop data, so anything other than
 * exactly one entry is rejected rather than narrowed to the first member.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Structure check: the end-of-central-directory record and central directory must parse.</li>
 *   <li>Entry count check: zero entries is an invalid format, more than one is rejected.</li>
 *   <li>Extraction of the single entry (stored or deflated) from the offsets and compressed size the central
 *   directory records, with CRC verification. Local header sizes and data descriptors are not trusted.</li>
 *   <li>Size check against the uncompressed size recorded in the central directory.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Immutable; safe for concurrent use.</p>
 * <p><strong>Observability:</strong> Counts {@code decompress.zip.success} and
 * {@code decompress.zip.failure.<reason>}; observes {@code decompress.zip.bytes}.</p>
 *
 * @since 0.1.0
 */
public final class ZipDecompressor implements PayloadDecompressor {
  private static final Logger log = LoggerFactory.getLogger(ZipDecompressor.class);
  private static final int LOCAL_HEADER_SIGNATURE = 0x04034b50;
  private static final int LOCAL_HEADER_LENGTH = 30;
  private static final int METHOD_STORED = 0;
  private static final int METHOD_DEFLATED = 8;
  private static final int FLAG_ENCRYPTED = 1;
  private static final int NAME_PREVIEW_BYTES = 128;

  private final long maxDecompressedBytes;
  private final MetricsPort metrics;
  private final String metricPrefix;

  /**
   * Creates a decompressor with default limits and no metrics.
   */
  public ZipDecompressor() {
    this(DecompressionConfig.defaults(), MetricsPort.NO_OP);
  }

  /**
   * Creates a decompressor with explicit limits.
   *
   * @param config decompression limits; must not be {@code null}
   * @param metrics metrics adapter; falls back to {@link MetricsPort#NO_OP} when {@code null}
   */
  public ZipDecompressor(DecompressionConfig config, MetricsPort metrics) {
    this.maxDecompressedBytes = Objects.requireNonNull(config, "config").maxDecompressedBytes();
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
    this.metricPrefix = "decompress." + CompressionFormat.ZIP.label();
  }

  /**
   * Checks whether {@code data} holds a parseable zip central directory.
   *
   * @param data candidate bytes; may be {@code null}
   * @return {@code true} when the archive structure is well formed
   */
  public static boolean isZip(byte[] data) {
    return ZipCentralDirectory.parse(data).isPresent();
  }

  @Override
  public CompressionFormat format() {
    return CompressionFormat.ZIP;
  }

  @Override
  public boolean matches(byte[] data) {
    return isZip(data);
  }

  @Override
  public byte[] decompress(byte[] data) throws DecompressionException {
    Objects.requireNonNull(data, "data");
    ZipCentralDirectory directory = ZipCentralDirectory.parse(data)
        .orElseThrow(() -> failure(Reason.INVALID_FORMAT, "payload is not zip format", null));
    ZipCentralDirectory.Entry entry = requireSingleEntry(directory.entries());
    String name = Logs.truncate(entry.name(), NAME_PREVIEW_BYTES);
    if (entry.uncompressedSize() > maxDecompressedBytes) {
      throw failure(Reason.LIMIT_EXCEEDED, "zip entry " + name + " records "
          + entry.uncompressedSize() + " bytes, limit is " + maxDecompressedBytes, null);
    }

    byte[] extracted = extract(data, entry, name);
    if (extracted.length != entry.uncompressedSize()) {
      throw failure(Reason.SIZE_MISMATCH, "zip entry " + name + " extracted "
          + extracted.length + " bytes but archive records " + entry.uncompressedSize(), null);
    }
    metrics.increment(metricPrefix + ".success");
    metrics.observe(metricPrefix + ".bytes", extracted.length);
    log.debug("Extracted zip entry {} ({} bytes)", name, extracted.length);
    return extracted;
  }

  private ZipCentralDirectory.Entry requireSingleEntry(List<ZipCentralDirectory.Entry> entries)
      throws DecompressionException {
    if (entries.isEmpty()) {
      throw failure(Reason.INVALID_FORMAT, "zip archive contains no entries", null);
    }
    if (entries.size() > 1) {
      throw failure(Reason.EXCESS_ENTRIES,
          "zip archive contains " + entries.size() + " entries; only single-file archives are supported",
          null);
    }
    return entries.get(0);
  }

  private byte[] extract(byte[] data, ZipCentralDirectory.Entry entry, String name)
      throws DecompressionException {
    if ((entry.flags() & FLAG_ENCRYPTED) != 0) {
      throw failure(Reason.EXTRACTION_FAILED, "zip entry " + name + " is encrypted", null);
    }
    int start = dataStart(data, entry);
    if (start < 0 || entry.compressedSize() > data.length - start) {
      throw failure(Reason.EXTRACTION_FAILED,
          "local header or data of zip entry " + name + " lies outside the archive", null);
    }
    int compressed = (int) entry.compressedSize();

    byte[] extracted;
    switch (entry.method()) {
      case METHOD_STORED -> {
        if (compressed > maxDecompressedBytes) {
          throw failure(Reason.LIMIT_EXCEEDED, "zip entry " + name + " stores " + compressed
              + " bytes, limit is " + maxDecompressedBytes, null);
        }
        extracted = Arrays.copyOfRange(data, start, start + compressed);
      }
      case METHOD_DEFLATED -> extracted = inflate(data, start, compressed, entry, name);
      default -> throw failure(Reason.EXTRACTION_FAILED,
          "zip entry " + name + " uses unsupported compression method " + entry.method(), null);
    }

    CRC32 crc = new CRC32();
    crc.update(extracted);
    if (crc.getValue() != entry.crc()) {
      throw failure(Reason.EXTRACTION_FAILED, String.format(Locale.ROOT,
          "zip entry %s fails CRC check (expected %08x, computed %08x)", name, entry.crc(), crc.getValue()),
          null);
    }
    return extracted;
  }

  /**
   * Locates the first data byte of {@code entry} behind its local header, or {@code -1} when the header is
   * missing, truncated, or disagrees with the central directory about the compression method.
   */
  private static int dataStart(byte[] data, ZipCentralDirectory.Entry entry) {
    long offset = entry.localHeaderOffset();
    if (offset + LOCAL_HEADER_LENGTH > data.length) {
      return -1;
    }
    ByteBuffer buf = ByteBuffer.wrap(data).order(ByteOrder.LITTLE_ENDIAN);
    int local = (int) offset;
    if (buf.getInt(local) != LOCAL_HEADER_SIGNATURE
        || (buf.getShort(local + 8) & 0xFFFF) != entry.method()) {
      return -1;
    }
    long start = offset + LOCAL_HEADER_LENGTH
        + (buf.getShort(local + 26) & 0xFFFF)
        + (buf.getShort(local + 28) & 0xFFFF);
    return start > data.length ? -1 : (int) start;
  }

  private byte[] inflate(byte[] data, int start, int compressed, ZipCentralDirectory.Entry entry, String name)
      throws DecompressionException {
    // Raw deflate wants one byte of trailing input beyond the stream; the archive supplies it when present.
    int available = Math.min(compressed + 1, data.length - start);
    Inflater inflater = new Inflater(true);
    try (InputStream in =
        new InflaterInputStream(new ByteArrayInputStream(data, start, available), inflater)) {
      byte[] inflated = BoundedReads.readAll(in, maxDecompressedBytes, entry.uncompressedSize());
      if (inflater.getBytesRead() > compressed) {
        throw failure(Reason.EXTRACTION_FAILED,
            "deflate stream of zip entry " + name + " runs past its recorded compressed size", null);
      }
      return inflated;
    } catch (BoundedReads.OutputLimitException ex) {
      throw failure(Reason.LIMIT_EXCEEDED,
          "zip entry " + name + " inflates beyond " + ex.limit() + " bytes", ex);
    } catch (IOException ex) {
      throw failure(Reason.EXTRACTION_FAILED,
          "unable to inflate zip entry " + name + ": " + ex.getMessage(), ex);
    } finally {
      inflater.end();
    }
  }

  private DecompressionException failure(Reason reason, String message, Throwable cause) {
    metrics.increment(metricPrefix + ".failure." + reason.name().toLowerCase(Locale.ROOT));
    log.debug("Rejected zip payload ({}): {}", reason, message);
    return new DecompressionException(CompressionFormat.ZIP, reason, message, cause);
  }
}
