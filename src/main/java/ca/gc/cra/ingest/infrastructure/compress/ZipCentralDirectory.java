package ca.gc.cra.ingest.infrastructure.compress;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * In-memory reader for a zip archive's end-of-central-directory record and central directory headers.
 *
 * <p>Parsing never throws: any record that does not fit inside the buffer makes {@link #parse(byte[])}
 * return empty. Zip64 sizes and offsets are read from the zip64 end record and extended-information extra
 * fields when the 16/32-bit fields are saturated. Archives with bytes prepended before the first local header
 * are not recognized.</p>
 */
final class ZipCentralDirectory {
  private static final int EOCD_SIGNATURE = 0x06054b50;
  private static final int CENTRAL_HEADER_SIGNATURE = 0x02014b50;
  private static final int ZIP64_LOCATOR_SIGNATURE = 0x07064b50;
  private static final int ZIP64_EOCD_SIGNATURE = 0x06064b50;
  private static final int EOCD_LENGTH = 22;
  private static final int ZIP64_LOCATOR_LENGTH = 20;
  private static final int ZIP64_EOCD_MIN_LENGTH = 56;
  private static final int CENTRAL_HEADER_LENGTH = 46;
  private static final int MAX_COMMENT_LENGTH = 0xFFFF;
  private static final int ZIP64_EXTRA_ID = 0x0001;
  private static final int FLAG_UTF8 = 1 << 11;
  private static final long U16_SATURATED = 0xFFFFL;
  private static final long U32_SATURATED = 0xFFFFFFFFL;
  private static final Charset LEGACY_NAMES = StandardCharsets.ISO_8859_1;

  /**
   * Central directory header of one archive member.
   *
   * @param name entry name as recorded in the archive
   * @param method compression method (0 stored, 8 deflated, others unsupported)
   * @param flags general purpose bit flags
   * @param crc recorded CRC-32 of the uncompressed data
   * @param compressedSize recorded compressed size in bytes
   * @param uncompressedSize recorded uncompressed size in bytes
   * @param localHeaderOffset offset of the entry's local file header
   */
  record Entry(
      String name,
      int method,
      int flags,
      long crc,
      long compressedSize,
      long uncompressedSize,
      long localHeaderOffset) {}

  private final List<Entry> entries;

  private ZipCentralDirectory(List<Entry> entries) {
    this.entries = List.copyOf(entries);
  }

  List<Entry> entries() {
    return entries;
  }

  /**
   * Locates and parses the central directory of {@code data}.
   *
   * @param data candidate archive bytes; may be {@code null}
   * @return parsed directory, or empty when the buffer is not a well-formed zip archive
   */
  static Optional<ZipCentralDirectory> parse(byte[] data) {
    if (data == null || data.length < EOCD_LENGTH) {
      return Optional.empty();
    }
    ByteBuffer buf = ByteBuffer.wrap(data).order(ByteOrder.LITTLE_ENDIAN);
    int eocd = findEndRecord(buf);
    if (eocd < 0) {
      return Optional.empty();
    }
    long entryCount = u16(buf, eocd + 10);
    long directorySize = u32(buf, eocd + 12);
    long directoryOffset = u32(buf, eocd + 16);
    long directoryLimit = eocd;

    if (entryCount == U16_SATURATED || directorySize == U32_SATURATED
        || directoryOffset == U32_SATURATED) {
      int locator = eocd - ZIP64_LOCATOR_LENGTH;
      if (locator < 0 || buf.getInt(locator) != ZIP64_LOCATOR_SIGNATURE) {
        return Optional.empty();
      }
      long zip64End = buf.getLong(locator + 8);
      if (zip64End < 0 || zip64End + ZIP64_EOCD_MIN_LENGTH > locator) {
        return Optional.empty();
      }
      int end = (int) zip64End;
      if (buf.getInt(end) != ZIP64_EOCD_SIGNATURE) {
        return Optional.empty();
      }
      entryCount = buf.getLong(end + 32);
      directorySize = buf.getLong(end + 40);
      directoryOffset = buf.getLong(end + 48);
      directoryLimit = end;
    }

    if (entryCount < 0 || directorySize < 0 || directoryOffset < 0
        || directoryOffset + directorySize > directoryLimit) {
      return Optional.empty();
    }
    return readEntries(buf, (int) directoryOffset, (int) (directoryOffset + directorySize), entryCount);
  }

  private static int findEndRecord(ByteBuffer buf) {
    int last = buf.limit() - EOCD_LENGTH;
    int first = Math.max(0, last - MAX_COMMENT_LENGTH);
    for (int pos = last; pos >= first; pos--) {
      if (buf.getInt(pos) == EOCD_SIGNATURE) {
        int commentLength = (int) u16(buf, pos + 20);
        if ((long) pos + EOCD_LENGTH + commentLength <= buf.limit()) {
          return pos;
        }
      }
    }
    return -1;
  }

  private static Optional<ZipCentralDirectory> readEntries(
      ByteBuffer buf, int start, int end, long expected) {
    List<Entry> entries = new ArrayList<>();
    int pos = start;
    while (entries.size() < expected) {
      if (pos + CENTRAL_HEADER_LENGTH > end || buf.getInt(pos) != CENTRAL_HEADER_SIGNATURE) {
        return Optional.empty();
      }
      int flags = (int) u16(buf, pos + 8);
      int method = (int) u16(buf, pos + 10);
      long crc = u32(buf, pos + 16);
      long compressed = u32(buf, pos + 20);
      long uncompressed = u32(buf, pos + 24);
      int nameLength = (int) u16(buf, pos + 28);
      int extraLength = (int) u16(buf, pos + 30);
      int commentLength = (int) u16(buf, pos + 32);
      long localOffset = u32(buf, pos + 42);
      int nameStart = pos + CENTRAL_HEADER_LENGTH;
      int extraStart = nameStart + nameLength;
      int next = extraStart + extraLength + commentLength;
      if (next > end) {
        return Optional.empty();
      }

      if (uncompressed == U32_SATURATED || compressed == U32_SATURATED
          || localOffset == U32_SATURATED) {
        long[] widened = readZip64Extra(buf, extraStart, extraLength,
            uncompressed == U32_SATURATED, compressed == U32_SATURATED,
            localOffset == U32_SATURATED);
        if (widened == null) {
          return Optional.empty();
        }
        uncompressed = widened[0] < 0 ? uncompressed : widened[0];
        compressed = widened[1] < 0 ? compressed : widened[1];
        localOffset = widened[2] < 0 ? localOffset : widened[2];
      }
      if (localOffset >= start) {
        return Optional.empty();
      }

      Charset charset = (flags & FLAG_UTF8) != 0 ? StandardCharsets.UTF_8 : LEGACY_NAMES;
      String name = new String(buf.array(), nameStart, nameLength, charset);
      entries.add(new Entry(name, method, flags, crc, compressed, uncompressed, localOffset));
      pos = next;
    }
    return Optional.of(new ZipCentralDirectory(entries));
  }

  /**
   * Reads the zip64 extended information field; values appear only for the saturated header fields, in the
   * order uncompressed size, compressed size, local header offset.
   *
   * @return widened values with {@code -1} for fields not requested, or {@code null} when the field is missing
   */
  private static long[] readZip64Extra(
      ByteBuffer buf, int start, int length,
      boolean wantUncompressed, boolean wantCompressed, boolean wantOffset) {
    int pos = start;
    int end = start + length;
    while (pos + 4 <= end) {
      int id = (int) u16(buf, pos);
      int size = (int) u16(buf, pos + 2);
      int data = pos + 4;
      if (data + size > end) {
        return null;
      }
      if (id == ZIP64_EXTRA_ID) {
        long[] values = {-1L, -1L, -1L};
        boolean[] wanted = {wantUncompressed, wantCompressed, wantOffset};
        int cursor = data;
        for (int i = 0; i < values.length; i++) {
          if (!wanted[i]) {
            continue;
          }
          if (cursor + 8 > data + size) {
            return null;
          }
          values[i] = buf.getLong(cursor);
          if (values[i] < 0) {
            return null;
          }
          cursor += 8;
        }
        return values;
      }
      pos = data + size;
    }
    return null;
  }

  private static long u16(ByteBuffer buf, int index) {
    return buf.getShort(index) & U16_SATURATED;
  }

  private static long u32(ByteBuffer buf, int index) {
    return buf.getInt(index) & U32_SATURATED;
  }
}
