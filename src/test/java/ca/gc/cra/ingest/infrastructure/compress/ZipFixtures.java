package ca.gc.cra.ingest.infrastructure.compress;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.zip.CRC32;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;

/**
 * Builds zip archives and locates header fields for tampering in tests.
 */
final class ZipFixtures {
  static final int LOCAL_METHOD_OFFSET = 8;
  static final int LOCAL_UNCOMPRESSED_OFFSET = 22;
  static final int CENTRAL_FLAGS_OFFSET = 8;
  static final int CENTRAL_METHOD_OFFSET = 10;
  static final int CENTRAL_COMPRESSED_OFFSET = 20;
  static final int CENTRAL_UNCOMPRESSED_OFFSET = 24;
  static final int DESCRIPTOR_UNCOMPRESSED_OFFSET = 12;
  private static final int CENTRAL_HEADER_SIGNATURE = 0x02014b50;
  private static final int DATA_DESCRIPTOR_SIGNATURE = 0x08074b50;

  private ZipFixtures() {}

  static byte[] deflated(Map<String, String> entries) throws IOException {
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    try (ZipOutputStream zip = new ZipOutputStream(out, StandardCharsets.UTF_8)) {
      for (Map.Entry<String, String> entry : entries.entrySet()) {
        zip.putNextEntry(new ZipEntry(entry.getKey()));
        zip.write(entry.getValue().getBytes(StandardCharsets.UTF_8));
        zip.closeEntry();
      }
    }
    return out.toByteArray();
  }

  static byte[] deflated(String name, String content) throws IOException {
    return deflated(Map.of(name, content));
  }

  /** Single deflated entry whose name is written in ISO-8859-1 without the UTF-8 flag. */
  static byte[] latin1Named(String name, String content) throws IOException {
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    try (ZipOutputStream zip = new ZipOutputStream(out, StandardCharsets.ISO_8859_1)) {
      zip.putNextEntry(new ZipEntry(name));
      zip.write(content.getBytes(StandardCharsets.UTF_8));
      zip.closeEntry();
    }
    return out.toByteArray();
  }

  static byte[] stored(String name, String content) throws IOException {
    byte[] data = content.getBytes(StandardCharsets.UTF_8);
    CRC32 crc = new CRC32();
    crc.update(data);
    ZipEntry entry = new ZipEntry(name);
    entry.setMethod(ZipEntry.STORED);
    entry.setSize(data.length);
    entry.setCompressedSize(data.length);
    entry.setCrc(crc.getValue());

    ByteArrayOutputStream out = new ByteArrayOutputStream();
    try (ZipOutputStream zip = new ZipOutputStream(out, StandardCharsets.UTF_8)) {
      zip.putNextEntry(entry);
      zip.write(data);
      zip.closeEntry();
    }
    return out.toByteArray();
  }

  /** End-of-central-directory record with no entries. */
  static byte[] empty() {
    return ByteBuffer.allocate(22).order(ByteOrder.LITTLE_ENDIAN).putInt(0x06054b50).array();
  }

  static int centralHeaderOffset(byte[] archive) {
    ByteBuffer buf = ByteBuffer.wrap(archive).order(ByteOrder.LITTLE_ENDIAN);
    for (int pos = 0; pos + 4 <= archive.length; pos++) {
      if (buf.getInt(pos) == CENTRAL_HEADER_SIGNATURE) {
        return pos;
      }
    }
    throw new IllegalStateException("no central directory header");
  }

  /** Offset of the first data byte of the entry whose local header starts at 0. */
  static int localDataOffset(byte[] archive) {
    ByteBuffer buf = ByteBuffer.wrap(archive).order(ByteOrder.LITTLE_ENDIAN);
    return 30 + (buf.getShort(26) & 0xFFFF) + (buf.getShort(28) & 0xFFFF);
  }

  /** Offset of the data descriptor ZipOutputStream writes after a deflated entry. */
  static int dataDescriptorOffset(byte[] archive) {
    ByteBuffer buf = ByteBuffer.wrap(archive).order(ByteOrder.LITTLE_ENDIAN);
    int end = centralHeaderOffset(archive);
    for (int pos = localDataOffset(archive); pos + 16 <= end; pos++) {
      if (buf.getInt(pos) == DATA_DESCRIPTOR_SIGNATURE) {
        return pos;
      }
    }
    throw new IllegalStateException("no data descriptor");
  }

  static void putInt(byte[] archive, int offset, int value) {
    ByteBuffer.wrap(archive).order(ByteOrder.LITTLE_ENDIAN).putInt(offset, value);
  }

  static void putShort(byte[] archive, int offset, int value) {
    ByteBuffer.wrap(archive).order(ByteOrder.LITTLE_ENDIAN).putShort(offset, (short) value);
  }
}
