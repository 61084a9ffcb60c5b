package com.photo.panogroup.core.scan;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;

class CaptureTimeReaderTest {

    private static final Instant MTIME = Instant.parse("2030-01-01T00:00:00Z");

    @TempDir
    Path tempDir;

    private final CaptureTimeReader reader = new CaptureTimeReader();

    private Path jpeg(String name, String dateTimeOriginal, String dateTime) throws IOException {
        return Files.write(tempDir.resolve(name), jpegWithExif(dateTimeOriginal, dateTime));
    }

    @Test
    void dateTimeOriginalIsUsed() throws IOException {
        Path file = jpeg("original.jpg", "2024:06:01 10:00:00", null);

        assertEquals(Instant.parse("2024-06-01T10:00:00Z"), reader.read(file, MTIME));
    }

    @Test
    void dateTimeIsUsedWhenOriginalIsMissing() throws IOException {
        Path file = jpeg("modified.jpg", null, "2023:12:24 18:30:05");

        assertEquals(Instant.parse("2023-12-24T18:30:05Z"), reader.read(file, MTIME));
    }

    @Test
    void dateTimeOriginalWinsOverDateTime() throws IOException {
        Path file = jpeg("both.jpg", "2024:06:01 10:00:00", "2024:07:15 08:00:00");

        assertEquals(Instant.parse("2024-06-01T10:00:00Z"), reader.read(file, MTIME));
    }

    @Test
    void exifWithoutDatesFallsBackToModificationTime() throws IOException {
        Path file = jpeg("undated.jpg", null, null);

        assertEquals(MTIME, reader.read(file, MTIME));
    }

    @Test
    void unreadableFileFallsBackToModificationTime() throws IOException {
        Path file = Files.write(tempDir.resolve("garbage.jpg"), new byte[]{1, 2, 3});

        assertEquals(MTIME, reader.read(file, MTIME));
    }

    /**
     * 只含 APP1/Exif 段的最小 JPEG：IFD0 可带 DateTime，Exif 子 IFD 可带 DateTimeOriginal
     */
    static byte[] jpegWithExif(String dateTimeOriginal, String dateTime) {
        int ifd0Entries = (dateTime != null ? 1 : 0) + (dateTimeOriginal != null ? 1 : 0);
        int subIfdOffset = 8 + 2 + 12 * ifd0Entries + 4;
        int dataOffset = subIfdOffset + (dateTimeOriginal != null ? 2 + 12 + 4 : 0);

        ByteBuffer tiff = ByteBuffer.allocate(dataOffset + 40).order(ByteOrder.BIG_ENDIAN);
        tiff.put((byte) 'M').put((byte) 'M').putShort((short) 42).putInt(8);

        int next = dataOffset;
        tiff.putShort((short) ifd0Entries);
        if (dateTime != null) {
            asciiEntry(tiff, 0x0132, next);
            next += 20;
        }
        if (dateTimeOriginal != null) {
            tiff.putShort((short) 0x8769).putShort((short) 4).putInt(1).putInt(subIfdOffset);
        }
        tiff.putInt(0);

        if (dateTimeOriginal != null) {
            tiff.putShort((short) 1);
            asciiEntry(tiff, 0x9003, next);
            tiff.putInt(0);
        }
        if (dateTime != null) {
            tiff.put(exifDate(dateTime));
        }
        if (dateTimeOriginal != null) {
            tiff.put(exifDate(dateTimeOriginal));
        }
        byte[] tiffBytes = new byte[tiff.position()];
        tiff.flip();
        tiff.get(tiffBytes);

        ByteArrayOutputStream out = new ByteArrayOutputStream();
        out.write(0xFF);
        out.write(0xD8);
        out.write(0xFF);
        out.write(0xE1);
        int length = 2 + 6 + tiffBytes.length;
        out.write(length >> 8);
        out.write(length & 0xFF);
        out.writeBytes("Exif\0\0".getBytes(StandardCharsets.US_ASCII));
        out.writeBytes(tiffBytes);
        // 扫描段开始，元数据读取到此为止
        out.write(0xFF);
        out.write(0xDA);
        out.write(0xFF);
        out.write(0xD9);
        return out.toByteArray();
    }

    private static void asciiEntry(ByteBuffer tiff, int tag, int valueOffset) {
        tiff.putShort((short) tag).putShort((short) 2).putInt(20).putInt(valueOffset);
    }

    private static byte[] exifDate(String value) {
        byte[] text = value.getBytes(StandardCharsets.US_ASCII);
        byte[] field = new byte[20];
        System.arraycopy(text, 0, field, 0, Math.min(text.length, 19));
        return field;
    }
}
