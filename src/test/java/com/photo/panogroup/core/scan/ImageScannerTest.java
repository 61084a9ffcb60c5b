package com.photo.panogroup.core.scan;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ImageScannerTest {

    @TempDir
    Path root;

    private ImageScanner scanner;

    @BeforeEach
    void setUp() {
        scanner = new ImageScanner(List.of("jpg", "jpeg", ".PNG", "tif"), "panorama_", new CaptureTimeReader());
    }

    private Path touch(String relative) throws IOException {
        Path file = root.resolve(relative);
        Files.createDirectories(file.getParent());
        Files.write(file, new byte[]{1, 2, 3});
        return file;
    }

    @Test
    void findsImagesRecursivelySortedByPath() throws IOException {
        touch("b.jpg");
        touch("a.JPG");
        touch("day2/c.png");
        touch("day2/deeper/d.tif");

        List<String> names = scanner.scan(root).stream()
                .map(r -> root.relativize(r.getPath()).toString().replace('\\', '/'))
                .collect(Collectors.toList());

        assertEquals(List.of("a.JPG", "b.jpg", "day2/c.png", "day2/deeper/d.tif"), names);
    }

    @Test
    void skipsPriorOutputAndOtherFiles() throws IOException {
        touch("IMG_1.jpg");
        touch("panorama_IMG_1_3.jpg");
        touch("notes.txt");
        touch("raw.cr2");
        touch("noextension");
        Files.createDirectories(root.resolve("folder.jpg"));

        List<ImageRecord> images = scanner.scan(root);

        assertEquals(1, images.size());
        assertEquals("IMG_1.jpg", images.get(0).getFileName());
    }

    @Test
    void emptyDirectoryYieldsNothing() throws IOException {
        assertTrue(scanner.scan(root).isEmpty());
    }

    @Test
    void missingDirectoryIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> scanner.scan(root.resolve("missing")));
    }

    @Test
    void captureTimeFallsBackToModificationTime() throws IOException {
        Path file = touch("no-exif.jpg");
        Instant mtime = Instant.parse("2023-03-04T05:06:07Z");
        Files.setLastModifiedTime(file, FileTime.from(mtime));

        ImageRecord record = scanner.scan(root).get(0);

        assertEquals(mtime, record.getLastModified());
        assertEquals(mtime, record.getCaptureTime());
        assertTrue(record.getPath().isAbsolute());
    }

    @Test
    void eligibilityIsCaseInsensitive() {
        assertTrue(scanner.isEligible(Path.of("x.JPEG")));
        assertTrue(scanner.isEligible(Path.of("x.png")));
        assertFalse(scanner.isEligible(Path.of("x.")));
        assertFalse(scanner.isEligible(Path.of("panorama_x.jpg")));
    }
}
