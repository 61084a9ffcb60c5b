package com.photo.panogroup.core.cache;

import com.photo.panogroup.core.feature.DetectorKind;
import com.photo.panogroup.core.scan.ImageRecord;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CacheKeysTest {

    private static final Instant T0 = Instant.parse("2024-06-01T10:00:00Z");

    private static ImageRecord image(String name, Instant mtime) {
        return new ImageRecord(Path.of("photos", name), mtime, mtime);
    }

    @Test
    void keysAreFixedLengthHex() {
        String key = CacheKeys.features(image("a.jpg", T0), DetectorKind.SIFT, 500);

        assertEquals(32, key.length());
        assertTrue(key.matches("[0-9a-f]{32}"));
    }

    @Test
    void featureKeyChangesWithModificationTime() {
        String before = CacheKeys.features(image("a.jpg", T0), DetectorKind.SIFT, 500);
        String after = CacheKeys.features(image("a.jpg", T0.plusSeconds(1)), DetectorKind.SIFT, 500);

        assertNotEquals(before, after);
    }

    @Test
    void featureKeyDependsOnDetectorAndPath() {
        ImageRecord a = image("a.jpg", T0);

        assertNotEquals(CacheKeys.features(a, DetectorKind.SIFT, 500), CacheKeys.features(a, DetectorKind.ORB, 500));
        assertNotEquals(CacheKeys.features(a, DetectorKind.SIFT, 500), CacheKeys.features(image("b.jpg", T0), DetectorKind.SIFT, 500));
        assertEquals(CacheKeys.features(a, DetectorKind.SIFT, 500), CacheKeys.features(image("a.jpg", T0), DetectorKind.SIFT, 500));
    }

    @Test
    void orbKeyChangesWithFeatureLimitButSiftKeyDoesNot() {
        ImageRecord a = image("a.jpg", T0);

        assertNotEquals(CacheKeys.features(a, DetectorKind.ORB, 500), CacheKeys.features(a, DetectorKind.ORB, 1000));
        assertEquals(CacheKeys.features(a, DetectorKind.SIFT, 500), CacheKeys.features(a, DetectorKind.SIFT, 1000));
    }

    @Test
    void graphKeyIgnoresInputOrder() {
        List<ImageRecord> forward = List.of(image("a.jpg", T0), image("b.jpg", T0), image("c.jpg", T0));
        List<ImageRecord> backward = List.of(image("c.jpg", T0), image("a.jpg", T0), image("b.jpg", T0));

        assertEquals(CacheKeys.graph(forward, DetectorKind.SIFT, 30, false),
                CacheKeys.graph(backward, DetectorKind.SIFT, 30, false));
    }

    @Test
    void graphKeyIsScopedByThresholdModeAndDetector() {
        List<ImageRecord> images = List.of(image("a.jpg", T0), image("b.jpg", T0));
        String base = CacheKeys.graph(images, DetectorKind.SIFT, 30, false);

        assertNotEquals(base, CacheKeys.graph(images, DetectorKind.SIFT, 31, false));
        assertNotEquals(base, CacheKeys.graph(images, DetectorKind.SIFT, 30, true));
        assertNotEquals(base, CacheKeys.graph(images, DetectorKind.ORB, 30, false));
        assertNotEquals(base, CacheKeys.graph(List.of(image("a.jpg", T0)), DetectorKind.SIFT, 30, false));
    }

    @Test
    void descriptionsAreReadable() {
        ImageRecord a = image("a.jpg", T0);

        assertEquals("features|" + a.getId() + "|" + T0.toEpochMilli() + "|ORB|500",
                CacheKeys.featuresDescription(a, DetectorKind.ORB, 500));
        assertEquals("features|" + a.getId() + "|" + T0.toEpochMilli() + "|SIFT",
                CacheKeys.featuresDescription(a, DetectorKind.SIFT, 500));
        assertTrue(CacheKeys.graphDescription(List.of(a), DetectorKind.SIFT, 12, true).endsWith("|SIFT|12|consecutive"));
    }
}
