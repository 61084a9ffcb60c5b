package com.photo.panogroup.core.feature;

import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DetectorCapabilitiesTest {

    @Test
    void availableDetectorIsUsedAsIs() {
        DetectorCapabilities capabilities = new DetectorCapabilities(EnumSet.allOf(DetectorKind.class));

        assertEquals(DetectorKind.SIFT, capabilities.resolve(DetectorKind.SIFT));
        assertEquals(DetectorKind.ORB, capabilities.resolve(DetectorKind.ORB));
    }

    @Test
    void siftFallsBackToOrb() {
        DetectorCapabilities capabilities = new DetectorCapabilities(List.of(DetectorKind.ORB));

        assertFalse(capabilities.isAvailable(DetectorKind.SIFT));
        assertEquals(DetectorKind.ORB, capabilities.resolve(DetectorKind.SIFT));
        // 重复解析结果一致
        assertEquals(DetectorKind.ORB, capabilities.resolve(DetectorKind.SIFT));
    }

    @Test
    void orbHasNoFallback() {
        DetectorCapabilities capabilities = new DetectorCapabilities(List.of(DetectorKind.SIFT));

        assertThrows(IllegalStateException.class, () -> capabilities.resolve(DetectorKind.ORB));
    }

    @Test
    void nothingAvailableFailsLoudly() {
        DetectorCapabilities capabilities = new DetectorCapabilities(List.of());

        assertTrue(capabilities.available().isEmpty());
        assertThrows(IllegalStateException.class, () -> capabilities.resolve(DetectorKind.SIFT));
    }

    @Test
    void parseIsCaseInsensitive() {
        assertEquals(DetectorKind.SIFT, DetectorKind.parse("sift"));
        assertEquals(DetectorKind.ORB, DetectorKind.parse(" Orb "));
        assertNull(DetectorKind.parse(null));
        assertNull(DetectorKind.parse("  "));
        assertThrows(IllegalArgumentException.class, () -> DetectorKind.parse("surf"));
    }

    @Test
    void fallbackTable() {
        assertEquals(DetectorKind.ORB, DetectorKind.SIFT.fallback());
        assertNull(DetectorKind.ORB.fallback());
    }
}
