package com.photo.panogroup.core.feature;

import org.junit.jupiter.api.Test;
import org.opencv.core.CvType;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class DescriptorMatrixTest {

    @Test
    void shapeMustMatchDataLength() {
        assertThrows(IllegalArgumentException.class,
                () -> new DescriptorMatrix(2, 4, CvType.CV_8U, new byte[7]));
        assertThrows(IllegalArgumentException.class,
                () -> new DescriptorMatrix(1, 2, CvType.CV_32F, new byte[2]));
    }

    @Test
    void overflowingShapeIsRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> new DescriptorMatrix(65536, 65536, CvType.CV_8U, new byte[0]));
        assertThrows(IllegalArgumentException.class,
                () -> new DescriptorMatrix(32768, 32768, CvType.CV_32F, new byte[0]));
    }

    @Test
    void floatValuesAreStoredLittleEndian() {
        DescriptorMatrix matrix = DescriptorMatrix.ofFloats(1, 1, new float[]{1.0f});

        assertEquals(CvType.CV_32F, matrix.getType());
        assertArrayEquals(new byte[]{0, 0, (byte) 0x80, 0x3f}, matrix.getData());
    }

    @Test
    void unsupportedTypeIsRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> new DescriptorMatrix(1, 1, CvType.CV_16S, new byte[2]));
    }
}
