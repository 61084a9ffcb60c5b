package com.photo.panogroup.core.match;

import com.photo.panogroup.core.feature.DescriptorMatrix;
import com.photo.panogroup.core.feature.DetectorKind;
import com.photo.panogroup.core.feature.FeaturePoint;
import com.photo.panogroup.core.feature.FeatureSet;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.opencv.core.CvType;

import java.util.ArrayList;
import java.util.List;

import static com.photo.panogroup.OpenCvTestSupport.assumeOpenCv;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * 构造 12 个平移一致的匹配点和 3 个离群点，验证内点阈值判定
 */
class HomographyPairMatcherTest {

    private static final float[][] INLIERS = {
            {12, 40}, {95, 22}, {180, 61}, {260, 15}, {33, 140}, {120, 170},
            {210, 130}, {290, 190}, {60, 250}, {150, 235}, {240, 275}, {300, 90}
    };
    private static final float[][] OUTLIERS_A = {{50, 50}, {200, 100}, {10, 300}};
    private static final float[][] OUTLIERS_B = {{700, 20}, {5, 400}, {400, 5}};
    private static final float DX = 100;
    private static final float DY = 50;
    private static final int COLS = 16;

    private final HomographyPairMatcher matcher = new HomographyPairMatcher();

    @BeforeAll
    static void loadOpenCv() {
        assumeOpenCv();
    }

    private static FeatureSet siftSet(boolean shifted) {
        List<FeaturePoint> points = new ArrayList<>();
        for (float[] p : INLIERS) {
            points.add(shifted ? FeaturePoint.at(p[0] + DX, p[1] + DY) : FeaturePoint.at(p[0], p[1]));
        }
        for (float[] p : shifted ? OUTLIERS_B : OUTLIERS_A) {
            points.add(FeaturePoint.at(p[0], p[1]));
        }
        // 第 i 个点的描述子只在第 i 列为 1，两侧完全一致，交叉校验后一一对应
        float[] descriptors = new float[points.size() * COLS];
        for (int i = 0; i < points.size(); i++) {
            descriptors[i * COLS + i] = 1f;
        }
        return new FeatureSet(DetectorKind.SIFT, points, DescriptorMatrix.ofFloats(points.size(), COLS, descriptors));
    }

    @Test
    void inlierCountEqualToThresholdIsAccepted() {
        MatchResult result = matcher.evaluate(siftSet(false), siftSet(true), DetectorKind.SIFT, 12);

        assertEquals(15, result.getMatchCount());
        assertTrue(result.isHomographyFound());
        assertEquals(12, result.getInlierCount());
        assertTrue(result.isOverlap());
        assertTrue(matcher.compare(siftSet(false), siftSet(true), DetectorKind.SIFT, 12));
    }

    @Test
    void inlierCountBelowThresholdIsRejected() {
        MatchResult result = matcher.evaluate(siftSet(false), siftSet(true), DetectorKind.SIFT, 13);

        assertTrue(result.isHomographyChecked());
        assertEquals(12, result.getInlierCount());
        assertFalse(result.isOverlap());
    }

    @Test
    void tooFewMatchesSkipGeometricCheck() {
        MatchResult result = matcher.evaluate(siftSet(false), siftSet(true), DetectorKind.SIFT, 16);

        assertEquals(15, result.getMatchCount());
        assertFalse(result.isHomographyChecked());
        assertFalse(result.isOverlap());
    }

    @Test
    void emptyFeatureSetNeverOverlaps() {
        FeatureSet empty = new FeatureSet(DetectorKind.SIFT, List.of(), DescriptorMatrix.empty(CvType.CV_32F));

        assertFalse(matcher.compare(empty, siftSet(true), DetectorKind.SIFT, 1));
        assertFalse(matcher.compare(siftSet(false), empty, DetectorKind.SIFT, 1));
    }

    @Test
    void incompatibleDescriptorsAreTreatedAsNoOverlap() {
        byte[] bits = new byte[INLIERS.length * 32];
        List<FeaturePoint> points = new ArrayList<>();
        for (float[] p : INLIERS) {
            points.add(FeaturePoint.at(p[0], p[1]));
        }
        FeatureSet orb = new FeatureSet(DetectorKind.ORB, points, DescriptorMatrix.ofBytes(points.size(), 32, bits));

        assertThrows(MatchException.class, () -> matcher.evaluate(siftSet(false), orb, DetectorKind.SIFT, 4));
        assertFalse(matcher.compare(siftSet(false), orb, DetectorKind.SIFT, 4));
    }

    @Test
    void acceptanceRule() {
        assertTrue(HomographyPairMatcher.accepts(true, 30, 30));
        assertFalse(HomographyPairMatcher.accepts(true, 29, 30));
        assertFalse(HomographyPairMatcher.accepts(false, 100, 30));
    }
}
