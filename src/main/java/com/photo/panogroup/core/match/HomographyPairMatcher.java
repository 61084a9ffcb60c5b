package com.photo.panogroup.core.match;

import com.photo.panogroup.core.feature.DetectorKind;
import com.photo.panogroup.core.feature.FeaturePoint;
import com.photo.panogroup.core.feature.FeatureSet;
import org.opencv.calib3d.Calib3d;
import org.opencv.core.Core;
import org.opencv.core.CvException;
import org.opencv.core.DMatch;
import org.opencv.core.Mat;
import org.opencv.core.MatOfDMatch;
import org.opencv.core.MatOfPoint2f;
import org.opencv.core.Point;
import org.opencv.features2d.BFMatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * 交叉校验匹配 + RANSAC 单应性验证
 * <p>
 * 1. 暴力匹配（SIFT 用 L2，ORB 用 Hamming），crossCheck 只保留双向最近邻；
 * 2. 匹配数 &lt; minMatches 直接判定不重叠，跳过几何校验；
 * 3. RANSAC 估计单应性，重投影误差阈值 5 像素；
 * 4. 找到单应性且内点数 &gt;= minMatches 才判定重叠。
 */
public class HomographyPairMatcher implements PairMatcher {
    private static final Logger logger = LoggerFactory.getLogger(HomographyPairMatcher.class);

    public static final double RANSAC_THRESH = 5.0;

    // findHomography 至少需要 4 对点
    private static final int MIN_HOMOGRAPHY_POINTS = 4;

    @Override
    public boolean compare(FeatureSet a, FeatureSet b, DetectorKind detector, int minMatches) {
        try {
            MatchResult result = evaluate(a, b, detector, minMatches);
            logger.trace("Pair evaluated: {}", result);
            return result.isOverlap();
        } catch (RuntimeException e) {
            logger.warn("Matching failed, treating pair as non-overlapping: {}", e.getMessage());
            return false;
        }
    }

    /**
     * 计算匹配明细
     *
     * @throws MatchException OpenCV 调用失败或特征集不兼容
     */
    public MatchResult evaluate(FeatureSet a, FeatureSet b, DetectorKind detector, int minMatches) {
        if (a.isEmpty() || b.isEmpty()) {
            return MatchResult.rejected(0);
        }
        if (a.getDescriptors().getType() != b.getDescriptors().getType()
                || a.getDescriptors().getCols() != b.getDescriptors().getCols()) {
            throw new MatchException("Incompatible descriptors: " + a.getDescriptors() + " vs " + b.getDescriptors());
        }

        Mat descA = null;
        Mat descB = null;
        MatOfDMatch matches = null;
        MatOfPoint2f srcPts = null;
        MatOfPoint2f dstPts = null;
        Mat mask = null;
        Mat homography = null;
        try {
            descA = a.getDescriptors().toMat();
            descB = b.getDescriptors().toMat();

            BFMatcher matcher = BFMatcher.create(detector.normType(), true);
            matches = new MatOfDMatch();
            matcher.match(descA, descB, matches);
            List<DMatch> matchList = matches.toList();

            if (matchList.size() < minMatches) {
                return MatchResult.rejected(matchList.size());
            }
            if (matchList.size() < MIN_HOMOGRAPHY_POINTS) {
                return MatchResult.verified(matchList.size(), false, 0, minMatches);
            }

            List<FeaturePoint> kpA = a.getKeypoints();
            List<FeaturePoint> kpB = b.getKeypoints();
            List<Point> src = new ArrayList<>(matchList.size());
            List<Point> dst = new ArrayList<>(matchList.size());
            for (DMatch m : matchList) {
                FeaturePoint p = kpA.get(m.queryIdx);
                FeaturePoint q = kpB.get(m.trainIdx);
                src.add(new Point(p.getX(), p.getY()));
                dst.add(new Point(q.getX(), q.getY()));
            }

            srcPts = new MatOfPoint2f();
            srcPts.fromList(src);
            dstPts = new MatOfPoint2f();
            dstPts.fromList(dst);
            mask = new Mat();
            homography = Calib3d.findHomography(srcPts, dstPts, Calib3d.RANSAC, RANSAC_THRESH, mask);

            boolean found = homography != null && !homography.empty();
            int inliers = found && !mask.empty() ? Core.countNonZero(mask) : 0;
            return MatchResult.verified(matchList.size(), found, inliers, minMatches);
        } catch (CvException e) {
            throw new MatchException("OpenCV failure while matching: " + e.getMessage(), e);
        } finally {
            if (descA != null) descA.release();
            if (descB != null) descB.release();
            if (matches != null) matches.release();
            if (srcPts != null) srcPts.release();
            if (dstPts != null) dstPts.release();
            if (mask != null) mask.release();
            if (homography != null) homography.release();
        }
    }

    /**
     * 判定规则：找到单应性且内点数不少于阈值（恰好等于阈值也接受）
     */
    public static boolean accepts(boolean homographyFound, int inlierCount, int minMatches) {
        return homographyFound && inlierCount >= minMatches;
    }
}
