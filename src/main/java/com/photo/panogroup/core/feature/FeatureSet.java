package com.photo.panogroup.core.feature;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.opencv.core.KeyPoint;
import org.opencv.core.MatOfKeyPoint;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * 单张图像的特征集合：有序关键点 + 平行的描述子矩阵。
 * 创建后不可变。
 */
public final class FeatureSet {

    private final DetectorKind detector;
    private final List<FeaturePoint> keypoints;
    private final DescriptorMatrix descriptors;

    @JsonCreator
    public FeatureSet(@JsonProperty("detector") DetectorKind detector,
                      @JsonProperty("keypoints") List<FeaturePoint> keypoints,
                      @JsonProperty("descriptors") DescriptorMatrix descriptors) {
        this.detector = Objects.requireNonNull(detector, "detector");
        this.keypoints = List.copyOf(Objects.requireNonNull(keypoints, "keypoints"));
        this.descriptors = Objects.requireNonNull(descriptors, "descriptors");
        if (this.keypoints.size() != descriptors.getRows()) {
            throw new IllegalArgumentException("Keypoint count " + this.keypoints.size()
                    + " does not match descriptor rows " + descriptors.getRows());
        }
    }

    /**
     * 从 OpenCV 检测结果构建（调用方负责释放传入的 Mat）
     */
    public static FeatureSet fromOpenCv(DetectorKind detector, MatOfKeyPoint keyPoints, org.opencv.core.Mat descriptors) {
        List<KeyPoint> list = keyPoints.toList();
        List<FeaturePoint> points = new ArrayList<>(list.size());
        for (KeyPoint kp : list) {
            points.add(FeaturePoint.fromKeyPoint(kp));
        }
        return new FeatureSet(detector, points, DescriptorMatrix.fromMat(descriptors));
    }

    public DetectorKind getDetector() { return detector; }
    public List<FeaturePoint> getKeypoints() { return keypoints; }
    public DescriptorMatrix getDescriptors() { return descriptors; }

    @JsonIgnore
    public int size() {
        return keypoints.size();
    }

    @JsonIgnore
    public boolean isEmpty() {
        return keypoints.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FeatureSet)) return false;
        FeatureSet that = (FeatureSet) o;
        return detector == that.detector && keypoints.equals(that.keypoints) && descriptors.equals(that.descriptors);
    }

    @Override
    public int hashCode() {
        return Objects.hash(detector, keypoints, descriptors);
    }

    @Override
    public String toString() {
        return "FeatureSet{" + detector + ", " + keypoints.size() + " keypoints}";
    }
}
