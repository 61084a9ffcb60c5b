package com.photo.panogroup.core.feature;

/**
 * 单张图像特征提取结果
 * <p>
 * 失败以状态值返回，不抛异常：调用方把失败图像当作孤立节点处理。
 */
public class ExtractionResult {

    public enum Status {
        SUCCESS,
        LOAD_ERROR,
        NO_FEATURES,
        EXTRACTION_ERROR
    }

    private final Status status;
    private final DetectorKind detector;
    private final FeatureSet features;
    private final String detail;
    private final boolean fromCache;

    private ExtractionResult(Status status, DetectorKind detector, FeatureSet features, String detail, boolean fromCache) {
        this.status = status;
        this.detector = detector;
        this.features = features;
        this.detail = detail;
        this.fromCache = fromCache;
    }

    public static ExtractionResult computed(FeatureSet features) {
        return new ExtractionResult(Status.SUCCESS, features.getDetector(), features, null, false);
    }

    public static ExtractionResult cached(FeatureSet features) {
        return new ExtractionResult(Status.SUCCESS, features.getDetector(), features, null, true);
    }

    public static ExtractionResult loadError(DetectorKind detector, String detail) {
        return new ExtractionResult(Status.LOAD_ERROR, detector, null, detail, false);
    }

    public static ExtractionResult noFeatures(DetectorKind detector) {
        return new ExtractionResult(Status.NO_FEATURES, detector, null, "no features found", false);
    }

    public static ExtractionResult error(DetectorKind detector, String detail) {
        return new ExtractionResult(Status.EXTRACTION_ERROR, detector, null, detail, false);
    }

    public boolean isSuccess() {
        return status == Status.SUCCESS;
    }

    public Status getStatus() { return status; }

    /** 实际使用的检测器（可能是降级后的） */
    public DetectorKind getDetector() { return detector; }

    public FeatureSet getFeatures() { return features; }
    public String getDetail() { return detail; }
    public boolean isFromCache() { return fromCache; }

    @Override
    public String toString() {
        return isSuccess()
                ? "ExtractionResult{" + status + ", " + features + (fromCache ? ", cached" : "") + "}"
                : "ExtractionResult{" + status + ", " + detail + "}";
    }
}
