package com.photo.panogroup.core.feature;

import com.photo.panogroup.core.cache.CacheCodec;
import com.photo.panogroup.core.cache.CacheKeys;
import com.photo.panogroup.core.cache.CacheStore;
import com.photo.panogroup.core.cache.PayloadKind;
import com.photo.panogroup.core.scan.ImageRecord;
import org.opencv.core.Mat;
import org.opencv.core.MatOfKeyPoint;
import org.opencv.features2d.Feature2D;
import org.opencv.imgcodecs.Imgcodecs;
import org.opencv.imgproc.Imgproc;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 带缓存的 OpenCV 特征提取
 * <p>
 * 流程：解析实际检测器 → 查缓存 → 读图（imread 按 EXIF 方向自动旋转）→ 转灰度 → detectAndCompute → 写缓存。
 * 缓存键使用实际检测器，降级到 ORB 后的结果不会冒充 SIFT。
 * 同一像素数据和检测器得到相同结果。
 */
public class CachedFeatureExtractor implements FeatureExtractor {
    private static final Logger logger = LoggerFactory.getLogger(CachedFeatureExtractor.class);

    private final CacheStore cacheStore;
    private final CacheCodec cacheCodec;
    private final DetectorCapabilities capabilities;
    private final int orbFeatures;

    // 统计：真正执行检测的次数 / 缓存命中次数
    private final AtomicInteger computedCount = new AtomicInteger();
    private final AtomicInteger cacheHitCount = new AtomicInteger();

    public CachedFeatureExtractor(CacheStore cacheStore, CacheCodec cacheCodec,
                                  DetectorCapabilities capabilities, int orbFeatures) {
        this.cacheStore = cacheStore;
        this.cacheCodec = cacheCodec;
        this.capabilities = capabilities;
        this.orbFeatures = orbFeatures;
    }

    @Override
    public ExtractionResult extract(ImageRecord image, DetectorKind requested) {
        DetectorKind detector = capabilities.resolve(requested);
        String key = CacheKeys.features(image, detector, orbFeatures);

        Optional<FeatureSet> cached = cacheCodec.read(cacheStore, key, PayloadKind.FEATURES, FeatureSet.class);
        if (cached.isPresent() && cached.get().getDetector() == detector) {
            cacheHitCount.incrementAndGet();
            logger.debug("Feature cache hit for {} ({})", image.getFileName(), detector);
            return ExtractionResult.cached(cached.get());
        }

        ExtractionResult result = compute(image, detector);
        if (result.isSuccess()) {
            cacheCodec.write(cacheStore, key, PayloadKind.FEATURES, result.getFeatures());
        }
        return result;
    }

    private ExtractionResult compute(ImageRecord image, DetectorKind detector) {
        Mat color = null;
        Mat gray = null;
        Mat mask = null;
        MatOfKeyPoint keyPoints = null;
        Mat descriptors = null;
        try {
            color = Imgcodecs.imread(image.getId(), Imgcodecs.IMREAD_COLOR);
            if (color == null || color.empty()) {
                return ExtractionResult.loadError(detector, "cannot decode image " + image.getPath());
            }

            gray = toGray(color);

            computedCount.incrementAndGet();
            Feature2D feature2D = detector.create(orbFeatures);
            keyPoints = new MatOfKeyPoint();
            descriptors = new Mat();
            mask = new Mat();
            feature2D.detectAndCompute(gray, mask, keyPoints, descriptors);

            if (keyPoints.empty() || descriptors.empty()) {
                return ExtractionResult.noFeatures(detector);
            }

            FeatureSet features = FeatureSet.fromOpenCv(detector, keyPoints, descriptors);
            logger.debug("Extracted {} {} keypoints from {}", features.size(), detector, image.getFileName());
            return ExtractionResult.computed(features);
        } catch (RuntimeException e) {
            logger.warn("Feature extraction failed for {}: {}", image.getPath(), e.getMessage());
            return ExtractionResult.error(detector, e.getClass().getSimpleName() + ": " + e.getMessage());
        } finally {
            if (color != null) color.release();
            if (gray != null) gray.release();
            if (mask != null) mask.release();
            if (keyPoints != null) keyPoints.release();
            if (descriptors != null) descriptors.release();
        }
    }

    private static Mat toGray(Mat image) {
        Mat gray = new Mat();
        if (image.channels() == 3) Imgproc.cvtColor(image, gray, Imgproc.COLOR_BGR2GRAY);
        else if (image.channels() == 4) Imgproc.cvtColor(image, gray, Imgproc.COLOR_BGRA2GRAY);
        else image.copyTo(gray);
        return gray;
    }

    public int getComputedCount() {
        return computedCount.get();
    }

    public int getCacheHitCount() {
        return cacheHitCount.get();
    }
}
