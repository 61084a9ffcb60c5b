package com.photo.panogroup.core.feature;

import com.photo.panogroup.core.scan.ImageRecord;

public interface FeatureExtractor {
    /**
     * 提取单张图像的特征
     * @param image 图像
     * @param detector 请求的检测器（实现可按能力表降级）
     * @return 提取结果，失败以状态返回
     */
    ExtractionResult extract(ImageRecord image, DetectorKind detector);
}
