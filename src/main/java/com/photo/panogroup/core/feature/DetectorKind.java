package com.photo.panogroup.core.feature;

import org.opencv.core.Core;
import org.opencv.features2d.Feature2D;

/**
 * 特征检测器类型
 * <p>
 * SIFT 输出浮点描述子（L2 距离），ORB 输出二进制描述子（Hamming 距离）。
 * SIFT 不可用时按降级表退回 ORB。
 */
public enum DetectorKind {

    SIFT(Core.NORM_L2) {
        @Override
        public Feature2D create(int orbFeatures) {
            return org.opencv.features2d.SIFT.create();
        }

        @Override
        public DetectorKind fallback() {
            return ORB;
        }
    },

    ORB(Core.NORM_HAMMING) {
        @Override
        public Feature2D create(int orbFeatures) {
            return org.opencv.features2d.ORB.create(orbFeatures);
        }

        @Override
        public DetectorKind fallback() {
            return null;
        }
    };

    private final int normType;

    DetectorKind(int normType) {
        this.normType = normType;
    }

    /**
     * 创建检测器实例（Feature2D 非线程安全，每次提取单独创建）
     */
    public abstract Feature2D create(int orbFeatures);

    /**
     * 不可用时的替代检测器，没有替代时返回 null
     */
    public abstract DetectorKind fallback();

    /**
     * 描述子匹配使用的距离类型
     */
    public int normType() {
        return normType;
    }

    /**
     * 宽松解析（忽略大小写），空值返回 null
     */
    public static DetectorKind parse(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return valueOf(value.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unsupported detector: " + value + ". Expected SIFT or ORB.");
        }
    }
}
