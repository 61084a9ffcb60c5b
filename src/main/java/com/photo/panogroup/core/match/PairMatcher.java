package com.photo.panogroup.core.match;

import com.photo.panogroup.core.feature.DetectorKind;
import com.photo.panogroup.core.feature.FeatureSet;

public interface PairMatcher {
    /**
     * 判断两张图像是否重叠
     * <p>
     * 实现内部的任何失败都按“不重叠”返回，不得抛出，不得中断整体流程。
     *
     * @param a 第一张图像的特征
     * @param b 第二张图像的特征
     * @param detector 特征所用的检测器（决定描述子距离）
     * @param minMatches 最少匹配数 / 内点数
     * @return 是否重叠
     */
    boolean compare(FeatureSet a, FeatureSet b, DetectorKind detector, int minMatches);
}
