package com.photo.panogroup.core.cache;

import com.photo.panogroup.core.feature.DetectorKind;
import com.photo.panogroup.core.scan.ImageRecord;
import org.springframework.util.DigestUtils;

import java.nio.charset.StandardCharsets;
import java.util.Collection;
import java.util.stream.Collectors;

/**
 * 缓存键：对可读字符串取 MD5，得到固定长度的 32 位十六进制文件名。
 * 只需要避免偶然冲突，不涉及安全。
 */
public final class CacheKeys {

    private CacheKeys() {
    }

    /**
     * 单张图像特征：路径 + 修改时间 + 实际检测器；ORB 另含最大特征点数。
     * 文件内容变化（修改时间变化）即得到新键，旧条目不会被回收。
     */
    public static String features(ImageRecord image, DetectorKind detector, int orbFeatures) {
        return digest(featuresDescription(image, detector, orbFeatures));
    }

    static String featuresDescription(ImageRecord image, DetectorKind detector, int orbFeatures) {
        String description = "features|" + image.getId()
                + "|" + image.getLastModified().toEpochMilli()
                + "|" + detector.name();
        // SIFT 不受该参数影响
        return detector == DetectorKind.ORB ? description + "|" + orbFeatures : description;
    }

    /**
     * 整张重叠图：排序后的路径集合 + 检测器 + 匹配阈值 + 是否只比较相邻图像
     */
    public static String graph(Collection<ImageRecord> images, DetectorKind detector, int minMatches, boolean consecutive) {
        return digest(graphDescription(images, detector, minMatches, consecutive));
    }

    static String graphDescription(Collection<ImageRecord> images, DetectorKind detector, int minMatches, boolean consecutive) {
        String paths = images.stream()
                .map(ImageRecord::getId)
                .sorted()
                .collect(Collectors.joining("\n"));
        return "graph|" + paths
                + "|" + detector.name()
                + "|" + minMatches
                + "|" + (consecutive ? "consecutive" : "all-pairs");
    }

    public static String digest(String description) {
        return DigestUtils.md5DigestAsHex(description.getBytes(StandardCharsets.UTF_8));
    }
}
