package com.photo.panogroup.core.feature;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 检测器能力表
 * <p>
 * 启动时探测一次当前 OpenCV 运行时支持哪些检测器，之后按降级表解析：
 * 请求的检测器不可用时沿 {@link DetectorKind#fallback()} 查找第一个可用的替代。
 * 替代只作为提示（每种请求记录一次），不是错误。
 */
public class DetectorCapabilities {
    private static final Logger logger = LoggerFactory.getLogger(DetectorCapabilities.class);

    private final Set<DetectorKind> available;
    private final Set<DetectorKind> substitutionsReported = ConcurrentHashMap.newKeySet();

    public DetectorCapabilities(Collection<DetectorKind> available) {
        this.available = available.isEmpty()
                ? Collections.emptySet()
                : Collections.unmodifiableSet(EnumSet.copyOf(available));
    }

    /**
     * 探测 OpenCV 中实际可创建的检测器
     *
     * @param disabled 配置中强制禁用的检测器
     */
    public static DetectorCapabilities probe(Collection<DetectorKind> disabled) {
        EnumSet<DetectorKind> found = EnumSet.noneOf(DetectorKind.class);
        for (DetectorKind kind : DetectorKind.values()) {
            if (disabled != null && disabled.contains(kind)) {
                logger.info("Detector {} disabled by configuration", kind);
                continue;
            }
            try {
                kind.create(500).clear();
                found.add(kind);
            } catch (Exception | UnsatisfiedLinkError e) {
                logger.warn("Detector {} is not available in this OpenCV build: {}", kind, e.getMessage());
            }
        }
        logger.info("Available detectors: {}", found);
        return new DetectorCapabilities(found);
    }

    public boolean isAvailable(DetectorKind kind) {
        return available.contains(kind);
    }

    public Set<DetectorKind> available() {
        return available;
    }

    /**
     * 解析实际使用的检测器
     *
     * @throws IllegalStateException 请求的检测器及其所有替代均不可用
     */
    public DetectorKind resolve(DetectorKind requested) {
        DetectorKind candidate = requested;
        while (candidate != null && !available.contains(candidate)) {
            candidate = candidate.fallback();
        }
        if (candidate == null) {
            throw new IllegalStateException("No usable detector for " + requested + " (available: " + available + ")");
        }
        if (candidate != requested && substitutionsReported.add(requested)) {
            logger.warn("{} is unavailable, falling back to {}", requested, candidate);
        }
        return candidate;
    }
}
