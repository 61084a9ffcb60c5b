package com.photo.panogroup.service;

import com.photo.panogroup.core.feature.DetectorKind;
import com.photo.panogroup.core.graph.ImageGroup;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

import java.nio.file.Path;
import java.util.List;

/**
 * 一次分组运行的结果
 */
@Getter
@ToString
@AllArgsConstructor
public class GroupingReport {
    private final Path root;
    private final DetectorKind detector;     // 实际使用的检测器（可能已降级）
    private final int imageCount;
    private final List<ImageGroup> groups;   // 大小 > 1 且未超限的分组
    private final List<ImageGroup> skipped;  // 超过最大分组大小而跳过的分组

    public static GroupingReport empty(Path root, DetectorKind detector) {
        return new GroupingReport(root, detector, 0, List.of(), List.of());
    }
}
