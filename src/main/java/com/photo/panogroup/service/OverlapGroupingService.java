package com.photo.panogroup.service;

import com.photo.panogroup.config.YamlConfig;
import com.photo.panogroup.core.feature.DetectorCapabilities;
import com.photo.panogroup.core.feature.DetectorKind;
import com.photo.panogroup.core.graph.ComponentGrouper;
import com.photo.panogroup.core.graph.ImageGroup;
import com.photo.panogroup.core.graph.OverlapGraph;
import com.photo.panogroup.core.graph.OverlapGraphBuilder;
import com.photo.panogroup.core.graph.RunCancelledException;
import com.photo.panogroup.core.progress.ProgressEvent;
import com.photo.panogroup.core.progress.ProgressEvent.Stage;
import com.photo.panogroup.core.progress.ProgressReporter;
import com.photo.panogroup.core.scan.ImageRecord;
import com.photo.panogroup.core.scan.ImageScanner;
import com.photo.panogroup.core.stitcher.StitchOutcome;
import com.photo.panogroup.core.stitcher.Stitcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 重叠分组服务
 * <p>
 * 扫描目录 → 构建重叠图 → 连通分量 → 过滤单张和超大分组 → （可选）逐组调用拼接器。
 */
@Service
public class OverlapGroupingService {
    private static final Logger logger = LoggerFactory.getLogger(OverlapGroupingService.class);

    static final String OUTPUT_EXTENSION = ".jpg";

    @Autowired
    private YamlConfig yamlConfig;

    @Autowired
    private ImageScanner imageScanner;

    @Autowired
    private OverlapGraphBuilder graphBuilder;

    @Autowired
    private ComponentGrouper componentGrouper;

    @Autowired
    private DetectorCapabilities capabilities;

    @Autowired
    private Stitcher stitcher;

    @Autowired
    private ProgressReporter progress;

    /**
     * 使用配置中的默认参数分组
     */
    public GroupingReport findGroups(Path root) throws IOException {
        return findGroups(root,
                yamlConfig.getFeatures().getDefaultDetector(),
                yamlConfig.getMatching().getMinMatches(),
                yamlConfig.getGrouping().getMaxGroupSize(),
                yamlConfig.getGrouping().isConsecutive());
    }

    /**
     * 查找可拼接的图像组
     *
     * @param root         图像根目录（递归扫描）
     * @param detector     请求的检测器，不可用时自动降级
     * @param minMatches   判定重叠所需的最少内点数（>= 1）
     * @param maxGroupSize 最大分组大小，超过的分组跳过；<= 0 不限制
     * @param consecutive  只比较拍摄顺序相邻的图像
     * @return 大小大于 1 的分组，每组按拍摄顺序排列
     */
    public GroupingReport findGroups(Path root, DetectorKind detector, int minMatches,
                                     int maxGroupSize, boolean consecutive) throws IOException {
        if (detector == null) {
            throw new IllegalArgumentException("detector is required");
        }
        if (minMatches < 1) {
            throw new IllegalArgumentException("minMatches must be >= 1: " + minMatches);
        }
        DetectorKind effective = capabilities.resolve(detector);

        progress.onEvent(ProgressEvent.start(Stage.SCAN, 0));
        List<ImageRecord> images = imageScanner.scan(root);
        progress.onEvent(ProgressEvent.complete(Stage.SCAN, images.size()));

        if (images.isEmpty()) {
            logger.info("No images to group under {}", root);
            return GroupingReport.empty(root, effective);
        }

        OverlapGraph graph = graphBuilder.build(images, detector, minMatches, consecutive);

        List<List<String>> components = componentGrouper.group(graph);
        progress.onEvent(ProgressEvent.start(Stage.GROUP, components.size()));

        Map<String, ImageRecord> byId = new HashMap<>();
        images.forEach(image -> byId.put(image.getId(), image));

        List<ImageGroup> groups = new ArrayList<>();
        List<ImageGroup> skipped = new ArrayList<>();
        for (List<String> component : components) {
            if (component.size() < 2) {
                continue;
            }
            List<ImageRecord> members = new ArrayList<>(component.size());
            component.forEach(id -> members.add(byId.get(id)));
            ImageGroup group = new ImageGroup(members);

            if (maxGroupSize > 0 && group.size() > maxGroupSize) {
                logger.warn("Skipping group of {} images starting at {} (max group size {})",
                        group.size(), group.first().getPath(), maxGroupSize);
                progress.onEvent(ProgressEvent.notice(Stage.GROUP, "Skipped group of " + group.size()
                        + " images starting at " + group.first().getFileName() + " (max " + maxGroupSize + ")"));
                skipped.add(group);
            } else {
                groups.add(group);
            }
        }
        Comparator<ImageGroup> byFirstImage = Comparator.comparing(ImageGroup::first, ImageRecord.CAPTURE_ORDER);
        groups.sort(byFirstImage);
        skipped.sort(byFirstImage);
        progress.onEvent(ProgressEvent.complete(Stage.GROUP, components.size()));

        logger.info("Found {} group(s) among {} image(s) under {} ({} skipped as oversized)",
                groups.size(), images.size(), root, skipped.size());
        return new GroupingReport(root, effective, images.size(), groups, skipped);
    }

    /**
     * 逐组调用拼接器，单组失败不影响其它组
     */
    public List<StitchOutcome> stitchGroups(GroupingReport report) {
        Path outputDir = resolveOutputDirectory(report.getRoot());
        List<ImageGroup> groups = report.getGroups();
        List<StitchOutcome> outcomes = new ArrayList<>(groups.size());

        progress.onEvent(ProgressEvent.start(Stage.STITCH, groups.size()));
        for (int i = 0; i < groups.size(); i++) {
            ImageGroup group = groups.get(i);
            Path output = outputPath(report.getRoot(), outputDir, yamlConfig.getScan().getOutputPrefix(), group);
            StitchOutcome outcome;
            try {
                outcome = stitcher.stitch(group.paths(), output);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new RunCancelledException("Stitching interrupted", e);
            } catch (RuntimeException e) {
                logger.warn("Stitcher failed on {}", group, e);
                outcome = StitchOutcome.failure(group.paths(), output, String.valueOf(e.getMessage()));
            }
            if (!outcome.isSuccess()) {
                progress.onEvent(ProgressEvent.notice(Stage.STITCH,
                        "Failed to stitch " + group + ": " + outcome.getMessage()));
            }
            outcomes.add(outcome);
            progress.onEvent(ProgressEvent.advance(Stage.STITCH, i + 1, groups.size()));
        }
        progress.onEvent(ProgressEvent.complete(Stage.STITCH, groups.size()));

        long succeeded = outcomes.stream().filter(StitchOutcome::isSuccess).count();
        logger.info("Stitched {}/{} group(s) into {}", succeeded, outcomes.size(), outputDir);
        return outcomes;
    }

    public List<StitchOutcome> stitchGroups(Path root, DetectorKind detector, int minMatches,
                                            int maxGroupSize, boolean consecutive) throws IOException {
        return stitchGroups(findGroups(root, detector, minMatches, maxGroupSize, consecutive));
    }

    private Path resolveOutputDirectory(Path root) {
        String configured = yamlConfig.getStitcher().getOutputDirectory();
        return configured == null || configured.isBlank() ? root : Path.of(configured);
    }

    /**
     * 输出路径：保留首张图像相对扫描根目录的子目录，
     * 不同子目录下同名的首张图像（如 100CANON/IMG_0001.jpg 与 101CANON/IMG_0001.jpg）不会写到同一个文件
     */
    static Path outputPath(Path root, Path outputDir, String prefix, ImageGroup group) {
        Path normalizedRoot = root.toAbsolutePath().normalize();
        Path folder = group.first().getPath().getParent();
        Path target = outputDir;
        if (folder != null && folder.startsWith(normalizedRoot)) {
            target = outputDir.resolve(normalizedRoot.relativize(folder).toString());
        }
        return target.resolve(outputFileName(prefix, group));
    }

    /**
     * 输出文件名：前缀 + 首张图像文件名（去扩展名）+ _ + 张数 + .jpg
     */
    static String outputFileName(String prefix, ImageGroup group) {
        String name = group.first().getFileName();
        int dot = name.lastIndexOf('.');
        String base = dot > 0 ? name.substring(0, dot) : name;
        return (prefix == null ? "" : prefix) + base + "_" + group.size() + OUTPUT_EXTENSION;
    }
}
