package com.photo.panogroup.config;

import com.photo.panogroup.core.feature.DetectorKind;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Data
@Configuration
@ConfigurationProperties(prefix = "pano-group")
public class YamlConfig {
    private int workers = 0;       // 0 = CPU 逻辑核数
    private ScanConfig scan = new ScanConfig();
    private FeatureConfig features = new FeatureConfig();
    private MatchingConfig matching = new MatchingConfig();
    private GroupingConfig grouping = new GroupingConfig();
    private CacheConfig cache = new CacheConfig();
    private StitcherConfig stitcher = new StitcherConfig();

    /**
     * 实际使用的线程数
     */
    public int effectiveWorkers() {
        return workers > 0 ? workers : Runtime.getRuntime().availableProcessors();
    }

    @Data
    public static class ScanConfig {
        private List<String> extensions = new ArrayList<>(List.of("jpg", "jpeg", "png", "tif", "tiff", "bmp", "webp"));
        // 以此前缀开头的文件是之前的拼接输出，扫描时跳过
        private String outputPrefix = "panorama_";
    }

    @Data
    public static class FeatureConfig {
        private DetectorKind defaultDetector = DetectorKind.SIFT;
        private int orbFeatures = 500;
        private List<DetectorKind> disabledDetectors = new ArrayList<>();
    }

    @Data
    public static class MatchingConfig {
        private int minMatches = 30;
        private boolean parallel = false;
    }

    @Data
    public static class GroupingConfig {
        private int maxGroupSize = 50;  // <= 0 不限制
        private boolean consecutive = false;
    }

    @Data
    public static class CacheConfig {
        private Path directory = Path.of(System.getProperty("user.home"), ".cache", "pano-group");
        private int maxEntries = 0;                    // 0 = 不限
        private Duration maxAge = Duration.ZERO;       // 0 = 不过期
        private Duration pruneInterval = Duration.ofHours(1);
    }

    @Data
    public static class StitcherConfig {
        // 每条命令支持 {inputs} {output} {workdir} 占位符
        private List<String> steps = new ArrayList<>();
        private Duration timeout = Duration.ofMinutes(10);
        private String outputDirectory = "";  // 为空时输出到扫描目录
    }
}
