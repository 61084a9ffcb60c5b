package com.photo.panogroup.config;

import com.photo.panogroup.core.cache.CacheCodec;
import com.photo.panogroup.core.cache.CacheStore;
import com.photo.panogroup.core.cache.FileCacheStore;
import com.photo.panogroup.core.feature.CachedFeatureExtractor;
import com.photo.panogroup.core.feature.DetectorCapabilities;
import com.photo.panogroup.core.feature.FeatureExtractor;
import com.photo.panogroup.core.graph.ComponentGrouper;
import com.photo.panogroup.core.graph.OverlapGraphBuilder;
import com.photo.panogroup.core.match.HomographyPairMatcher;
import com.photo.panogroup.core.match.PairMatcher;
import com.photo.panogroup.core.progress.LoggingProgressReporter;
import com.photo.panogroup.core.progress.ProgressReporter;
import com.photo.panogroup.core.scan.CaptureTimeReader;
import com.photo.panogroup.core.scan.ImageScanner;
import com.photo.panogroup.core.stitcher.ExternalCommandStitcher;
import com.photo.panogroup.core.stitcher.Stitcher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;

/**
 * 分组流水线组件装配
 * <p>
 * 核心组件本身不依赖 Spring，这里按 {@link YamlConfig} 组装。
 */
@Configuration
public class PipelineConfig {

    @Bean
    public CacheStore cacheStore(YamlConfig config) {
        return new FileCacheStore(config.getCache().getDirectory());
    }

    @Bean
    public CacheCodec cacheCodec() {
        return new CacheCodec();
    }

    @Bean
    public DetectorCapabilities detectorCapabilities(YamlConfig config) {
        return DetectorCapabilities.probe(config.getFeatures().getDisabledDetectors());
    }

    @Bean
    public FeatureExtractor featureExtractor(CacheStore cacheStore, CacheCodec cacheCodec,
                                             DetectorCapabilities capabilities, YamlConfig config) {
        return new CachedFeatureExtractor(cacheStore, cacheCodec, capabilities, config.getFeatures().getOrbFeatures());
    }

    @Bean
    public PairMatcher pairMatcher() {
        return new HomographyPairMatcher();
    }

    @Bean
    public ProgressReporter progressReporter() {
        return new LoggingProgressReporter();
    }

    @Bean
    public OverlapGraphBuilder overlapGraphBuilder(FeatureExtractor featureExtractor, PairMatcher pairMatcher,
                                                   CacheStore cacheStore, CacheCodec cacheCodec,
                                                   DetectorCapabilities capabilities, ExecutorService workerPool,
                                                   ProgressReporter progressReporter, YamlConfig config) {
        return new OverlapGraphBuilder(featureExtractor, pairMatcher, cacheStore, cacheCodec, capabilities,
                workerPool, progressReporter, config.getMatching().isParallel());
    }

    @Bean
    public ComponentGrouper componentGrouper() {
        return new ComponentGrouper();
    }

    @Bean
    public ImageScanner imageScanner(YamlConfig config) {
        return new ImageScanner(config.getScan().getExtensions(), config.getScan().getOutputPrefix(),
                new CaptureTimeReader());
    }

    @Bean
    public Stitcher stitcher(YamlConfig config) {
        return new ExternalCommandStitcher(config.getStitcher().getSteps(), config.getStitcher().getTimeout());
    }
}
