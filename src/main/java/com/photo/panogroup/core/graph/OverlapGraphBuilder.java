package com.photo.panogroup.core.graph;

import com.photo.panogroup.core.cache.CacheCodec;
import com.photo.panogroup.core.cache.CacheKeys;
import com.photo.panogroup.core.cache.CacheStore;
import com.photo.panogroup.core.cache.PayloadKind;
import com.photo.panogroup.core.feature.DetectorCapabilities;
import com.photo.panogroup.core.feature.DetectorKind;
import com.photo.panogroup.core.feature.ExtractionResult;
import com.photo.panogroup.core.feature.FeatureExtractor;
import com.photo.panogroup.core.feature.FeatureSet;
import com.photo.panogroup.core.match.PairMatcher;
import com.photo.panogroup.core.progress.ProgressEvent;
import com.photo.panogroup.core.progress.ProgressEvent.Stage;
import com.photo.panogroup.core.progress.ProgressReporter;
import com.photo.panogroup.core.scan.ImageRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 重叠图构建
 * <p>
 * 流程：
 * 1. 按（排序路径、检测器、阈值、相邻模式）查整图缓存，命中直接返回；
 * 2. 在共享线程池上并行提取所有图像特征，全部完成后再进入匹配（屏障）；
 *    提取失败的图像作为孤立节点保留，只发提示，不中断；
 * 3. 选择候选图像对（全量或相邻）；
 * 4. 逐对匹配，重叠则对称加边（可选按对并行，加边幂等）；
 * 5. 写入整图缓存后返回。
 * <p>
 * 调用线程被中断时取消未完成任务并抛出 {@link RunCancelledException}，不写缓存。
 */
public class OverlapGraphBuilder {
    private static final Logger logger = LoggerFactory.getLogger(OverlapGraphBuilder.class);

    private final FeatureExtractor featureExtractor;
    private final PairMatcher pairMatcher;
    private final CacheStore cacheStore;
    private final CacheCodec cacheCodec;
    private final DetectorCapabilities capabilities;
    private final ExecutorService workerPool;
    private final ProgressReporter progress;
    private final boolean parallelMatching;

    public OverlapGraphBuilder(FeatureExtractor featureExtractor,
                               PairMatcher pairMatcher,
                               CacheStore cacheStore,
                               CacheCodec cacheCodec,
                               DetectorCapabilities capabilities,
                               ExecutorService workerPool,
                               ProgressReporter progress,
                               boolean parallelMatching) {
        this.featureExtractor = featureExtractor;
        this.pairMatcher = pairMatcher;
        this.cacheStore = cacheStore;
        this.cacheCodec = cacheCodec;
        this.capabilities = capabilities;
        this.workerPool = workerPool;
        this.progress = progress != null ? progress : ProgressReporter.NONE;
        this.parallelMatching = parallelMatching;
    }

    public OverlapGraph build(List<ImageRecord> images, DetectorKind requested, int minMatches, boolean consecutive) {
        if (minMatches < 1) {
            throw new IllegalArgumentException("minMatches must be >= 1: " + minMatches);
        }
        if (images.isEmpty()) {
            return OverlapGraph.empty();
        }

        DetectorKind detector = capabilities.resolve(requested);
        if (detector != requested) {
            progress.onEvent(ProgressEvent.notice(Stage.EXTRACT,
                    requested + " is not available, using " + detector + " instead"));
        }

        String graphKey = CacheKeys.graph(images, detector, minMatches, consecutive);
        Optional<OverlapGraph> cached = cacheCodec.read(cacheStore, graphKey, PayloadKind.GRAPH, OverlapGraph.class);
        if (cached.isPresent()) {
            logger.info("Overlap graph cache hit for {} image(s): {}", images.size(), cached.get());
            return cached.get();
        }

        OverlapGraph.Builder graph = OverlapGraph.builder();
        images.forEach(image -> graph.addNode(image.getId()));

        Map<String, FeatureSet> features = extractAll(images, detector);

        List<ImageRecord> usable = new ArrayList<>();
        for (ImageRecord image : images) {
            if (features.containsKey(image.getId())) {
                usable.add(image);
            }
        }
        List<CandidatePairs.ImagePair> pairs = CandidatePairs.select(usable, consecutive);
        matchAll(pairs, features, detector, minMatches, graph);

        OverlapGraph result = graph.build();
        cacheCodec.write(cacheStore, graphKey, PayloadKind.GRAPH, result);
        logger.info("Built overlap graph: {} ({} comparison(s), {} mode)",
                result, pairs.size(), consecutive ? "consecutive" : "all-pairs");
        return result;
    }

    private Map<String, FeatureSet> extractAll(List<ImageRecord> images, DetectorKind detector) {
        int total = images.size();
        progress.onEvent(ProgressEvent.start(Stage.EXTRACT, total));

        List<Future<ExtractionResult>> futures = new ArrayList<>(total);
        for (ImageRecord image : images) {
            futures.add(workerPool.submit(() -> featureExtractor.extract(image, detector)));
        }

        Map<String, FeatureSet> features = new HashMap<>();
        try {
            for (int i = 0; i < total; i++) {
                ImageRecord image = images.get(i);
                ExtractionResult result = await(futures.get(i), image, detector);
                if (result.isSuccess()) {
                    features.put(image.getId(), result.getFeatures());
                } else {
                    progress.onEvent(ProgressEvent.notice(Stage.EXTRACT,
                            "Skipping " + image.getPath() + " (" + result.getStatus() + ": " + result.getDetail() + ")"));
                }
                progress.onEvent(ProgressEvent.advance(Stage.EXTRACT, i + 1, total));
            }
        } catch (InterruptedException e) {
            futures.forEach(f -> f.cancel(true));
            Thread.currentThread().interrupt();
            throw new RunCancelledException("Feature extraction interrupted", e);
        }

        progress.onEvent(ProgressEvent.complete(Stage.EXTRACT, total));
        logger.info("Extracted {} features for {}/{} image(s)", detector, features.size(), total);
        return features;
    }

    private static ExtractionResult await(Future<ExtractionResult> future, ImageRecord image, DetectorKind detector)
            throws InterruptedException {
        try {
            return future.get();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            logger.warn("Feature extraction task failed for {}", image.getPath(), cause);
            return ExtractionResult.error(detector, String.valueOf(cause.getMessage()));
        }
    }

    private void matchAll(List<CandidatePairs.ImagePair> pairs, Map<String, FeatureSet> features,
                          DetectorKind detector, int minMatches, OverlapGraph.Builder graph) {
        int total = pairs.size();
        progress.onEvent(ProgressEvent.start(Stage.MATCH, total));
        AtomicInteger done = new AtomicInteger();

        if (!parallelMatching || total < 2) {
            for (CandidatePairs.ImagePair pair : pairs) {
                if (Thread.currentThread().isInterrupted()) {
                    throw new RunCancelledException("Matching interrupted", new InterruptedException());
                }
                matchPair(pair, features, detector, minMatches, graph);
                progress.onEvent(ProgressEvent.advance(Stage.MATCH, done.incrementAndGet(), total));
            }
        } else {
            List<Future<?>> futures = new ArrayList<>(total);
            for (CandidatePairs.ImagePair pair : pairs) {
                futures.add(workerPool.submit(() -> {
                    matchPair(pair, features, detector, minMatches, graph);
                    progress.onEvent(ProgressEvent.advance(Stage.MATCH, done.incrementAndGet(), total));
                }));
            }
            try {
                for (int i = 0; i < total; i++) {
                    try {
                        futures.get(i).get();
                    } catch (ExecutionException e) {
                        logger.warn("Matching task failed for {}", pairs.get(i), e.getCause());
                    }
                }
            } catch (InterruptedException e) {
                futures.forEach(f -> f.cancel(true));
                Thread.currentThread().interrupt();
                throw new RunCancelledException("Matching interrupted", e);
            }
        }
        progress.onEvent(ProgressEvent.complete(Stage.MATCH, total));
    }

    private void matchPair(CandidatePairs.ImagePair pair, Map<String, FeatureSet> features,
                           DetectorKind detector, int minMatches, OverlapGraph.Builder graph) {
        String a = pair.getFirst().getId();
        String b = pair.getSecond().getId();
        boolean overlap;
        try {
            overlap = pairMatcher.compare(features.get(a), features.get(b), detector, minMatches);
        } catch (RuntimeException e) {
            // PairMatcher 约定不抛出，这里兜底，单对失败不影响整体
            logger.warn("Matcher failed on {}, treating as non-overlapping: {}", pair, e.getMessage());
            overlap = false;
        }
        if (overlap) {
            graph.addEdge(a, b);
            logger.debug("Overlap: {}", pair);
        }
    }
}
