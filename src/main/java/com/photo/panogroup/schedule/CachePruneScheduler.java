package com.photo.panogroup.schedule;

import com.photo.panogroup.config.YamlConfig;
import com.photo.panogroup.core.cache.CacheStore;
import com.photo.panogroup.core.cache.EvictionPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * 缓存淘汰定时任务
 * 按 pano-group.cache.prune-interval 周期执行；未配置 max-entries / max-age 时不做任何事
 */
@Component
public class CachePruneScheduler {

    private static final Logger logger = LoggerFactory.getLogger(CachePruneScheduler.class);

    @Autowired
    private CacheStore cacheStore;

    @Autowired
    private YamlConfig config;

    @Scheduled(fixedDelayString = "${pano-group.cache.prune-interval:PT1H}",
            initialDelayString = "${pano-group.cache.prune-interval:PT1H}")
    public void pruneCache() {
        EvictionPolicy policy = new EvictionPolicy(config.getCache().getMaxEntries(), config.getCache().getMaxAge());
        if (policy.isUnbounded()) {
            logger.debug("Cache eviction not configured, skip prune task");
            return;
        }

        try {
            int removed = cacheStore.prune(policy);
            logger.info("Cache prune task completed. Removed: {}, remaining: {}",
                    removed, cacheStore.stats().getEntries());
        } catch (Exception e) {
            logger.error("Cache prune task failed", e);
        }
    }
}
