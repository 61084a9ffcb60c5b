package com.photo.panogroup.controller;

import com.photo.panogroup.config.YamlConfig;
import com.photo.panogroup.core.cache.CacheStats;
import com.photo.panogroup.core.cache.CacheStore;
import com.photo.panogroup.core.cache.EvictionPolicy;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

/**
 * 缓存管理控制器
 */
@RestController
@RequestMapping("/api/cache")
@Tag(name = "缓存管理", description = "查看、清空和按策略淘汰特征 / 重叠图缓存")
public class CacheController {
    private static final Logger logger = LoggerFactory.getLogger(CacheController.class);

    @Autowired
    private CacheStore cacheStore;

    @Autowired
    private YamlConfig yamlConfig;

    @GetMapping
    @Operation(summary = "缓存统计", description = "返回缓存目录、条目数和总字节数")
    public ResponseEntity<Map<String, Object>> stats() {
        Map<String, Object> response = new HashMap<>();
        try {
            response.put("status", "success");
            response.put("data", cacheStore.stats());
            return ResponseEntity.ok(response);
        } catch (Exception e) {
            logger.error("Failed to read cache stats", e);
            response.put("status", "error");
            response.put("message", e.getMessage());
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(response);
        }
    }

    @DeleteMapping
    @Operation(summary = "清空缓存", description = "删除所有缓存条目，下次分组时全部重新计算")
    public ResponseEntity<Map<String, Object>> clear() {
        Map<String, Object> response = new HashMap<>();
        try {
            int removed = cacheStore.clear();
            logger.info("Cache cleared: {} entries removed", removed);
            response.put("status", "success");
            response.put("data", Map.of("removed", removed));
            return ResponseEntity.ok(response);
        } catch (Exception e) {
            logger.error("Failed to clear cache", e);
            response.put("status", "error");
            response.put("message", e.getMessage());
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(response);
        }
    }

    @PostMapping("/prune")
    @Operation(
            summary = "按策略淘汰缓存",
            description = """
                    按最近使用时间淘汰缓存条目。参数未填写时使用配置中的 cache.max-entries / cache.max-age。

                    | 参数 | 说明 |
                    |------|------|
                    | maxEntries | 最多保留的条目数，0 不限 |
                    | maxAgeSeconds | 超过该时长未使用的条目被删除，0 不限 |
                    """
    )
    public ResponseEntity<Map<String, Object>> prune(
            @Parameter(description = "最多保留的条目数") @RequestParam(required = false) Integer maxEntries,
            @Parameter(description = "最长未使用秒数") @RequestParam(required = false) Long maxAgeSeconds) {
        Map<String, Object> response = new HashMap<>();
        try {
            EvictionPolicy policy = new EvictionPolicy(
                    maxEntries != null ? maxEntries : yamlConfig.getCache().getMaxEntries(),
                    maxAgeSeconds != null ? Duration.ofSeconds(maxAgeSeconds) : yamlConfig.getCache().getMaxAge());
            int removed = cacheStore.prune(policy);
            CacheStats stats = cacheStore.stats();

            Map<String, Object> data = new HashMap<>();
            data.put("removed", removed);
            data.put("remaining", stats.getEntries());
            response.put("status", "success");
            response.put("data", data);
            return ResponseEntity.ok(response);
        } catch (IllegalArgumentException e) {
            response.put("status", "error");
            response.put("message", e.getMessage());
            return ResponseEntity.badRequest().body(response);
        } catch (Exception e) {
            logger.error("Failed to prune cache", e);
            response.put("status", "error");
            response.put("message", e.getMessage());
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(response);
        }
    }
}
