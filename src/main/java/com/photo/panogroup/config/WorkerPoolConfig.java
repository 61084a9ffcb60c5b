package com.photo.panogroup.config;

import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 特征提取 / 匹配共用的工作线程池
 * <p>
 * 进程内只创建一次，随应用关闭而关闭。
 */
@Configuration
public class WorkerPoolConfig {
    private static final Logger logger = LoggerFactory.getLogger(WorkerPoolConfig.class);

    @Autowired
    private YamlConfig yamlConfig;

    private ExecutorService workerPool;

    @Bean
    public ExecutorService workerPool() {
        int size = yamlConfig.effectiveWorkers();
        AtomicInteger counter = new AtomicInteger();
        workerPool = Executors.newFixedThreadPool(size, r -> {
            Thread t = new Thread(r, "Pano-Worker-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        logger.info("Worker pool started with {} thread(s)", size);
        return workerPool;
    }

    @PreDestroy
    public void shutdown() {
        if (workerPool == null) {
            return;
        }
        workerPool.shutdown();
        try {
            if (!workerPool.awaitTermination(5, TimeUnit.SECONDS)) {
                workerPool.shutdownNow();
            }
        } catch (InterruptedException e) {
            workerPool.shutdownNow();
            Thread.currentThread().interrupt();
        }
        logger.info("Worker pool stopped");
    }
}
