package com.photo.panogroup.core.cache;

import java.util.Optional;

/**
 * 持久化键值缓存（键为固定长度摘要，值为序列化后的字节）
 * <p>
 * 实现需要支持并发读写：不同键互不影响，同一键并发写入时最后写入者生效，不允许出现半写入的条目。
 * 读取失败一律视为未命中，不向外抛出。
 */
public interface CacheStore {

    Optional<byte[]> get(String key);

    void put(String key, byte[] payload);

    boolean remove(String key);

    /**
     * 删除全部条目
     * @return 删除的条目数
     */
    int clear();

    CacheStats stats();

    /**
     * 按策略回收条目（默认策略不回收任何条目）
     * @return 删除的条目数
     */
    int prune(EvictionPolicy policy);
}
