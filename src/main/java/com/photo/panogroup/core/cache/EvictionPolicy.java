package com.photo.panogroup.core.cache;

import java.time.Duration;

/**
 * 缓存回收策略
 * <p>
 * maxEntries：按最近访问时间保留的最大条目数（LRU），0 表示不限制；
 * maxAge：超过该时长未访问的条目被删除（TTL），零或 null 表示不限制。
 * 默认两者都不限制，缓存无限增长，被替代的旧条目不会自动回收。
 */
public final class EvictionPolicy {

    public static final EvictionPolicy UNBOUNDED = new EvictionPolicy(0, Duration.ZERO);

    private final int maxEntries;
    private final Duration maxAge;

    public EvictionPolicy(int maxEntries, Duration maxAge) {
        if (maxEntries < 0) {
            throw new IllegalArgumentException("maxEntries must be >= 0: " + maxEntries);
        }
        if (maxAge != null && maxAge.isNegative()) {
            throw new IllegalArgumentException("maxAge must not be negative: " + maxAge);
        }
        this.maxEntries = maxEntries;
        this.maxAge = maxAge == null ? Duration.ZERO : maxAge;
    }

    public boolean limitsEntries() {
        return maxEntries > 0;
    }

    public boolean limitsAge() {
        return !maxAge.isZero();
    }

    public boolean isUnbounded() {
        return !limitsEntries() && !limitsAge();
    }

    public int getMaxEntries() { return maxEntries; }
    public Duration getMaxAge() { return maxAge; }

    @Override
    public String toString() {
        return isUnbounded() ? "EvictionPolicy{unbounded}"
                : "EvictionPolicy{maxEntries=" + maxEntries + ", maxAge=" + maxAge + "}";
    }
}
