package com.photo.panogroup.core.cache;

/**
 * 缓存条目无法读取或解析（格式、版本、类型不符或数据损坏）。
 * 只在缓存层内部使用，调用方一律按未命中处理。
 */
public class CacheReadException extends Exception {

    public CacheReadException(String message) {
        super(message);
    }

    public CacheReadException(String message, Throwable cause) {
        super(message, cause);
    }
}
