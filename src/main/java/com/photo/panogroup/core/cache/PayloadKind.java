package com.photo.panogroup.core.cache;

/**
 * 缓存条目的载荷类型，写入信封用于读取时校验
 */
public enum PayloadKind {
    FEATURES,
    GRAPH
}
