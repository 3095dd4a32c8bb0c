package com.bucketretry.config;

/**
 * 令牌桶作用域（YAML 中大小写均可）
 */
public enum BucketScope {
    /** 每个 partition 一个桶 */
    PARTITION,
    /** 全进程共享一个桶 */
    SHARED
}
