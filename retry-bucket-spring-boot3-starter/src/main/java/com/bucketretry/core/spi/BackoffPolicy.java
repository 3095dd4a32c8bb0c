package com.bucketretry.core.spi;

import java.time.Duration;

/**
 * 回退策略（计算两次尝试之间的等待）
 */
public interface BackoffPolicy {

    /** 策略唯一名称（如 "fixed"、"exponential"、"myPolicy"） */
    String name();

    /**
     * @param attempt 第几次尝试, 从 0 开始, 负数视为编程错误
     * @return 等待时长
     */
    Duration backoff(int attempt);
}
