package com.bucketretry.core.spi;

import java.time.Instant;

/**
 * 时间来源，测试时可替换为虚拟时间
 */
@FunctionalInterface
public interface TimeSource {

    Instant now();
}
