package com.bucketretry.core.spi;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;

/**
 * 非阻塞延迟
 */
@FunctionalInterface
public interface Sleeper {

    /**
     * @param duration 至少等待的时长, <=0 立即完成
     * @return 到期完成的 future；取消它即放弃等待
     */
    CompletableFuture<Void> sleep(Duration duration);
}
