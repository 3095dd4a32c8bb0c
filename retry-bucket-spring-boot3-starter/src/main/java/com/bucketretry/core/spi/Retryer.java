package com.bucketretry.core.spi;

import java.util.concurrent.CompletableFuture;

/**
 * 重试执行入口
 */
public interface Retryer {

    <T> CompletableFuture<T> execute(RetryableOperation<T> operation, String partition);

    /** 使用默认 partition */
    <T> CompletableFuture<T> execute(RetryableOperation<T> operation);
}
