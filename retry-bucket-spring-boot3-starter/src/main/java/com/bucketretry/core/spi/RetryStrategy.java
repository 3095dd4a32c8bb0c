package com.bucketretry.core.spi;

import com.bucketretry.model.ClassifiedError;
import com.bucketretry.model.RetryToken;

import java.util.concurrent.CompletableFuture;

/**
 * 令牌生命周期：获取 -> 成功归还 / 刷新或拒绝
 */
public interface RetryStrategy {

    CompletableFuture<RetryToken> acquireInitialToken(String partition);

    void recordSuccess(RetryToken token);

    /**
     * 策略拒绝时以 RetryRejectedException 失败,
     * 容量不足时以 RetryCapacityExceededException 失败
     */
    CompletableFuture<RetryToken> refreshRetryToken(RetryToken token, ClassifiedError error);

    int maxAttempts();
}
