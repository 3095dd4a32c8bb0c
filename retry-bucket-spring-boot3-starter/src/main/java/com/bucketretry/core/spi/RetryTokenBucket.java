package com.bucketretry.core.spi;

import com.bucketretry.model.RetryToken;
import com.bucketretry.model.enums.ErrorCategory;

import java.util.concurrent.CompletableFuture;

/**
 * 重试容量令牌桶
 */
public interface RetryTokenBucket {

    /** 首次尝试, 扣减 initialCost */
    CompletableFuture<RetryToken> acquireInitial();

    /** 重试, 按错误类别扣减, attempt + 1 */
    CompletableFuture<RetryToken> acquireRefresh(RetryToken previous, ErrorCategory category);

    /** 成功后归还 token.cost */
    void release(RetryToken token);

    /** 当前容量 */
    int capacity();
}
