package com.bucketretry.core.spi;

import com.bucketretry.model.AttemptContext;

import java.util.concurrent.CompletableFuture;

/**
 * 业务操作
 * HTTP 形态的失败请抛出/返回 HttpOperationException, 其他异常一律不重试
 */
@FunctionalInterface
public interface RetryableOperation<T> {

    CompletableFuture<T> execute(AttemptContext ctx) throws Exception;
}
