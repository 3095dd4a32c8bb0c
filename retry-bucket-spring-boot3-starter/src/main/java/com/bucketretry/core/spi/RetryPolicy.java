package com.bucketretry.core.spi;

import com.bucketretry.model.ClassifiedError;
import com.bucketretry.model.RetryToken;

/**
 * 单条重试判定, 必须无副作用
 */
@FunctionalInterface
public interface RetryPolicy {

    boolean decide(RetryToken token, ClassifiedError error);
}
