package com.bucketretry.exception;

import lombok.Getter;

/**
 * 令牌桶容量不足且处于熔断模式
 */
@Getter
public class RetryCapacityExceededException extends RetryStrategyException {

    private final String partition;
    private final int requested;
    private final int available;

    public RetryCapacityExceededException(String partition, int requested, int available) {
        super("retry capacity exceeded, partition=" + partition
                + ", requested=" + requested + ", available=" + available);
        this.partition = partition;
        this.requested = requested;
        this.available = available;
    }
}
