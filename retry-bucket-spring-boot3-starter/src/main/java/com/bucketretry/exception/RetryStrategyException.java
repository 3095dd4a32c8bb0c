package com.bucketretry.exception;

/**
 * 引擎自身产生的异常
 * 调用方可据此区分 本地限制 与 远端失败
 */
public abstract class RetryStrategyException extends RuntimeException {

    protected RetryStrategyException(String message) {
        super(message);
    }
}
