package com.bucketretry.core;

import com.bucketretry.config.RetryBucketProperties;
import com.bucketretry.core.engine.StandardRetryer;
import com.bucketretry.core.time.WheelSleeper;
import io.netty.util.HashedWheelTimer;
import io.netty.util.Timeout;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;

import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 启动时打印关键配置, 停止时关闭时间轮并等待在途尝试完成
 */
public class RetryBucketLifecycle implements SmartLifecycle {

    Logger log = LoggerFactory.getLogger(RetryBucketLifecycle.class);

    private final HashedWheelTimer timer;

    private final ExecutorService executor;

    private final RetryBucketProperties props;

    private final AtomicBoolean running = new AtomicBoolean(false);

    public RetryBucketLifecycle(HashedWheelTimer timer, ExecutorService executor, RetryBucketProperties props) {
        this.timer = timer;
        this.executor = executor;
        this.props = props;
    }

    @Override
    public void start() {
        if (!running.compareAndSet(false, true)) {
            return;
        }
        timer.start();
        log.info("[Retry-Bucket] started: scope={}, defaultPartition={}, maxAttempts={}, retryable={}",
                props.getBucketScope(), props.getDefaultPartition(),
                props.getPolicy().getMaxAttempts(), props.getPolicy().getRetryableCategories());
        log.info("[Retry-Bucket] bucket={}, overrides={}", props.getBucket(), props.getBucketPerPartition().keySet());
        log.info("[Retry-Bucket] backoff: strategy={}, initial={}ms, max={}ms, scale={}, jitter={}",
                props.getBackoff().getStrategy(),
                props.getBackoff().getInitialDelay().toMillis(),
                props.getBackoff().getMaxDelay().toMillis(),
                props.getBackoff().getScaleFactor(),
                props.getBackoff().getJitterFraction());
        log.info("[Retry-Bucket] wheel.tick={}ms, exec.core={}, exec.max={}",
                props.getWheel().getTickDuration().toMillis(),
                props.getExecutor().getCorePoolSize(),
                props.getExecutor().getMaxPoolSize());
    }

    @Override
    public void stop() {
        if (!running.compareAndSet(true, false)) {
            log.info("[Retry-Bucket] stop skipped: already stopped");
            return;
        }
        // 未到期的等待与未执行的尝试都以失败结束, 调用方不会一直挂起
        Set<Timeout> unprocessed = timer.stop();
        int waits = WheelSleeper.abortAll(unprocessed, new RejectedExecutionException("retry timer stopped"));
        executor.shutdown();
        int attempts = 0;
        long awaitMs = Math.max(1, props.getShutdown().getAwait().toMillis());
        try {
            if (!executor.awaitTermination(awaitMs, TimeUnit.MILLISECONDS)) {
                attempts = abortQueued();
                log.warn("[Retry-Bucket] executor forced shutdown after {}ms", awaitMs);
            }
        } catch (InterruptedException ie) {
            attempts = abortQueued();
            Thread.currentThread().interrupt();
        }
        log.info("[Retry-Bucket] stopped, pendingWaitsAborted={}, queuedAttemptsAborted={}", waits, attempts);
    }

    private int abortQueued() {
        List<Runnable> dropped = executor.shutdownNow();
        return StandardRetryer.abortAll(dropped, new RejectedExecutionException("retry executor stopped"));
    }

    @Override
    public boolean isRunning() {
        return running.get();
    }

    @Override public boolean isAutoStartup() { return true; }
}
