package com.bucketretry.core.engine;

import com.bucketretry.core.metric.RetryMetrics;
import com.bucketretry.core.spi.BackoffPolicy;
import com.bucketretry.core.spi.ErrorClassifier;
import com.bucketretry.core.spi.RetryStrategy;
import com.bucketretry.core.spi.RetryableOperation;
import com.bucketretry.core.spi.Retryer;
import com.bucketretry.core.spi.Sleeper;
import com.bucketretry.exception.HttpOperationException;
import com.bucketretry.exception.RetryCapacityExceededException;
import com.bucketretry.exception.RetryRejectedException;
import com.bucketretry.model.AttemptContext;
import com.bucketretry.model.ClassifiedError;
import com.bucketretry.model.RetryToken;
import com.bucketretry.model.enums.SequenceState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Collection;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * 重试执行循环, 唯一调用业务操作的组件
 *
 * 1. 获取初始令牌, 等待 backoff(0)
 * 2. 执行操作：
 *    成功 -> 归还容量, 返回结果
 *    HttpOperationException -> 分类 -> 刷新令牌 -> 等待 max(backoff, Retry-After) -> 继续
 *    分类为空 / 其他异常 -> 原样抛出, 不做容量记账
 *    刷新被拒（策略或容量） -> 抛出原始异常, 拒绝原因挂在 suppressed 上
 *
 * 等待不占线程, 到期后切回 executor 执行下一次尝试
 */
public class StandardRetryer implements Retryer {

    private static final Logger log = LoggerFactory.getLogger(StandardRetryer.class);

    private final RetryStrategy strategy;

    private final BackoffPolicy backoff;

    private final ErrorClassifier classifier;

    private final Sleeper sleeper;

    /** 业务操作执行线程池 */
    private final Executor executor;

    /** 指标 */
    private final RetryMetrics meter;

    private final String defaultPartition;

    public StandardRetryer(RetryStrategy strategy,
                           BackoffPolicy backoff,
                           ErrorClassifier classifier,
                           Sleeper sleeper,
                           Executor executor,
                           RetryMetrics meter,
                           String defaultPartition) {
        this.strategy = Objects.requireNonNull(strategy, "strategy");
        this.backoff = Objects.requireNonNull(backoff, "backoff");
        this.classifier = Objects.requireNonNull(classifier, "classifier");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.meter = meter == null ? RetryMetrics.noop() : meter;
        this.defaultPartition = Objects.requireNonNull(defaultPartition, "defaultPartition");
    }

    @Override
    public <T> CompletableFuture<T> execute(RetryableOperation<T> operation) {
        return execute(operation, defaultPartition);
    }

    @Override
    public <T> CompletableFuture<T> execute(RetryableOperation<T> operation, String partition) {
        Objects.requireNonNull(operation, "operation");
        String p = partition == null || partition.isBlank() ? defaultPartition : partition;
        Sequence<T> seq = new Sequence<>(operation, p);
        seq.start();
        return seq.result;
    }

    /**
     * 一次 execute 调用, 各次尝试严格串行
     */
    private final class Sequence<T> {

        private final RetryableOperation<T> operation;

        private final String partition;

        private final CompletableFuture<T> result = new CompletableFuture<>();

        /** 当前挂起的等待/操作, 取消时一并取消 */
        private volatile CompletableFuture<?> pending;

        private volatile SequenceState state = SequenceState.FRESH;

        private volatile int invocations;

        private Sequence(RetryableOperation<T> operation, String partition) {
            this.operation = operation;
            this.partition = partition;
            result.whenComplete((v, ex) -> {
                if (result.isCancelled()) {
                    onCancelled();
                }
            });
        }

        private void start() {
            meter.incStarted();
            CompletableFuture<RetryToken> initial;
            try {
                initial = strategy.acquireInitialToken(partition);
            } catch (RuntimeException e) {
                initial = CompletableFuture.failedFuture(e);
            }
            track(initial).whenComplete((token, ex) -> guarded(() -> {
                if (ex != null) {
                    Throwable cause = unwrap(ex);
                    if (cause instanceof RetryCapacityExceededException) {
                        meter.incRejectedCapacity();
                    }
                    log.warn("[Retryer] initial token unavailable, partition={}, cause={}", partition, cause.toString());
                    finish(SequenceState.REJECTED, cause);
                    return;
                }
                state = SequenceState.ATTEMPTING;
                // 首次尝试前固定等待一次, 不计入重试次数
                waitThenAttempt(token, backoff.backoff(0));
            }));
        }

        private void waitThenAttempt(RetryToken token, Duration delay) {
            if (result.isDone()) {
                return;
            }
            meter.recordBackoff(delay);
            log.debug("[Retryer] sleep {}ms before attempt={}, partition={}", delay.toMillis(), token.getAttempt(), partition);
            track(sleeper.sleep(delay)).whenComplete((v, ex) -> guarded(() -> {
                if (ex != null) {
                    finish(SequenceState.REJECTED, unwrap(ex));
                    return;
                }
                dispatch(token);
            }));
        }

        private void attempt(RetryToken token) {
            state = SequenceState.ATTEMPTING;
            invocations++;
            AttemptContext ctx = AttemptContext.builder()
                    .partition(partition)
                    .attempt(token.getAttempt())
                    .maxAttempts(strategy.maxAttempts())
                    .build();

            CompletableFuture<T> call;
            try {
                call = operation.execute(ctx);
                if (call == null) {
                    call = CompletableFuture.failedFuture(new NullPointerException("operation returned null future"));
                }
            } catch (Throwable t) {
                call = CompletableFuture.failedFuture(t);
            }

            track(call).whenComplete((value, ex) -> guarded(() -> {
                if (ex == null) {
                    strategy.recordSuccess(token);
                    meter.incSuccess();
                    state = SequenceState.SUCCEEDED;
                    meter.recordAttempts(invocations, state);
                    if (token.getAttempt() > 0) {
                        log.info("[Retryer] succeeded after retry, partition={}, attempt={}", partition, token.getAttempt());
                    }
                    result.complete(value);
                    return;
                }
                onFailure(token, unwrap(ex));
            }));
        }

        private void onFailure(RetryToken token, Throwable error) {
            meter.incAttemptFailed();
            if (!(error instanceof HttpOperationException http)) {
                meter.incUnclassified();
                log.debug("[Retryer] non-http failure, propagate, partition={}, error={}", partition, error.toString());
                finish(SequenceState.UNCLASSIFIED, error);
                return;
            }

            Optional<ClassifiedError> info = classifier.classify(http.response().orElse(null), http);
            if (info.isEmpty()) {
                meter.incUnclassified();
                log.debug("[Retryer] failure without response, propagate, partition={}", partition);
                finish(SequenceState.UNCLASSIFIED, error);
                return;
            }
            ClassifiedError classified = info.get();
            log.debug("[Retryer] attempt={} failed, partition={}, category={}",
                    token.getAttempt(), partition, classified.getCategory());

            state = SequenceState.RETRYING;
            CompletableFuture<RetryToken> refreshed;
            try {
                refreshed = strategy.refreshRetryToken(token, classified);
            } catch (RuntimeException e) {
                refreshed = CompletableFuture.failedFuture(e);
            }
            track(refreshed).whenComplete((next, ex) -> guarded(() -> {
                if (ex != null) {
                    Throwable rejection = unwrap(ex);
                    if (rejection instanceof RetryCapacityExceededException) {
                        meter.incRejectedCapacity();
                    } else if (rejection instanceof RetryRejectedException) {
                        meter.incRejectedPolicy();
                    }
                    // 调用方看到的是失败原因, 而不是停止重试的原因
                    if (rejection != error) {
                        error.addSuppressed(rejection);
                    }
                    log.info("[Retryer] give up, partition={}, attempt={}, reason={}",
                            partition, token.getAttempt(), rejection.getMessage());
                    finish(SequenceState.REJECTED, error);
                    return;
                }
                Duration computed = backoff.backoff(next.getAttempt());
                Duration hint = classified.retryAfterHint().orElse(Duration.ZERO);
                waitThenAttempt(next, computed.compareTo(hint) >= 0 ? computed : hint);
            }));
        }

        private void dispatch(RetryToken token) {
            try {
                executor.execute(new PendingAttempt(this, token));
            } catch (RejectedExecutionException e) {
                log.warn("[Retryer] executor rejected attempt, partition={}", partition);
                finish(SequenceState.REJECTED, e);
            }
        }

        /**
         * 回调中的异常（包括可替换组件抛出的）一律结束本次 execute
         */
        private void guarded(Runnable body) {
            if (result.isDone()) {
                return;
            }
            try {
                body.run();
            } catch (Throwable t) {
                log.warn("[Retryer] sequence aborted, partition={}, state={}, error={}", partition, state, t.toString());
                finish(SequenceState.REJECTED, t);
            }
        }

        private void finish(SequenceState terminal, Throwable error) {
            state = terminal;
            if (result.completeExceptionally(error)) {
                meter.recordAttempts(invocations, terminal);
            }
        }

        private void onCancelled() {
            state = SequenceState.CANCELLED;
            CompletableFuture<?> p = pending;
            if (p != null) {
                p.cancel(false);
            }
            log.debug("[Retryer] cancelled by caller, partition={}, invocations={}", partition, invocations);
        }

        private <R> CompletableFuture<R> track(CompletableFuture<R> f) {
            pending = f;
            return f;
        }
    }

    /**
     * 投递到 executor 的一次尝试
     * 线程池停止时未执行的任务通过 {@link #abortAll} 结束对应的 execute
     */
    public static final class PendingAttempt implements Runnable {

        private final Sequence<?> sequence;

        private final RetryToken token;

        private PendingAttempt(Sequence<?> sequence, RetryToken token) {
            this.sequence = sequence;
            this.token = token;
        }

        @Override
        public void run() {
            sequence.guarded(() -> sequence.attempt(token));
        }

        public void abort(Throwable cause) {
            sequence.finish(SequenceState.REJECTED, cause);
        }
    }

    /**
     * 结束 shutdownNow 返回的未执行尝试, 返回结束的数量
     */
    public static int abortAll(Collection<Runnable> dropped, Throwable cause) {
        int n = 0;
        for (Runnable r : dropped) {
            if (r instanceof PendingAttempt pending) {
                pending.abort(cause);
                n++;
            }
        }
        return n;
    }

    static Throwable unwrap(Throwable t) {
        Throwable e = t;
        while ((e instanceof CompletionException || e instanceof ExecutionException) && e.getCause() != null) {
            e = e.getCause();
        }
        return e;
    }
}
