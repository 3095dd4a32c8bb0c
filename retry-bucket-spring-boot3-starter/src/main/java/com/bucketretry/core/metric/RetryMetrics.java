package com.bucketretry.core.metric;

import com.bucketretry.core.spi.RetryTokenBucket;
import com.bucketretry.model.enums.SequenceState;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.time.Duration;

public final class RetryMetrics {
    private final MeterRegistry reg;
    private final Counter started;
    private final Counter success;
    private final Counter attemptFailed;
    private final Counter rejectedPolicy;
    private final Counter rejectedCapacity;
    private final Counter unclassified;
    private final DistributionSummary attempts;
    private final Timer backoffWait;

    private RetryMetrics(MeterRegistry reg) {
        this.reg = reg;
        this.started  = Counter.builder("retry.sequence.started").description("retry sequences started").register(reg);
        this.success  = Counter.builder("retry.success").description("sequences succeeded").register(reg);
        this.attemptFailed = Counter.builder("retry.attempt.failed").description("failed attempts").register(reg);
        this.rejectedPolicy = Counter.builder("retry.rejected.policy").description("retries declined by policy").register(reg);
        this.rejectedCapacity = Counter.builder("retry.rejected.capacity").description("retries denied by bucket capacity").register(reg);
        this.unclassified = Counter.builder("retry.unclassified").description("failures propagated without classification").register(reg);
        this.attempts = DistributionSummary.builder("retry.attempts")
                .description("attempt count per sequence").baseUnit("times").register(reg);
        this.backoffWait = Timer.builder("retry.backoff.wait").description("backoff wait before an attempt").register(reg);
    }

    public static RetryMetrics create(MeterRegistry reg) { return new RetryMetrics(reg); }

    /** 测试或未接入指标时使用 */
    public static RetryMetrics noop() { return new RetryMetrics(new SimpleMeterRegistry()); }

    public MeterRegistry getRegistry() { return reg; }

    public void incStarted(){ started.increment(); }
    public void incSuccess(){ success.increment(); }
    public void incAttemptFailed(){ attemptFailed.increment(); }
    public void incRejectedPolicy(){ rejectedPolicy.increment(); }
    public void incRejectedCapacity(){ rejectedCapacity.increment(); }
    public void incUnclassified(){ unclassified.increment(); }
    public void recordBackoff(Duration d){ backoffWait.record(d); }

    /** 终态时记录本次共执行了几次 */
    public void recordAttempts(int n, SequenceState state) {
        attempts.record(n);
        Counter.builder("retry.sequence.finished")
                .description("retry sequences by terminal state")
                .tag("state", state.name())
                .register(reg)
                .increment();
    }

    public void registerBucket(String partition, RetryTokenBucket bucket) {
        Gauge.builder("retry.bucket.capacity", bucket, RetryTokenBucket::capacity)
                .description("available retry capacity")
                .tag("partition", partition)
                .register(reg);
    }
}
