package com.bucketretry.core.bucket;

import com.bucketretry.config.BucketConfiguration;
import com.bucketretry.core.spi.RetryTokenBucket;
import com.bucketretry.core.spi.Sleeper;
import com.bucketretry.core.spi.TimeSource;
import com.bucketretry.exception.RetryCapacityExceededException;
import com.bucketretry.model.RetryToken;
import com.bucketretry.model.enums.ErrorCategory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 令牌桶
 * - 每次扣减/归还前先按流逝时间回填
 * - 容量不足: 熔断模式直接失败, 否则等待回填
 * - capacity / lastRefillMark 只在 lock 内读写, 等待期间不持锁
 */
public class StandardRetryTokenBucket implements RetryTokenBucket {

    private static final Logger log = LoggerFactory.getLogger(StandardRetryTokenBucket.class);

    private static final long NANOS_PER_SECOND = 1_000_000_000L;

    private final String partition;

    /** 构造时拷贝, 之后不受外部修改影响 */
    private final BucketConfiguration config;

    private final TimeSource timeSource;

    private final Sleeper sleeper;

    private final ReentrantLock lock = new ReentrantLock();

    private int capacity;

    private Instant lastRefillMark;

    public StandardRetryTokenBucket(String partition, BucketConfiguration config,
                                    TimeSource timeSource, Sleeper sleeper) {
        this.partition = partition;
        this.config = new BucketConfiguration(Objects.requireNonNull(config, "config")).validate();
        this.timeSource = Objects.requireNonNull(timeSource, "timeSource");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
        this.capacity = this.config.getMaxCapacity();
        this.lastRefillMark = timeSource.now();
    }

    @Override
    public CompletableFuture<RetryToken> acquireInitial() {
        log.debug("[TokenBucket] acquire initial token, partition={}", partition);
        int successIncrement = config.getInitialSuccessIncrement();
        return checkout(config.getInitialCost())
                .thenApply(v -> new RetryToken(partition, 0, successIncrement));
    }

    @Override
    public CompletableFuture<RetryToken> acquireRefresh(RetryToken previous, ErrorCategory category) {
        Objects.requireNonNull(previous, "previous");
        Objects.requireNonNull(category, "category");
        int size = category.isTimeoutLike() ? config.getTimeoutRetryCost() : config.getStandardRetryCost();
        log.debug("[TokenBucket] acquire refresh token, partition={}, category={}, attempt={}, size={}",
                partition, category, previous.getAttempt(), size);
        return checkout(size).thenApply(v -> previous.next(size));
    }

    @Override
    public void release(RetryToken token) {
        int size = token.cost().orElse(0);
        lock.lock();
        try {
            refillLocked();
            capacity = (int) Math.min(config.getMaxCapacity(), (long) capacity + size);
        } finally {
            lock.unlock();
        }
        log.debug("[TokenBucket] returned {} units, partition={}", size, partition);
    }

    @Override
    public int capacity() {
        lock.lock();
        try {
            return capacity;
        } finally {
            lock.unlock();
        }
    }

    /**
     * 按流逝时间回填, 无时间流逝时不改变容量
     */
    public void refill() {
        lock.lock();
        try {
            refillLocked();
        } finally {
            lock.unlock();
        }
    }

    public String getPartition() { return partition; }

    /** 配置副本 */
    public BucketConfiguration getConfiguration() { return new BucketConfiguration(config); }

    private CompletableFuture<Void> checkout(int size) {
        long delaySeconds;
        lock.lock();
        try {
            refillLocked();
            if (size <= capacity) {
                capacity -= size;
                return CompletableFuture.completedFuture(null);
            }
            if (config.isCircuitBreakerMode()) {
                int available = capacity;
                log.warn("[TokenBucket] retry capacity exceeded, partition={}, requested={}, available={}",
                        partition, size, available);
                return CompletableFuture.failedFuture(
                        new RetryCapacityExceededException(partition, size, available));
            }
            int shortfall = size - capacity;
            int rate = config.getRefillRatePerSecond();
            delaySeconds = (shortfall + (long) rate - 1) / rate;
            capacity = 0;
        } finally {
            lock.unlock();
        }
        // 等待结束后不再校验也不再扣减, 视等待本身为足够
        log.info("[TokenBucket] capacity unavailable, partition={}, wait {}s for refill", partition, delaySeconds);
        return sleeper.sleep(Duration.ofSeconds(delaySeconds)).thenRun(this::consumeWaitedRefill);
    }

    /**
     * 等待期间的回填归等待者所有, 只推进标记
     */
    private void consumeWaitedRefill() {
        lock.lock();
        try {
            Instant now = timeSource.now();
            if (now.isAfter(lastRefillMark)) {
                lastRefillMark = now;
            }
        } finally {
            lock.unlock();
        }
    }

    private void refillLocked() {
        Instant now = timeSource.now();
        long elapsedNanos = elapsedNanos(lastRefillMark, now);
        if (elapsedNanos > 0) {
            long units = refillUnits(elapsedNanos, config.getRefillRatePerSecond());
            capacity = (int) Math.min(config.getMaxCapacity(), capacity + units);
            lastRefillMark = now;
        }
    }

    private static long elapsedNanos(Instant from, Instant to) {
        try {
            return Duration.between(from, to).toNanos();
        } catch (ArithmeticException overflow) {
            return Long.MAX_VALUE;
        }
    }

    /** floor(rate * elapsed), 溢出按填满处理 */
    private static long refillUnits(long elapsedNanos, int rate) {
        if (rate <= 0) {
            return 0;
        }
        if (elapsedNanos > Long.MAX_VALUE / rate) {
            return Integer.MAX_VALUE;
        }
        return elapsedNanos * rate / NANOS_PER_SECOND;
    }
}
