package com.bucketretry.config;

import com.bucketretry.model.BackoffConfiguration;
import com.bucketretry.model.enums.ErrorCategory;
import lombok.Data;
import org.springframework.beans.factory.InitializingBean;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.RejectedExecutionHandler;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * 重试配置（绑定前缀：retry）
 *
 * YAML 示例：
 * retry:
 *   enabled: true
 *   default-partition: default
 *   bucket-scope: partition
 *   bucket:
 *     initial-cost: 0
 *     initial-success-increment: 1
 *     max-capacity: 500
 *     standard-retry-cost: 5
 *     timeout-retry-cost: 10
 *     refill-rate-per-second: 10
 *     circuit-breaker-mode: true
 *   bucket-per-partition:
 *     payments: { max-capacity: 50, circuit-breaker-mode: false }
 *   backoff:
 *     strategy: exponential
 *     initial-delay: 10ms
 *     jitter-fraction: 1.0
 *     max-delay: 20s
 *     scale-factor: 1.5
 *   policy:
 *     max-attempts: 3
 *     retryable-categories: [transient, throttling]
 *   wheel:
 *     tick-duration: 10ms
 *     ticks-per-wheel: 512
 *   executor:
 *     core-pool-size: 4
 *     max-pool-size: 16
 *     rejected-handler: CALLER_RUNS
 *   shutdown:
 *     await: 10s
 */
@ConfigurationProperties(prefix = "retry")
public class RetryBucketProperties implements InitializingBean {

    /** 开关 */
    private boolean enabled = true;

    /** 未指定 partition 时使用 */
    private String defaultPartition = "default";

    private BucketScope bucketScope = BucketScope.PARTITION;

    /** 默认桶配置（可被 partition 覆盖） */
    private BucketConfiguration bucket = new BucketConfiguration();

    /** 按 partition 覆盖 */
    private Map<String, BucketConfiguration> bucketPerPartition = new LinkedHashMap<>();

    private Backoff backoff = new Backoff();

    private Policy policy = new Policy();

    private Wheel wheel = new Wheel();

    private Exec executor = new Exec();

    private Shutdown shutdown = new Shutdown();

    // ----------------- 嵌套配置对象 -----------------

    @Data
    public static class Backoff {
        /** 策略：exponential | fixed | spi:{name} */
        private String strategy = "exponential";

        private Duration initialDelay = BackoffConfiguration.DEFAULT_INITIAL_DELAY;

        /** 抖动比例（0~1），退避值在 [raw*(1-j), raw] 之间 */
        private double jitterFraction = BackoffConfiguration.DEFAULT_JITTER_FRACTION;

        private Duration maxDelay = BackoffConfiguration.DEFAULT_MAX_DELAY;

        private double scaleFactor = BackoffConfiguration.DEFAULT_SCALE_FACTOR;

        public BackoffConfiguration toConfiguration() {
            return BackoffConfiguration.builder()
                    .initialDelay(initialDelay)
                    .jitterFraction(jitterFraction)
                    .maxDelay(maxDelay)
                    .scaleFactor(scaleFactor)
                    .build();
        }
    }

    @Data
    public static class Policy {
        /** attempt < maxAttempts 时才允许重试 */
        private int maxAttempts = 3;

        private Set<ErrorCategory> retryableCategories = EnumSet.of(ErrorCategory.TRANSIENT, ErrorCategory.THROTTLING);
    }

    @Data
    public static class Wheel {
        /** 时间轮刻度, 退避默认 10ms 起步, 刻度不宜过粗 */
        private Duration tickDuration = Duration.ofMillis(10);

        /** 槽位数量（2^n 较佳） */
        private int ticksPerWheel = 512;

        /** 允许挂起的最大 timeout 数量（Netty 参数） */
        private long maxPendingTimeouts = 100_000;
    }

    @Data
    public static class Exec {
        private int corePoolSize = 4;

        private int maxPoolSize = 16;

        private int queueCapacity = 1000;

        private Duration keepAlive = Duration.ofSeconds(60);

        /** 拒绝策略：ABORT | CALLER_RUNS */
        private RejectedHandlerPolicy rejectedHandler = RejectedHandlerPolicy.CALLER_RUNS;
    }

    @Data
    public static class Shutdown {
        /** 优雅停机等待时长 */
        private Duration await = Duration.ofSeconds(10);
    }

    // ----------------- 公共枚举/工具 -----------------

    /**
     * 线程池拒绝策略（YAML 中大小写均可）
     * 不提供丢弃类策略：被丢弃的尝试会让调用方一直挂起
     */
    public enum RejectedHandlerPolicy {
        ABORT, CALLER_RUNS;

        public RejectedExecutionHandler toHandler() {
            return switch (this) {
                case ABORT -> new ThreadPoolExecutor.AbortPolicy();
                case CALLER_RUNS -> (r, executor) -> {
                    // 线程池已关闭时不能静默丢弃, 交给调用方结束 execute
                    if (executor.isShutdown()) {
                        throw new RejectedExecutionException("retry executor is shut down");
                    }
                    r.run();
                };
            };
        }
    }

    /**
     * 查找 partition 对应的桶配置, 未覆盖则使用默认
     */
    public BucketConfiguration bucketFor(String partition) {
        if (bucketPerPartition != null && partition != null) {
            BucketConfiguration override = bucketPerPartition.get(partition);
            if (override != null) {
                return override;
            }
        }
        return bucket;
    }

    @Override
    public void afterPropertiesSet() {
        // 参数校验
        bucket.validate();
        if (bucketPerPartition != null) {
            bucketPerPartition.values().forEach(BucketConfiguration::validate);
        }
        backoff.toConfiguration();
        if (policy.getMaxAttempts() < 0) {
            throw new IllegalArgumentException("retry.policy.max-attempts must be >= 0");
        }
        if (defaultPartition == null || defaultPartition.isBlank()) {
            throw new IllegalArgumentException("retry.default-partition must not be blank");
        }
    }

    // ----------------- getters/setters 顶层 -----------------

    public boolean isEnabled() { return enabled; }
    public void setEnabled(boolean enabled) { this.enabled = enabled; }

    public String getDefaultPartition() { return defaultPartition; }
    public void setDefaultPartition(String defaultPartition) { this.defaultPartition = defaultPartition; }

    public BucketScope getBucketScope() { return bucketScope; }
    public void setBucketScope(BucketScope bucketScope) { this.bucketScope = bucketScope; }

    public BucketConfiguration getBucket() { return bucket; }
    public void setBucket(BucketConfiguration bucket) { this.bucket = bucket; }

    public Map<String, BucketConfiguration> getBucketPerPartition() { return bucketPerPartition; }
    public void setBucketPerPartition(Map<String, BucketConfiguration> bucketPerPartition) { this.bucketPerPartition = bucketPerPartition; }

    public Backoff getBackoff() { return backoff; }
    public void setBackoff(Backoff backoff) { this.backoff = backoff; }

    public Policy getPolicy() { return policy; }
    public void setPolicy(Policy policy) { this.policy = policy; }

    public Wheel getWheel() { return wheel; }
    public void setWheel(Wheel wheel) { this.wheel = wheel; }

    public Exec getExecutor() { return executor; }
    public void setExecutor(Exec executor) { this.executor = executor; }

    public Shutdown getShutdown() { return shutdown; }
    public void setShutdown(Shutdown shutdown) { this.shutdown = shutdown; }
}
