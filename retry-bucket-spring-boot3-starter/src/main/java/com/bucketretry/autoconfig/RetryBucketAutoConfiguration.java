package com.bucketretry.autoconfig;

import com.bucketretry.config.RetryBucketProperties;
import com.bucketretry.core.RetryBucketLifecycle;
import com.bucketretry.core.backoff.BackoffRegistry;
import com.bucketretry.core.bucket.BucketRegistry;
import com.bucketretry.core.failure.StandardErrorClassifier;
import com.bucketretry.core.metric.RetryMetrics;
import com.bucketretry.core.policy.RetryPolicySet;
import com.bucketretry.core.spi.BackoffPolicy;
import com.bucketretry.core.spi.ErrorClassifier;
import com.bucketretry.core.spi.RetryPolicy;
import com.bucketretry.core.spi.RetryStrategy;
import com.bucketretry.core.spi.Retryer;
import com.bucketretry.core.spi.Sleeper;
import com.bucketretry.core.spi.TimeSource;
import com.bucketretry.core.engine.StandardRetryer;
import com.bucketretry.core.strategy.StandardRetryStrategy;
import com.bucketretry.core.time.SystemTimeSource;
import com.bucketretry.core.time.WheelSleeper;
import io.micrometer.core.instrument.util.NamedThreadFactory;
import io.netty.util.HashedWheelTimer;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingDeque;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

/**
 * 令牌桶重试引擎装配, 各组件均可由业务方 Bean 覆盖
 */
@AutoConfiguration(after = RetryBucketMetricsAutoConfiguration.class)
@ConditionalOnProperty(prefix = "retry", name = "enabled", havingValue = "true", matchIfMissing = true)
@EnableConfigurationProperties(RetryBucketProperties.class)
public class RetryBucketAutoConfiguration {

    /**
     * 时间轮
     */
    @Bean
    @ConditionalOnMissingBean
    public HashedWheelTimer retryBucketTimer(RetryBucketProperties props) {
        return new HashedWheelTimer(
                new NamedThreadFactory("retry-bucket-timer"),
                props.getWheel().getTickDuration().toMillis(),
                TimeUnit.MILLISECONDS,
                props.getWheel().getTicksPerWheel(),
                false,
                props.getWheel().getMaxPendingTimeouts()
        );
    }

    /**
     * 业务操作执行线程池
     */
    @Bean("retryBucketExecutor")
    @ConditionalOnMissingBean(name = "retryBucketExecutor")
    public ExecutorService retryBucketExecutor(RetryBucketProperties props) {
        RetryBucketProperties.Exec exec = props.getExecutor();
        return new ThreadPoolExecutor(
                exec.getCorePoolSize(),
                exec.getMaxPoolSize(),
                exec.getKeepAlive().toSeconds(),
                TimeUnit.SECONDS,
                new LinkedBlockingDeque<>(exec.getQueueCapacity()),
                new NamedThreadFactory("retry-bucket-exec"),
                exec.getRejectedHandler().toHandler()
        );
    }

    @Bean
    @ConditionalOnMissingBean
    public TimeSource retryTimeSource() {
        return new SystemTimeSource();
    }

    @Bean
    @ConditionalOnMissingBean
    public Sleeper retrySleeper(HashedWheelTimer timer) {
        return new WheelSleeper(timer);
    }

    /**
     * partition -> 令牌桶
     */
    @Bean
    @ConditionalOnMissingBean
    public BucketRegistry bucketRegistry(RetryBucketProperties props, TimeSource timeSource,
                                         Sleeper sleeper, ObjectProvider<RetryMetrics> meter) {
        return new BucketRegistry(props, timeSource, sleeper, meter.getIfAvailable());
    }

    /**
     * 策略注册中心
     */
    @Bean
    @ConditionalOnMissingBean
    public BackoffRegistry backoffRegistry(RetryBucketProperties props,
                                           ObjectProvider<BackoffPolicy> discoveredPolicies) {
        return new BackoffRegistry(props.getBackoff().toConfiguration(),
                discoveredPolicies.orderedStream().collect(Collectors.toList()));
    }

    @Bean
    @ConditionalOnMissingBean
    public ErrorClassifier errorClassifier(TimeSource timeSource) {
        return new StandardErrorClassifier(timeSource);
    }

    /**
     * 标准判定 + 业务方 RetryPolicy Bean（OR）
     */
    @Bean
    @ConditionalOnMissingBean
    public RetryPolicySet retryPolicySet(RetryBucketProperties props, ObjectProvider<RetryPolicy> extra) {
        RetryBucketProperties.Policy p = props.getPolicy();
        List<RetryPolicy> userPolicies = extra.orderedStream().collect(Collectors.toList());
        return RetryPolicySet.standard(p.getMaxAttempts(), p.getRetryableCategories()).or(userPolicies);
    }

    @Bean
    @ConditionalOnMissingBean
    public RetryStrategy retryStrategy(BucketRegistry buckets, RetryPolicySet policies) {
        return new StandardRetryStrategy(buckets, policies);
    }

    /**
     * 重试执行入口
     */
    @Bean
    @ConditionalOnMissingBean
    public Retryer retryer(RetryStrategy strategy,
                           BackoffRegistry backoffRegistry,
                           ErrorClassifier classifier,
                           Sleeper sleeper,
                           @Qualifier("retryBucketExecutor") ExecutorService executor,
                           ObjectProvider<RetryMetrics> meter,
                           RetryBucketProperties props) {
        return new StandardRetryer(strategy,
                backoffRegistry.resolve(props.getBackoff().getStrategy()),
                classifier,
                sleeper,
                executor,
                meter.getIfAvailable(),
                props.getDefaultPartition());
    }

    @Bean
    @ConditionalOnMissingBean
    public RetryBucketLifecycle retryBucketLifecycle(HashedWheelTimer timer,
                                                     @Qualifier("retryBucketExecutor") ExecutorService executor,
                                                     RetryBucketProperties props) {
        return new RetryBucketLifecycle(timer, executor, props);
    }
}
