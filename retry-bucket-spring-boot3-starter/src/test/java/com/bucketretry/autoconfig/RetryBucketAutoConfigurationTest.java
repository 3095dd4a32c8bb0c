package com.bucketretry.autoconfig;

import com.bucketretry.config.BucketScope;
import com.bucketretry.config.RetryBucketProperties;
import com.bucketretry.core.RetryBucketLifecycle;
import com.bucketretry.core.bucket.BucketRegistry;
import com.bucketretry.core.metric.RetryMetrics;
import com.bucketretry.core.policy.RetryPolicySet;
import com.bucketretry.core.spi.RetryPolicy;
import com.bucketretry.core.spi.Retryer;
import com.bucketretry.core.spi.TimeSource;
import com.bucketretry.exception.HttpOperationException;
import com.bucketretry.model.HttpResponseMeta;
import com.bucketretry.model.enums.ErrorCategory;
import com.bucketretry.support.VirtualTimeSource;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class RetryBucketAutoConfigurationTest {

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(
                    RetryBucketMetricsAutoConfiguration.class,
                    RetryBucketAutoConfiguration.class));

    @Test
    void registersEngineBeans() {
        runner.run(ctx -> {
            assertNull(ctx.getStartupFailure());
            assertNotNull(ctx.getBean(Retryer.class));
            assertNotNull(ctx.getBean(BucketRegistry.class));
            assertNotNull(ctx.getBean(RetryMetrics.class));
            assertTrue(ctx.getBean(RetryBucketLifecycle.class).isRunning());
            assertEquals(3, ctx.getBean(RetryPolicySet.class).maxAttempts());
        });
    }

    @Test
    void disabledByProperty() {
        runner.withPropertyValues("retry.enabled=false")
                .run(ctx -> assertTrue(ctx.getBeansOfType(Retryer.class).isEmpty()));
    }

    @Test
    void bindsProperties() {
        runner.withPropertyValues(
                        "retry.bucket-scope=shared",
                        "retry.bucket.max-capacity=42",
                        "retry.bucket.refill-rate-per-second=0",
                        "retry.bucket-per-partition.payments.max-capacity=7",
                        "retry.policy.max-attempts=5",
                        "retry.policy.retryable-categories=transient,server",
                        "retry.backoff.initial-delay=50ms")
                .run(ctx -> {
                    RetryBucketProperties props = ctx.getBean(RetryBucketProperties.class);
                    assertEquals(BucketScope.SHARED, props.getBucketScope());
                    assertEquals(42, props.getBucket().getMaxCapacity());
                    assertTrue(props.getBucket().isCircuitBreakerMode());
                    assertEquals(7, props.getBucketPerPartition().get("payments").getMaxCapacity());
                    assertTrue(props.getPolicy().getRetryableCategories().contains(ErrorCategory.SERVER));
                    assertEquals(50, props.getBackoff().getInitialDelay().toMillis());
                    assertEquals(5, ctx.getBean(RetryPolicySet.class).maxAttempts());
                });
    }

    @Test
    void invalidPropertiesFailStartup() {
        runner.withPropertyValues("retry.bucket.max-capacity=0")
                .run(ctx -> assertNotNull(ctx.getStartupFailure()));
    }

    @Test
    void userBeansOverrideDefaults() {
        runner.withUserConfiguration(CustomTime.class).run(ctx ->
                assertInstanceOf(VirtualTimeSource.class, ctx.getBean(TimeSource.class)));
    }

    @Test
    void userRetryPolicyIsOredIntoSet() {
        runner.withUserConfiguration(RetryClientErrors.class)
                .withPropertyValues("retry.backoff.initial-delay=0ms", "retry.backoff.max-delay=0ms")
                .run(ctx -> {
                    RetryPolicySet set = ctx.getBean(RetryPolicySet.class);
                    assertEquals(2, set.getPolicies().size());

                    AtomicInteger calls = new AtomicInteger();
                    String value = ctx.getBean(Retryer.class).execute(c -> {
                        if (calls.getAndIncrement() == 0) {
                            return CompletableFuture.<String>failedFuture(new HttpOperationException(HttpResponseMeta.of(409)));
                        }
                        return CompletableFuture.completedFuture("ok");
                    }).get(5, TimeUnit.SECONDS);

                    assertEquals("ok", value);
                    assertEquals(2, calls.get());
                });
    }

    @Configuration(proxyBeanMethods = false)
    static class CustomTime {
        @Bean
        TimeSource virtualTime() {
            return new VirtualTimeSource();
        }
    }

    @Configuration(proxyBeanMethods = false)
    static class RetryClientErrors {
        @Bean
        RetryPolicy conflicts() {
            return (token, error) -> error.getCategory() == ErrorCategory.CLIENT;
        }
    }
}
