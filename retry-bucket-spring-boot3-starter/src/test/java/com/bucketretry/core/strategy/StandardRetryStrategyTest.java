package com.bucketretry.core.strategy;

import com.bucketretry.config.BucketConfiguration;
import com.bucketretry.config.RetryBucketProperties;
import com.bucketretry.core.bucket.BucketRegistry;
import com.bucketretry.core.policy.RetryPolicySet;
import com.bucketretry.exception.RetryCapacityExceededException;
import com.bucketretry.exception.RetryRejectedException;
import com.bucketretry.model.ClassifiedError;
import com.bucketretry.model.RetryToken;
import com.bucketretry.model.enums.ErrorCategory;
import com.bucketretry.support.VirtualSleeper;
import com.bucketretry.support.VirtualTimeSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.concurrent.CompletionException;

import static org.junit.jupiter.api.Assertions.*;

class StandardRetryStrategyTest {

    private RetryBucketProperties props;

    private BucketRegistry registry;

    private StandardRetryStrategy strategy;

    @BeforeEach
    void setUp() {
        props = new RetryBucketProperties();
        BucketConfiguration bucket = new BucketConfiguration();
        bucket.setMaxCapacity(10);
        bucket.setStandardRetryCost(5);
        bucket.setTimeoutRetryCost(10);
        bucket.setCircuitBreakerMode(true);
        props.setBucket(bucket);
        VirtualTimeSource time = new VirtualTimeSource();
        registry = new BucketRegistry(props, time, new VirtualSleeper(time), null);
        strategy = new StandardRetryStrategy(registry,
                RetryPolicySet.standard(3, EnumSet.of(ErrorCategory.TRANSIENT, ErrorCategory.THROTTLING)));
    }

    @Test
    void initialTokenStartsAtZero() {
        RetryToken token = strategy.acquireInitialToken("orders").join();

        assertEquals(0, token.getAttempt());
        assertEquals("orders", token.getPartition());
        assertEquals(3, strategy.maxAttempts());
    }

    @Test
    void refreshChargesBucketOfTokenPartition() {
        RetryToken token = strategy.acquireInitialToken("orders").join();
        RetryToken next = strategy.refreshRetryToken(token, ClassifiedError.of(ErrorCategory.TRANSIENT)).join();

        assertEquals(1, next.getAttempt());
        assertEquals(0, registry.bucketFor("orders").capacity());
        assertEquals(10, registry.bucketFor("payments").capacity());
    }

    @Test
    void policyDeclineDoesNotTouchBucket() {
        RetryToken token = strategy.acquireInitialToken("orders").join();

        CompletionException ex = assertThrows(CompletionException.class,
                () -> strategy.refreshRetryToken(token, ClassifiedError.of(ErrorCategory.CLIENT)).join());
        RetryRejectedException rejected = assertInstanceOf(RetryRejectedException.class, ex.getCause());
        assertEquals(ErrorCategory.CLIENT, rejected.getCategory());
        assertEquals(10, registry.bucketFor("orders").capacity());
    }

    @Test
    void attemptLimitIsEnforced() {
        RetryToken token = new RetryToken("orders", 3, null);
        CompletionException ex = assertThrows(CompletionException.class,
                () -> strategy.refreshRetryToken(token, ClassifiedError.of(ErrorCategory.TRANSIENT)).join());
        assertInstanceOf(RetryRejectedException.class, ex.getCause());
    }

    @Test
    void capacityShortageSurfacesAsCapacityError() {
        RetryToken token = strategy.acquireInitialToken("orders").join();
        RetryToken next = strategy.refreshRetryToken(token, ClassifiedError.of(ErrorCategory.THROTTLING)).join();

        CompletionException ex = assertThrows(CompletionException.class,
                () -> strategy.refreshRetryToken(next, ClassifiedError.of(ErrorCategory.THROTTLING)).join());
        assertInstanceOf(RetryCapacityExceededException.class, ex.getCause());
    }

    @Test
    void successReturnsIncrementToPartitionBucket() {
        RetryToken token = strategy.acquireInitialToken("orders").join();
        RetryToken next = strategy.refreshRetryToken(token, ClassifiedError.of(ErrorCategory.TRANSIENT)).join();
        strategy.recordSuccess(next);

        assertEquals(10, registry.bucketFor("orders").capacity());
    }
}
