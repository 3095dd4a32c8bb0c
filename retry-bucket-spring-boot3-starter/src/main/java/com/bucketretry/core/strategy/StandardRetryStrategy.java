package com.bucketretry.core.strategy;

import com.bucketretry.core.bucket.BucketRegistry;
import com.bucketretry.core.policy.RetryPolicySet;
import com.bucketretry.core.spi.RetryStrategy;
import com.bucketretry.exception.RetryRejectedException;
import com.bucketretry.model.ClassifiedError;
import com.bucketretry.model.RetryToken;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * 令牌生命周期
 * FRESH -> ATTEMPTING -> (SUCCEEDED | RETRYING -> ATTEMPTING | REJECTED)
 */
public class StandardRetryStrategy implements RetryStrategy {

    private static final Logger log = LoggerFactory.getLogger(StandardRetryStrategy.class);

    private final BucketRegistry buckets;

    private final RetryPolicySet policies;

    public StandardRetryStrategy(BucketRegistry buckets, RetryPolicySet policies) {
        this.buckets = Objects.requireNonNull(buckets, "buckets");
        this.policies = Objects.requireNonNull(policies, "policies");
    }

    @Override
    public CompletableFuture<RetryToken> acquireInitialToken(String partition) {
        log.debug("[RetryStrategy] acquire initial token, partition={}", partition);
        return buckets.bucketFor(partition).acquireInitial();
    }

    @Override
    public void recordSuccess(RetryToken token) {
        log.debug("[RetryStrategy] record success, partition={}, attempt={}", token.getPartition(), token.getAttempt());
        buckets.bucketFor(token.getPartition()).release(token);
    }

    @Override
    public CompletableFuture<RetryToken> refreshRetryToken(RetryToken token, ClassifiedError error) {
        if (!policies.shouldRetry(token, error)) {
            log.info("[RetryStrategy] retry rejected, partition={}, attempt={}, category={}",
                    token.getPartition(), token.getAttempt(), error.getCategory());
            return CompletableFuture.failedFuture(new RetryRejectedException(token.getAttempt(), error.getCategory()));
        }
        return buckets.bucketFor(token.getPartition()).acquireRefresh(token, error.getCategory());
    }

    @Override
    public int maxAttempts() {
        return policies.maxAttempts();
    }
}
