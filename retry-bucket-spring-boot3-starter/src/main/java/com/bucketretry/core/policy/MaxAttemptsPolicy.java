package com.bucketretry.core.policy;

import com.bucketretry.core.spi.RetryPolicy;
import com.bucketretry.model.ClassifiedError;
import com.bucketretry.model.RetryToken;
import lombok.Getter;
import lombok.ToString;

/**
 * attempt 严格小于上限
 */
@Getter
@ToString
public class MaxAttemptsPolicy implements RetryPolicy {

    private final int maxAttempts;

    public MaxAttemptsPolicy(int maxAttempts) {
        if (maxAttempts < 0) {
            throw new IllegalArgumentException("maxAttempts must be >= 0");
        }
        this.maxAttempts = maxAttempts;
    }

    @Override
    public boolean decide(RetryToken token, ClassifiedError error) {
        return token.getAttempt() < maxAttempts;
    }
}
