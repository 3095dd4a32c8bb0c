package com.bucketretry.model;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.time.Duration;

/**
 * 退避参数，构造后不可变
 */
@Getter
@ToString
public final class BackoffConfiguration {

    public static final Duration DEFAULT_INITIAL_DELAY = Duration.ofMillis(10);
    public static final double DEFAULT_JITTER_FRACTION = 1.0;
    public static final Duration DEFAULT_MAX_DELAY = Duration.ofSeconds(20);
    public static final double DEFAULT_SCALE_FACTOR = 1.5;

    private final Duration initialDelay;

    /** 0~1, 1 表示最多减掉 100% */
    private final double jitterFraction;

    private final Duration maxDelay;

    private final double scaleFactor;

    @Builder
    private BackoffConfiguration(Duration initialDelay, Double jitterFraction,
                                 Duration maxDelay, Double scaleFactor) {
        this.initialDelay = initialDelay == null ? DEFAULT_INITIAL_DELAY : initialDelay;
        this.jitterFraction = jitterFraction == null ? DEFAULT_JITTER_FRACTION : jitterFraction;
        this.maxDelay = maxDelay == null ? DEFAULT_MAX_DELAY : maxDelay;
        this.scaleFactor = scaleFactor == null ? DEFAULT_SCALE_FACTOR : scaleFactor;

        if (this.initialDelay.isNegative()) {
            throw new IllegalArgumentException("retry.backoff.initial-delay must be >= 0");
        }
        if (this.maxDelay.isNegative()) {
            throw new IllegalArgumentException("retry.backoff.max-delay must be >= 0");
        }
        if (!(this.jitterFraction >= 0.0 && this.jitterFraction <= 1.0)) {
            throw new IllegalArgumentException("retry.backoff.jitter-fraction must be within [0, 1]");
        }
        if (!(this.scaleFactor > 1.0)) {
            throw new IllegalArgumentException("retry.backoff.scale-factor must be > 1");
        }
    }

    public static BackoffConfiguration defaults() {
        return builder().build();
    }
}
