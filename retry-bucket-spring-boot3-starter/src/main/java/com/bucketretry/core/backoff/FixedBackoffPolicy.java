package com.bucketretry.core.backoff;

import com.bucketretry.core.spi.BackoffPolicy;
import com.bucketretry.model.BackoffConfiguration;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;

/**
 * 固定间隔策略（抖动规则与指数策略一致）
 */
public class FixedBackoffPolicy implements BackoffPolicy {

    private final BackoffConfiguration cfg;

    public FixedBackoffPolicy(BackoffConfiguration cfg) {
        this.cfg = Objects.requireNonNull(cfg, "cfg");
    }

    @Override
    public String name() {
        return "fixed";
    }

    @Override
    public Duration backoff(int attempt) {
        if (attempt < 0) {
            throw new IllegalArgumentException("attempt must be >= 0, got " + attempt);
        }
        double raw = Math.min(Backoffs.nanos(cfg.getInitialDelay()), Backoffs.nanos(cfg.getMaxDelay()));
        return Backoffs.jitter(raw, cfg.getJitterFraction(), () -> ThreadLocalRandom.current().nextDouble());
    }
}
