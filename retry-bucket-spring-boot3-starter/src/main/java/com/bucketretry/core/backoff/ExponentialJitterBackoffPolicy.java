package com.bucketretry.core.backoff;

import com.bucketretry.core.spi.BackoffPolicy;
import com.bucketretry.model.BackoffConfiguration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * 指数退避 + 抖动
 * raw = min(initialDelay * scaleFactor^attempt, maxDelay)
 * delay = raw * (1 - U[0, jitterFraction])
 */
public class ExponentialJitterBackoffPolicy implements BackoffPolicy {

    private static final Logger log = LoggerFactory.getLogger(ExponentialJitterBackoffPolicy.class);

    private final BackoffConfiguration cfg;

    /** [0,1) 均匀分布 */
    private final DoubleSupplier uniform;

    public ExponentialJitterBackoffPolicy(BackoffConfiguration cfg) {
        this(cfg, () -> ThreadLocalRandom.current().nextDouble());
    }

    ExponentialJitterBackoffPolicy(BackoffConfiguration cfg, DoubleSupplier uniform) {
        this.cfg = Objects.requireNonNull(cfg, "cfg");
        this.uniform = Objects.requireNonNull(uniform, "uniform");
    }

    @Override
    public String name() {
        return "exponential";
    }

    @Override
    public Duration backoff(int attempt) {
        if (attempt < 0) {
            throw new IllegalArgumentException("attempt must be >= 0, got " + attempt);
        }
        double ideal = Backoffs.nanos(cfg.getInitialDelay()) * Math.pow(cfg.getScaleFactor(), attempt);
        double raw = Math.min(ideal, Backoffs.nanos(cfg.getMaxDelay()));
        Duration delay = Backoffs.jitter(raw, cfg.getJitterFraction(), uniform);
        log.debug("[Backoff] attempt={} delay={}ms", attempt, delay.toMillis());
        return delay;
    }

    public BackoffConfiguration getConfiguration() { return cfg; }
}
