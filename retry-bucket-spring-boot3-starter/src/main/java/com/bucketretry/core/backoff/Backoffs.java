package com.bucketretry.core.backoff;

import java.time.Duration;
import java.util.function.DoubleSupplier;

final class Backoffs {

    private Backoffs() {
    }

    static double nanos(Duration d) {
        try {
            return d.toNanos();
        } catch (ArithmeticException overflow) {
            return Long.MAX_VALUE;
        }
    }

    /**
     * raw * (1 - draw), draw ∈ [0, jitterFraction]；jitterFraction=0 时不取随机数
     */
    static Duration jitter(double rawNanos, double jitterFraction, DoubleSupplier uniform) {
        double draw = jitterFraction > 0 ? uniform.getAsDouble() * jitterFraction : 0.0;
        double delay = rawNanos * (1.0 - draw);
        return Duration.ofNanos(Math.round(delay));
    }
}
