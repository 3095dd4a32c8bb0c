package com.bucketretry.core.time;

import com.bucketretry.core.spi.TimeSource;

import java.time.Clock;
import java.time.Instant;
import java.util.Objects;

public class SystemTimeSource implements TimeSource {

    private final Clock clock;

    public SystemTimeSource() {
        this(Clock.systemUTC());
    }

    public SystemTimeSource(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public Instant now() {
        return clock.instant();
    }
}
