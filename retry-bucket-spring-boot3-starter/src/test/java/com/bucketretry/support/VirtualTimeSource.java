package com.bucketretry.support;

import com.bucketretry.core.spi.TimeSource;

import java.time.Duration;
import java.time.Instant;

public class VirtualTimeSource implements TimeSource {

    private volatile Instant current;

    public VirtualTimeSource() {
        this(Instant.parse("2024-01-01T00:00:00Z"));
    }

    public VirtualTimeSource(Instant start) {
        this.current = start;
    }

    @Override
    public Instant now() {
        return current;
    }

    public synchronized void advance(Duration d) {
        current = current.plus(d);
    }
}
