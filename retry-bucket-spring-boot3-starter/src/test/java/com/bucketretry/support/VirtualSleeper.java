package com.bucketretry.support;

import com.bucketretry.core.spi.Sleeper;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * 立即完成, 同时推进虚拟时间并记录每次等待
 */
public class VirtualSleeper implements Sleeper {

    private final VirtualTimeSource time;

    private final List<Duration> sleeps = new ArrayList<>();

    public VirtualSleeper(VirtualTimeSource time) {
        this.time = time;
    }

    @Override
    public synchronized CompletableFuture<Void> sleep(Duration duration) {
        sleeps.add(duration);
        time.advance(duration);
        return CompletableFuture.completedFuture(null);
    }

    public synchronized List<Duration> sleeps() {
        return List.copyOf(sleeps);
    }
}
