package com.bucketretry.core.time;

import com.bucketretry.core.spi.Sleeper;
import io.netty.util.HashedWheelTimer;
import io.netty.util.Timeout;
import io.netty.util.TimerTask;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Collection;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * 基于时间轮的延迟, 等待期间不占用线程
 * future 在时间轮 worker 线程上完成, 后续逻辑应切换到业务线程池
 */
public class WheelSleeper implements Sleeper {

    private static final Logger log = LoggerFactory.getLogger(WheelSleeper.class);

    private final HashedWheelTimer timer;

    public WheelSleeper(HashedWheelTimer timer) {
        this.timer = Objects.requireNonNull(timer, "timer");
    }

    @Override
    public CompletableFuture<Void> sleep(Duration duration) {
        if (duration == null || duration.isZero() || duration.isNegative()) {
            return CompletableFuture.completedFuture(null);
        }
        CompletableFuture<Void> f = new CompletableFuture<>();
        Timeout timeout;
        try {
            timeout = timer.newTimeout(new SleepTask(f), toNanos(duration), TimeUnit.NANOSECONDS);
        } catch (IllegalStateException | RejectedExecutionException e) {
            // 时间轮已停止或挂起数量超限
            log.warn("[WheelSleeper] schedule rejected, delay={}ms, cause={}", duration.toMillis(), e.toString());
            f.completeExceptionally(e);
            return f;
        }
        // 调用方取消 → 撤销时间轮任务
        f.whenComplete((v, ex) -> {
            if (f.isCancelled()) {
                timeout.cancel();
            }
        });
        return f;
    }

    /**
     * 结束 timer.stop() 返回的未到期等待, 返回结束的数量
     */
    public static int abortAll(Collection<Timeout> unprocessed, Throwable cause) {
        if (unprocessed == null) {
            return 0;
        }
        int n = 0;
        for (Timeout t : unprocessed) {
            if (t.task() instanceof SleepTask task) {
                task.future.completeExceptionally(cause);
                n++;
            }
        }
        return n;
    }

    private static final class SleepTask implements TimerTask {

        private final CompletableFuture<Void> future;

        private SleepTask(CompletableFuture<Void> future) {
            this.future = future;
        }

        @Override
        public void run(Timeout timeout) {
            future.complete(null);
        }
    }

    private static long toNanos(Duration d) {
        try {
            return d.toNanos();
        } catch (ArithmeticException overflow) {
            return Long.MAX_VALUE;
        }
    }
}
