package apimonitor.scheduler;

import lombok.Getter;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 单个端点的周期任务句柄，cancel 可重复调用
 */
public final class JobHandle {
    @Getter
    private final long endpointId;
    @Getter
    private final Duration interval;
    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private volatile ScheduledFuture<?> future;
    @Getter
    private volatile Instant nextRunTime;

    JobHandle(long endpointId, Duration interval) {
        this.endpointId = endpointId;
        this.interval = interval;
    }

    void arm(ScheduledFuture<?> next, Instant dueAt) {
        this.future = next;
        this.nextRunTime = dueAt;
        // cancel 与 arm 并发时，保证新排的任务也被取消
        if (cancelled.get()) {
            next.cancel(false);
        }
    }

    public boolean cancel() {
        if (!cancelled.compareAndSet(false, true)) {
            return false;
        }
        ScheduledFuture<?> current = future;
        if (current != null) {
            current.cancel(false);
        }
        nextRunTime = null;
        return true;
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public JobStatus status() {
        return new JobStatus(endpointId, interval.toSeconds(), nextRunTime);
    }
}
