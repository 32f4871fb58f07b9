package apimonitor.retry;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

/**
 * 非阻塞等待
 */
@FunctionalInterface
public interface DelayScheduler {

    CompletableFuture<Void> after(Duration delay);

    /**
     * 基于 CompletableFuture.delayedExecutor，不占用调用线程
     */
    static DelayScheduler system() {
        return delay -> CompletableFuture.runAsync(() -> {
        }, CompletableFuture.delayedExecutor(delay.toMillis(), TimeUnit.MILLISECONDS));
    }
}
