package apimonitor.breaker;

import apimonitor.utils.FutureUtils;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * 熔断器
 * <p>
 * CLOSED 连续失败达到 failureThreshold 进入 OPEN；OPEN 在 recoveryTimeout 内直接拒绝调用，
 * 超时后下一次调用先切换到 HALF_OPEN 再执行；HALF_OPEN 成功 successThreshold 次回到 CLOSED，
 * 任意一次失败立即重新 OPEN。
 * <p>
 * 准入判断和计数都在锁内完成，被包装的操作在锁外执行。
 */
@Slf4j
public class CircuitBreaker {

    @Getter
    private final String name;
    @Getter
    private final CircuitBreakerSettings settings;
    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock();

    private CircuitState state = CircuitState.CLOSED;
    private int failureCount;
    private int successCount;
    private Instant lastFailureAt;

    public CircuitBreaker(String name, CircuitBreakerSettings settings, Clock clock) {
        this.name = name;
        this.settings = settings.validated();
        this.clock = clock;
    }

    public CircuitBreaker(String name, CircuitBreakerSettings settings) {
        this(name, settings, Clock.systemUTC());
    }

    /**
     * 异步调用，OPEN 状态下返回 CircuitOpenException 失败的 future 且不执行操作
     */
    public <T> CompletableFuture<T> call(Supplier<CompletableFuture<T>> operation) {
        try {
            acquirePermission();
        } catch (CircuitOpenException e) {
            return CompletableFuture.failedFuture(e);
        }
        CompletableFuture<T> result = new CompletableFuture<>();
        FutureUtils.invoke(operation).whenComplete((value, error) -> {
            if (error == null) {
                onSuccess();
                result.complete(value);
            } else {
                Throwable cause = FutureUtils.unwrap(error);
                onFailure(cause);
                result.completeExceptionally(cause);
            }
        });
        return result;
    }

    /**
     * 同步调用
     */
    public <T> T execute(Callable<T> operation) throws Exception {
        acquirePermission();
        T value;
        try {
            value = operation.call();
        } catch (Exception e) {
            onFailure(e);
            throw e;
        }
        onSuccess();
        return value;
    }

    private void acquirePermission() {
        lock.lock();
        try {
            if (state != CircuitState.OPEN) {
                return;
            }
            Instant now = clock.instant();
            Duration elapsed = lastFailureAt == null ? settings.getRecoveryTimeout() : Duration.between(lastFailureAt, now);
            if (elapsed.compareTo(settings.getRecoveryTimeout()) >= 0) {
                state = CircuitState.HALF_OPEN;
                successCount = 0;
                log.warn("Circuit breaker '{}' entering HALF_OPEN state", name);
                return;
            }
            throw new CircuitOpenException(name, lastFailureAt, settings.getRecoveryTimeout().minus(elapsed));
        } finally {
            lock.unlock();
        }
    }

    private void onSuccess() {
        lock.lock();
        try {
            if (state == CircuitState.HALF_OPEN) {
                successCount++;
                if (successCount >= settings.getSuccessThreshold()) {
                    state = CircuitState.CLOSED;
                    failureCount = 0;
                    successCount = 0;
                    log.warn("Circuit breaker '{}' CLOSED after recovery", name);
                }
            } else if (state == CircuitState.CLOSED) {
                failureCount = 0;
            }
        } finally {
            lock.unlock();
        }
    }

    private void onFailure(Throwable error) {
        if (!settings.getRecordFailure().test(error)) {
            log.debug("Circuit breaker '{}' ignored failure: {}", name, error.toString());
            return;
        }
        lock.lock();
        try {
            failureCount++;
            lastFailureAt = clock.instant();
            if (state == CircuitState.HALF_OPEN) {
                state = CircuitState.OPEN;
                successCount = 0;
                log.error("Circuit breaker '{}' REOPENED after failure in HALF_OPEN state: {}", name, error.toString());
            } else if (state == CircuitState.CLOSED && failureCount >= settings.getFailureThreshold()) {
                state = CircuitState.OPEN;
                log.error("Circuit breaker '{}' OPENED after {} failures", name, failureCount);
            } else {
                log.warn("Circuit breaker '{}' failure {}/{}: {}", name, failureCount,
                        settings.getFailureThreshold(), error.toString());
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * 管理员重置，唯一允许从外部改写状态的入口
     */
    public void reset() {
        lock.lock();
        try {
            state = CircuitState.CLOSED;
            failureCount = 0;
            successCount = 0;
            lastFailureAt = null;
            log.info("Circuit breaker '{}' manually reset", name);
        } finally {
            lock.unlock();
        }
    }

    public CircuitState getState() {
        lock.lock();
        try {
            return state;
        } finally {
            lock.unlock();
        }
    }

    public CircuitBreakerSnapshot snapshot() {
        lock.lock();
        try {
            return CircuitBreakerSnapshot.builder()
                    .name(name)
                    .state(state)
                    .failureCount(failureCount)
                    .successCount(successCount)
                    .lastFailureAt(lastFailureAt)
                    .failureThreshold(settings.getFailureThreshold())
                    .recoveryTimeout(settings.getRecoveryTimeout())
                    .successThreshold(settings.getSuccessThreshold())
                    .build();
        } finally {
            lock.unlock();
        }
    }
}
