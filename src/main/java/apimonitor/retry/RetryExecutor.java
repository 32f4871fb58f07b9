package apimonitor.retry;

import apimonitor.utils.FutureUtils;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;
import java.util.function.Supplier;

/**
 * 指数退避重试执行器
 */
@Slf4j
public class RetryExecutor {

    private final DelayScheduler delayScheduler;
    private final DoubleSupplier random;

    public RetryExecutor(DelayScheduler delayScheduler, DoubleSupplier random) {
        this.delayScheduler = delayScheduler;
        this.random = random;
    }

    public RetryExecutor(DelayScheduler delayScheduler) {
        this(delayScheduler, () -> ThreadLocalRandom.current().nextDouble());
    }

    public RetryExecutor() {
        this(DelayScheduler.system());
    }

    /**
     * 执行操作，失败时按策略重试；不可重试的异常立即返回，用尽后返回 RetryExhaustedException
     */
    public <T> CompletableFuture<T> run(Supplier<CompletableFuture<T>> operation, RetryPolicy policy) {
        if (policy.getMaxAttempts() < 1) {
            return CompletableFuture.failedFuture(
                    new IllegalArgumentException("maxAttempts必须大于0: " + policy.getMaxAttempts()));
        }
        CompletableFuture<T> result = new CompletableFuture<>();
        attempt(operation, policy, 1, result);
        return result;
    }

    private <T> void attempt(Supplier<CompletableFuture<T>> operation, RetryPolicy policy,
                             int attempt, CompletableFuture<T> result) {
        FutureUtils.invoke(operation).whenComplete((value, error) -> {
            if (error == null) {
                result.complete(value);
                return;
            }
            if (result.isDone()) {
                // 调用方已超时或取消
                return;
            }
            Throwable cause = FutureUtils.unwrap(error);
            if (!policy.getRetryOn().test(cause)) {
                result.completeExceptionally(cause);
                return;
            }
            if (attempt >= policy.getMaxAttempts()) {
                log.error("重试 {} 次后仍然失败: {}", attempt, cause.toString());
                result.completeExceptionally(new RetryExhaustedException(attempt, cause));
                return;
            }
            Duration delay = nextDelay(policy, attempt + 1);
            log.warn("Attempt {}/{} failed: {}. Retrying in {}ms", attempt, policy.getMaxAttempts(),
                    cause.toString(), delay.toMillis());
            delayScheduler.after(delay).whenComplete((ignored, delayError) -> {
                if (delayError != null) {
                    result.completeExceptionally(FutureUtils.unwrap(delayError));
                } else if (!result.isDone()) {
                    attempt(operation, policy, attempt + 1, result);
                }
            });
        });
    }

    Duration nextDelay(RetryPolicy policy, int attempt) {
        Duration delay = policy.delayBefore(attempt);
        if (!policy.isJitter()) {
            return delay;
        }
        double factor = 0.5 + random.getAsDouble() * 0.5;
        return Duration.ofMillis((long) (delay.toMillis() * factor));
    }
}
