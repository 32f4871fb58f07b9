package apimonitor.retry;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.util.function.Predicate;

/**
 * 重试策略
 */
@Value
@Builder(toBuilder = true)
public class RetryPolicy {

    @Builder.Default
    int maxAttempts = 3;

    @Builder.Default
    Duration baseDelay = Duration.ofSeconds(1);

    @Builder.Default
    double multiplier = 2.0;

    @Builder.Default
    Duration maxDelay = Duration.ofSeconds(60);

    @Builder.Default
    boolean jitter = true;

    /**
     * 可重试的异常，默认全部重试
     */
    @Builder.Default
    Predicate<Throwable> retryOn = error -> true;

    public static RetryPolicy noRetry() {
        return RetryPolicy.builder().maxAttempts(1).build();
    }

    /**
     * 第 attempt 次尝试(从2开始)之前的基础等待时间，不含抖动
     */
    public Duration delayBefore(int attempt) {
        if (attempt < 2) {
            return Duration.ZERO;
        }
        double millis = baseDelay.toMillis() * Math.pow(multiplier, attempt - 2);
        long capped = (long) Math.min(millis, (double) maxDelay.toMillis());
        return Duration.ofMillis(Math.max(0, capped));
    }
}
