package apimonitor.breaker;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.util.function.Predicate;

/**
 * 熔断器配置
 */
@Value
@Builder(toBuilder = true)
public class CircuitBreakerSettings {

    @Builder.Default
    int failureThreshold = 5;

    @Builder.Default
    Duration recoveryTimeout = Duration.ofSeconds(60);

    @Builder.Default
    int successThreshold = 3;

    /**
     * 判断异常是否计入失败次数，默认所有异常都计入
     */
    @Builder.Default
    Predicate<Throwable> recordFailure = error -> true;

    public static CircuitBreakerSettings defaults() {
        return CircuitBreakerSettings.builder().build();
    }

    public CircuitBreakerSettings validated() {
        if (failureThreshold < 1) {
            throw new IllegalArgumentException("failureThreshold必须大于0: " + failureThreshold);
        }
        if (successThreshold < 1) {
            throw new IllegalArgumentException("successThreshold必须大于0: " + successThreshold);
        }
        if (recoveryTimeout == null || recoveryTimeout.isNegative()) {
            throw new IllegalArgumentException("recoveryTimeout不能为负: " + recoveryTimeout);
        }
        return this;
    }
}
