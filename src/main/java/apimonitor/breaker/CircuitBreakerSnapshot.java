package apimonitor.breaker;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.time.Instant;

/**
 * 熔断器状态快照(只读导出)
 */
@Value
@Builder
public class CircuitBreakerSnapshot {
    String name;
    CircuitState state;
    int failureCount;
    int successCount;
    Instant lastFailureAt;
    int failureThreshold;
    Duration recoveryTimeout;
    int successThreshold;
}
