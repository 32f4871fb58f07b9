package apimonitor.breaker;

import apimonitor.exception.MonitorException;
import lombok.Getter;

import java.time.Duration;
import java.time.Instant;

/**
 * 熔断器处于OPEN状态时拒绝调用
 */
@Getter
public class CircuitOpenException extends MonitorException {
    private final String circuitName;
    private final Instant lastFailureAt;
    private final Duration retryIn;

    public CircuitOpenException(String circuitName, Instant lastFailureAt, Duration retryIn) {
        super(String.format("Circuit breaker '%s' is OPEN. Last failure: %s. Will retry in %ds",
                circuitName, lastFailureAt, Math.max(0, retryIn.toSeconds())));
        this.circuitName = circuitName;
        this.lastFailureAt = lastFailureAt;
        this.retryIn = retryIn;
    }
}
