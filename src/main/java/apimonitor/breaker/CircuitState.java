package apimonitor.breaker;

/**
 * 熔断器状态
 */
public enum CircuitState {
    CLOSED,
    OPEN,
    HALF_OPEN
}
