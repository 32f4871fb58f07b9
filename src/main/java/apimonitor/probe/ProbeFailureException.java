package apimonitor.probe;

import apimonitor.exception.MonitorException;
import lombok.Getter;

import java.time.Duration;

/**
 * 单次HTTP探测失败
 */
@Getter
public class ProbeFailureException extends MonitorException {
    private final ErrorCategory category;
    private final Integer statusCode;
    private final Duration latency;

    public ProbeFailureException(ErrorCategory category, String message, Integer statusCode, Duration latency) {
        super(message);
        this.category = category;
        this.statusCode = statusCode;
        this.latency = latency;
    }

    public ProbeFailureException(ErrorCategory category, String message, Throwable cause) {
        super(message, cause);
        this.category = category;
        this.statusCode = null;
        this.latency = null;
    }
}
