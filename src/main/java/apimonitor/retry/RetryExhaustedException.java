package apimonitor.retry;

import apimonitor.exception.MonitorException;
import lombok.Getter;

/**
 * 重试次数用尽，cause 为最后一次失败的异常
 */
@Getter
public class RetryExhaustedException extends MonitorException {
    private final int attempts;

    public RetryExhaustedException(int attempts, Throwable lastError) {
        super("Operation failed after " + attempts + " attempts: " + lastError.getMessage(), lastError);
        this.attempts = attempts;
    }
}
