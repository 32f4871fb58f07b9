package apimonitor.exception;

/**
 * 参数校验失败
 */
public class ValidationException extends MonitorException {
    public ValidationException(String message) {
        super(message);
    }
}
