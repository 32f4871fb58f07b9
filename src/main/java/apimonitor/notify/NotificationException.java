package apimonitor.notify;

import apimonitor.exception.MonitorException;

/**
 * 通知发送失败
 */
public class NotificationException extends MonitorException {
    public NotificationException(String message) {
        super(message);
    }

    public NotificationException(String message, Throwable cause) {
        super(message, cause);
    }
}
