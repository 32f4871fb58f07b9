package apimonitor.notify;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * 一次通知发送记录
 */
@Value
@Builder
public class NotificationRecord {

    public enum Status {
        SENT,
        FAILED
    }

    long endpointId;
    String endpointName;
    NotificationKind kind;
    String channel;
    Status status;
    String subject;
    String errorMessage;
    Instant createdAt;
}
