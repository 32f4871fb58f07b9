package apimonitor.notify;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * 已格式化的通知内容
 */
@Value
@Builder
public class NotificationMessage {
    NotificationKind kind;
    long endpointId;
    String endpointName;
    String url;
    String method;
    Integer statusCode;
    String error;
    long responseTimeMs;
    Instant checkedAt;
    String subject;
    String body;
}
