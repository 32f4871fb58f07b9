package apimonitor.notify;

import lombok.Getter;

import java.util.List;

/**
 * 通知渠道基类
 */
@Getter
public abstract class NotificationChannel {

    public enum ChannelType {
        WEBHOOK,
        DINGTALK
    }

    protected final String type;
    protected final List<String> recipients;

    protected NotificationChannel(ChannelType type, List<String> recipients) {
        this.type = type.name().toLowerCase();
        this.recipients = recipients == null ? List.of() : List.copyOf(recipients);
    }

    /**
     * 发送通知，失败时抛出 NotificationException
     */
    public abstract void send(NotificationMessage message) throws NotificationException;
}
