package apimonitor.notify;

public enum NotificationKind {
    FAILURE,
    RECOVERY
}
