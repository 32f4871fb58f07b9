package apimonitor.probe;

/**
 * 探测失败分类
 */
public enum ErrorCategory {
    TIMEOUT,
    CONNECTION_ERROR,
    CLIENT_ERROR,
    STATUS_MISMATCH,
    CIRCUIT_OPEN,
    UNEXPECTED
}
