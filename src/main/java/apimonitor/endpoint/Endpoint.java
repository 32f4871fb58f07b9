package apimonitor.endpoint;

import apimonitor.exception.ValidationException;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 监控端点定义
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Endpoint {
    public static final List<String> SUPPORTED_METHODS = List.of("GET", "POST", "PUT", "PATCH", "DELETE", "HEAD");
    public static final Duration MIN_INTERVAL = Duration.ofSeconds(10);
    public static final Duration MIN_TIMEOUT = Duration.ofSeconds(1);

    private long id;
    private String name;
    private String url;
    @Builder.Default
    private String method = "GET";
    @Builder.Default
    private Duration interval = Duration.ofSeconds(60);
    @Builder.Default
    private Duration timeout = Duration.ofSeconds(10);
    @Builder.Default
    private int expectedStatus = 200;
    @Builder.Default
    private Map<String, String> headers = new LinkedHashMap<>();
    private Object body;                    // JSON请求体，Map或字符串
    @Builder.Default
    private boolean active = true;
    private String sourcePath;              // 定义所在的文件

    public void validate() throws ValidationException {
        if (id <= 0) {
            throw new ValidationException("端点id必须为正整数");
        }
        if (name == null || name.isBlank()) {
            throw new ValidationException("端点名称不能为空");
        }
        if (url == null || !(url.startsWith("http://") || url.startsWith("https://"))) {
            throw new ValidationException("端点url必须以http://或https://开头: " + url);
        }
        if (method == null || !SUPPORTED_METHODS.contains(method.toUpperCase())) {
            throw new ValidationException("不支持的HTTP方法: " + method);
        }
        if (interval == null || interval.compareTo(MIN_INTERVAL) < 0) {
            throw new ValidationException("检查间隔不能小于10秒: " + interval);
        }
        if (timeout == null || timeout.compareTo(MIN_TIMEOUT) < 0) {
            throw new ValidationException("超时时间不能小于1秒: " + timeout);
        }
        if (expectedStatus < 100 || expectedStatus > 599) {
            throw new ValidationException("expected_status必须在100-599之间: " + expectedStatus);
        }
    }
}
