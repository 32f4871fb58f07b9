package apimonitor.uptime;

import apimonitor.exception.ValidationException;
import lombok.Getter;

import java.time.Duration;
import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * 统计时间窗口
 */
@Getter
public enum TimeWindow {
    LAST_24_HOURS("24h", Duration.ofHours(24)),
    LAST_7_DAYS("7d", Duration.ofDays(7)),
    LAST_30_DAYS("30d", Duration.ofDays(30));

    private final String label;
    private final Duration duration;

    TimeWindow(String label, Duration duration) {
        this.label = label;
        this.duration = duration;
    }

    public static TimeWindow parse(String label) {
        for (TimeWindow window : values()) {
            if (window.label.equals(label)) {
                return window;
            }
        }
        throw new ValidationException(String.format("Invalid period: %s. Use one of: %s", label,
                Arrays.stream(values()).map(TimeWindow::getLabel).collect(Collectors.joining(", "))));
    }
}
