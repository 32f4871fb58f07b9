package apimonitor.uptime;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * 一段连续失败组成的故障
 */
@Value
@Builder
public class DowntimeIncident {
    Instant start;
    Instant end;
    double durationMinutes;
    int failureCount;
    List<String> errors;
}
