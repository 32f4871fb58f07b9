package apimonitor.uptime;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class OverallSummary {
    int totalEndpoints;
    int activeEndpoints;
    int inactiveEndpoints;
    int healthyEndpoints;
    int unhealthyEndpoints;
    Instant timestamp;
}
