package apimonitor.uptime;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * 端点在时间窗口内的可用性统计，没有数据时响应时间字段为 null
 */
@Value
@Builder
public class EndpointStatistics {
    long endpointId;
    String endpointName;
    String period;
    double uptimePercentage;
    long totalChecks;
    long successfulChecks;
    long failedChecks;
    Double avgResponseTimeMs;
    Long minResponseTimeMs;
    Long maxResponseTimeMs;
    Instant lastCheck;
    Instant lastSuccess;
    Instant lastFailure;
}
