package apimonitor.probe;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.time.Instant;

/**
 * 单次探测结果，创建后不可变
 */
@Value
@Builder(toBuilder = true)
public class ProbeResult {
    long endpointId;
    boolean success;
    Integer statusCode;
    Duration latency;
    ErrorCategory errorCategory;
    String errorMessage;
    Instant checkedAt;

    public long getLatencyMs() {
        return latency == null ? 0 : latency.toMillis();
    }
}
