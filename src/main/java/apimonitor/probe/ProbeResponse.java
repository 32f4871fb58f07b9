package apimonitor.probe;

import lombok.Value;

import java.time.Duration;

/**
 * 传输层返回的原始响应
 */
@Value
public class ProbeResponse {
    int statusCode;
    Duration latency;
}
