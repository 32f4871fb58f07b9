package apimonitor.scheduler;

import lombok.Value;

import java.time.Instant;

/**
 * 调度任务状态
 */
@Value
public class JobStatus {
    long endpointId;
    long intervalSeconds;
    Instant nextRunTime;
}
