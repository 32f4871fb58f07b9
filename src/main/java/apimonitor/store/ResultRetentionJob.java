package apimonitor.store;

import apimonitor.config.MonitorSettings;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.TimeUnit;

/**
 * 定期清理超过保留天数的探测结果
 */
@Slf4j
@Component
public class ResultRetentionJob {

    @Autowired
    private ProbeResultStore probeResultStore;

    @Autowired
    private MonitorSettings settings;

    @Autowired
    private Clock monitorClock;

    @Scheduled(initialDelayString = "${monitor.history.cleanup-interval-seconds:86400}",
            fixedDelayString = "${monitor.history.cleanup-interval-seconds:86400}",
            timeUnit = TimeUnit.SECONDS)
    public void purgeExpiredResults() {
        Instant cutoff = monitorClock.instant().minus(Duration.ofDays(settings.getRetentionDays()));
        try {
            long removed = probeResultStore.purgeOlderThan(cutoff);
            log.info("历史结果清理完成, 删除 {} 条, 保留 {} 天", removed, settings.getRetentionDays());
        } catch (Exception e) {
            log.error("历史结果清理失败", e);
        }
    }
}
