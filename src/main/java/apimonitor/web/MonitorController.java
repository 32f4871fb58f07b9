package apimonitor.web;

import apimonitor.breaker.CircuitBreakerRegistry;
import apimonitor.breaker.CircuitBreakerSnapshot;
import apimonitor.cooldown.CooldownGate;
import apimonitor.endpoint.EndpointLoader;
import apimonitor.notify.NotificationDispatcher;
import apimonitor.notify.NotificationRecord;
import apimonitor.scheduler.JobStatus;
import apimonitor.scheduler.MonitorScheduler;
import apimonitor.uptime.DowntimeIncident;
import apimonitor.uptime.EndpointStatistics;
import apimonitor.uptime.OverallSummary;
import apimonitor.uptime.UptimeAggregator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * 监控状态查询与管理接口
 */
@Slf4j
@RestController
@RequestMapping("/api/monitor")
@RequiredArgsConstructor
public class MonitorController {

    private final CircuitBreakerRegistry circuitBreakerRegistry;
    private final MonitorScheduler monitorScheduler;
    private final UptimeAggregator uptimeAggregator;
    private final NotificationDispatcher notificationDispatcher;
    private final EndpointLoader endpointLoader;
    private final CooldownGate cooldownGate;

    @GetMapping("/breakers")
    public Map<String, CircuitBreakerSnapshot> breakers() {
        return circuitBreakerRegistry.snapshots();
    }

    @PostMapping("/breakers/{name}/reset")
    public ResponseEntity<Map<String, Object>> resetBreaker(@PathVariable String name) {
        if (!circuitBreakerRegistry.reset(name)) {
            return ResponseEntity.notFound().build();
        }
        log.info("熔断器已手动重置: {}", name);
        return ResponseEntity.ok(Map.of("name", name, "reset", true));
    }

    @GetMapping("/jobs")
    public Map<Long, JobStatus> jobs() {
        return monitorScheduler.getAllJobStatuses();
    }

    @GetMapping("/jobs/{endpointId}")
    public ResponseEntity<JobStatus> job(@PathVariable long endpointId) {
        return ResponseEntity.of(monitorScheduler.getJobStatus(endpointId));
    }

    @GetMapping("/endpoints/{id}/statistics")
    public EndpointStatistics statistics(@PathVariable long id,
                                         @RequestParam(defaultValue = "24h") String period) {
        return uptimeAggregator.statistics(id, period);
    }

    @GetMapping("/endpoints/{id}/incidents")
    public List<DowntimeIncident> incidents(@PathVariable long id,
                                            @RequestParam(defaultValue = "24h") String period,
                                            @RequestParam(defaultValue = "1") double minDurationMinutes) {
        return uptimeAggregator.incidents(id, period, minDurationMinutes);
    }

    @GetMapping("/summary")
    public OverallSummary summary() {
        return uptimeAggregator.overallSummary();
    }

    @GetMapping("/notifications")
    public List<NotificationRecord> notifications() {
        return notificationDispatcher.recentNotifications();
    }

    @PostMapping("/endpoints/reload")
    public Map<String, Object> reloadEndpoints() {
        int count = endpointLoader.reload();
        log.info("Endpoint configuration reloaded, {} endpoints", count);
        return Map.of("endpoints", count);
    }

    @PostMapping("/cooldown/revalidate")
    public Map<String, Object> revalidateCooldown() {
        return Map.of("available", cooldownGate.revalidate());
    }
}
