package apimonitor.uptime;

import apimonitor.endpoint.Endpoint;
import apimonitor.endpoint.EndpointRepository;
import apimonitor.exception.EndpointNotFoundException;
import apimonitor.probe.ProbeResult;
import apimonitor.store.ProbeResultStore;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.LongSummaryStatistics;
import java.util.Objects;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * 可用性统计 - 基于已保存的探测结果按需计算
 */
@Slf4j
public class UptimeAggregator {

    /**
     * 相邻两次失败间隔不超过该值时归为同一故障
     */
    public static final Duration INCIDENT_GAP = Duration.ofSeconds(120);

    private final EndpointRepository endpoints;
    private final ProbeResultStore resultStore;
    private final Clock clock;

    public UptimeAggregator(EndpointRepository endpoints, ProbeResultStore resultStore, Clock clock) {
        this.endpoints = endpoints;
        this.resultStore = resultStore;
        this.clock = clock;
    }

    public EndpointStatistics statistics(long endpointId, String period) {
        TimeWindow window = TimeWindow.parse(period);
        Endpoint endpoint = requireEndpoint(endpointId);
        List<ProbeResult> results = load(endpointId, window);

        EndpointStatistics.EndpointStatisticsBuilder builder = EndpointStatistics.builder()
                .endpointId(endpointId)
                .endpointName(endpoint.getName())
                .period(window.getLabel());
        if (results.isEmpty()) {
            return builder.uptimePercentage(0.0).build();
        }

        long successful = results.stream().filter(ProbeResult::isSuccess).count();
        LongSummaryStatistics latency = results.stream()
                .filter(r -> r.getLatency() != null)
                .mapToLong(ProbeResult::getLatencyMs)
                .summaryStatistics();

        builder.uptimePercentage(round(successful * 100.0 / results.size(), 2))
                .totalChecks(results.size())
                .successfulChecks(successful)
                .failedChecks(results.size() - successful)
                .lastCheck(results.get(results.size() - 1).getCheckedAt())
                .lastSuccess(lastMatching(results, true))
                .lastFailure(lastMatching(results, false));
        if (latency.getCount() > 0) {
            builder.avgResponseTimeMs(round(latency.getAverage(), 3))
                    .minResponseTimeMs(latency.getMin())
                    .maxResponseTimeMs(latency.getMax());
        }
        EndpointStatistics statistics = builder.build();
        log.debug("生成统计: endpoint={}, period={}, uptime={}", endpointId, window.getLabel(),
                statistics.getUptimePercentage());
        return statistics;
    }

    /**
     * 将连续失败合并为故障，持续时间小于 minDurationMinutes 的故障不返回
     */
    public List<DowntimeIncident> incidents(long endpointId, String period, double minDurationMinutes) {
        TimeWindow window = TimeWindow.parse(period);
        requireEndpoint(endpointId);
        List<ProbeResult> failures = load(endpointId, window).stream()
                .filter(r -> !r.isSuccess())
                .collect(Collectors.toList());
        return groupIncidents(failures, minDurationMinutes);
    }

    static List<DowntimeIncident> groupIncidents(List<ProbeResult> failures, double minDurationMinutes) {
        List<ProbeResult> ordered = new ArrayList<>(failures);
        ordered.sort(Comparator.comparing(ProbeResult::getCheckedAt));

        List<DowntimeIncident> incidents = new ArrayList<>();
        List<ProbeResult> current = new ArrayList<>();
        for (ProbeResult failure : ordered) {
            if (!current.isEmpty()) {
                Instant lastEnd = current.get(current.size() - 1).getCheckedAt();
                if (Duration.between(lastEnd, failure.getCheckedAt()).compareTo(INCIDENT_GAP) > 0) {
                    addIncident(incidents, current, minDurationMinutes);
                    current = new ArrayList<>();
                }
            }
            current.add(failure);
        }
        if (!current.isEmpty()) {
            addIncident(incidents, current, minDurationMinutes);
        }
        return incidents;
    }

    private static void addIncident(List<DowntimeIncident> incidents, List<ProbeResult> failures,
                                     double minDurationMinutes) {
        Instant start = failures.get(0).getCheckedAt();
        Instant end = failures.get(failures.size() - 1).getCheckedAt();
        double minutes = Duration.between(start, end).toMillis() / 60000.0;
        if (minutes < minDurationMinutes) {
            return;
        }
        List<String> errors = new ArrayList<>(failures.stream()
                .map(ProbeResult::getErrorMessage)
                .filter(Objects::nonNull)
                .collect(Collectors.toCollection(TreeSet::new)));
        incidents.add(DowntimeIncident.builder()
                .start(start)
                .end(end)
                .durationMinutes(round(minutes, 1))
                .failureCount(failures.size())
                .errors(errors)
                .build());
    }

    /**
     * 全部端点概况，启用端点按最近一次结果判断健康，没有结果视为不健康
     */
    public OverallSummary overallSummary() {
        List<Endpoint> all = endpoints.listAllEndpoints();
        int active = 0;
        int healthy = 0;
        for (Endpoint endpoint : all) {
            if (!endpoint.isActive()) {
                continue;
            }
            active++;
            if (resultStore.findLatest(endpoint.getId()).map(ProbeResult::isSuccess).orElse(false)) {
                healthy++;
            }
        }
        return OverallSummary.builder()
                .totalEndpoints(all.size())
                .activeEndpoints(active)
                .inactiveEndpoints(all.size() - active)
                .healthyEndpoints(healthy)
                .unhealthyEndpoints(active - healthy)
                .timestamp(clock.instant())
                .build();
    }

    private Endpoint requireEndpoint(long endpointId) {
        return endpoints.getEndpoint(endpointId)
                .orElseThrow(() -> new EndpointNotFoundException(endpointId));
    }

    private List<ProbeResult> load(long endpointId, TimeWindow window) {
        Instant since = clock.instant().minus(window.getDuration());
        List<ProbeResult> results = new ArrayList<>(resultStore.findSince(endpointId, since));
        results.sort(Comparator.comparing(ProbeResult::getCheckedAt));
        return results;
    }

    private static Instant lastMatching(List<ProbeResult> ordered, boolean success) {
        for (int i = ordered.size() - 1; i >= 0; i--) {
            if (ordered.get(i).isSuccess() == success) {
                return ordered.get(i).getCheckedAt();
            }
        }
        return null;
    }

    private static double round(double value, int scale) {
        return BigDecimal.valueOf(value).setScale(scale, RoundingMode.HALF_UP).doubleValue();
    }
}
