package apimonitor.store;

import apimonitor.probe.ProbeResult;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 进程内结果存储，单进程部署时使用
 */
@Slf4j
public class InMemoryProbeResultStore implements ProbeResultStore {

    private final Map<Long, NavigableMap<Instant, List<ProbeResult>>> results = new ConcurrentHashMap<>();

    @Override
    public void save(long endpointId, ProbeResult result) {
        NavigableMap<Instant, List<ProbeResult>> history = results.computeIfAbsent(endpointId, k -> new TreeMap<>());
        synchronized (history) {
            List<ProbeResult> sameInstant = history.computeIfAbsent(result.getCheckedAt(), k -> new ArrayList<>(1));
            if (!sameInstant.contains(result)) {
                sameInstant.add(result);
            }
        }
    }

    @Override
    public List<ProbeResult> findSince(long endpointId, Instant since) {
        NavigableMap<Instant, List<ProbeResult>> history = results.get(endpointId);
        if (history == null) {
            return List.of();
        }
        List<ProbeResult> list = new ArrayList<>();
        synchronized (history) {
            history.tailMap(since, true).values().forEach(list::addAll);
        }
        return list;
    }

    @Override
    public Optional<ProbeResult> findLatest(long endpointId) {
        NavigableMap<Instant, List<ProbeResult>> history = results.get(endpointId);
        if (history == null) {
            return Optional.empty();
        }
        synchronized (history) {
            Map.Entry<Instant, List<ProbeResult>> last = history.lastEntry();
            if (last == null || last.getValue().isEmpty()) {
                return Optional.empty();
            }
            List<ProbeResult> sameInstant = last.getValue();
            return Optional.of(sameInstant.get(sameInstant.size() - 1));
        }
    }

    @Override
    public long purgeOlderThan(Instant cutoff) {
        long removed = 0;
        for (NavigableMap<Instant, List<ProbeResult>> history : results.values()) {
            synchronized (history) {
                NavigableMap<Instant, List<ProbeResult>> expired = history.headMap(cutoff, false);
                for (List<ProbeResult> list : expired.values()) {
                    removed += list.size();
                }
                expired.clear();
            }
        }
        log.info("清理过期探测结果 {} 条, cutoff={}", removed, cutoff);
        return removed;
    }
}
