package apimonitor.store;

import apimonitor.probe.ProbeResult;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * 探测结果存储
 */
public interface ProbeResultStore {

    /**
     * 追加一条结果，重复保存同一条结果不会产生重复记录
     */
    void save(long endpointId, ProbeResult result);

    /**
     * 指定时间之后的结果，按时间升序
     */
    List<ProbeResult> findSince(long endpointId, Instant since);

    Optional<ProbeResult> findLatest(long endpointId);

    /**
     * 删除早于 cutoff 的结果，返回删除条数
     */
    long purgeOlderThan(Instant cutoff);

    default void close() {
    }
}
