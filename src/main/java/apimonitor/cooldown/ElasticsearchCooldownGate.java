package apimonitor.cooldown;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import co.elastic.clients.elasticsearch._types.ElasticsearchException;
import co.elastic.clients.elasticsearch.core.GetResponse;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * ES冷却闸门，多进程共享冷却记录。
 * 后端异常时放行通知并停用自身，之后使用本地闸门直到 revalidate 成功。
 */
@Slf4j
public class ElasticsearchCooldownGate implements CooldownGate {
    private static final int CONFLICT = 409;

    private final ElasticsearchClient esClient;
    private final String cooldownIndex;
    private final Duration cooldown;
    private final Clock clock;
    private final LocalCooldownGate fallback;
    private final AtomicBoolean disabled = new AtomicBoolean(false);

    public ElasticsearchCooldownGate(ElasticsearchClient esClient, String cooldownIndex, Duration cooldown, Clock clock) {
        this.esClient = esClient;
        this.cooldownIndex = cooldownIndex;
        this.cooldown = cooldown;
        this.clock = clock;
        this.fallback = new LocalCooldownGate(cooldown, clock);
        ensureIndexExists();
    }

    @Override
    public boolean tryAcquire(long endpointId) {
        if (disabled.get()) {
            return fallback.tryAcquire(endpointId);
        }
        try {
            return acquireRemote(endpointId, true);
        } catch (Exception e) {
            log.warn("冷却后端不可用, 放行通知并切换到本地闸门: endpoint={}, error={}", endpointId, e.toString());
            disabled.set(true);
            fallback.tryAcquire(endpointId);
            return true;
        }
    }

    private boolean acquireRemote(long endpointId, boolean retryCreate) throws IOException {
        String id = documentId(endpointId);
        Instant now = clock.instant();
        CooldownDocument document = new CooldownDocument(endpointId, now.toString(), now.plus(cooldown).toString());

        try {
            esClient.create(c -> c
                    .index(cooldownIndex)
                    .id(id)
                    .document(document)
            );
            return true;
        } catch (ElasticsearchException e) {
            if (e.status() != CONFLICT) {
                throw e;
            }
        }

        GetResponse<CooldownDocument> existing = esClient.get(g -> g
                        .index(cooldownIndex)
                        .id(id),
                CooldownDocument.class);
        if (!existing.found() || existing.source() == null) {
            // 冲突后记录又被删除
            return retryCreate && acquireRemote(endpointId, false);
        }
        if (parseExpiresAt(existing.source().getExpiresAt()).isAfter(now)) {
            log.debug("端点 {} 处于冷却期, 到期时间: {}", endpointId, existing.source().getExpiresAt());
            return false;
        }

        // 过期记录按 seq_no/primary_term 替换，并发替换只有一个成功
        try {
            esClient.index(i -> i
                    .index(cooldownIndex)
                    .id(id)
                    .document(document)
                    .ifSeqNo(existing.seqNo())
                    .ifPrimaryTerm(existing.primaryTerm())
            );
            return true;
        } catch (ElasticsearchException e) {
            if (e.status() == CONFLICT) {
                return false;
            }
            throw e;
        }
    }

    @Override
    public void reset(long endpointId) {
        fallback.reset(endpointId);
        if (disabled.get()) {
            return;
        }
        try {
            esClient.delete(d -> d
                    .index(cooldownIndex)
                    .id(documentId(endpointId))
            );
        } catch (Exception e) {
            log.warn("删除冷却记录失败: endpoint={}, error={}", endpointId, e.toString());
        }
    }

    @Override
    public boolean revalidate() {
        try {
            if (esClient.ping().value()) {
                if (disabled.compareAndSet(true, false)) {
                    log.info("冷却后端恢复可用, 切回ES闸门");
                }
                return true;
            }
        } catch (Exception e) {
            log.warn("冷却后端仍不可用: {}", e.toString());
        }
        disabled.set(true);
        return false;
    }

    public boolean isDisabled() {
        return disabled.get();
    }

    /**
     * expiresAt 可能是 ISO 时间或 epoch 毫秒，无法解析时视为已过期
     */
    static Instant parseExpiresAt(String expiresAt) {
        if (StringUtils.isBlank(expiresAt)) {
            return Instant.EPOCH;
        }
        try {
            if (StringUtils.isNumeric(expiresAt)) {
                return Instant.ofEpochMilli(Long.parseLong(expiresAt));
            }
            return Instant.parse(expiresAt);
        } catch (DateTimeParseException | NumberFormatException e) {
            log.warn("无法解析冷却到期时间, 按已过期处理: {}", expiresAt);
            return Instant.EPOCH;
        }
    }

    static String documentId(long endpointId) {
        return "endpoint_" + endpointId;
    }

    private void ensureIndexExists() {
        try {
            boolean exists = esClient.indices().exists(req -> req.index(cooldownIndex)).value();
            if (!exists) {
                esClient.indices().create(req -> req
                        .index(cooldownIndex)
                        .mappings(m -> m
                                .properties("endpointId", p -> p.long_(l -> l))
                                .properties("notifiedAt", p -> p
                                        .date(d -> d.format("strict_date_optional_time||epoch_millis")))
                                .properties("expiresAt", p -> p
                                        .date(d -> d.format("strict_date_optional_time||epoch_millis")))
                        )
                );
            }
        } catch (Exception e) {
            log.warn("创建冷却索引失败, 使用本地闸门: {}", e.toString());
            disabled.set(true);
        }
    }
}
