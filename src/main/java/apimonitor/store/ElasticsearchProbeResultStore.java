package apimonitor.store;

import apimonitor.exception.MonitorException;
import apimonitor.probe.ProbeResult;
import co.elastic.clients.elasticsearch.ElasticsearchClient;
import co.elastic.clients.elasticsearch._types.SortOrder;
import co.elastic.clients.elasticsearch.core.BulkRequest;
import co.elastic.clients.elasticsearch.core.BulkResponse;
import co.elastic.clients.elasticsearch.core.DeleteByQueryResponse;
import co.elastic.clients.elasticsearch.core.SearchResponse;
import co.elastic.clients.elasticsearch.core.search.Hit;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.*;

/**
 * ES结果存储 - 写入先进入队列，定时或攒够一批后批量写入
 */
public class ElasticsearchProbeResultStore implements ProbeResultStore {
    private static final Logger logger = LoggerFactory.getLogger(ElasticsearchProbeResultStore.class);

    static final int BULK_SIZE = 100;
    private static final Duration FLUSH_INTERVAL = Duration.ofSeconds(5);
    private static final int MAX_RESULTS = 10000;

    private final ElasticsearchClient esClient;
    private final String resultIndex;
    private final BlockingQueue<ProbeResultDocument> pendingResults = new LinkedBlockingQueue<>(5000);
    private final ScheduledExecutorService flushExecutor;

    public ElasticsearchProbeResultStore(ElasticsearchClient esClient, String resultIndex) {
        this.esClient = esClient;
        this.resultIndex = resultIndex;
        this.flushExecutor = Executors.newSingleThreadScheduledExecutor(
                new ThreadFactoryBuilder().setNameFormat("result-flusher-%d").setDaemon(true).build());
        ensureIndexExists();
        flushExecutor.scheduleAtFixedRate(this::flush,
                FLUSH_INTERVAL.toMillis(), FLUSH_INTERVAL.toMillis(), TimeUnit.MILLISECONDS);
    }

    @Override
    public void save(long endpointId, ProbeResult result) {
        ProbeResultDocument document = ProbeResultDocument.from(endpointId, result);
        if (!pendingResults.offer(document)) {
            logger.warn("结果队列已满，直接写入: {}", document.getId());
            writeDocument(document);
            return;
        }
        if (pendingResults.size() >= BULK_SIZE) {
            flushExecutor.execute(this::flush);
        }
    }

    /**
     * 批量写入队列中的结果
     */
    synchronized void flush() {
        while (!pendingResults.isEmpty()) {
            List<ProbeResultDocument> documents = new ArrayList<>();
            pendingResults.drainTo(documents, BULK_SIZE);
            if (documents.isEmpty()) {
                return;
            }
            try {
                BulkRequest.Builder bulkBuilder = new BulkRequest.Builder();
                for (ProbeResultDocument document : documents) {
                    bulkBuilder.operations(op -> op
                            .index(idx -> idx
                                    .index(resultIndex)
                                    .id(document.getId())
                                    .document(document)
                            )
                    );
                }
                BulkResponse response = esClient.bulk(bulkBuilder.build());
                if (response.errors()) {
                    logger.error("批量写入探测结果部分失败, 逐条重试 {} 条", documents.size());
                    documents.forEach(this::writeDocument);
                }
            } catch (Exception e) {
                logger.error("批量写入探测结果异常, 逐条重试", e);
                documents.forEach(this::writeDocument);
            }
        }
    }

    private void writeDocument(ProbeResultDocument document) {
        try {
            esClient.index(i -> i
                    .index(resultIndex)
                    .id(document.getId())
                    .document(document)
            );
        } catch (Exception e) {
            logger.error("写入探测结果失败: {}", document.getId(), e);
        }
    }

    @Override
    public List<ProbeResult> findSince(long endpointId, Instant since) {
        try {
            SearchResponse<ProbeResultDocument> response = esClient.search(s -> s
                            .index(resultIndex)
                            .query(q -> q.bool(b -> b
                                    .filter(f -> f.term(t -> t.field("endpointId").value(endpointId)))
                                    .filter(f -> f.range(r -> r.date(d -> d
                                            .field("checkedAt")
                                            .gte(since.toString()))))
                            ))
                            .sort(so -> so.field(f -> f.field("checkedAt").order(SortOrder.Asc)))
                            .size(MAX_RESULTS),
                    ProbeResultDocument.class);
            return toResults(response);
        } catch (IOException e) {
            throw new MonitorException("查询探测结果失败: endpoint=" + endpointId, e);
        }
    }

    @Override
    public Optional<ProbeResult> findLatest(long endpointId) {
        try {
            SearchResponse<ProbeResultDocument> response = esClient.search(s -> s
                            .index(resultIndex)
                            .query(q -> q.term(t -> t.field("endpointId").value(endpointId)))
                            .sort(so -> so.field(f -> f.field("checkedAt").order(SortOrder.Desc)))
                            .size(1),
                    ProbeResultDocument.class);
            return toResults(response).stream().findFirst();
        } catch (IOException e) {
            throw new MonitorException("查询最新探测结果失败: endpoint=" + endpointId, e);
        }
    }

    private List<ProbeResult> toResults(SearchResponse<ProbeResultDocument> response) {
        List<ProbeResult> results = new ArrayList<>();
        for (Hit<ProbeResultDocument> hit : response.hits().hits()) {
            if (hit.source() != null) {
                results.add(hit.source().toResult());
            }
        }
        return results;
    }

    @Override
    public long purgeOlderThan(Instant cutoff) {
        try {
            DeleteByQueryResponse response = esClient.deleteByQuery(d -> d
                    .index(resultIndex)
                    .query(q -> q.range(r -> r.date(dr -> dr
                            .field("checkedAt")
                            .lt(cutoff.toString()))))
            );
            long deleted = response.deleted() == null ? 0 : response.deleted();
            logger.info("清理过期探测结果 {} 条, cutoff={}", deleted, cutoff);
            return deleted;
        } catch (IOException e) {
            throw new MonitorException("清理探测结果失败", e);
        }
    }

    private void ensureIndexExists() {
        try {
            boolean exists = esClient.indices().exists(req -> req.index(resultIndex)).value();
            if (!exists) {
                esClient.indices().create(req -> req
                        .index(resultIndex)
                        .mappings(m -> m
                                .properties("id", p -> p.keyword(k -> k))
                                .properties("endpointId", p -> p.long_(l -> l))
                                .properties("success", p -> p.boolean_(b -> b))
                                .properties("statusCode", p -> p.integer(i -> i))
                                .properties("responseTimeMs", p -> p.long_(l -> l))
                                .properties("errorCategory", p -> p.keyword(k -> k))
                                .properties("errorMessage", p -> p.text(t -> t))
                                .properties("checkedAt", p -> p
                                        .date(d -> d.format("strict_date_optional_time||epoch_millis")))
                        )
                );
                logger.info("创建探测结果索引: {}", resultIndex);
            }
        } catch (Exception e) {
            logger.error("创建探测结果索引失败: {}", resultIndex, e);
        }
    }

    @Override
    public void close() {
        flushExecutor.shutdown();
        try {
            if (!flushExecutor.awaitTermination(10, TimeUnit.SECONDS)) {
                flushExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            flushExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        flush();
    }
}
