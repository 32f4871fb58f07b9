package apimonitor.notify;

import apimonitor.breaker.CircuitBreaker;
import apimonitor.breaker.CircuitBreakerRegistry;
import apimonitor.breaker.CircuitBreakerSettings;
import apimonitor.breaker.CircuitOpenException;
import apimonitor.endpoint.Endpoint;
import apimonitor.probe.ProbeResult;
import com.google.common.collect.EvictingQueue;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * 通知分发器 - 异步发送到所有渠道，每个渠道由独立熔断器保护
 */
@Slf4j
public class NotificationDispatcher implements NotificationService, AutoCloseable {
    public static final String BREAKER_PREFIX = "notification_";
    private static final int HISTORY_SIZE = 500;

    private final List<NotificationChannel> channels;
    private final CircuitBreakerRegistry breakers;
    private final CircuitBreakerSettings breakerSettings;
    private final NotificationTemplates templates;
    private final Executor executor;
    private final Clock clock;
    private final EvictingQueue<NotificationRecord> history = EvictingQueue.create(HISTORY_SIZE);

    public NotificationDispatcher(List<NotificationChannel> channels,
                                  CircuitBreakerRegistry breakers,
                                  CircuitBreakerSettings breakerSettings,
                                  NotificationTemplates templates,
                                  Executor executor,
                                  Clock clock) {
        this.channels = List.copyOf(channels);
        this.breakers = breakers;
        this.breakerSettings = breakerSettings;
        this.templates = templates;
        this.executor = executor;
        this.clock = clock;
        if (this.channels.isEmpty()) {
            log.warn("未配置任何通知渠道, 通知只记录日志");
        }
    }

    @Override
    public void notifyFailure(Endpoint endpoint, ProbeResult result) {
        submit(templates.render(NotificationKind.FAILURE, endpoint, result));
    }

    @Override
    public void notifyRecovery(Endpoint endpoint, ProbeResult result) {
        submit(templates.render(NotificationKind.RECOVERY, endpoint, result));
    }

    private void submit(NotificationMessage message) {
        log.info("发送{}通知: {}", message.getKind(), message.getSubject());
        try {
            executor.execute(() -> dispatch(message));
        } catch (RejectedExecutionException e) {
            log.error("通知线程池已关闭, 丢弃通知: {}", message.getSubject());
            record(message, "all", NotificationRecord.Status.FAILED, "dispatcher rejected: " + e.getMessage());
        }
    }

    void dispatch(NotificationMessage message) {
        for (NotificationChannel channel : channels) {
            CircuitBreaker breaker = breakers.getOrCreate(BREAKER_PREFIX + channel.getType(), breakerSettings);
            try {
                breaker.execute(() -> {
                    channel.send(message);
                    return null;
                });
                record(message, channel.getType(), NotificationRecord.Status.SENT, null);
            } catch (CircuitOpenException e) {
                log.warn("通知渠道 {} 熔断中, 跳过: {}", channel.getType(), message.getSubject());
                record(message, channel.getType(), NotificationRecord.Status.FAILED, e.getMessage());
            } catch (Exception e) {
                log.error("通知渠道 {} 发送失败: {}", channel.getType(), message.getSubject(), e);
                record(message, channel.getType(), NotificationRecord.Status.FAILED, e.getMessage());
            }
        }
    }

    private void record(NotificationMessage message, String channel, NotificationRecord.Status status, String error) {
        NotificationRecord record = NotificationRecord.builder()
                .endpointId(message.getEndpointId())
                .endpointName(message.getEndpointName())
                .kind(message.getKind())
                .channel(channel)
                .status(status)
                .subject(message.getSubject())
                .errorMessage(error)
                .createdAt(clock.instant())
                .build();
        synchronized (history) {
            history.add(record);
        }
    }

    /**
     * 最近的发送记录，最新的在前
     */
    public List<NotificationRecord> recentNotifications() {
        List<NotificationRecord> records;
        synchronized (history) {
            records = new ArrayList<>(history);
        }
        Collections.reverse(records);
        return records;
    }

    @Override
    public void close() {
        if (executor instanceof ExecutorService) {
            ExecutorService service = (ExecutorService) executor;
            service.shutdown();
            try {
                if (!service.awaitTermination(10, TimeUnit.SECONDS)) {
                    service.shutdownNow();
                }
            } catch (InterruptedException e) {
                service.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
    }
}
