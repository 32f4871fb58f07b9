package apimonitor.config;

import lombok.Getter;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * monitor.* 配置项
 */
@Getter
@Component
public class MonitorSettings {

    @Value("${monitor.endpoints.path:config/endpoints}")
    private String endpointsPath;

    @Value("${monitor.scheduler.pool-size:4}")
    private int schedulerPoolSize;

    @Value("${monitor.scheduler.worker-pool-size:10}")
    private int workerPoolSize;

    // 探测
    @Value("${monitor.probe.max-concurrent-checks:20}")
    private int maxConcurrentChecks;

    @Value("${monitor.probe.deadline-buffer-seconds:2}")
    private int deadlineBufferSeconds;

    // 重试
    @Value("${monitor.retry.enabled:true}")
    private boolean retryEnabled;

    @Value("${monitor.retry.max-attempts:3}")
    private int retryMaxAttempts;

    @Value("${monitor.retry.base-delay-ms:1000}")
    private long retryBaseDelayMs;

    @Value("${monitor.retry.multiplier:2.0}")
    private double retryMultiplier;

    @Value("${monitor.retry.max-delay-ms:60000}")
    private long retryMaxDelayMs;

    @Value("${monitor.retry.jitter:true}")
    private boolean retryJitter;

    // 熔断
    @Value("${monitor.breaker.failure-threshold:3}")
    private int breakerFailureThreshold;

    @Value("${monitor.breaker.recovery-timeout-seconds:30}")
    private long breakerRecoveryTimeoutSeconds;

    @Value("${monitor.breaker.success-threshold:2}")
    private int breakerSuccessThreshold;

    @Value("${monitor.breaker.notification.failure-threshold:5}")
    private int notificationBreakerFailureThreshold;

    @Value("${monitor.breaker.notification.recovery-timeout-seconds:60}")
    private long notificationBreakerRecoveryTimeoutSeconds;

    @Value("${monitor.breaker.notification.success-threshold:3}")
    private int notificationBreakerSuccessThreshold;

    // 通知
    @Value("${monitor.notifications.enabled:true}")
    private boolean notificationsEnabled;

    @Value("${monitor.notifications.send-recovery:true}")
    private boolean sendRecovery;

    @Value("${monitor.notifications.cooldown-seconds:300}")
    private long cooldownSeconds;

    @Value("${monitor.notifications.webhook.url:}")
    private String webhookUrl;

    @Value("${monitor.notifications.webhook.method:POST}")
    private String webhookMethod;

    @Value("#{${monitor.notifications.webhook.headers:{:}}}")
    private Map<String, String> webhookHeaders;

    @Value("${monitor.notifications.webhook.users:}")
    private String[] webhookUsers;

    @Value("${monitor.notifications.dingtalk.webhook-url:}")
    private String dingtalkWebhookUrl;

    @Value("${monitor.notifications.dingtalk.users:}")
    private String[] dingtalkUsers;

    @Value("${monitor.notifications.failure-subject:}")
    private String failureSubject;

    @Value("${monitor.notifications.failure-body:}")
    private String failureBody;

    @Value("${monitor.notifications.recovery-subject:}")
    private String recoverySubject;

    @Value("${monitor.notifications.recovery-body:}")
    private String recoveryBody;

    // 历史数据
    @Value("${monitor.history.retention-days:90}")
    private int retentionDays;

    @Value("${monitor.history.cleanup-interval-seconds:86400}")
    private long cleanupIntervalSeconds;

    // Elasticsearch
    @Value("${monitor.elasticsearch.enabled:false}")
    private boolean elasticsearchEnabled;

    @Value("${monitor.elasticsearch.host:localhost}")
    private String elasticsearchHost;

    @Value("${monitor.elasticsearch.port:9200}")
    private int elasticsearchPort;

    @Value("${monitor.elasticsearch.scheme:http}")
    private String elasticsearchScheme;

    @Value("${monitor.elasticsearch.ssl:false}")
    private boolean elasticsearchSsl;

    @Value("${monitor.elasticsearch.username:}")
    private String elasticsearchUsername;

    @Value("${monitor.elasticsearch.password:}")
    private String elasticsearchPassword;

    @Value("${monitor.elasticsearch.timeout:30}")
    private int elasticsearchTimeoutSeconds;

    @Value("${monitor.elasticsearch.results-index:api-monitor-results}")
    private String resultsIndex;

    @Value("${monitor.elasticsearch.cooldown-index:api-monitor-cooldown}")
    private String cooldownIndex;
}
