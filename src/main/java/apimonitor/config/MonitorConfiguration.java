package apimonitor.config;

import apimonitor.breaker.CircuitBreakerRegistry;
import apimonitor.breaker.CircuitBreakerSettings;
import apimonitor.cooldown.CooldownGate;
import apimonitor.cooldown.ElasticsearchCooldownGate;
import apimonitor.cooldown.LocalCooldownGate;
import apimonitor.endpoint.EndpointLoader;
import apimonitor.notify.DingTalkChannel;
import apimonitor.notify.NotificationChannel;
import apimonitor.notify.NotificationDispatcher;
import apimonitor.notify.NotificationTemplates;
import apimonitor.notify.WebhookChannel;
import apimonitor.probe.HealthProbe;
import apimonitor.probe.OkHttpProbeTransport;
import apimonitor.retry.RetryExecutor;
import apimonitor.retry.RetryPolicy;
import apimonitor.scheduler.MonitorScheduler;
import apimonitor.store.ElasticsearchProbeResultStore;
import apimonitor.store.InMemoryProbeResultStore;
import apimonitor.store.ProbeResultStore;
import apimonitor.uptime.UptimeAggregator;
import co.elastic.clients.elasticsearch.ElasticsearchClient;
import co.elastic.clients.json.jackson.JacksonJsonpMapper;
import co.elastic.clients.transport.ElasticsearchTransport;
import co.elastic.clients.transport.rest_client.RestClientTransport;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.apache.http.HttpHost;
import org.apache.http.auth.AuthScope;
import org.apache.http.auth.UsernamePasswordCredentials;
import org.apache.http.client.CredentialsProvider;
import org.apache.http.conn.ssl.NoopHostnameVerifier;
import org.apache.http.impl.client.BasicCredentialsProvider;
import org.apache.http.ssl.SSLContextBuilder;
import org.elasticsearch.client.RestClient;
import org.elasticsearch.client.RestClientBuilder;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import javax.net.ssl.SSLContext;
import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.*;

/**
 * 监控组件装配
 */
@Slf4j
@Configuration
public class MonitorConfiguration {

    @Bean
    public Clock monitorClock() {
        return Clock.systemUTC();
    }

    @Bean(destroyMethod = "shutdownNow")
    public ScheduledExecutorService monitorSchedulerExecutor(MonitorSettings settings) {
        return Executors.newScheduledThreadPool(
                settings.getSchedulerPoolSize(),
                new ThreadFactoryBuilder()
                        .setNameFormat("monitor-scheduler-%d")
                        .setDaemon(true)
                        .build()
        );
    }

    @Bean(destroyMethod = "shutdown")
    public ThreadPoolExecutor monitorWorkerExecutor(MonitorSettings settings) {
        return new ThreadPoolExecutor(
                settings.getWorkerPoolSize(),
                settings.getWorkerPoolSize() * 2,
                60L, TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(1000),
                new ThreadFactoryBuilder()
                        .setNameFormat("monitor-worker-%d")
                        .build(),
                new ThreadPoolExecutor.CallerRunsPolicy()
        );
    }

    @Bean
    public CircuitBreakerRegistry circuitBreakerRegistry(Clock monitorClock) {
        return new CircuitBreakerRegistry(monitorClock);
    }

    @Bean
    public RetryExecutor retryExecutor() {
        return new RetryExecutor();
    }

    @Bean(destroyMethod = "close")
    public OkHttpProbeTransport probeTransport(MonitorSettings settings, ObjectMapper objectMapper) {
        return new OkHttpProbeTransport(settings.getMaxConcurrentChecks(), objectMapper);
    }

    @Bean
    public HealthProbe healthProbe(MonitorSettings settings,
                                   OkHttpProbeTransport probeTransport,
                                   CircuitBreakerRegistry circuitBreakerRegistry,
                                   RetryExecutor retryExecutor,
                                   Clock monitorClock) {
        CircuitBreakerSettings breakerSettings = CircuitBreakerSettings.builder()
                .failureThreshold(settings.getBreakerFailureThreshold())
                .recoveryTimeout(Duration.ofSeconds(settings.getBreakerRecoveryTimeoutSeconds()))
                .successThreshold(settings.getBreakerSuccessThreshold())
                .build();
        RetryPolicy retryPolicy = settings.isRetryEnabled()
                ? RetryPolicy.builder()
                .maxAttempts(settings.getRetryMaxAttempts())
                .baseDelay(Duration.ofMillis(settings.getRetryBaseDelayMs()))
                .multiplier(settings.getRetryMultiplier())
                .maxDelay(Duration.ofMillis(settings.getRetryMaxDelayMs()))
                .jitter(settings.isRetryJitter())
                .build()
                : RetryPolicy.noRetry();
        return new HealthProbe(probeTransport, circuitBreakerRegistry, breakerSettings, retryExecutor, retryPolicy,
                Duration.ofSeconds(settings.getDeadlineBufferSeconds()), monitorClock);
    }

    /**
     * 创建ES REST客户端
     */
    @Bean(destroyMethod = "close")
    @ConditionalOnProperty(name = "monitor.elasticsearch.enabled", havingValue = "true")
    public RestClient monitorRestClient(MonitorSettings settings) {
        int timeoutMs = settings.getElasticsearchTimeoutSeconds() * 1000;
        RestClientBuilder builder = RestClient.builder(new HttpHost(
                settings.getElasticsearchHost(), settings.getElasticsearchPort(), settings.getElasticsearchScheme()));

        builder.setRequestConfigCallback(requestConfigBuilder -> requestConfigBuilder
                .setConnectTimeout(timeoutMs)
                .setSocketTimeout(timeoutMs)
                .setConnectionRequestTimeout(timeoutMs));

        builder.setHttpClientConfigCallback(httpClientBuilder -> {
            if (settings.isElasticsearchSsl()) {
                try {
                    SSLContext sslContext = SSLContextBuilder.create()
                            .loadTrustMaterial((chain, authType) -> true)
                            .build();
                    httpClientBuilder.setSSLContext(sslContext);
                    httpClientBuilder.setSSLHostnameVerifier(NoopHostnameVerifier.INSTANCE);
                } catch (Exception e) {
                    throw new IllegalStateException("Failed to create SSLContext", e);
                }
            }
            if (StringUtils.isNotBlank(settings.getElasticsearchUsername())) {
                CredentialsProvider credentialsProvider = new BasicCredentialsProvider();
                credentialsProvider.setCredentials(AuthScope.ANY, new UsernamePasswordCredentials(
                        settings.getElasticsearchUsername(), settings.getElasticsearchPassword()));
                httpClientBuilder.setDefaultCredentialsProvider(credentialsProvider);
            }
            return httpClientBuilder;
        });
        return builder.build();
    }

    @Bean
    @ConditionalOnProperty(name = "monitor.elasticsearch.enabled", havingValue = "true")
    public ElasticsearchClient monitorElasticsearchClient(RestClient monitorRestClient) {
        ObjectMapper mapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .setSerializationInclusion(JsonInclude.Include.NON_NULL);
        ElasticsearchTransport transport = new RestClientTransport(monitorRestClient, new JacksonJsonpMapper(mapper));
        return new ElasticsearchClient(transport);
    }

    @Bean(destroyMethod = "close")
    public ProbeResultStore probeResultStore(MonitorSettings settings,
                                             ObjectProvider<ElasticsearchClient> esClient) {
        ElasticsearchClient client = esClient.getIfAvailable();
        if (client != null) {
            log.info("使用ES存储探测结果: {}", settings.getResultsIndex());
            return new ElasticsearchProbeResultStore(client, settings.getResultsIndex());
        }
        log.info("使用内存存储探测结果");
        return new InMemoryProbeResultStore();
    }

    @Bean
    public CooldownGate cooldownGate(MonitorSettings settings,
                                     ObjectProvider<ElasticsearchClient> esClient,
                                     Clock monitorClock) {
        Duration cooldown = Duration.ofSeconds(settings.getCooldownSeconds());
        ElasticsearchClient client = esClient.getIfAvailable();
        if (client != null) {
            return new ElasticsearchCooldownGate(client, settings.getCooldownIndex(), cooldown, monitorClock);
        }
        return new LocalCooldownGate(cooldown, monitorClock);
    }

    @Bean(destroyMethod = "close")
    public NotificationDispatcher notificationDispatcher(MonitorSettings settings,
                                                         CircuitBreakerRegistry circuitBreakerRegistry,
                                                         ObjectMapper objectMapper,
                                                         Clock monitorClock) {
        List<NotificationChannel> channels = new ArrayList<>();
        if (StringUtils.isNotBlank(settings.getWebhookUrl())) {
            channels.add(new WebhookChannel(settings.getWebhookUrl(), settings.getWebhookMethod(),
                    settings.getWebhookHeaders(), Arrays.asList(settings.getWebhookUsers()), objectMapper));
        }
        if (StringUtils.isNotBlank(settings.getDingtalkWebhookUrl())) {
            channels.add(new DingTalkChannel(settings.getDingtalkWebhookUrl(), Arrays.asList(settings.getDingtalkUsers())));
        }

        NotificationTemplates defaults = NotificationTemplates.defaults();
        NotificationTemplates templates = NotificationTemplates.builder()
                .failureSubject(StringUtils.defaultIfBlank(settings.getFailureSubject(), defaults.getFailureSubject()))
                .failureBody(StringUtils.defaultIfBlank(settings.getFailureBody(), defaults.getFailureBody()))
                .recoverySubject(StringUtils.defaultIfBlank(settings.getRecoverySubject(), defaults.getRecoverySubject()))
                .recoveryBody(StringUtils.defaultIfBlank(settings.getRecoveryBody(), defaults.getRecoveryBody()))
                .build();

        CircuitBreakerSettings breakerSettings = CircuitBreakerSettings.builder()
                .failureThreshold(settings.getNotificationBreakerFailureThreshold())
                .recoveryTimeout(Duration.ofSeconds(settings.getNotificationBreakerRecoveryTimeoutSeconds()))
                .successThreshold(settings.getNotificationBreakerSuccessThreshold())
                .build();

        ExecutorService executor = new ThreadPoolExecutor(
                2, 5, 60L, TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(1000),
                new ThreadFactoryBuilder().setNameFormat("notification-%d").build(),
                new ThreadPoolExecutor.CallerRunsPolicy()
        );
        return new NotificationDispatcher(channels, circuitBreakerRegistry, breakerSettings, templates,
                executor, monitorClock);
    }

    @Bean(destroyMethod = "close")
    public EndpointLoader endpointLoader(MonitorSettings settings,
                                         ScheduledExecutorService monitorSchedulerExecutor) throws IOException {
        Path path = Paths.get(settings.getEndpointsPath());
        EndpointLoader loader = new EndpointLoader(path, monitorSchedulerExecutor);
        loader.loadAll();
        loader.startWatching();
        return loader;
    }

    @Bean(initMethod = "start", destroyMethod = "close")
    public MonitorScheduler monitorScheduler(MonitorSettings settings,
                                             EndpointLoader endpointLoader,
                                             HealthProbe healthProbe,
                                             ProbeResultStore probeResultStore,
                                             CooldownGate cooldownGate,
                                             NotificationDispatcher notificationDispatcher,
                                             ScheduledExecutorService monitorSchedulerExecutor,
                                             ThreadPoolExecutor monitorWorkerExecutor,
                                             Clock monitorClock) {
        MonitorScheduler scheduler = new MonitorScheduler(endpointLoader, healthProbe, probeResultStore, cooldownGate,
                notificationDispatcher, settings.isNotificationsEnabled(), settings.isSendRecovery(),
                monitorSchedulerExecutor, monitorWorkerExecutor, monitorClock);
        endpointLoader.addChangeListener(scheduler);
        return scheduler;
    }

    @Bean
    public UptimeAggregator uptimeAggregator(EndpointLoader endpointLoader,
                                             ProbeResultStore probeResultStore,
                                             Clock monitorClock) {
        return new UptimeAggregator(endpointLoader, probeResultStore, monitorClock);
    }
}
