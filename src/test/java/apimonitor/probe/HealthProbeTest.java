package apimonitor.probe;

import apimonitor.breaker.CircuitBreakerRegistry;
import apimonitor.breaker.CircuitBreakerSettings;
import apimonitor.breaker.CircuitState;
import apimonitor.endpoint.Endpoint;
import apimonitor.retry.RetryExecutor;
import apimonitor.retry.RetryPolicy;
import apimonitor.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.ConnectException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

import static org.assertj.core.api.Assertions.assertThat;

class HealthProbeTest {

    private static final Instant NOW = Instant.parse("2024-03-01T12:00:00Z");

    private MutableClock clock;
    private CircuitBreakerRegistry registry;
    private ScriptedTransport transport;
    private Endpoint endpoint;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(NOW);
        registry = new CircuitBreakerRegistry(clock);
        transport = new ScriptedTransport();
        endpoint = Endpoint.builder()
                .id(7)
                .name("orders-api")
                .url("https://orders.example.com/health")
                .timeout(Duration.ofSeconds(1))
                .build();
    }

    private HealthProbe probe(RetryPolicy policy, Duration buffer) {
        RetryExecutor retry = new RetryExecutor(delay -> CompletableFuture.completedFuture(null));
        CircuitBreakerSettings settings = CircuitBreakerSettings.builder()
                .failureThreshold(2)
                .recoveryTimeout(Duration.ofSeconds(30))
                .successThreshold(1)
                .build();
        return new HealthProbe(transport, registry, settings, retry, policy, buffer, clock);
    }

    private static RetryPolicy attempts(int count) {
        return RetryPolicy.builder().maxAttempts(count).jitter(false).build();
    }

    @Test
    void successfulCheckReportsStatusAndLatency() {
        transport.respond(200, Duration.ofMillis(42));

        ProbeResult result = probe(attempts(3), Duration.ofSeconds(2)).check(endpoint).join();

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getEndpointId()).isEqualTo(7);
        assertThat(result.getStatusCode()).isEqualTo(200);
        assertThat(result.getLatencyMs()).isEqualTo(42);
        assertThat(result.getErrorCategory()).isNull();
        assertThat(result.getCheckedAt()).isEqualTo(NOW);
    }

    @Test
    void statusMismatchIsRetriedThenReported() {
        transport.respond(500, Duration.ofMillis(5));
        transport.respond(500, Duration.ofMillis(5));

        ProbeResult result = probe(attempts(2), Duration.ofSeconds(2)).check(endpoint).join();

        assertThat(transport.calls.get()).isEqualTo(2);
        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getStatusCode()).isEqualTo(500);
        assertThat(result.getErrorCategory()).isEqualTo(ErrorCategory.STATUS_MISMATCH);
        assertThat(result.getErrorMessage()).isEqualTo("Failed after 2 attempts: Expected status 200, got 500");
    }

    @Test
    void singleAttemptFailureHasNoAttemptPrefix() {
        transport.respond(503, Duration.ofMillis(5));

        ProbeResult result = probe(attempts(1), Duration.ofSeconds(2)).check(endpoint).join();

        assertThat(result.getErrorMessage()).isEqualTo("Expected status 200, got 503");
    }

    @Test
    void recoversWhenRetrySucceeds() {
        transport.fail(new ProbeFailureException(ErrorCategory.CONNECTION_ERROR,
                "Connection error: refused", new ConnectException("refused")));
        transport.respond(200, Duration.ofMillis(10));

        ProbeResult result = probe(attempts(3), Duration.ofSeconds(2)).check(endpoint).join();

        assertThat(result.isSuccess()).isTrue();
        assertThat(transport.calls.get()).isEqualTo(2);
    }

    @Test
    void transportErrorKeepsItsCategory() {
        transport.fail(new ProbeFailureException(ErrorCategory.CONNECTION_ERROR,
                "Connection error: refused", new ConnectException("refused")));

        ProbeResult result = probe(attempts(1), Duration.ofSeconds(2)).check(endpoint).join();

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getErrorCategory()).isEqualTo(ErrorCategory.CONNECTION_ERROR);
        assertThat(result.getErrorMessage()).isEqualTo("Connection error: refused");
        assertThat(result.getStatusCode()).isNull();
    }

    @Test
    void openBreakerShortCircuitsWithoutCallingTransport() {
        HealthProbe probe = probe(attempts(1), Duration.ofSeconds(2));
        transport.respond(500, Duration.ofMillis(1));
        transport.respond(500, Duration.ofMillis(1));
        probe.check(endpoint).join();
        probe.check(endpoint).join();
        assertThat(registry.find(HealthProbe.breakerName(endpoint)).orElseThrow().getState())
                .isEqualTo(CircuitState.OPEN);

        ProbeResult result = probe.check(endpoint).join();

        assertThat(transport.calls.get()).isEqualTo(2);
        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getErrorCategory()).isEqualTo(ErrorCategory.CIRCUIT_OPEN);
        assertThat(result.getErrorMessage()).contains("is OPEN");
        assertThat(result.getLatency()).isEqualTo(Duration.ZERO);
    }

    @Test
    void deadlineProducesTimeoutResult() {
        transport.hang();

        ProbeResult result = probe(attempts(3), Duration.ofMillis(100)).check(endpoint)
                .orTimeout(10, TimeUnit.SECONDS)
                .join();

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getErrorCategory()).isEqualTo(ErrorCategory.TIMEOUT);
        assertThat(result.getErrorMessage()).isEqualTo("Health check timed out after 1s");
        assertThat(transport.calls.get()).isEqualTo(1);
    }

    @Test
    void deadlineCancelsPendingRequest() {
        transport.hang();

        ProbeResult result = probe(attempts(3), Duration.ofMillis(100)).check(endpoint)
                .orTimeout(10, TimeUnit.SECONDS)
                .join();

        assertThat(result.getErrorCategory()).isEqualTo(ErrorCategory.TIMEOUT);
        assertThat(transport.sent).hasSize(1);
        assertThat(transport.sent.get(0)).isCancelled();
        assertThat(transport.calls.get()).isEqualTo(1);
    }

    @Test
    void unexpectedErrorIsReportedAsUnexpected() {
        transport.fail(new IllegalStateException("broken"));

        ProbeResult result = probe(attempts(1), Duration.ofSeconds(2)).check(endpoint).join();

        assertThat(result.getErrorCategory()).isEqualTo(ErrorCategory.UNEXPECTED);
        assertThat(result.getErrorMessage()).startsWith("Unexpected error: ").contains("broken");
    }

    @Test
    void breakerIsNamedAfterEndpoint() {
        assertThat(HealthProbe.breakerName(endpoint)).isEqualTo("health_check_orders-api");
    }

    /**
     * 按顺序返回预设响应的传输层
     */
    private static class ScriptedTransport implements ProbeTransport {
        private final Deque<Supplier<CompletableFuture<ProbeResponse>>> script = new ArrayDeque<>();
        private final AtomicInteger calls = new AtomicInteger();
        private final List<CompletableFuture<ProbeResponse>> sent = new ArrayList<>();

        void respond(int status, Duration latency) {
            script.add(() -> CompletableFuture.completedFuture(new ProbeResponse(status, latency)));
        }

        void fail(Throwable error) {
            script.add(() -> CompletableFuture.failedFuture(error));
        }

        void hang() {
            script.add(CompletableFuture::new);
        }

        @Override
        public CompletableFuture<ProbeResponse> send(Endpoint endpoint) {
            calls.incrementAndGet();
            Supplier<CompletableFuture<ProbeResponse>> next = script.poll();
            if (next == null) {
                return CompletableFuture.failedFuture(new IllegalStateException("no scripted response"));
            }
            CompletableFuture<ProbeResponse> future = next.get();
            sent.add(future);
            return future;
        }
    }
}
