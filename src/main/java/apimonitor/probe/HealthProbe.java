package apimonitor.probe;

import apimonitor.breaker.CircuitBreaker;
import apimonitor.breaker.CircuitBreakerRegistry;
import apimonitor.breaker.CircuitBreakerSettings;
import apimonitor.breaker.CircuitOpenException;
import apimonitor.endpoint.Endpoint;
import apimonitor.retry.RetryExecutor;
import apimonitor.retry.RetryExhaustedException;
import apimonitor.retry.RetryPolicy;
import apimonitor.utils.FutureUtils;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 健康探测：breaker(retry(http)) 并受 timeout + buffer 的总时限约束。
 * 返回的 future 总是正常完成，失败被转换为 success=false 的结果。
 */
@Slf4j
public class HealthProbe {

    public static final String BREAKER_PREFIX = "health_check_";

    private final ProbeTransport transport;
    private final CircuitBreakerRegistry breakers;
    private final CircuitBreakerSettings breakerSettings;
    private final RetryExecutor retryExecutor;
    private final RetryPolicy retryPolicy;
    private final Duration deadlineBuffer;
    private final Clock clock;

    public HealthProbe(ProbeTransport transport,
                       CircuitBreakerRegistry breakers,
                       CircuitBreakerSettings breakerSettings,
                       RetryExecutor retryExecutor,
                       RetryPolicy retryPolicy,
                       Duration deadlineBuffer,
                       Clock clock) {
        this.transport = transport;
        this.breakers = breakers;
        this.breakerSettings = breakerSettings;
        this.retryExecutor = retryExecutor;
        this.retryPolicy = retryPolicy;
        this.deadlineBuffer = deadlineBuffer;
        this.clock = clock;
    }

    public static String breakerName(Endpoint endpoint) {
        return BREAKER_PREFIX + endpoint.getName();
    }

    public CompletableFuture<ProbeResult> check(Endpoint endpoint) {
        Instant checkedAt = clock.instant();
        long started = System.nanoTime();
        Duration deadline = endpoint.getTimeout().plus(deadlineBuffer);
        CircuitBreaker breaker = breakers.getOrCreate(breakerName(endpoint), breakerSettings);

        AtomicReference<CompletableFuture<ProbeResponse>> inFlight = new AtomicReference<>();
        return breaker.call(() -> retryExecutor.run(() -> attempt(endpoint, inFlight), retryPolicy)
                        .orTimeout(deadline.toMillis(), TimeUnit.MILLISECONDS)
                        .whenComplete((response, error) -> {
                            // 超时后取消仍在进行的请求，释放连接
                            if (error != null && FutureUtils.unwrap(error) instanceof TimeoutException) {
                                CompletableFuture<ProbeResponse> pending = inFlight.get();
                                if (pending != null) {
                                    pending.cancel(true);
                                }
                            }
                        }))
                .handle((response, error) -> {
                    if (error == null) {
                        return ProbeResult.builder()
                                .endpointId(endpoint.getId())
                                .success(true)
                                .statusCode(response.getStatusCode())
                                .latency(response.getLatency())
                                .checkedAt(checkedAt)
                                .build();
                    }
                    ProbeResult failed = toFailure(endpoint, FutureUtils.unwrap(error), deadline, checkedAt,
                            Duration.ofNanos(System.nanoTime() - started));
                    log.warn("Health check failed for {} ({}): [{}] {}", endpoint.getName(), endpoint.getUrl(),
                            failed.getErrorCategory(), failed.getErrorMessage());
                    return failed;
                });
    }

    /**
     * 单次请求，状态码不符也视为失败，以便参与重试和熔断计数
     */
    private CompletableFuture<ProbeResponse> attempt(Endpoint endpoint,
                                                     AtomicReference<CompletableFuture<ProbeResponse>> inFlight) {
        CompletableFuture<ProbeResponse> sent = transport.send(endpoint);
        inFlight.set(sent);
        return sent.thenApply(response -> {
            if (response.getStatusCode() != endpoint.getExpectedStatus()) {
                throw new ProbeFailureException(ErrorCategory.STATUS_MISMATCH,
                        String.format("Expected status %d, got %d", endpoint.getExpectedStatus(), response.getStatusCode()),
                        response.getStatusCode(), response.getLatency());
            }
            return response;
        });
    }

    private ProbeResult toFailure(Endpoint endpoint, Throwable error, Duration deadline,
                                  Instant checkedAt, Duration elapsed) {
        ProbeResult.ProbeResultBuilder builder = ProbeResult.builder()
                .endpointId(endpoint.getId())
                .success(false)
                .latency(elapsed)
                .checkedAt(checkedAt);

        Throwable cause = error;
        String prefix = "";
        if (error instanceof RetryExhaustedException) {
            RetryExhaustedException exhausted = (RetryExhaustedException) error;
            cause = exhausted.getCause() == null ? error : exhausted.getCause();
            if (exhausted.getAttempts() > 1) {
                prefix = "Failed after " + exhausted.getAttempts() + " attempts: ";
            }
        }

        if (cause instanceof ProbeFailureException) {
            ProbeFailureException failure = (ProbeFailureException) cause;
            builder.errorCategory(failure.getCategory())
                    .errorMessage(prefix + failure.getMessage())
                    .statusCode(failure.getStatusCode());
            if (failure.getLatency() != null) {
                builder.latency(failure.getLatency());
            }
        } else if (cause instanceof TimeoutException) {
            builder.errorCategory(ErrorCategory.TIMEOUT)
                    .errorMessage(prefix + "Health check timed out after " + deadline.toSeconds() + "s");
        } else if (cause instanceof CircuitOpenException) {
            builder.errorCategory(ErrorCategory.CIRCUIT_OPEN)
                    .errorMessage(cause.getMessage())
                    .latency(Duration.ZERO);
        } else {
            builder.errorCategory(ErrorCategory.UNEXPECTED)
                    .errorMessage(prefix + "Unexpected error: " + cause);
        }
        return builder.build();
    }
}
