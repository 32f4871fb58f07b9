package apimonitor.retry;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RetryExecutorTest {

    private final List<Duration> delays = new ArrayList<>();
    private final DelayScheduler recordingScheduler = delay -> {
        delays.add(delay);
        return CompletableFuture.completedFuture(null);
    };

    private final RetryPolicy noJitter = RetryPolicy.builder()
            .maxAttempts(3)
            .baseDelay(Duration.ofSeconds(1))
            .multiplier(2.0)
            .jitter(false)
            .build();

    @Test
    void returnsFirstSuccessWithoutDelay() throws Exception {
        RetryExecutor executor = new RetryExecutor(recordingScheduler);

        String value = executor.run(() -> CompletableFuture.completedFuture("ok"), noJitter).get();

        assertThat(value).isEqualTo("ok");
        assertThat(delays).isEmpty();
    }

    @Test
    void retriesWithExponentialBackoffUntilSuccess() throws Exception {
        RetryExecutor executor = new RetryExecutor(recordingScheduler);
        AtomicInteger calls = new AtomicInteger();

        String value = executor.run(() -> calls.incrementAndGet() < 3
                ? CompletableFuture.failedFuture(new IOException("flaky"))
                : CompletableFuture.completedFuture("third time"), noJitter).get();

        assertThat(value).isEqualTo("third time");
        assertThat(calls.get()).isEqualTo(3);
        assertThat(delays).containsExactly(Duration.ofSeconds(1), Duration.ofSeconds(2));
    }

    @Test
    void stopsRetryingOnceCallerGaveUp() {
        RetryExecutor executor = new RetryExecutor(recordingScheduler);
        CompletableFuture<String> pending = new CompletableFuture<>();
        AtomicInteger calls = new AtomicInteger();

        CompletableFuture<String> result = executor.run(() -> {
            calls.incrementAndGet();
            return pending;
        }, noJitter);
        result.completeExceptionally(new TimeoutException());
        pending.completeExceptionally(new IOException("late failure"));

        assertThat(calls.get()).isEqualTo(1);
        assertThat(delays).isEmpty();
    }

    @Test
    void exhaustedAttemptsCarryLastError() {
        RetryExecutor executor = new RetryExecutor(recordingScheduler);
        AtomicInteger calls = new AtomicInteger();

        CompletableFuture<String> result = executor.run(() ->
                CompletableFuture.failedFuture(new IOException("attempt " + calls.incrementAndGet())), noJitter);

        assertThatThrownBy(result::get)
                .isInstanceOf(ExecutionException.class)
                .cause()
                .isInstanceOf(RetryExhaustedException.class)
                .hasMessage("Operation failed after 3 attempts: attempt 3")
                .hasCauseInstanceOf(IOException.class);
        assertThat(calls.get()).isEqualTo(3);
    }

    @Test
    void nonRetryableErrorPropagatesImmediately() {
        RetryExecutor executor = new RetryExecutor(recordingScheduler);
        RetryPolicy policy = noJitter.toBuilder()
                .retryOn(error -> error instanceof IOException)
                .build();
        AtomicInteger calls = new AtomicInteger();

        CompletableFuture<String> result = executor.run(() -> {
            calls.incrementAndGet();
            return CompletableFuture.failedFuture(new IllegalArgumentException("bad request"));
        }, policy);

        assertThatThrownBy(result::get).hasCauseInstanceOf(IllegalArgumentException.class);
        assertThat(calls.get()).isEqualTo(1);
        assertThat(delays).isEmpty();
    }

    @Test
    void synchronousThrowIsRetried() throws Exception {
        RetryExecutor executor = new RetryExecutor(recordingScheduler);
        AtomicInteger calls = new AtomicInteger();

        String value = executor.run(() -> {
            if (calls.incrementAndGet() == 1) {
                throw new IllegalStateException("sync");
            }
            return CompletableFuture.completedFuture("ok");
        }, noJitter).get();

        assertThat(value).isEqualTo("ok");
        assertThat(delays).hasSize(1);
    }

    @Test
    void singleAttemptPolicyDoesNotRetry() {
        RetryExecutor executor = new RetryExecutor(recordingScheduler);

        CompletableFuture<String> result = executor.run(
                () -> CompletableFuture.failedFuture(new IOException("down")), RetryPolicy.noRetry());

        assertThatThrownBy(result::get).cause()
                .isInstanceOf(RetryExhaustedException.class)
                .satisfies(e -> assertThat(((RetryExhaustedException) e).getAttempts()).isEqualTo(1));
        assertThat(delays).isEmpty();
    }

    @Test
    void delayIsCappedAtMaxDelay() {
        RetryPolicy policy = RetryPolicy.builder()
                .baseDelay(Duration.ofSeconds(10))
                .multiplier(10)
                .maxDelay(Duration.ofSeconds(60))
                .build();

        assertThat(policy.delayBefore(1)).isEqualTo(Duration.ZERO);
        assertThat(policy.delayBefore(2)).isEqualTo(Duration.ofSeconds(10));
        assertThat(policy.delayBefore(3)).isEqualTo(Duration.ofSeconds(60));
        assertThat(policy.delayBefore(10)).isEqualTo(Duration.ofSeconds(60));
    }

    @Test
    void jitterScalesDelayBetweenHalfAndFull() {
        RetryPolicy policy = noJitter.toBuilder().jitter(true).build();

        assertThat(new RetryExecutor(recordingScheduler, () -> 0.0).nextDelay(policy, 3))
                .isEqualTo(Duration.ofSeconds(1));
        assertThat(new RetryExecutor(recordingScheduler, () -> 0.5).nextDelay(policy, 3))
                .isEqualTo(Duration.ofMillis(1500));
        assertThat(new RetryExecutor(recordingScheduler, () -> 0.999).nextDelay(policy, 3))
                .isBetween(Duration.ofMillis(1990), Duration.ofSeconds(2));
    }

    @Test
    void rejectsNonPositiveMaxAttempts() {
        RetryExecutor executor = new RetryExecutor(recordingScheduler);

        CompletableFuture<String> result = executor.run(() -> CompletableFuture.completedFuture("x"),
                RetryPolicy.builder().maxAttempts(0).build());

        assertThatThrownBy(result::get).hasCauseInstanceOf(IllegalArgumentException.class);
    }
}
