package apimonitor.breaker;

import apimonitor.support.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;

class CircuitBreakerRegistryTest {

    private final CircuitBreakerRegistry registry =
            new CircuitBreakerRegistry(new MutableClock(Instant.parse("2024-01-01T00:00:00Z")));

    @Test
    void returnsSameInstanceForSameName() {
        CircuitBreaker first = registry.getOrCreate("health_check_api", CircuitBreakerSettings.defaults());
        CircuitBreaker second = registry.getOrCreate("health_check_api",
                CircuitBreakerSettings.builder().failureThreshold(1).build());

        assertThat(second).isSameAs(first);
        assertThat(second.getSettings().getFailureThreshold()).isEqualTo(5);
        assertThat(registry.size()).isEqualTo(1);
    }

    @Test
    void snapshotsAreSortedByName() {
        registry.getOrCreate("notification_webhook", CircuitBreakerSettings.defaults());
        registry.getOrCreate("health_check_b", CircuitBreakerSettings.defaults());
        registry.getOrCreate("health_check_a", CircuitBreakerSettings.defaults());

        assertThat(registry.snapshots().keySet())
                .containsExactly("health_check_a", "health_check_b", "notification_webhook");
    }

    @Test
    void resetUnknownNameReturnsFalse() {
        assertThat(registry.reset("missing")).isFalse();
        assertThat(registry.find("missing")).isEmpty();
    }

    @Test
    void resetKnownBreakerClosesIt() {
        CircuitBreaker breaker = registry.getOrCreate("api",
                CircuitBreakerSettings.builder().failureThreshold(1).build());
        breaker.call(() -> CompletableFuture.failedFuture(new RuntimeException("down")));
        assertThat(breaker.getState()).isEqualTo(CircuitState.OPEN);

        assertThat(registry.reset("api")).isTrue();
        assertThat(breaker.getState()).isEqualTo(CircuitState.CLOSED);
    }

    @Test
    void resetAllClosesEveryBreaker() {
        CircuitBreakerSettings settings = CircuitBreakerSettings.builder().failureThreshold(1).build();
        registry.getOrCreate("a", settings).call(() -> CompletableFuture.failedFuture(new RuntimeException()));
        registry.getOrCreate("b", settings).call(() -> CompletableFuture.failedFuture(new RuntimeException()));

        registry.resetAll();

        assertThat(registry.snapshots().values())
                .allMatch(snapshot -> snapshot.getState() == CircuitState.CLOSED);
    }
}
