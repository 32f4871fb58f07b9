package apimonitor.cooldown;

import com.google.common.base.Ticker;
import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.TimeUnit;

/**
 * 进程内冷却闸门，记录在 cooldown 时间后自动过期
 */
@Slf4j
public class LocalCooldownGate implements CooldownGate {
    private final Cache<Long, Instant> cache;
    private final Clock clock;

    public LocalCooldownGate(Duration cooldown, Clock clock) {
        this.clock = clock;
        this.cache = CacheBuilder.newBuilder()
                .expireAfterWrite(cooldown.toMillis(), TimeUnit.MILLISECONDS)
                .maximumSize(10000)
                .ticker(new Ticker() {
                    @Override
                    public long read() {
                        return TimeUnit.MILLISECONDS.toNanos(clock.millis());
                    }
                })
                .build();
    }

    @Override
    public boolean tryAcquire(long endpointId) {
        Instant previous = cache.asMap().putIfAbsent(endpointId, clock.instant());
        if (previous != null) {
            log.debug("端点 {} 处于冷却期, 上次通知: {}", endpointId, previous);
            return false;
        }
        return true;
    }

    @Override
    public void reset(long endpointId) {
        cache.invalidate(endpointId);
    }
}
