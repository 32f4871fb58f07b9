package apimonitor.breaker;

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * 熔断器注册表，每个名称只对应一个熔断器实例
 */
@Slf4j
public class CircuitBreakerRegistry {

    private final ConcurrentMap<String, CircuitBreaker> breakers = new ConcurrentHashMap<>();
    private final Clock clock;

    public CircuitBreakerRegistry(Clock clock) {
        this.clock = clock;
    }

    public CircuitBreakerRegistry() {
        this(Clock.systemUTC());
    }

    /**
     * 获取或懒创建熔断器；已存在时忽略传入配置
     */
    public CircuitBreaker getOrCreate(String name, CircuitBreakerSettings settings) {
        return breakers.computeIfAbsent(name, key -> {
            log.debug("创建熔断器: {}", key);
            return new CircuitBreaker(key, settings, clock);
        });
    }

    public Optional<CircuitBreaker> find(String name) {
        return Optional.ofNullable(breakers.get(name));
    }

    /**
     * 所有熔断器状态快照，按名称排序
     */
    public Map<String, CircuitBreakerSnapshot> snapshots() {
        Map<String, CircuitBreakerSnapshot> result = new TreeMap<>();
        breakers.forEach((name, breaker) -> result.put(name, breaker.snapshot()));
        return result;
    }

    /**
     * 重置指定熔断器，不存在时返回 false
     */
    public boolean reset(String name) {
        CircuitBreaker breaker = breakers.get(name);
        if (breaker == null) {
            return false;
        }
        breaker.reset();
        return true;
    }

    public void resetAll() {
        breakers.values().forEach(CircuitBreaker::reset);
    }

    public int size() {
        return breakers.size();
    }
}
