package com.ryuqq.waypoint.adapter.inmemory.protection;

import com.ryuqq.waypoint.core.protection.CircuitBreaker;
import com.ryuqq.waypoint.core.protection.CircuitBreakerConfig;
import com.ryuqq.waypoint.core.protection.CircuitBreakerSnapshot;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Operation 이름별 {@link InMemoryCircuitBreaker} 레지스트리.
 *
 * <p>최초 조회 시 생성되며 이후 같은 인스턴스를 반환합니다.
 * 레지스트리는 소유자(Orchestrator 인스턴스)마다 하나씩 만듭니다.</p>
 *
 * @author Waypoint Team
 * @since 1.0.0
 */
public final class CircuitBreakerRegistry {

    private final CircuitBreakerConfig config;
    private final Clock clock;
    private final ConcurrentHashMap<String, CircuitBreaker> breakers = new ConcurrentHashMap<>();

    public CircuitBreakerRegistry(CircuitBreakerConfig config, Clock clock) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.config = config;
        this.clock = clock;
    }

    /**
     * Circuit Breaker 조회 (없으면 생성).
     *
     * @param operationName Operation 이름
     * @return Circuit Breaker
     */
    public CircuitBreaker get(String operationName) {
        if (operationName == null) {
            throw new IllegalArgumentException("operationName cannot be null");
        }
        return breakers.computeIfAbsent(operationName, name -> new InMemoryCircuitBreaker(name, config, clock));
    }

    /**
     * 이미 생성된 Circuit Breaker 조회.
     *
     * @param operationName Operation 이름
     * @return Circuit Breaker (없으면 empty)
     */
    public Optional<CircuitBreaker> find(String operationName) {
        if (operationName == null) {
            throw new IllegalArgumentException("operationName cannot be null");
        }
        return Optional.ofNullable(breakers.get(operationName));
    }

    /**
     * 전체 스냅샷 (이름 순).
     *
     * @return Operation 이름 → 스냅샷
     */
    public Map<String, CircuitBreakerSnapshot> snapshots() {
        Map<String, CircuitBreakerSnapshot> result = new LinkedHashMap<>();
        new TreeMap<>(breakers).forEach((name, breaker) -> result.put(name, breaker.snapshot()));
        return result;
    }

    /**
     * Circuit Breaker 리셋. 생성되지 않은 이름은 무시합니다.
     *
     * @param operationName Operation 이름
     */
    public void reset(String operationName) {
        find(operationName).ifPresent(CircuitBreaker::reset);
    }

    public void resetAll() {
        breakers.values().forEach(CircuitBreaker::reset);
    }

    public CircuitBreakerConfig getConfig() {
        return config;
    }
}
