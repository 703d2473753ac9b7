package com.ryuqq.waypoint.adapter.inmemory.protection;

import com.ryuqq.waypoint.core.protection.Bulkhead;
import com.ryuqq.waypoint.core.protection.BulkheadConfig;

import java.util.concurrent.ConcurrentHashMap;

/**
 * Operation 이름별 {@link SemaphoreBulkhead} 레지스트리.
 *
 * @author Waypoint Team
 * @since 1.0.0
 */
public final class BulkheadRegistry {

    private final BulkheadConfig config;
    private final ConcurrentHashMap<String, Bulkhead> bulkheads = new ConcurrentHashMap<>();

    public BulkheadRegistry(BulkheadConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.config = config;
    }

    public Bulkhead get(String operationName) {
        if (operationName == null) {
            throw new IllegalArgumentException("operationName cannot be null");
        }
        return bulkheads.computeIfAbsent(operationName, name -> new SemaphoreBulkhead(config));
    }

    /**
     * 모든 Bulkhead의 누적 거부 횟수.
     *
     * @return 거부 횟수 합계
     */
    public long totalRejected() {
        return bulkheads.values().stream().mapToLong(Bulkhead::getRejectedCount).sum();
    }
}
