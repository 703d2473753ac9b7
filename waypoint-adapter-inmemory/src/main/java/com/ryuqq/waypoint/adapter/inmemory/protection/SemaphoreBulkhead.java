package com.ryuqq.waypoint.adapter.inmemory.protection;

import com.ryuqq.waypoint.core.protection.Bulkhead;
import com.ryuqq.waypoint.core.protection.BulkheadConfig;

import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicLong;

/**
 * {@link Semaphore} 기반 Bulkhead.
 *
 * <p>허용량 확보는 대기하지 않습니다. 남은 permit이 없으면 즉시 false를 반환하고
 * 거부 횟수를 증가시킵니다.</p>
 *
 * @author Waypoint Team
 * @since 1.0.0
 */
public final class SemaphoreBulkhead implements Bulkhead {

    private final BulkheadConfig config;
    private final Semaphore permits;
    private final AtomicLong rejected = new AtomicLong();

    public SemaphoreBulkhead(BulkheadConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.config = config;
        this.permits = new Semaphore(config.maxConcurrentCalls());
    }

    @Override
    public boolean tryAcquire() {
        if (permits.tryAcquire()) {
            return true;
        }
        rejected.incrementAndGet();
        return false;
    }

    /**
     * {@inheritDoc}
     *
     * @throws IllegalStateException 확보된 permit 없이 호출된 경우
     */
    @Override
    public void release() {
        if (permits.availablePermits() >= config.maxConcurrentCalls()) {
            throw new IllegalStateException("release() called without a matching tryAcquire()");
        }
        permits.release();
    }

    @Override
    public int getCurrentConcurrency() {
        return config.maxConcurrentCalls() - permits.availablePermits();
    }

    @Override
    public long getRejectedCount() {
        return rejected.get();
    }

    @Override
    public BulkheadConfig getConfig() {
        return config;
    }
}
