package com.ryuqq.waypoint.core.protection.noop;

import com.ryuqq.waypoint.core.protection.Bulkhead;
import com.ryuqq.waypoint.core.protection.BulkheadConfig;

/**
 * Bulkhead NoOp 구현.
 *
 * <p>동시 실행 수 제한을 적용하지 않습니다. Bulkhead 기능이 꺼진 설정에서 사용됩니다.</p>
 *
 * @author Waypoint Team
 * @since 1.0.0
 */
public final class NoOpBulkhead implements Bulkhead {

    private static final BulkheadConfig UNLIMITED_CONFIG = new BulkheadConfig(Integer.MAX_VALUE);

    @Override
    public boolean tryAcquire() {
        return true;
    }

    @Override
    public void release() {
        // NoOp
    }

    @Override
    public int getCurrentConcurrency() {
        return 0;
    }

    @Override
    public long getRejectedCount() {
        return 0;
    }

    @Override
    public BulkheadConfig getConfig() {
        return UNLIMITED_CONFIG;
    }
}
