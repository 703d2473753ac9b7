package com.ryuqq.waypoint.adapter.runner;

import java.time.Duration;

/**
 * ApprovalExpirySweeper 설정.
 *
 * @param interval 스캔 주기 (양수, 기본 30초)
 * @author Waypoint Team
 * @since 1.0.0
 */
public record ApprovalSweeperConfig(Duration interval) {

    public ApprovalSweeperConfig() {
        this(Duration.ofSeconds(30));
    }

    public ApprovalSweeperConfig {
        if (interval == null || interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("interval must be positive (current: " + interval + ")");
        }
    }
}
