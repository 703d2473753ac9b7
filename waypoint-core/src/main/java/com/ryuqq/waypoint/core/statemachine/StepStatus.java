package com.ryuqq.waypoint.core.statemachine;

/**
 * 실행 안에서 개별 step의 상태.
 *
 * @author Waypoint Team
 * @since 1.0.0
 */
public enum StepStatus {
    PENDING,
    AWAITING_APPROVAL,
    RUNNING,
    SUCCEEDED,
    FAILED,
    /** 선행 step 실패로 실행되지 않음. */
    SKIPPED,
    CANCELLED;

    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED || this == SKIPPED || this == CANCELLED;
    }

    public boolean isSuccessful() {
        return this == SUCCEEDED;
    }
}
