package com.ryuqq.waypoint.core.statemachine;

/**
 * 워크플로우 실행의 생명주기 상태.
 *
 * <p><strong>상태 전이 다이어그램:</strong></p>
 * <pre>
 * PENDING
 *    │
 *    ▼ (start)
 * RUNNING ◄──────────────┐
 *    │                   │ (resumeFromApproval)
 *    ├─► AWAITING_APPROVAL
 *    │
 *    ├─► COMPLETED
 *    ├─► FAILED
 *    └─► CANCELLED
 * </pre>
 *
 * <p>종료 상태(COMPLETED, FAILED, CANCELLED)에서는 어떤 전이도 허용되지 않습니다.</p>
 *
 * @author Waypoint Team
 * @since 1.0.0
 */
public enum ExecutionStatus {

    /** 생성됨, 아직 시작 전. */
    PENDING,

    /** 실행 중. */
    RUNNING,

    /** 승인 결정 대기 중. */
    AWAITING_APPROVAL,

    /** 완료 (성공). */
    COMPLETED,

    /** 실패. */
    FAILED,

    /** 취소. */
    CANCELLED;

    /**
     * 종료 상태인지 확인.
     *
     * @return COMPLETED, FAILED, CANCELLED인 경우 true
     */
    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }
}
