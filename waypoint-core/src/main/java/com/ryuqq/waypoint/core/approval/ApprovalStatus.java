package com.ryuqq.waypoint.core.approval;

/**
 * 승인 요청 상태.
 *
 * <pre>
 * PENDING ─┬─► APPROVED
 *          ├─► REJECTED   (사람의 거절 또는 system 자동 거절)
 *          ├─► EXPIRED
 *          └─► CANCELLED
 * </pre>
 *
 * <p>PENDING 이외의 상태는 모두 종료 상태이며 더 이상 변경되지 않습니다.</p>
 *
 * @author Waypoint Team
 * @since 1.0.0
 */
public enum ApprovalStatus {
    PENDING,
    APPROVED,
    REJECTED,
    EXPIRED,
    CANCELLED;

    public boolean isTerminal() {
        return this != PENDING;
    }

    /**
     * 승인자(사람 또는 system)의 결정으로 종료되었는지 확인.
     *
     * @return APPROVED 또는 REJECTED인 경우 true
     */
    public boolean isDecided() {
        return this == APPROVED || this == REJECTED;
    }
}
