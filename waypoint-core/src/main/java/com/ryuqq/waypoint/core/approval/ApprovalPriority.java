package com.ryuqq.waypoint.core.approval;

/**
 * 승인 요청 우선순위. 대기 목록은 CRITICAL부터 정렬됩니다.
 *
 * @author Waypoint Team
 * @since 1.0.0
 */
public enum ApprovalPriority {
    LOW(1),
    MEDIUM(2),
    HIGH(3),
    CRITICAL(4);

    private final int rank;

    ApprovalPriority(int rank) {
        this.rank = rank;
    }

    /**
     * 정렬 순위. 클수록 먼저 처리됩니다.
     *
     * @return 순위
     */
    public int rank() {
        return rank;
    }
}
