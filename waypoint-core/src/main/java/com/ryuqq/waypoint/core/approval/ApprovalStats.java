package com.ryuqq.waypoint.core.approval;

import java.time.Duration;

/**
 * 승인 요청 통계.
 *
 * @param pendingCount PENDING 수
 * @param approvedCount APPROVED 수
 * @param rejectedCount REJECTED 수 (system 자동 거절 포함)
 * @param expiredCount EXPIRED 수
 * @param cancelledCount CANCELLED 수
 * @param averageDecisionTime APPROVED/REJECTED 요청의 평균 결정 소요 시간 (없으면 ZERO)
 * @author Waypoint Team
 * @since 1.0.0
 */
public record ApprovalStats(
    int pendingCount,
    int approvedCount,
    int rejectedCount,
    int expiredCount,
    int cancelledCount,
    Duration averageDecisionTime
) {

    /**
     * PENDING을 벗어난 요청 수.
     *
     * @return 종료된 요청 수
     */
    public int decidedCount() {
        return approvedCount + rejectedCount + expiredCount + cancelledCount;
    }

    public int totalCount() {
        return pendingCount + decidedCount();
    }
}
