package com.ryuqq.waypoint.application.approval;

import com.ryuqq.waypoint.core.approval.ApprovalRequest;

/**
 * 승인 요청 생명주기 알림.
 *
 * <p>리스너 예외는 로그로 남기고 무시되며, 요청 처리에 영향을 주지 않습니다.</p>
 *
 * @author Waypoint Team
 * @since 1.0.0
 */
public interface ApprovalEventListener {

    /**
     * 요청 생성 직후 호출.
     *
     * @param request PENDING 요청
     */
    default void onCreated(ApprovalRequest request) {
    }

    /**
     * 요청이 종료 상태(APPROVED, REJECTED, EXPIRED, CANCELLED)가 된 직후 호출.
     *
     * @param request 종료된 요청
     */
    default void onResolved(ApprovalRequest request) {
    }
}
