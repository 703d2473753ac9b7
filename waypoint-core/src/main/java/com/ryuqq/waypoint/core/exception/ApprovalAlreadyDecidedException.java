package com.ryuqq.waypoint.core.exception;

import com.ryuqq.waypoint.core.approval.ApprovalStatus;

/**
 * 이미 PENDING 상태를 벗어난 승인 요청에 결정을 시도했을 때 발생합니다.
 *
 * @author Waypoint Team
 * @since 1.0.0
 */
public class ApprovalAlreadyDecidedException extends ApprovalException {

    private final ApprovalStatus status;

    public ApprovalAlreadyDecidedException(String approvalId, ApprovalStatus status) {
        super(approvalId, "Approval request " + approvalId + " is already " + status);
        this.status = status;
    }

    /**
     * @return 요청의 현재(최종) 상태
     */
    public ApprovalStatus getStatus() {
        return status;
    }
}
