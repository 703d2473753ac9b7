package com.ryuqq.waypoint.core.exception;

/**
 * 존재하지 않는 승인 요청을 참조했을 때 발생합니다.
 *
 * @author Waypoint Team
 * @since 1.0.0
 */
public class ApprovalNotFoundException extends ApprovalException {

    public ApprovalNotFoundException(String approvalId) {
        super(approvalId, "Approval request not found: " + approvalId);
    }
}
