package com.ryuqq.waypoint.core.exception;

/**
 * 승인자 목록에 없는 사용자가 결정을 시도했을 때 발생합니다.
 *
 * @author Waypoint Team
 * @since 1.0.0
 */
public class UnauthorizedApproverException extends ApprovalException {

    private final String approver;

    public UnauthorizedApproverException(String approvalId, String approver) {
        super(approvalId, "'" + approver + "' is not authorized to decide approval request " + approvalId);
        this.approver = approver;
    }

    public String getApprover() {
        return approver;
    }
}
