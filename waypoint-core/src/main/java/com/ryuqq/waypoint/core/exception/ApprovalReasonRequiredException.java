package com.ryuqq.waypoint.core.exception;

/**
 * 사유가 필수인 승인 요청에 사유 없이 결정을 시도했을 때 발생합니다.
 *
 * @author Waypoint Team
 * @since 1.0.0
 */
public class ApprovalReasonRequiredException extends ApprovalException {

    public ApprovalReasonRequiredException(String approvalId) {
        super(approvalId, "A decision reason is required for approval request " + approvalId);
    }
}
