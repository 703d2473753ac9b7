package com.ryuqq.waypoint.core.exception;

/**
 * 승인 요청 처리 실패의 공통 상위 타입.
 *
 * <p>실패한 호출은 저장된 요청 상태를 변경하지 않습니다.</p>
 *
 * @author Waypoint Team
 * @since 1.0.0
 */
public abstract class ApprovalException extends WaypointException {

    private final String approvalId;

    protected ApprovalException(String approvalId, String message) {
        super(message);
        this.approvalId = approvalId;
    }

    public String getApprovalId() {
        return approvalId;
    }
}
