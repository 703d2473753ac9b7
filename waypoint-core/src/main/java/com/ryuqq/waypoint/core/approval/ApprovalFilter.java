package com.ryuqq.waypoint.core.approval;

/**
 * 승인 요청 조회 조건. null 필드는 조건에서 제외됩니다.
 *
 * @param workflowId 워크플로우 ID
 * @param executionId 실행 ID
 * @param priority 우선순위
 * @param status 상태
 * @author Waypoint Team
 * @since 1.0.0
 */
public record ApprovalFilter(
    String workflowId,
    String executionId,
    ApprovalPriority priority,
    ApprovalStatus status
) {

    public static ApprovalFilter all() {
        return new ApprovalFilter(null, null, null, null);
    }

    public ApprovalFilter withWorkflowId(String workflowId) {
        return new ApprovalFilter(workflowId, executionId, priority, status);
    }

    public ApprovalFilter withExecutionId(String executionId) {
        return new ApprovalFilter(workflowId, executionId, priority, status);
    }

    public ApprovalFilter withPriority(ApprovalPriority priority) {
        return new ApprovalFilter(workflowId, executionId, priority, status);
    }

    public ApprovalFilter withStatus(ApprovalStatus status) {
        return new ApprovalFilter(workflowId, executionId, priority, status);
    }

    public boolean matches(ApprovalRequest request) {
        if (workflowId != null && !workflowId.equals(request.getWorkflowId())) {
            return false;
        }
        if (executionId != null && !executionId.equals(request.getExecutionId())) {
            return false;
        }
        if (priority != null && priority != request.getPriority()) {
            return false;
        }
        return status == null || status == request.getStatus();
    }
}
