package com.ryuqq.waypoint.core.exception;

/**
 * 정의 저장소에서 워크플로우를 찾지 못했을 때 발생합니다.
 *
 * @author Waypoint Team
 * @since 1.0.0
 */
public class WorkflowNotFoundException extends WaypointException {

    private final String workflowId;

    public WorkflowNotFoundException(String workflowId) {
        super("Workflow not found: " + workflowId);
        this.workflowId = workflowId;
    }

    public String getWorkflowId() {
        return workflowId;
    }
}
