package com.ryuqq.waypoint.core.exception;

/**
 * 워크플로우 정의가 실행 불가능한 그래프일 때 발생합니다.
 *
 * <p>step 없음, 중복 id, 알 수 없는 의존성, 순환 의존성이 해당됩니다.</p>
 *
 * @author Waypoint Team
 * @since 1.0.0
 */
public class WorkflowValidationException extends WaypointException {

    private final String workflowId;

    public WorkflowValidationException(String workflowId, String message) {
        super("Invalid workflow '" + workflowId + "': " + message);
        this.workflowId = workflowId;
    }

    public String getWorkflowId() {
        return workflowId;
    }
}
