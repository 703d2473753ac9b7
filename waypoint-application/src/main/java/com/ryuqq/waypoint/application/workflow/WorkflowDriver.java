package com.ryuqq.waypoint.application.workflow;

import com.ryuqq.waypoint.application.execution.ExecutionContext;
import com.ryuqq.waypoint.core.exception.WorkflowNotFoundException;
import com.ryuqq.waypoint.core.exception.WorkflowValidationException;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 워크플로우 실행 드라이버 포트.
 *
 * <p>step 그래프를 의존성 순서대로 실행하며, 승인 게이트가 있는 step은
 * 결정이 내려질 때까지 실행을 보류합니다. 실행 중 발생한 모든 예외는
 * {@link ExecutionContext}에 기록되며 드라이버 밖으로 전파되지 않습니다.</p>
 *
 * @author Waypoint Team
 * @since 1.0.0
 */
public interface WorkflowDriver {

    /**
     * 실행을 시작하고 즉시 반환합니다.
     *
     * @param workflowId 워크플로우 ID
     * @param inputs 워크플로우 입력
     * @return RUNNING 이후 상태의 실행 컨텍스트
     * @throws WorkflowNotFoundException 정의가 없는 경우
     * @throws WorkflowValidationException 그래프가 유효하지 않은 경우
     */
    ExecutionContext submit(String workflowId, Map<String, Object> inputs);

    /**
     * 실행을 시작하고 종료될 때까지 기다립니다.
     *
     * @param workflowId 워크플로우 ID
     * @param inputs 워크플로우 입력
     * @return 종료된 실행 컨텍스트
     */
    ExecutionContext execute(String workflowId, Map<String, Object> inputs);

    /**
     * 실행 취소 (협조적). 대기 중인 승인 요청도 함께 취소됩니다.
     *
     * @param executionId 실행 ID
     * @return 취소되었으면 true, 없거나 이미 종료되었으면 false
     */
    boolean cancel(String executionId);

    /**
     * 진행 중인 실행 조회.
     *
     * @param executionId 실행 ID
     * @return 실행 컨텍스트 (없거나 종료되어 정리되었으면 empty)
     */
    Optional<ExecutionContext> getExecution(String executionId);

    List<ExecutionContext> getActiveExecutions();
}
