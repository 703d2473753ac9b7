package com.ryuqq.waypoint.application.execution;

/**
 * 실행과 step 생명주기 알림.
 *
 * <p>리스너 예외는 로그로 남기고 무시되며, 실행 흐름에 영향을 주지 않습니다.
 * 콜백은 실행을 조정하는 스레드 또는 step 스레드에서 호출되므로 오래 걸리는 작업을 하면 안 됩니다.</p>
 *
 * @author Waypoint Team
 * @since 1.0.0
 */
public interface ExecutionEventListener {

    /**
     * 실행이 RUNNING이 된 직후 호출.
     *
     * @param context 실행 컨텍스트
     */
    default void onExecutionStarted(ExecutionContext context) {
    }

    /**
     * 실행이 종료 상태(COMPLETED, FAILED, CANCELLED)로 끝나고 활성 목록에서 빠진 뒤 호출.
     *
     * @param context 종료된 실행 컨텍스트
     */
    default void onExecutionFinished(ExecutionContext context) {
    }

    default void onStepStarted(ExecutionContext context, String stepId) {
    }

    default void onStepSucceeded(ExecutionContext context, String stepId, Object result) {
    }

    /**
     * step 실패 시 호출. 승인 거절로 실행되지 못한 경우도 포함됩니다.
     *
     * @param context 실행 컨텍스트
     * @param stepId step ID
     * @param error 실패 원인
     */
    default void onStepFailed(ExecutionContext context, String stepId, Throwable error) {
    }

    default void onStepSkipped(ExecutionContext context, String stepId) {
    }
}
