package com.ryuqq.waypoint.core.exception;

/**
 * step이 실행되지 못하고 실패로 종료되었을 때 실행 컨텍스트에 기록되는 예외.
 *
 * <p>승인 거절, 만료, 대기 시간 초과처럼 Operation을 호출하지 않은 실패와,
 * 독립 실행 정책에서 일부 step이 실패한 실행의 요약 실패를 나타냅니다.</p>
 *
 * @author Waypoint Team
 * @since 1.0.0
 */
public class StepFailedException extends WaypointException {

    private final String stepId;

    public StepFailedException(String stepId, String message) {
        super("Step '" + stepId + "' failed: " + message);
        this.stepId = stepId;
    }

    public StepFailedException(String stepId, String message, Throwable cause) {
        super("Step '" + stepId + "' failed: " + message, cause);
        this.stepId = stepId;
    }

    public String getStepId() {
        return stepId;
    }
}
