package com.ryuqq.waypoint.application.execution;

import java.time.Instant;

/**
 * 실행 중 기록된 오류.
 *
 * @param stepId 오류가 발생한 step (실행 수준 오류이면 null)
 * @param message 오류 메시지
 * @param cause 원인 예외 (nullable)
 * @param occurredAt 기록 시각
 * @author Waypoint Team
 * @since 1.0.0
 */
public record ExecutionError(String stepId, String message, Throwable cause, Instant occurredAt) {

    public static ExecutionError of(String stepId, Throwable cause, Instant occurredAt) {
        String message = cause == null ? "unknown error" : describe(cause);
        return new ExecutionError(stepId, message, cause, occurredAt);
    }

    private static String describe(Throwable cause) {
        String message = cause.getMessage();
        return message == null ? cause.getClass().getSimpleName() : message;
    }
}
