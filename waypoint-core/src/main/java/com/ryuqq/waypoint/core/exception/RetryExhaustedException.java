package com.ryuqq.waypoint.core.exception;

/**
 * 재시도가 모두 소진되었거나 재시도 불가 실패로 중단되었을 때 발생합니다.
 *
 * <p>마지막 실패가 {@link #getCause()}로 전달됩니다.</p>
 *
 * @author Waypoint Team
 * @since 1.0.0
 */
public class RetryExhaustedException extends WaypointException {

    private final String operationName;
    private final int attempts;

    public RetryExhaustedException(String operationName, int attempts, Throwable cause) {
        super("Operation '" + operationName + "' failed after " + attempts + " attempt(s): " + describe(cause), cause);
        this.operationName = operationName;
        this.attempts = attempts;
    }

    private static String describe(Throwable cause) {
        if (cause == null) {
            return "unknown";
        }
        return cause.getClass().getSimpleName() + ": " + cause.getMessage();
    }

    public String getOperationName() {
        return operationName;
    }

    public int getAttempts() {
        return attempts;
    }
}
