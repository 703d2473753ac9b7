package com.ryuqq.waypoint.core.exception;

/**
 * 보호 실행의 최종 실패.
 *
 * <p>fallback이 없거나 fallback 자체가 실패한 경우 워크플로우 드라이버에 전달됩니다.
 * 원래 실패는 {@link #getCause()}, fallback 실패는 {@link #getSuppressed()}에 담깁니다.</p>
 *
 * @author Waypoint Team
 * @since 1.0.0
 */
public class ResilienceException extends WaypointException {

    private final String operationName;
    private final int attempts;

    public ResilienceException(String operationName, int attempts, Throwable cause) {
        super("Resilient execution of '" + operationName + "' failed after " + attempts + " attempt(s)", cause);
        this.operationName = operationName;
        this.attempts = attempts;
    }

    /**
     * fallback 실패를 함께 담은 예외 생성.
     *
     * @param operationName Operation 이름
     * @param attempts 시도 횟수
     * @param cause 원래 실패
     * @param fallbackError fallback 실패
     * @return 결합된 예외
     */
    public static ResilienceException withFallbackFailure(
        String operationName, int attempts, Throwable cause, Throwable fallbackError
    ) {
        ResilienceException exception = new ResilienceException(operationName, attempts, cause);
        if (fallbackError != null) {
            exception.addSuppressed(fallbackError);
        }
        return exception;
    }

    public String getOperationName() {
        return operationName;
    }

    public int getAttempts() {
        return attempts;
    }

    /**
     * fallback 실패 여부.
     *
     * @return fallback이 실행되었다가 실패한 경우 true
     */
    public boolean isFallbackFailed() {
        return getSuppressed().length > 0;
    }
}
