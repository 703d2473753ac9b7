package com.ryuqq.waypoint.core.retry;

/**
 * 재시도 간격 증가 방식.
 *
 * <p>attempt는 0부터 시작하며, 기본 지연에 곱해지는 배수를 결정합니다.</p>
 *
 * @author Waypoint Team
 * @since 1.0.0
 */
public enum BackoffStrategy {

    /** 항상 initialDelay. */
    FIXED,

    /** initialDelay × (attempt + 1). */
    LINEAR,

    /** initialDelay × 2^attempt. */
    EXPONENTIAL;

    /**
     * attempt에 대한 배수.
     *
     * @param attempt 0부터 시작하는 시도 번호
     * @return 배수 (1 이상)
     * @throws IllegalArgumentException attempt가 음수인 경우
     */
    public double multiplier(int attempt) {
        if (attempt < 0) {
            throw new IllegalArgumentException("attempt cannot be negative (current: " + attempt + ")");
        }
        return switch (this) {
            case FIXED -> 1.0;
            case LINEAR -> attempt + 1.0;
            case EXPONENTIAL -> Math.pow(2.0, attempt);
        };
    }
}
