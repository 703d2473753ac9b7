package com.ryuqq.waypoint.core.retry;

/**
 * 실패 분류.
 *
 * <p>기본 재시도 정책은 VALIDATION, PERMANENT를 제외한 모든 분류를 재시도합니다.</p>
 *
 * @author Waypoint Team
 * @since 1.0.0
 */
public enum ErrorCategory {

    /** 제한 시간 초과. */
    TIMEOUT(true),

    /** 일시적 장애 (네트워크, rate limit, 5xx). */
    TRANSIENT(true),

    /** 입력 오류. 재시도해도 결과가 같습니다. */
    VALIDATION(false),

    /** 자원 부족 (quota, 메모리). */
    RESOURCE(true),

    /** 권한, 미존재 등 영구 실패. */
    PERMANENT(false),

    /** 분류 불가. */
    UNKNOWN(true);

    private final boolean retryable;

    ErrorCategory(boolean retryable) {
        this.retryable = retryable;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
