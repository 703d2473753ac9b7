package com.ryuqq.waypoint.core.retry;

import com.ryuqq.waypoint.core.exception.OperationTimeoutException;

import java.io.IOException;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.TimeoutException;

/**
 * 예외를 {@link ErrorCategory}로 분류합니다.
 *
 * <p><strong>분류 순서:</strong></p>
 * <ol>
 *   <li>타입: timeout 계열 → TIMEOUT, 입력 검증 계열 → VALIDATION,
 *       권한 계열 → PERMANENT, 메모리 부족 → RESOURCE</li>
 *   <li>메시지 키워드 (TIMEOUT → TRANSIENT → VALIDATION → RESOURCE → PERMANENT)</li>
 *   <li>{@link IOException} → TRANSIENT</li>
 *   <li>그 외 → UNKNOWN</li>
 * </ol>
 *
 * @author Waypoint Team
 * @since 1.0.0
 */
public final class ErrorClassifier {

    private static final List<String> TRANSIENT_KEYWORDS = List.of(
        "rate limit", "too many requests", "temporarily unavailable", "service unavailable",
        "connection", "network", "502", "503", "504"
    );

    private static final List<String> VALIDATION_KEYWORDS = List.of(
        "validation", "invalid", "bad request", "400"
    );

    private static final List<String> RESOURCE_KEYWORDS = List.of(
        "out of memory", "quota", "limit exceeded", "insufficient", "resource"
    );

    private static final List<String> PERMANENT_KEYWORDS = List.of(
        "unauthorized", "forbidden", "not found", "401", "403", "404", "permission"
    );

    private ErrorClassifier() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 예외 분류.
     *
     * @param error 분류할 예외 (null이면 UNKNOWN)
     * @return 분류 결과
     */
    public static ErrorCategory classify(Throwable error) {
        if (error == null) {
            return ErrorCategory.UNKNOWN;
        }
        if (error instanceof OperationTimeoutException || error instanceof TimeoutException
            || error.getClass().getSimpleName().toLowerCase(Locale.ROOT).contains("timeout")) {
            return ErrorCategory.TIMEOUT;
        }
        if (error instanceof IllegalArgumentException) {
            return ErrorCategory.VALIDATION;
        }
        if (error instanceof SecurityException || error instanceof UnsupportedOperationException) {
            return ErrorCategory.PERMANENT;
        }
        if (error instanceof OutOfMemoryError) {
            return ErrorCategory.RESOURCE;
        }

        String message = error.getMessage() == null ? "" : error.getMessage().toLowerCase(Locale.ROOT);
        if (message.contains("timeout") || message.contains("timed out")) {
            return ErrorCategory.TIMEOUT;
        }
        if (containsAny(message, TRANSIENT_KEYWORDS)) {
            return ErrorCategory.TRANSIENT;
        }
        if (containsAny(message, VALIDATION_KEYWORDS)) {
            return ErrorCategory.VALIDATION;
        }
        if (containsAny(message, RESOURCE_KEYWORDS)) {
            return ErrorCategory.RESOURCE;
        }
        if (containsAny(message, PERMANENT_KEYWORDS)) {
            return ErrorCategory.PERMANENT;
        }
        if (error instanceof IOException) {
            return ErrorCategory.TRANSIENT;
        }
        return ErrorCategory.UNKNOWN;
    }

    /**
     * 기본 재시도 판정.
     *
     * @param error 예외
     * @return 분류가 재시도 가능한 경우 true
     */
    public static boolean isRetryable(Throwable error) {
        return classify(error).isRetryable();
    }

    private static boolean containsAny(String message, List<String> keywords) {
        for (String keyword : keywords) {
            if (message.contains(keyword)) {
                return true;
            }
        }
        return false;
    }
}
