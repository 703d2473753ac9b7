package com.ryuqq.waypoint.core.retry;

import java.time.Duration;
import java.time.Instant;

/**
 * 단일 시도 기록.
 *
 * @param attempt 0부터 시작하는 시도 번호
 * @param startedAt 시작 시각
 * @param duration 소요 시간
 * @param success 성공 여부
 * @param category 실패 분류 (성공 시 null)
 * @param errorMessage 실패 메시지 (성공 시 null)
 * @param delayBeforeNext 다음 시도 전 대기 시간 (재시도하지 않으면 ZERO)
 * @author Waypoint Team
 * @since 1.0.0
 */
public record RetryAttempt(
    int attempt,
    Instant startedAt,
    Duration duration,
    boolean success,
    ErrorCategory category,
    String errorMessage,
    Duration delayBeforeNext
) {
}
