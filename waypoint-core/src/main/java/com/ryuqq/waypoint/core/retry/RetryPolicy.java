package com.ryuqq.waypoint.core.retry;

import java.time.Duration;
import java.util.EnumSet;
import java.util.Set;
import java.util.function.Predicate;

/**
 * 재시도 정책.
 *
 * <p>한 번 생성되면 변경되지 않으며, 변경이 필요하면 {@code withX} 메서드로 복사본을 만듭니다.</p>
 *
 * <p><strong>지연 계산:</strong></p>
 * <pre>
 * delay(n) = min(maxDelay, initialDelay × growth(n))   (n은 0부터)
 * 실제 지연 = delay(n) ± jitterFactor × delay(n)
 * </pre>
 *
 * <p><strong>프리셋:</strong></p>
 * <ul>
 *   <li>{@link #defaults()}: EXPONENTIAL, 3회, 100ms ~ 10s</li>
 *   <li>{@link #aggressive()}: EXPONENTIAL, 5회, 500ms ~ 30s</li>
 *   <li>{@link #conservative()}: LINEAR, 2회, 2s ~ 10s</li>
 *   <li>{@link #transientOnly()}: EXPONENTIAL, 3회, 1s ~ 60s, TRANSIENT/TIMEOUT만 재시도</li>
 *   <li>{@link #noRetry()}: 1회</li>
 * </ul>
 *
 * @param maxAttempts 최대 시도 횟수 (최초 시도 포함, 1 이상)
 * @param backoffStrategy 지연 증가 방식
 * @param initialDelay 최초 재시도 지연
 * @param maxDelay 지연 상한
 * @param jitterFactor 지연 흔들림 비율 (0.0 ~ 1.0)
 * @param retryable 재시도 여부 판정
 * @author Waypoint Team
 * @since 1.0.0
 */
public record RetryPolicy(
    int maxAttempts,
    BackoffStrategy backoffStrategy,
    Duration initialDelay,
    Duration maxDelay,
    double jitterFactor,
    Predicate<Throwable> retryable
) {

    public RetryPolicy {
        if (maxAttempts <= 0) {
            throw new IllegalArgumentException("maxAttempts must be positive (current: " + maxAttempts + ")");
        }
        if (backoffStrategy == null) {
            throw new IllegalArgumentException("backoffStrategy cannot be null");
        }
        if (initialDelay == null || initialDelay.isNegative()) {
            throw new IllegalArgumentException("initialDelay cannot be null or negative (current: " + initialDelay + ")");
        }
        if (maxDelay == null || maxDelay.compareTo(initialDelay) < 0) {
            throw new IllegalArgumentException(
                "maxDelay must be >= initialDelay (initial: " + initialDelay + ", max: " + maxDelay + ")"
            );
        }
        if (jitterFactor < 0.0 || jitterFactor > 1.0) {
            throw new IllegalArgumentException(
                "jitterFactor must be between 0.0 and 1.0 (current: " + jitterFactor + ")"
            );
        }
        if (retryable == null) {
            throw new IllegalArgumentException("retryable cannot be null");
        }
    }

    /**
     * 기본 정책으로 생성 ({@link #defaults()}와 동일).
     */
    public RetryPolicy() {
        this(3, BackoffStrategy.EXPONENTIAL, Duration.ofMillis(100), Duration.ofSeconds(10), 0.1,
            ErrorClassifier::isRetryable);
    }

    public static RetryPolicy defaults() {
        return new RetryPolicy();
    }

    public static RetryPolicy aggressive() {
        return new RetryPolicy(5, BackoffStrategy.EXPONENTIAL, Duration.ofMillis(500), Duration.ofSeconds(30), 0.1,
            ErrorClassifier::isRetryable);
    }

    public static RetryPolicy conservative() {
        return new RetryPolicy(2, BackoffStrategy.LINEAR, Duration.ofSeconds(2), Duration.ofSeconds(10), 0.1,
            ErrorClassifier::isRetryable);
    }

    public static RetryPolicy transientOnly() {
        return new RetryPolicy(3, BackoffStrategy.EXPONENTIAL, Duration.ofSeconds(1), Duration.ofSeconds(60), 0.1,
            onlyCategories(EnumSet.of(ErrorCategory.TRANSIENT, ErrorCategory.TIMEOUT)));
    }

    public static RetryPolicy noRetry() {
        return new RetryPolicy(1, BackoffStrategy.FIXED, Duration.ZERO, Duration.ZERO, 0.0,
            ErrorClassifier::isRetryable);
    }

    /**
     * 고정 지연 정책.
     *
     * @param maxAttempts 최대 시도 횟수
     * @param delay 고정 지연
     * @return jitter 없는 FIXED 정책
     */
    public static RetryPolicy fixed(int maxAttempts, Duration delay) {
        return new RetryPolicy(maxAttempts, BackoffStrategy.FIXED, delay, delay, 0.0, ErrorClassifier::isRetryable);
    }

    /**
     * 주어진 분류만 재시도하는 판정 생성.
     *
     * @param categories 재시도할 분류
     * @return 판정
     */
    public static Predicate<Throwable> onlyCategories(Set<ErrorCategory> categories) {
        Set<ErrorCategory> allowed = Set.copyOf(categories);
        return error -> allowed.contains(ErrorClassifier.classify(error));
    }

    /**
     * jitter 적용 전 기본 지연.
     *
     * @param attempt 0부터 시작하는 시도 번호
     * @return min(maxDelay, initialDelay × growth(attempt))
     */
    public Duration baseDelay(int attempt) {
        double millis = initialDelay.toMillis() * backoffStrategy.multiplier(attempt);
        if (millis >= maxDelay.toMillis()) {
            return maxDelay;
        }
        return Duration.ofMillis((long) millis);
    }

    public boolean isRetryable(Throwable error) {
        return retryable.test(error);
    }

    public RetryPolicy withMaxAttempts(int maxAttempts) {
        return new RetryPolicy(maxAttempts, backoffStrategy, initialDelay, maxDelay, jitterFactor, retryable);
    }

    public RetryPolicy withBackoffStrategy(BackoffStrategy backoffStrategy) {
        return new RetryPolicy(maxAttempts, backoffStrategy, initialDelay, maxDelay, jitterFactor, retryable);
    }

    public RetryPolicy withInitialDelay(Duration initialDelay) {
        return new RetryPolicy(maxAttempts, backoffStrategy, initialDelay, maxDelay, jitterFactor, retryable);
    }

    public RetryPolicy withMaxDelay(Duration maxDelay) {
        return new RetryPolicy(maxAttempts, backoffStrategy, initialDelay, maxDelay, jitterFactor, retryable);
    }

    public RetryPolicy withJitterFactor(double jitterFactor) {
        return new RetryPolicy(maxAttempts, backoffStrategy, initialDelay, maxDelay, jitterFactor, retryable);
    }

    public RetryPolicy withRetryable(Predicate<Throwable> retryable) {
        return new RetryPolicy(maxAttempts, backoffStrategy, initialDelay, maxDelay, jitterFactor, retryable);
    }
}
