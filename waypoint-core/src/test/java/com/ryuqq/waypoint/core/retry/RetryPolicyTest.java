package com.ryuqq.waypoint.core.retry;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.EnumSet;

import static org.junit.jupiter.api.Assertions.*;

/**
 * RetryPolicy 테스트.
 *
 * @author Waypoint Team
 * @since 1.0.0
 */
@DisplayName("RetryPolicy 테스트")
class RetryPolicyTest {

    @Test
    @DisplayName("EXPONENTIAL 기본 지연은 min(maxDelay, initialDelay × 2^n) 이다")
    void exponential_기본_지연_공식() {
        // given
        RetryPolicy policy = new RetryPolicy(10, BackoffStrategy.EXPONENTIAL,
            Duration.ofMillis(100), Duration.ofMillis(5_000), 0.0, e -> true);

        // when & then
        for (int n = 0; n < 10; n++) {
            long expected = Math.min(5_000L, 100L * (1L << n));
            assertEquals(Duration.ofMillis(expected), policy.baseDelay(n), "attempt " + n);
        }
    }

    @Test
    @DisplayName("LINEAR 와 FIXED 의 증가 배수")
    void linear_fixed_배수() {
        // given
        RetryPolicy linear = new RetryPolicy(5, BackoffStrategy.LINEAR,
            Duration.ofMillis(200), Duration.ofSeconds(10), 0.0, e -> true);
        RetryPolicy fixed = RetryPolicy.fixed(5, Duration.ofMillis(100));

        // when & then
        assertEquals(Duration.ofMillis(200), linear.baseDelay(0));
        assertEquals(Duration.ofMillis(600), linear.baseDelay(2));
        assertEquals(Duration.ofMillis(100), fixed.baseDelay(0));
        assertEquals(Duration.ofMillis(100), fixed.baseDelay(4));
    }

    @Test
    @DisplayName("기본 정책은 3회, EXPONENTIAL, 100ms ~ 10s 이다")
    void 기본_정책_값() {
        // when
        RetryPolicy policy = RetryPolicy.defaults();

        // then
        assertEquals(3, policy.maxAttempts());
        assertEquals(BackoffStrategy.EXPONENTIAL, policy.backoffStrategy());
        assertEquals(Duration.ofMillis(100), policy.initialDelay());
        assertEquals(Duration.ofSeconds(10), policy.maxDelay());
    }

    @Test
    @DisplayName("프리셋별 시도 횟수와 전략")
    void 프리셋_값() {
        assertEquals(5, RetryPolicy.aggressive().maxAttempts());
        assertEquals(BackoffStrategy.LINEAR, RetryPolicy.conservative().backoffStrategy());
        assertEquals(2, RetryPolicy.conservative().maxAttempts());
        assertEquals(1, RetryPolicy.noRetry().maxAttempts());
    }

    @Test
    @DisplayName("transientOnly 정책은 TRANSIENT, TIMEOUT 만 재시도한다")
    void transientOnly_재시도_판정() {
        // given
        RetryPolicy policy = RetryPolicy.transientOnly();

        // when & then
        assertTrue(policy.isRetryable(new RuntimeException("503 Service Unavailable")));
        assertTrue(policy.isRetryable(new RuntimeException("request timed out")));
        assertFalse(policy.isRetryable(new RuntimeException("quota exhausted")));
        assertFalse(policy.isRetryable(new RuntimeException("something odd")));
    }

    @Test
    @DisplayName("기본 판정은 VALIDATION, PERMANENT 를 재시도하지 않는다")
    void 기본_판정() {
        // given
        RetryPolicy policy = RetryPolicy.defaults();

        // when & then
        assertFalse(policy.isRetryable(new IllegalArgumentException("bad input")));
        assertFalse(policy.isRetryable(new RuntimeException("403 Forbidden")));
        assertTrue(policy.isRetryable(new RuntimeException("connection reset")));
    }

    @Test
    @DisplayName("onlyCategories 판정")
    void onlyCategories_판정() {
        // given
        RetryPolicy policy = RetryPolicy.defaults()
            .withRetryable(RetryPolicy.onlyCategories(EnumSet.of(ErrorCategory.RESOURCE)));

        // when & then
        assertTrue(policy.isRetryable(new RuntimeException("quota exceeded")));
        assertFalse(policy.isRetryable(new RuntimeException("connection reset")));
    }

    @Test
    @DisplayName("잘못된 값은 생성 시점에 거부된다")
    void 잘못된_값_검증() {
        assertThrows(IllegalArgumentException.class, () -> RetryPolicy.defaults().withMaxAttempts(0));
        assertThrows(IllegalArgumentException.class, () -> RetryPolicy.defaults().withJitterFactor(1.5));
        assertThrows(IllegalArgumentException.class, () -> RetryPolicy.defaults().withMaxDelay(Duration.ofMillis(10)));
        assertThrows(IllegalArgumentException.class, () -> RetryPolicy.defaults().withRetryable(null));
        assertThrows(IllegalArgumentException.class, () -> BackoffStrategy.EXPONENTIAL.multiplier(-1));
    }

    @Test
    @DisplayName("RetryResult 는 실패 시 마지막 예외를 요구한다")
    void retryResult_검증() {
        // when
        RetryResult<String> ok = RetryResult.succeeded("v", 3, Duration.ofMillis(200));

        // then
        assertTrue(ok.success());
        assertEquals(2, ok.retries());
        assertThrows(IllegalArgumentException.class,
            () -> new RetryResult<>(false, null, null, 1, Duration.ZERO));
    }
}
