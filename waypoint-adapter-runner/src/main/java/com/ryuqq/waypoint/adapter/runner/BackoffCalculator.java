package com.ryuqq.waypoint.adapter.runner;

import com.ryuqq.waypoint.core.retry.RetryPolicy;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Backoff with Jitter 계산기.
 *
 * <p>재시도 간격을 {@link RetryPolicy}의 전략에 따라 늘리되, Jitter를 추가하여
 * Thundering Herd Problem을 방지합니다.</p>
 *
 * <p><strong>알고리즘:</strong></p>
 * <pre>
 * base   = min(maxDelay, initialDelay * growth(attempt))
 * growth = 2^attempt (EXPONENTIAL) | attempt+1 (LINEAR) | 1 (FIXED)
 * jitter = base * jitterFactor * uniform(-1, 1)
 * delay  = max(0, base + jitter)
 * </pre>
 *
 * <p><strong>예시 (EXPONENTIAL, initialDelay=100ms, maxDelay=10s, jitterFactor=0.1):</strong></p>
 * <ul>
 *   <li>attempt=0: 100ms ± 10ms</li>
 *   <li>attempt=1: 200ms ± 20ms</li>
 *   <li>attempt=2: 400ms ± 40ms</li>
 *   <li>attempt=10: 102400ms → 10000ms ± 1000ms (maxDelay에서 cap)</li>
 * </ul>
 *
 * @author Waypoint Team
 * @since 1.0.0
 */
public class BackoffCalculator {

    private final DoubleSupplier random;

    /**
     * 기본 난수 공급자({@link ThreadLocalRandom})로 생성.
     */
    public BackoffCalculator() {
        this(() -> ThreadLocalRandom.current().nextDouble());
    }

    /**
     * 커스텀 난수 공급자로 생성.
     *
     * @param random [0.0, 1.0) 범위의 난수 공급자
     * @throws IllegalArgumentException random이 null인 경우
     */
    public BackoffCalculator(DoubleSupplier random) {
        if (random == null) {
            throw new IllegalArgumentException("random cannot be null");
        }
        this.random = random;
    }

    /**
     * 재시도 지연 시간 계산.
     *
     * @param policy 재시도 정책
     * @param attempt 방금 실패한 시도 번호 (0부터 시작)
     * @return 다음 시도 전 대기 시간
     * @throws IllegalArgumentException policy가 null이거나 attempt가 음수인 경우
     */
    public Duration calculate(RetryPolicy policy, int attempt) {
        if (policy == null) {
            throw new IllegalArgumentException("policy cannot be null");
        }
        if (attempt < 0) {
            throw new IllegalArgumentException("attempt cannot be negative (current: " + attempt + ")");
        }

        // 1. 전략별 증가 + maxDelay cap
        long baseMillis = policy.baseDelay(attempt).toMillis();

        // 2. ±jitter
        double spread = random.getAsDouble() * 2.0 - 1.0;
        long jitter = (long) (baseMillis * policy.jitterFactor() * spread);

        return Duration.ofMillis(Math.max(0L, baseMillis + jitter));
    }
}
