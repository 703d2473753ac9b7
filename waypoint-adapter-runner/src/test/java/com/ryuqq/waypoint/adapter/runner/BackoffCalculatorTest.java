package com.ryuqq.waypoint.adapter.runner;

import com.ryuqq.waypoint.core.retry.BackoffStrategy;
import com.ryuqq.waypoint.core.retry.RetryPolicy;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * BackoffCalculator 유닛 테스트.
 *
 * @author Waypoint Team
 * @since 1.0.0
 */
@DisplayName("BackoffCalculator 테스트")
class BackoffCalculatorTest {

    private static final RetryPolicy EXPONENTIAL = RetryPolicy.defaults();

    @ParameterizedTest(name = "attempt={0} → {1}ms")
    @CsvSource({"0, 100", "1, 200", "2, 400", "3, 800", "10, 10000"})
    @DisplayName("jitter 0이면 지수 증가 후 maxDelay에서 cap")
    void 지수_증가와_cap(int attempt, long expectedMillis) {
        // given: random 0.5 → spread 0
        BackoffCalculator calculator = new BackoffCalculator(() -> 0.5);

        // when
        Duration delay = calculator.calculate(EXPONENTIAL, attempt);

        // then
        assertThat(delay).isEqualTo(Duration.ofMillis(expectedMillis));
    }

    @Test
    @DisplayName("jitter는 기본 지연의 ±jitterFactor 범위")
    void jitter_범위() {
        // given
        BackoffCalculator low = new BackoffCalculator(() -> 0.0);
        BackoffCalculator high = new BackoffCalculator(() -> 0.999999);

        // when
        Duration lowDelay = low.calculate(EXPONENTIAL, 2);
        Duration highDelay = high.calculate(EXPONENTIAL, 2);

        // then (base 400ms, jitter 0.1)
        assertThat(lowDelay).isEqualTo(Duration.ofMillis(360));
        assertThat(highDelay).isBetween(Duration.ofMillis(439), Duration.ofMillis(440));
    }

    @Test
    @DisplayName("기본 random으로도 항상 범위 안")
    void 기본_random_범위() {
        BackoffCalculator calculator = new BackoffCalculator();

        for (int i = 0; i < 200; i++) {
            assertThat(calculator.calculate(EXPONENTIAL, 1))
                .isBetween(Duration.ofMillis(180), Duration.ofMillis(220));
        }
    }

    @Test
    @DisplayName("LINEAR, FIXED 전략")
    void 선형_고정() {
        BackoffCalculator calculator = new BackoffCalculator(() -> 0.5);
        RetryPolicy linear = EXPONENTIAL.withBackoffStrategy(BackoffStrategy.LINEAR);

        assertThat(calculator.calculate(linear, 2)).isEqualTo(Duration.ofMillis(300));
        assertThat(calculator.calculate(RetryPolicy.fixed(3, Duration.ofMillis(250)), 5))
            .isEqualTo(Duration.ofMillis(250));
    }

    @Test
    @DisplayName("지연은 음수가 되지 않음")
    void 음수_아님() {
        BackoffCalculator calculator = new BackoffCalculator(() -> 0.0);
        RetryPolicy fullJitter = RetryPolicy.fixed(3, Duration.ofMillis(100)).withJitterFactor(1.0);

        assertThat(calculator.calculate(fullJitter, 0)).isEqualTo(Duration.ZERO);
    }

    @Test
    @DisplayName("음수 attempt나 null policy는 거부")
    void 인자_검증() {
        BackoffCalculator calculator = new BackoffCalculator();

        assertThatThrownBy(() -> calculator.calculate(EXPONENTIAL, -1))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("-1");
        assertThatThrownBy(() -> calculator.calculate(null, 0))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
