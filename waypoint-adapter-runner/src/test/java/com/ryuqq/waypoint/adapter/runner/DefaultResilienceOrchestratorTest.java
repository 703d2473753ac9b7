package com.ryuqq.waypoint.adapter.runner;

import com.ryuqq.waypoint.application.resilience.ResilienceCommand;
import com.ryuqq.waypoint.application.resilience.ResilienceConfig;
import com.ryuqq.waypoint.application.resilience.ResilienceResult;
import com.ryuqq.waypoint.core.exception.ResilienceException;
import com.ryuqq.waypoint.core.protection.CircuitBreakerConfig;
import com.ryuqq.waypoint.core.protection.CircuitBreakerState;
import com.ryuqq.waypoint.core.retry.RetryPolicy;
import com.ryuqq.waypoint.testkit.fixture.MutableClock;
import com.ryuqq.waypoint.testkit.fixture.RecordingSleeper;
import com.ryuqq.waypoint.testkit.fixture.ScriptedOperation;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

/**
 * DefaultResilienceOrchestrator 유닛 테스트.
 *
 * <p>계약 테스트가 다루지 않는 구현 세부사항을 검증합니다:</p>
 * <ul>
 *   <li>제한 시간이 없으면 시도 실행 스레드를 쓰지 않음</li>
 *   <li>재시도 이력은 Operation 이름으로 남음</li>
 *   <li>명령 객체 처리</li>
 *   <li>인스턴스 간 상태 독립</li>
 * </ul>
 *
 * @author Waypoint Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("DefaultResilienceOrchestrator 테스트")
class DefaultResilienceOrchestratorTest {

    @Mock
    private ExecutorService attemptExecutor;

    private MutableClock clock;
    private RecordingSleeper sleeper;
    private DefaultResilienceOrchestrator orchestrator;

    private final ResilienceConfig config = new ResilienceConfig()
        .withRetryPolicy(RetryPolicy.fixed(3, Duration.ofMillis(10)))
        .withCircuitBreaker(new CircuitBreakerConfig(2, Duration.ofSeconds(5), 1))
        .withTimeout(Duration.ZERO);

    @BeforeEach
    void setUp() {
        clock = MutableClock.create();
        sleeper = new RecordingSleeper(clock);
        orchestrator = new DefaultResilienceOrchestrator(config, sleeper, clock, new BackoffCalculator(() -> 0.5),
            attemptExecutor);
    }

    @AfterEach
    void tearDown() throws InterruptedException {
        orchestrator.shutdown();
    }

    @Test
    @DisplayName("백오프 대기 중 인터럽트되면 ResilienceException, 호출은 한 번 집계되고 인터럽트 플래그 유지")
    void 백오프_인터럽트_fallback_없음() {
        // given
        DefaultResilienceOrchestrator interrupting = interruptingOrchestrator();
        ScriptedOperation<String> operation = ScriptedOperation.failing(new IOException("connection reset"));

        // when & then
        assertThatThrownBy(() -> interrupting.execute(operation, "payment-api"))
            .isInstanceOf(ResilienceException.class)
            .satisfies(e -> assertThat(((ResilienceException) e).getAttempts()).isEqualTo(1));
        assertThat(Thread.interrupted()).isTrue();
        assertThat(interrupting.getMetrics().totalCalls()).isEqualTo(1);
        assertThat(interrupting.getMetrics().failedCalls()).isEqualTo(1);
    }

    @Test
    @DisplayName("백오프 대기 중 인터럽트되어도 fallback이 있으면 fallback 결과 반환")
    void 백오프_인터럽트_fallback_사용() {
        // given
        DefaultResilienceOrchestrator interrupting = interruptingOrchestrator();
        ScriptedOperation<String> operation = ScriptedOperation.failing(new IOException("connection reset"));

        // when
        ResilienceResult<String> result = interrupting.execute(operation, "payment-api", cause -> "cached");

        // then
        assertThat(Thread.interrupted()).isTrue();
        assertThat(result.result()).isEqualTo("cached");
        assertThat(result.usedFallback()).isTrue();
        assertThat(interrupting.getMetrics().totalCalls()).isEqualTo(1);
        assertThat(interrupting.getMetrics().fallbackCalls()).isEqualTo(1);
    }

    private DefaultResilienceOrchestrator interruptingOrchestrator() {
        return new DefaultResilienceOrchestrator(config, duration -> {
            throw new InterruptedException("shutdown requested");
        }, clock, new BackoffCalculator(() -> 0.5), attemptExecutor);
    }

    @Test
    @DisplayName("제한 시간이 0이면 호출 스레드에서 실행")
    void 제한_시간_없음_호출_스레드_실행() {
        // given
        Thread caller = Thread.currentThread();

        // when
        ResilienceResult<Thread> result = orchestrator.execute(Thread::currentThread, "inline");

        // then
        assertThat(result.result()).isSameAs(caller);
        verify(attemptExecutor, never()).execute(any());
    }

    @Test
    @DisplayName("재시도 이력은 Operation 이름으로 조회")
    void 재시도_이력() {
        // given
        ScriptedOperation<String> operation = ScriptedOperation.<String>script()
            .thenThrow(new IOException("connection reset"))
            .thenReturn("ok");

        // when
        orchestrator.execute(operation, "fetch");

        // then
        RetryContext context = orchestrator.getRetryManager().getRetryContext("", "", "fetch").orElseThrow();
        assertThat(context.getAttemptCount()).isEqualTo(2);
        assertThat(context.isSucceeded()).isTrue();
    }

    @Test
    @DisplayName("명령 객체로 실행, 조회, 리셋")
    void 명령_처리() {
        // given
        ScriptedOperation<String> failing = ScriptedOperation.failing(new IOException("connection reset"));

        // when
        assertThatThrownBy(() -> orchestrator.handle(new ResilienceCommand.Execute<>(failing, "cmd", null)))
            .isInstanceOf(Exception.class);
        CircuitBreakerState opened = orchestrator.handle(new ResilienceCommand.GetCircuitState("cmd"));
        orchestrator.handle(new ResilienceCommand.ResetCircuit("cmd"));
        orchestrator.handle(new ResilienceCommand.ResetMetrics());

        // then
        assertThat(opened).isEqualTo(CircuitBreakerState.OPEN);
        assertThat(orchestrator.handle(new ResilienceCommand.GetCircuitState("cmd"))).isEqualTo(CircuitBreakerState.CLOSED);
        assertThat(orchestrator.handle(new ResilienceCommand.GetMetrics()).totalCalls()).isZero();
    }

    @Test
    @DisplayName("인스턴스마다 Circuit Breaker와 메트릭이 독립")
    void 인스턴스_독립() throws InterruptedException {
        // given
        DefaultResilienceOrchestrator other = new DefaultResilienceOrchestrator(
            config.withRetryEnabled(false), sleeper, clock);
        ScriptedOperation<String> failing = ScriptedOperation.failing(new IOException("connection reset"));

        try {
            // when
            for (int i = 0; i < 2; i++) {
                assertThatThrownBy(() -> other.execute(failing, "shared-name")).isInstanceOf(ResilienceException.class);
            }

            // then
            assertThat(other.getCircuitState("shared-name")).isEqualTo(CircuitBreakerState.OPEN);
            assertThat(orchestrator.getCircuitState("shared-name")).isEqualTo(CircuitBreakerState.CLOSED);
            assertThat(orchestrator.getMetrics().totalCalls()).isZero();
        } finally {
            other.shutdown();
        }
    }

    @Test
    @DisplayName("Circuit Breaker 비활성화 시 실패가 누적되어도 CLOSED")
    void circuit_비활성화() {
        // given
        DefaultResilienceOrchestrator noBreaker = new DefaultResilienceOrchestrator(
            config.withCircuitBreakerEnabled(false).withRetryEnabled(false), sleeper, clock,
            new BackoffCalculator(), Executors.newSingleThreadExecutor());
        ScriptedOperation<String> failing = ScriptedOperation.failing(new IOException("connection reset"));

        try {
            // when
            for (int i = 0; i < 5; i++) {
                assertThatThrownBy(() -> noBreaker.execute(failing, "unguarded")).isInstanceOf(ResilienceException.class);
            }

            // then
            assertThat(failing.invocations()).isEqualTo(5);
            assertThat(noBreaker.getCircuitState("unguarded")).isEqualTo(CircuitBreakerState.CLOSED);
            assertThat(noBreaker.getCircuitSnapshot("unguarded")).isEmpty();
        } finally {
            try {
                noBreaker.shutdown();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }

    @Test
    @DisplayName("null config나 executor는 거부")
    void 생성자_검증() {
        assertThatThrownBy(() -> new DefaultResilienceOrchestrator(null))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new DefaultResilienceOrchestrator(config, sleeper, clock, new BackoffCalculator(), null))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
