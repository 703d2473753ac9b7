package com.ryuqq.waypoint.application.resilience;

import com.ryuqq.waypoint.core.protection.CircuitBreakerState;
import com.ryuqq.waypoint.core.spi.Operation;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.doCallRealMethod;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * ResilienceCommand 디스패치 테스트.
 *
 * @author Waypoint Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("ResilienceCommand 테스트")
class ResilienceCommandTest {

    @Mock
    private ResilienceOrchestrator orchestrator;

    @Test
    @DisplayName("Execute 명령은 execute 로 전달된다")
    void execute_명령_전달() {
        // given
        Operation<String> operation = () -> "ok";
        ResilienceResult<String> expected = ResilienceResult.of("ok", 1);
        doCallRealMethod().when(orchestrator).handle(any());
        when(orchestrator.execute(eq(operation), eq("fetch"), isNull())).thenReturn(expected);

        // when
        ResilienceResult<String> result = orchestrator.handle(
            new ResilienceCommand.Execute<>(operation, "fetch", null));

        // then
        assertThat(result).isSameAs(expected);
    }

    @Test
    @DisplayName("조회 명령은 타입이 지정된 결과를 반환한다")
    void 조회_명령() {
        // given
        ResilienceMetricsSnapshot metrics = new ResilienceMetricsSnapshot(
            0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0,
            Duration.ZERO, Duration.ZERO, Duration.ZERO, Map.of(), Map.of());
        doCallRealMethod().when(orchestrator).handle(any());
        when(orchestrator.getCircuitState("fetch")).thenReturn(CircuitBreakerState.OPEN);
        when(orchestrator.getMetrics()).thenReturn(metrics);

        // when
        CircuitBreakerState state = orchestrator.handle(new ResilienceCommand.GetCircuitState("fetch"));
        ResilienceMetricsSnapshot snapshot = orchestrator.handle(new ResilienceCommand.GetMetrics());

        // then
        assertThat(state).isEqualTo(CircuitBreakerState.OPEN);
        assertThat(snapshot).isSameAs(metrics);
        assertThat(snapshot.successRate()).isZero();
    }

    @Test
    @DisplayName("리셋 명령은 해당 메서드를 호출한다")
    void 리셋_명령() {
        // given
        doCallRealMethod().when(orchestrator).handle(any());

        // when
        orchestrator.handle(new ResilienceCommand.ResetCircuit("fetch"));
        orchestrator.handle(new ResilienceCommand.ResetMetrics());

        // then
        verify(orchestrator).resetCircuit("fetch");
        verify(orchestrator).resetMetrics();
    }

    @Test
    @DisplayName("잘못된 명령 인자는 생성 시점에 거부된다")
    void 명령_검증() {
        assertThatThrownBy(() -> new ResilienceCommand.GetCircuitState(" "))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new ResilienceCommand.Execute<>(null, "fetch", null))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
