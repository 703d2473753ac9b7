package com.ryuqq.waypoint.application.resilience;

import com.ryuqq.waypoint.core.protection.CircuitBreakerState;
import com.ryuqq.waypoint.core.spi.Fallback;
import com.ryuqq.waypoint.core.spi.Operation;

/**
 * {@link ResilienceOrchestrator}에 보내는 명령.
 *
 * <p>API 계층은 문자열 action 대신 이 명령 중 하나를 만들어
 * {@link ResilienceOrchestrator#handle(ResilienceCommand)}로 전달합니다.</p>
 *
 * @param <R> 명령 결과 타입
 * @author Waypoint Team
 * @since 1.0.0
 */
public sealed interface ResilienceCommand<R> permits
    ResilienceCommand.Execute,
    ResilienceCommand.GetCircuitState,
    ResilienceCommand.ResetCircuit,
    ResilienceCommand.GetMetrics,
    ResilienceCommand.ResetMetrics {

    /**
     * 명령 실행.
     *
     * @param orchestrator 대상 orchestrator
     * @return 명령 결과
     */
    R applyTo(ResilienceOrchestrator orchestrator);

    /**
     * 보호 실행.
     */
    record Execute<T>(Operation<T> operation, String operationName, Fallback<T> fallback)
        implements ResilienceCommand<ResilienceResult<T>> {

        public Execute {
            if (operation == null) {
                throw new IllegalArgumentException("operation cannot be null");
            }
            if (operationName == null || operationName.isBlank()) {
                throw new IllegalArgumentException("operationName cannot be null or blank");
            }
        }

        @Override
        public ResilienceResult<T> applyTo(ResilienceOrchestrator orchestrator) {
            return orchestrator.execute(operation, operationName, fallback);
        }
    }

    record GetCircuitState(String operationName) implements ResilienceCommand<CircuitBreakerState> {

        public GetCircuitState {
            if (operationName == null || operationName.isBlank()) {
                throw new IllegalArgumentException("operationName cannot be null or blank");
            }
        }

        @Override
        public CircuitBreakerState applyTo(ResilienceOrchestrator orchestrator) {
            return orchestrator.getCircuitState(operationName);
        }
    }

    record ResetCircuit(String operationName) implements ResilienceCommand<Void> {

        public ResetCircuit {
            if (operationName == null || operationName.isBlank()) {
                throw new IllegalArgumentException("operationName cannot be null or blank");
            }
        }

        @Override
        public Void applyTo(ResilienceOrchestrator orchestrator) {
            orchestrator.resetCircuit(operationName);
            return null;
        }
    }

    record GetMetrics() implements ResilienceCommand<ResilienceMetricsSnapshot> {

        @Override
        public ResilienceMetricsSnapshot applyTo(ResilienceOrchestrator orchestrator) {
            return orchestrator.getMetrics();
        }
    }

    record ResetMetrics() implements ResilienceCommand<Void> {

        @Override
        public Void applyTo(ResilienceOrchestrator orchestrator) {
            orchestrator.resetMetrics();
            return null;
        }
    }
}
