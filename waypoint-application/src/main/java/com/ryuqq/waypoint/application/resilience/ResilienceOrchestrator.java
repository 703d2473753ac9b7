package com.ryuqq.waypoint.application.resilience;

import com.ryuqq.waypoint.core.exception.BulkheadFullException;
import com.ryuqq.waypoint.core.exception.CircuitOpenException;
import com.ryuqq.waypoint.core.exception.ResilienceException;
import com.ryuqq.waypoint.core.protection.CircuitBreakerSnapshot;
import com.ryuqq.waypoint.core.protection.CircuitBreakerState;
import com.ryuqq.waypoint.core.spi.Fallback;
import com.ryuqq.waypoint.core.spi.Operation;

import java.util.Optional;

/**
 * 재시도, Circuit Breaker, Bulkhead, 제한 시간, fallback을 하나의 호출로 합성하는 포트.
 *
 * <p><strong>실행 순서:</strong></p>
 * <ol>
 *   <li>Bulkhead 허용량 확보 (대기 없음, 실패 시 fallback 또는 {@link BulkheadFullException})</li>
 *   <li>재시도 루프: 매 시도는 Operation 이름의 Circuit Breaker를 거쳐 제한 시간 안에서 실행</li>
 *   <li>재시도 소진, 재시도 불가 실패, Circuit OPEN 시 fallback 실행</li>
 *   <li>모든 종료 경로에서 허용량 반환, 메트릭은 호출당 한 번 갱신</li>
 * </ol>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * ResilienceResult<Report> result = orchestrator.execute(
 *     () -> client.fetch(id),
 *     "fetch-report",
 *     cause -> Report.empty()
 * );
 * if (result.usedFallback()) {
 *     log.warn("degraded: {}", result.fallbackCause().getMessage());
 * }
 * }</pre>
 *
 * <p>Circuit Breaker 레지스트리와 메트릭은 구현 인스턴스가 소유합니다.
 * 인스턴스끼리 상태를 공유하지 않습니다.</p>
 *
 * @author Waypoint Team
 * @since 1.0.0
 */
public interface ResilienceOrchestrator {

    /**
     * 보호 실행.
     *
     * @param operation 실행할 Operation
     * @param operationName Circuit Breaker, Bulkhead, 메트릭 키
     * @param fallback 최종 실패 시 대체 결과 (nullable)
     * @param <T> 결과 타입
     * @return 실행 결과 (fallback이 성공하면 예외를 던지지 않음)
     * @throws BulkheadFullException 포화 상태이고 fallback이 없는 경우
     * @throws CircuitOpenException Circuit이 OPEN이어서 Operation을 호출하지 않았고 fallback이 없는 경우
     * @throws ResilienceException 최종 실패이고 fallback이 없거나 fallback도 실패한 경우
     */
    <T> ResilienceResult<T> execute(Operation<T> operation, String operationName, Fallback<T> fallback);

    /**
     * fallback 없이 보호 실행.
     *
     * @param operation 실행할 Operation
     * @param operationName Operation 이름
     * @param <T> 결과 타입
     * @return 실행 결과
     */
    default <T> ResilienceResult<T> execute(Operation<T> operation, String operationName) {
        return execute(operation, operationName, null);
    }

    /**
     * Circuit Breaker 상태 조회.
     *
     * @param operationName Operation 이름
     * @return 상태 (아직 호출된 적 없으면 CLOSED)
     */
    CircuitBreakerState getCircuitState(String operationName);

    /**
     * Circuit Breaker 스냅샷 조회.
     *
     * @param operationName Operation 이름
     * @return 스냅샷 (breaker가 생성되지 않았으면 empty)
     */
    Optional<CircuitBreakerSnapshot> getCircuitSnapshot(String operationName);

    /**
     * Circuit Breaker를 CLOSED로 리셋.
     *
     * @param operationName Operation 이름
     */
    void resetCircuit(String operationName);

    ResilienceMetricsSnapshot getMetrics();

    void resetMetrics();

    /**
     * 타입이 지정된 명령 처리.
     *
     * @param command 명령
     * @param <R> 명령 결과 타입
     * @return 명령 결과
     */
    default <R> R handle(ResilienceCommand<R> command) {
        if (command == null) {
            throw new IllegalArgumentException("command cannot be null");
        }
        return command.applyTo(this);
    }
}
