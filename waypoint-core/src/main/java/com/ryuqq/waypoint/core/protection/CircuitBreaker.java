package com.ryuqq.waypoint.core.protection;

import com.ryuqq.waypoint.core.exception.CircuitOpenException;
import com.ryuqq.waypoint.core.spi.Operation;

import java.time.Duration;

/**
 * Circuit Breaker SPI.
 *
 * <p>하나의 Operation 이름에 대한 실패/성공을 추적하고, 임계값 초과 시
 * Operation을 호출하지 않고 빠르게 실패(Fail-Fast)하여 장애 전파를 막습니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * CircuitBreaker cb = registry.get("fetch-report");
 *
 * try {
 *     Report report = cb.call(() -> client.fetch(id));
 * } catch (CircuitOpenException e) {
 *     // Operation은 호출되지 않았음
 *     scheduleLater(e.getRetryAfter());
 * }
 * }</pre>
 *
 * <p><strong>구현 요구사항:</strong></p>
 * <ul>
 *   <li>상태 변경은 breaker별 lock으로 직렬화</li>
 *   <li>Operation 실행은 lock 밖에서 수행</li>
 * </ul>
 *
 * @author Waypoint Team
 * @since 1.0.0
 */
public interface CircuitBreaker {

    /**
     * 보호 대상 Operation 이름.
     *
     * @return Operation 이름
     */
    String getName();

    /**
     * Circuit Breaker 통과 허용 여부 확인.
     *
     * <ul>
     *   <li>CLOSED, HALF_OPEN: true</li>
     *   <li>OPEN이고 recoveryTimeout 미경과: false (거부 횟수 증가)</li>
     * </ul>
     *
     * @return true: 요청 통과 허용, false: 요청 차단
     */
    boolean tryAcquire();

    /**
     * 실행 성공 기록.
     *
     * <ul>
     *   <li>CLOSED: failureCount를 0으로 리셋</li>
     *   <li>HALF_OPEN: 연속 성공 임계값 도달 시 CLOSED로 전이</li>
     * </ul>
     */
    void recordSuccess();

    /**
     * 실행 실패 기록.
     *
     * <ul>
     *   <li>CLOSED: failureCount 증가 후 임계값 도달 시 OPEN으로 전이</li>
     *   <li>HALF_OPEN: 즉시 OPEN으로 전이 (openedAt 갱신)</li>
     * </ul>
     *
     * @param throwable 발생한 예외
     */
    void recordFailure(Throwable throwable);

    /**
     * 현재 상태 조회.
     *
     * <p>OPEN 상태에서 recoveryTimeout이 경과했다면 HALF_OPEN을 반환합니다.</p>
     *
     * @return CLOSED, OPEN, HALF_OPEN 중 하나
     */
    CircuitBreakerState getState();

    /**
     * HALF_OPEN 전환까지 남은 시간.
     *
     * @return OPEN이 아니면 {@link Duration#ZERO}
     */
    Duration getRetryAfter();

    /**
     * 상태와 누적 카운터 스냅샷.
     *
     * @return 스냅샷
     */
    CircuitBreakerSnapshot snapshot();

    /**
     * CLOSED 상태로 강제 리셋. 모든 카운터가 초기화됩니다.
     */
    void reset();

    /**
     * Circuit Breaker를 거쳐 Operation 실행.
     *
     * <p>Operation은 lock 밖에서 실행되며, 결과에 따라
     * {@link #recordSuccess()} 또는 {@link #recordFailure(Throwable)}가 기록됩니다.</p>
     *
     * @param operation 실행할 Operation
     * @param <T> 결과 타입
     * @return Operation 결과
     * @throws CircuitOpenException OPEN 상태여서 Operation을 호출하지 않은 경우
     * @throws Exception Operation이 던진 예외
     */
    default <T> T call(Operation<T> operation) throws Exception {
        if (operation == null) {
            throw new IllegalArgumentException("operation cannot be null");
        }
        if (!tryAcquire()) {
            throw new CircuitOpenException(getName(), getRetryAfter());
        }
        T result;
        try {
            result = operation.execute();
        } catch (Exception e) {
            recordFailure(e);
            throw e;
        }
        recordSuccess();
        return result;
    }
}
