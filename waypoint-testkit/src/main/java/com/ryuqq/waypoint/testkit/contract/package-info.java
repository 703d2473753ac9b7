/**
 * SPI와 포트 구현체가 지켜야 할 계약 테스트.
 *
 * <p>각 계약은 추상 클래스이며, 구현 모듈의 테스트가 상속해 팩토리 메서드만 제공합니다.</p>
 *
 * <pre>
 * class InMemoryCircuitBreakerContractTest extends CircuitBreakerContract {
 *     protected CircuitBreaker createCircuitBreaker(String name, CircuitBreakerConfig config, Clock clock) {
 *         return new InMemoryCircuitBreaker(name, config, clock);
 *     }
 * }
 * </pre>
 *
 * @author Waypoint Team
 * @since 1.0.0
 */
package com.ryuqq.waypoint.testkit.contract;
