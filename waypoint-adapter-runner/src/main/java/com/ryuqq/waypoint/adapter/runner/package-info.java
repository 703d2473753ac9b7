/**
 * Runner Adapter Layer - 보호 실행과 워크플로우 실행 구현체.
 *
 * <h2>구현체</h2>
 * <ul>
 *   <li>{@link com.ryuqq.waypoint.adapter.runner.DefaultResilienceOrchestrator} - Bulkhead, 재시도, Circuit Breaker, 제한 시간, fallback 합성</li>
 *   <li>{@link com.ryuqq.waypoint.adapter.runner.RetryManager} - 재시도 루프와 시도 기록</li>
 *   <li>{@link com.ryuqq.waypoint.adapter.runner.WorkflowRunner} - DAG 순서 step 실행, 승인 게이트, 실패 정책</li>
 *   <li>{@link com.ryuqq.waypoint.adapter.runner.ApprovalExpirySweeper} - 만료된 승인 요청 주기적 정리</li>
 * </ul>
 *
 * <h2>아키텍처 위치</h2>
 * <pre>
 * adapter-runner (DefaultResilienceOrchestrator, WorkflowRunner)
 *   ↓ implements
 * application (ResilienceOrchestrator, WorkflowDriver, ApprovalManager)
 *   ↓ depends on
 * core (RetryPolicy, CircuitBreaker, Bulkhead, WorkflowDefinition)
 *   ↑ uses
 * adapter-inmemory (CircuitBreakerRegistry, BulkheadRegistry)
 * </pre>
 *
 * @author Waypoint Team
 * @since 1.0.0
 */
package com.ryuqq.waypoint.adapter.runner;
