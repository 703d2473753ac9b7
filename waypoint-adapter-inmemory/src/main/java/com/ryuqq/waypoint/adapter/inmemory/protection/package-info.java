/**
 * In-Memory Circuit Breaker, Bulkhead와 이름별 레지스트리.
 *
 * <p>상태는 인스턴스 단위이며 프로세스 간에 공유되지 않습니다.</p>
 *
 * @author Waypoint Team
 * @since 1.0.0
 */
package com.ryuqq.waypoint.adapter.inmemory.protection;
