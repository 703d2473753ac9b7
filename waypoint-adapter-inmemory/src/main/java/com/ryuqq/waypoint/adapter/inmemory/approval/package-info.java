/**
 * ConcurrentHashMap 기반 {@link com.ryuqq.waypoint.core.spi.ApprovalStore} 구현.
 *
 * <p>프로세스 재시작 시 데이터가 사라집니다. 테스트와 단일 인스턴스 배포용입니다.</p>
 *
 * @author Waypoint Team
 * @since 1.0.0
 */
package com.ryuqq.waypoint.adapter.inmemory.approval;
