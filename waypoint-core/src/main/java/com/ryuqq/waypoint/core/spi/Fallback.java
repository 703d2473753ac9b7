package com.ryuqq.waypoint.core.spi;

/**
 * 보호 실행이 최종 실패했을 때 대체 결과를 만드는 함수.
 *
 * <p>재시도 소진, 재시도 불가 실패, Circuit OPEN, Bulkhead 포화 시 호출되며
 * 실패 원인을 전달받습니다.</p>
 *
 * @param <T> 결과 타입
 * @author Waypoint Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface Fallback<T> {

    /**
     * 대체 결과 생성.
     *
     * @param cause 최종 실패 원인
     * @return 대체 결과
     * @throws Exception fallback 자체가 실패한 경우
     */
    T apply(Throwable cause) throws Exception;
}
