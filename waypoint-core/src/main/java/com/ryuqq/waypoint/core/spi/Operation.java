package com.ryuqq.waypoint.core.spi;

/**
 * 보호 대상 작업 단위.
 *
 * <p>step이 실제로 수행하는 일은 이 코어 밖(agent runtime 등)에서 제공되며,
 * 코어는 결과 또는 예외만 관찰합니다. checked 예외도 그대로 전파되어
 * {@link com.ryuqq.waypoint.core.retry.ErrorClassifier}에 의해 분류됩니다.</p>
 *
 * @param <T> 결과 타입
 * @author Waypoint Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface Operation<T> {

    /**
     * 작업 실행.
     *
     * @return 작업 결과
     * @throws Exception 작업 실패 시
     */
    T execute() throws Exception;
}
