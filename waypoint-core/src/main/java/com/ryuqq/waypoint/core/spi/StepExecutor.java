package com.ryuqq.waypoint.core.spi;

import com.ryuqq.waypoint.core.workflow.StepDefinition;

import java.util.Map;
import java.util.Optional;

/**
 * step의 실제 작업을 수행하는 SPI.
 *
 * <p>agent runtime 등 외부 실행기가 구현하며, 코어는 결과 또는 예외만 관찰합니다.
 * 취소는 협조적이므로 진행 중인 작업을 강제로 중단하지 않습니다.</p>
 *
 * @author Waypoint Team
 * @since 1.0.0
 */
public interface StepExecutor {

    /**
     * step 실행.
     *
     * @param step step 정의
     * @param inputs 참조가 해석된 입력 값
     * @return step 결과 (nullable)
     * @throws Exception 실행 실패 시 (분류되어 재시도 여부가 결정됨)
     */
    Object execute(StepDefinition step, Map<String, Object> inputs) throws Exception;

    /**
     * step별 fallback.
     *
     * @param step step 정의
     * @return fallback (기본값: 없음)
     */
    default Optional<Fallback<Object>> fallbackFor(StepDefinition step) {
        return Optional.empty();
    }
}
