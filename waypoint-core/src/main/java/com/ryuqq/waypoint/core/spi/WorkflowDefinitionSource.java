package com.ryuqq.waypoint.core.spi;

import com.ryuqq.waypoint.core.workflow.WorkflowDefinition;

import java.util.Optional;

/**
 * 읽기 전용 워크플로우 정의 저장소 SPI.
 *
 * @author Waypoint Team
 * @since 1.0.0
 */
public interface WorkflowDefinitionSource {

    /**
     * 워크플로우 정의 조회.
     *
     * @param workflowId 워크플로우 ID
     * @return 정의 (없으면 empty)
     */
    Optional<WorkflowDefinition> findById(String workflowId);
}
