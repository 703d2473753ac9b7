package com.ryuqq.waypoint.core.workflow;

import java.util.List;
import java.util.Optional;

/**
 * 워크플로우 정의 (step 그래프와 실패 정책).
 *
 * <p>그래프 유효성은 {@link WorkflowGraph#validate(WorkflowDefinition)}에서 검증합니다.</p>
 *
 * @param id 워크플로우 ID
 * @param name 표시 이름
 * @param steps step 목록
 * @param failurePolicy 실패 정책 (기본값 FAIL_FAST)
 * @author Waypoint Team
 * @since 1.0.0
 */
public record WorkflowDefinition(
    String id,
    String name,
    List<StepDefinition> steps,
    FailurePolicy failurePolicy
) {

    public WorkflowDefinition {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id cannot be null or blank");
        }
        if (name == null || name.isBlank()) {
            name = id;
        }
        steps = steps == null ? List.of() : List.copyOf(steps);
        if (failurePolicy == null) {
            failurePolicy = FailurePolicy.FAIL_FAST;
        }
    }

    public static WorkflowDefinition of(String id, StepDefinition... steps) {
        return new WorkflowDefinition(id, id, List.of(steps), FailurePolicy.FAIL_FAST);
    }

    public WorkflowDefinition withFailurePolicy(FailurePolicy failurePolicy) {
        return new WorkflowDefinition(id, name, steps, failurePolicy);
    }

    public Optional<StepDefinition> findStep(String stepId) {
        return steps.stream().filter(step -> step.id().equals(stepId)).findFirst();
    }
}
