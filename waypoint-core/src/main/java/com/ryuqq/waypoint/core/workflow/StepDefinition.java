package com.ryuqq.waypoint.core.workflow;

import com.ryuqq.waypoint.core.approval.ApprovalConfig;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 워크플로우 step 정의.
 *
 * <p>{@code inputs}의 문자열 값이 {@code $stepId}이면 해당 step의 결과로,
 * {@code $stepId.key}이면 결과 Map의 key 값으로 치환됩니다.</p>
 *
 * @param id step ID (워크플로우 안에서 유일, Operation 이름으로도 사용)
 * @param name 표시 이름
 * @param agentName 작업 주체 이름 (nullable)
 * @param dependsOn 선행 step ID 목록
 * @param inputs 입력 값
 * @param approval 승인 설정 (required=false이면 게이트 없음)
 * @author Waypoint Team
 * @since 1.0.0
 */
public record StepDefinition(
    String id,
    String name,
    String agentName,
    List<String> dependsOn,
    Map<String, Object> inputs,
    ApprovalConfig approval
) {

    public StepDefinition {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id cannot be null or blank");
        }
        if (name == null || name.isBlank()) {
            name = id;
        }
        dependsOn = dependsOn == null ? List.of() : List.copyOf(dependsOn);
        inputs = inputs == null
            ? Collections.emptyMap()
            : Collections.unmodifiableMap(new LinkedHashMap<>(inputs));
        if (approval == null) {
            approval = new ApprovalConfig();
        }
    }

    /**
     * 의존성, 입력, 승인 게이트 없는 step 생성.
     *
     * @param id step ID
     * @return step 정의
     */
    public static StepDefinition of(String id) {
        return new StepDefinition(id, id, null, List.of(), Map.of(), new ApprovalConfig());
    }

    public StepDefinition withName(String name) {
        return new StepDefinition(id, name, agentName, dependsOn, inputs, approval);
    }

    public StepDefinition withAgentName(String agentName) {
        return new StepDefinition(id, name, agentName, dependsOn, inputs, approval);
    }

    public StepDefinition withDependsOn(String... dependsOn) {
        return new StepDefinition(id, name, agentName, List.of(dependsOn), inputs, approval);
    }

    public StepDefinition withInputs(Map<String, Object> inputs) {
        return new StepDefinition(id, name, agentName, dependsOn, inputs, approval);
    }

    public StepDefinition withApproval(ApprovalConfig approval) {
        return new StepDefinition(id, name, agentName, dependsOn, inputs, approval);
    }

    public boolean requiresApproval() {
        return approval.required();
    }
}
