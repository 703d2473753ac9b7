package com.ryuqq.waypoint.adapter.runner;

import com.ryuqq.waypoint.core.workflow.StepDefinition;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * step 입력 해석기.
 *
 * <p><strong>규칙:</strong></p>
 * <ol>
 *   <li>step의 정적 입력에 워크플로우 입력을 덮어씁니다</li>
 *   <li>{@code "$stepId"} 또는 {@code "$stepId.output"} 형태의 문자열은 해당 step의 결과로 바꿉니다</li>
 *   <li>아직 결과가 없는 step을 가리키는 참조는 문자열 그대로 둡니다</li>
 * </ol>
 *
 * @author Waypoint Team
 * @since 1.0.0
 */
public final class StepInputResolver {

    private static final String REFERENCE_PREFIX = "$";

    private StepInputResolver() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    public static Map<String, Object> resolve(
        StepDefinition step,
        Map<String, Object> workflowInputs,
        Map<String, Object> stepResults
    ) {
        if (step == null) {
            throw new IllegalArgumentException("step cannot be null");
        }
        Map<String, Object> merged = new LinkedHashMap<>(step.inputs());
        if (workflowInputs != null) {
            merged.putAll(workflowInputs);
        }

        Map<String, Object> resolved = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : merged.entrySet()) {
            resolved.put(entry.getKey(), resolveValue(entry.getValue(), stepResults));
        }
        return resolved;
    }

    private static Object resolveValue(Object value, Map<String, Object> stepResults) {
        if (!(value instanceof String text) || !text.startsWith(REFERENCE_PREFIX) || stepResults == null) {
            return value;
        }
        String reference = text.substring(REFERENCE_PREFIX.length());
        int dot = reference.indexOf('.');
        String stepId = dot < 0 ? reference : reference.substring(0, dot);
        return stepResults.containsKey(stepId) ? stepResults.get(stepId) : value;
    }
}
