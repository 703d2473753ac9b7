package com.ryuqq.waypoint.core.workflow;

import com.ryuqq.waypoint.core.exception.WorkflowValidationException;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * step 의존성 그래프 연산.
 *
 * @author Waypoint Team
 * @since 1.0.0
 */
public final class WorkflowGraph {

    private WorkflowGraph() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 실행 가능한 그래프인지 검증.
     *
     * @param definition 워크플로우 정의
     * @throws WorkflowValidationException step 없음, 중복 id, 알 수 없는 의존성, 순환 의존성
     */
    public static void validate(WorkflowDefinition definition) {
        if (definition == null) {
            throw new IllegalArgumentException("definition cannot be null");
        }
        if (definition.steps().isEmpty()) {
            throw new WorkflowValidationException(definition.id(), "workflow has no steps");
        }
        Set<String> ids = new HashSet<>();
        for (StepDefinition step : definition.steps()) {
            if (!ids.add(step.id())) {
                throw new WorkflowValidationException(definition.id(), "duplicate step id '" + step.id() + "'");
            }
        }
        for (StepDefinition step : definition.steps()) {
            for (String dependency : step.dependsOn()) {
                if (!ids.contains(dependency)) {
                    throw new WorkflowValidationException(
                        definition.id(), "step '" + step.id() + "' depends on unknown step '" + dependency + "'"
                    );
                }
            }
        }
        List<String> order = topologicalOrder(definition);
        if (order.size() != definition.steps().size()) {
            Set<String> cyclic = new LinkedHashSet<>(ids);
            order.forEach(cyclic::remove);
            throw new WorkflowValidationException(definition.id(), "cyclic dependency among steps " + cyclic);
        }
    }

    /**
     * 의존성 순서대로 정렬된 step ID.
     *
     * <p>순환이 있으면 순환에 포함된 step은 결과에서 빠집니다.</p>
     *
     * @param definition 워크플로우 정의
     * @return 정렬된 step ID 목록
     */
    public static List<String> topologicalOrder(WorkflowDefinition definition) {
        Map<String, Integer> inDegree = new LinkedHashMap<>();
        Map<String, List<String>> dependents = new HashMap<>();
        for (StepDefinition step : definition.steps()) {
            inDegree.put(step.id(), step.dependsOn().size());
            for (String dependency : step.dependsOn()) {
                dependents.computeIfAbsent(dependency, key -> new ArrayList<>()).add(step.id());
            }
        }

        Deque<String> ready = new ArrayDeque<>();
        inDegree.forEach((id, degree) -> {
            if (degree == 0) {
                ready.add(id);
            }
        });

        List<String> order = new ArrayList<>();
        while (!ready.isEmpty()) {
            String id = ready.poll();
            order.add(id);
            for (String dependent : dependents.getOrDefault(id, List.of())) {
                int remaining = inDegree.merge(dependent, -1, Integer::sum);
                if (remaining == 0) {
                    ready.add(dependent);
                }
            }
        }
        return order;
    }

    /**
     * 주어진 step에 직접 또는 간접적으로 의존하는 모든 step.
     *
     * @param definition 워크플로우 정의
     * @param stepId 기준 step ID
     * @return 하위 step ID 집합 (기준 step 제외)
     */
    public static Set<String> downstreamOf(WorkflowDefinition definition, String stepId) {
        Set<String> result = new LinkedHashSet<>();
        Deque<String> queue = new ArrayDeque<>();
        queue.add(stepId);
        while (!queue.isEmpty()) {
            String current = queue.poll();
            for (StepDefinition step : definition.steps()) {
                if (step.dependsOn().contains(current) && result.add(step.id())) {
                    queue.add(step.id());
                }
            }
        }
        return result;
    }
}
