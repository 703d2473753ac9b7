package com.ryuqq.waypoint.adapter.inmemory.workflow;

import com.ryuqq.waypoint.core.spi.WorkflowDefinitionSource;
import com.ryuqq.waypoint.core.workflow.WorkflowDefinition;
import com.ryuqq.waypoint.core.workflow.WorkflowGraph;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory implementation of {@link WorkflowDefinitionSource}.
 *
 * <p>Definitions are validated with {@link WorkflowGraph#validate(WorkflowDefinition)} on
 * registration, so a registered workflow always has a valid step graph. Registering an id
 * again replaces the previous definition.</p>
 *
 * @author Waypoint Team
 * @since 1.0.0
 */
public class InMemoryWorkflowDefinitionSource implements WorkflowDefinitionSource {

    private final ConcurrentHashMap<String, WorkflowDefinition> definitions = new ConcurrentHashMap<>();

    public InMemoryWorkflowDefinitionSource register(WorkflowDefinition definition) {
        if (definition == null) {
            throw new IllegalArgumentException("definition cannot be null");
        }
        WorkflowGraph.validate(definition);
        definitions.put(definition.id(), definition);
        return this;
    }

    @Override
    public Optional<WorkflowDefinition> findById(String workflowId) {
        if (workflowId == null) {
            throw new IllegalArgumentException("workflowId cannot be null");
        }
        return Optional.ofNullable(definitions.get(workflowId));
    }

    public boolean remove(String workflowId) {
        return definitions.remove(workflowId) != null;
    }
}
