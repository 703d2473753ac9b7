package com.ryuqq.waypoint.core.workflow;

import com.ryuqq.waypoint.core.exception.WorkflowValidationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * WorkflowGraph 테스트.
 *
 * @author Waypoint Team
 * @since 1.0.0
 */
@DisplayName("WorkflowGraph 테스트")
class WorkflowGraphTest {

    @Test
    @DisplayName("의존성 순서대로 정렬된다")
    void topologicalOrder_의존성_순서() {
        // given
        WorkflowDefinition definition = WorkflowDefinition.of("wf",
            StepDefinition.of("report").withDependsOn("fetch", "enrich"),
            StepDefinition.of("enrich").withDependsOn("fetch"),
            StepDefinition.of("fetch"));

        // when
        List<String> order = WorkflowGraph.topologicalOrder(definition);

        // then
        assertEquals(List.of("fetch", "enrich", "report"), order);
        assertDoesNotThrow(() -> WorkflowGraph.validate(definition));
    }

    @Test
    @DisplayName("step 이 없으면 검증에 실패한다")
    void validate_step_없음() {
        // given
        WorkflowDefinition definition = WorkflowDefinition.of("empty");

        // when & then
        WorkflowValidationException exception = assertThrows(WorkflowValidationException.class,
            () -> WorkflowGraph.validate(definition));
        assertEquals("empty", exception.getWorkflowId());
    }

    @Test
    @DisplayName("중복 id, 알 수 없는 의존성은 검증에 실패한다")
    void validate_중복_미존재() {
        WorkflowDefinition duplicated = WorkflowDefinition.of("wf", StepDefinition.of("a"), StepDefinition.of("a"));
        WorkflowDefinition unknown = WorkflowDefinition.of("wf", StepDefinition.of("a").withDependsOn("ghost"));

        WorkflowValidationException e1 = assertThrows(WorkflowValidationException.class,
            () -> WorkflowGraph.validate(duplicated));
        WorkflowValidationException e2 = assertThrows(WorkflowValidationException.class,
            () -> WorkflowGraph.validate(unknown));

        assertTrue(e1.getMessage().contains("duplicate step id 'a'"));
        assertTrue(e2.getMessage().contains("unknown step 'ghost'"));
    }

    @Test
    @DisplayName("순환 의존성은 검증에 실패한다")
    void validate_순환() {
        // given
        WorkflowDefinition definition = WorkflowDefinition.of("wf",
            StepDefinition.of("root"),
            StepDefinition.of("a").withDependsOn("root", "c"),
            StepDefinition.of("b").withDependsOn("a"),
            StepDefinition.of("c").withDependsOn("b"));

        // when & then
        WorkflowValidationException exception = assertThrows(WorkflowValidationException.class,
            () -> WorkflowGraph.validate(definition));
        assertTrue(exception.getMessage().contains("cyclic dependency"));
        assertFalse(exception.getMessage().contains("root"));
    }

    @Test
    @DisplayName("downstreamOf 는 간접 의존 step 까지 포함한다")
    void downstreamOf_간접_의존() {
        // given
        WorkflowDefinition definition = WorkflowDefinition.of("wf",
            StepDefinition.of("a"),
            StepDefinition.of("b").withDependsOn("a"),
            StepDefinition.of("c").withDependsOn("b"),
            StepDefinition.of("d"));

        // when & then
        assertEquals(Set.of("b", "c"), WorkflowGraph.downstreamOf(definition, "a"));
        assertEquals(Set.of(), WorkflowGraph.downstreamOf(definition, "d"));
    }

    @Test
    @DisplayName("정의의 기본값: 이름은 id, 실패 정책은 FAIL_FAST, 승인 없음")
    void 정의_기본값() {
        // when
        WorkflowDefinition definition = WorkflowDefinition.of("wf", StepDefinition.of("a"));

        // then
        assertEquals("wf", definition.name());
        assertEquals(FailurePolicy.FAIL_FAST, definition.failurePolicy());
        assertFalse(definition.findStep("a").orElseThrow().requiresApproval());
        assertTrue(definition.findStep("missing").isEmpty());
    }
}
