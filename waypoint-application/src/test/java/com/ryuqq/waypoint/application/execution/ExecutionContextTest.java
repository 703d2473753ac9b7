package com.ryuqq.waypoint.application.execution;

import com.ryuqq.waypoint.application.approval.SettableClock;
import com.ryuqq.waypoint.core.statemachine.ExecutionStatus;
import com.ryuqq.waypoint.core.statemachine.StepStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * ExecutionContext 상태 전이 테스트.
 *
 * @author Waypoint Team
 * @since 1.0.0
 */
@DisplayName("ExecutionContext 테스트")
class ExecutionContextTest {

    private SettableClock clock;
    private ExecutionContext context;

    @BeforeEach
    void setUp() {
        clock = new SettableClock(Instant.parse("2026-01-01T00:00:00Z"));
        context = new ExecutionContext("wf", "exec-1", Map.of("customer", "c-1"), clock);
    }

    @Test
    @DisplayName("start → awaitApproval → resumeFromApproval 시나리오")
    void 승인_대기_후_재개() {
        // when
        context.start();
        context.awaitApproval("s1", "a1");

        // then
        assertThat(context.getStatus()).isEqualTo(ExecutionStatus.AWAITING_APPROVAL);
        assertThat(context.getCurrentStep()).isEqualTo("s1");
        assertThat(context.getPendingApprovalId()).isEqualTo("a1");
        assertThat(context.getStepStatus("s1")).isEqualTo(StepStatus.AWAITING_APPROVAL);

        // when
        context.resumeFromApproval();

        // then
        assertThat(context.getStatus()).isEqualTo(ExecutionStatus.RUNNING);
        assertThat(context.getPendingApprovalId()).isNull();
    }

    @Test
    @DisplayName("승인 대기 중에 두 번째 승인 대기는 허용되지 않는다")
    void 승인_대기는_하나만() {
        // given
        context.start();
        context.awaitApproval("s1", "a1");

        // when & then
        assertThatThrownBy(() -> context.awaitApproval("s2", "a2"))
            .isInstanceOf(IllegalStateException.class);
        assertThat(context.getPendingApprovalId()).isEqualTo("a1");
    }

    @Test
    @DisplayName("시작 전에는 승인 대기와 재개를 할 수 없다")
    void 시작_전_전이_불가() {
        assertThatThrownBy(() -> context.awaitApproval("s1", "a1")).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(context::resumeFromApproval).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> context.complete(Map.of())).isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("완료 시 출력과 실행 시간이 기록되고 종료 Future가 완료된다")
    void 완료_기록() {
        // given
        context.start();
        clock.advance(Duration.ofSeconds(3));

        // when
        context.recordStepResult("s1", "report");
        context.complete(Map.of("s1", "report"));

        // then
        assertThat(context.isTerminal()).isTrue();
        assertThat(context.getOutputs()).containsEntry("s1", "report");
        assertThat(context.getDuration()).contains(Duration.ofSeconds(3));
        assertThat(context.termination()).isCompletedWithValue(ExecutionStatus.COMPLETED);
    }

    @Test
    @DisplayName("종료 상태는 흡수 상태다: 이후의 전이는 거부되고 기록은 무시된다")
    void 종료_상태_흡수() {
        // given
        context.start();
        context.fail("s1", new RuntimeException("boom"));

        // when
        boolean recorded = context.recordStepResult("s2", "late");
        boolean cancelled = context.cancel();

        // then
        assertThat(recorded).isFalse();
        assertThat(cancelled).isFalse();
        assertThat(context.getStatus()).isEqualTo(ExecutionStatus.FAILED);
        assertThat(context.hasStepResult("s2")).isFalse();
        assertThat(context.getLastError()).hasValueSatisfying(error -> {
            assertThat(error.stepId()).isEqualTo("s1");
            assertThat(error.message()).isEqualTo("boom");
        });
        assertThatThrownBy(context::start).isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("승인 대기 중 취소하면 대기 중 승인 ID가 비워지고 미완료 step은 CANCELLED 가 된다")
    void 승인_대기_중_취소() {
        // given
        context.start();
        context.markStep("s0", StepStatus.RUNNING);
        context.awaitApproval("s1", "a1");

        // when
        boolean cancelled = context.cancel();

        // then
        assertThat(cancelled).isTrue();
        assertThat(context.getStatus()).isEqualTo(ExecutionStatus.CANCELLED);
        assertThat(context.getPendingApprovalId()).isNull();
        assertThat(context.getStepStatuses())
            .containsEntry("s0", StepStatus.CANCELLED)
            .containsEntry("s1", StepStatus.CANCELLED);
    }

    @Test
    @DisplayName("승인 대기 중 실패하면 대기 중 승인 ID가 비워지고 미완료 step은 CANCELLED 가 된다")
    void 승인_대기_중_실패() {
        // given
        context.start();
        context.markStep("s0", StepStatus.RUNNING);
        context.awaitApproval("s1", "a1");
        context.markStep("s0", StepStatus.FAILED);

        // when
        context.fail("s0", new IllegalArgumentException("invalid payload"));

        // then
        assertThat(context.getStatus()).isEqualTo(ExecutionStatus.FAILED);
        assertThat(context.getPendingApprovalId()).isNull();
        assertThat(context.getStepStatuses())
            .containsEntry("s0", StepStatus.FAILED)
            .containsEntry("s1", StepStatus.CANCELLED);
    }

    @Test
    @DisplayName("승인 대기 중 다른 step이 RUNNING 이 되어도 currentStep 은 승인 대상 step 을 가리킨다")
    void 승인_대기_중_currentStep_유지() {
        // given
        context.start();
        context.awaitApproval("s1", "a1");

        // when
        context.markStep("s2", StepStatus.RUNNING);

        // then
        assertThat(context.getCurrentStep()).isEqualTo("s1");
        assertThat(context.getStepStatus("s2")).isEqualTo(StepStatus.RUNNING);

        // when
        context.resumeFromApproval();
        context.markStep("s1", StepStatus.RUNNING);

        // then
        assertThat(context.getCurrentStep()).isEqualTo("s1");
    }

    @Test
    @DisplayName("step 실패 기록은 실행 상태를 바꾸지 않는다")
    void step_실패_기록() {
        // given
        context.start();

        // when
        context.recordStepFailure("s1", new IllegalStateException());

        // then
        assertThat(context.getStatus()).isEqualTo(ExecutionStatus.RUNNING);
        assertThat(context.getStepStatus("s1")).isEqualTo(StepStatus.FAILED);
        assertThat(context.getErrors()).singleElement()
            .satisfies(error -> assertThat(error.message()).isEqualTo("IllegalStateException"));
    }

    @Test
    @DisplayName("create 는 exec_ 접두사 ID를 만든다")
    void create_ID() {
        // when
        ExecutionContext created = ExecutionContext.create("wf", null, clock);

        // then
        assertThat(created.getExecutionId()).startsWith("exec_");
        assertThat(created.getStatus()).isEqualTo(ExecutionStatus.PENDING);
        assertThat(created.getInputs()).isEmpty();
        assertThat(created.getDuration()).isEmpty();
    }
}
