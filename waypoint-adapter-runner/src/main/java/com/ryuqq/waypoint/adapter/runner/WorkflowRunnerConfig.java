package com.ryuqq.waypoint.adapter.runner;

import java.time.Duration;

/**
 * WorkflowRunner 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>maxParallelSteps: 동시에 실행되는 step 수 상한 (기본 4)</li>
 *   <li>approvalWaitGrace: 승인 요청 만료 시각 이후 추가로 기다리는 시간 (기본 5초)</li>
 *   <li>executionTimeout: 실행 전체 제한 시간 (기본 {@link Duration#ZERO} = 제한 없음)</li>
 * </ul>
 *
 * @param maxParallelSteps 동시 step 수 (1 이상)
 * @param approvalWaitGrace 승인 대기 여유 시간 (음수 불가)
 * @param executionTimeout 실행 제한 시간 (음수 불가, 0이면 제한 없음)
 * @author Waypoint Team
 * @since 1.0.0
 */
public record WorkflowRunnerConfig(
    int maxParallelSteps,
    Duration approvalWaitGrace,
    Duration executionTimeout
) {

    public WorkflowRunnerConfig() {
        this(4, Duration.ofSeconds(5), Duration.ZERO);
    }

    public WorkflowRunnerConfig {
        if (maxParallelSteps <= 0) {
            throw new IllegalArgumentException(
                "maxParallelSteps must be positive (current: " + maxParallelSteps + ")"
            );
        }
        if (approvalWaitGrace == null || approvalWaitGrace.isNegative()) {
            throw new IllegalArgumentException(
                "approvalWaitGrace cannot be null or negative (current: " + approvalWaitGrace + ")"
            );
        }
        if (executionTimeout == null || executionTimeout.isNegative()) {
            throw new IllegalArgumentException(
                "executionTimeout cannot be null or negative (current: " + executionTimeout + ")"
            );
        }
    }

    public boolean hasExecutionTimeout() {
        return !executionTimeout.isZero();
    }

    public WorkflowRunnerConfig withMaxParallelSteps(int maxParallelSteps) {
        return new WorkflowRunnerConfig(maxParallelSteps, approvalWaitGrace, executionTimeout);
    }

    public WorkflowRunnerConfig withApprovalWaitGrace(Duration approvalWaitGrace) {
        return new WorkflowRunnerConfig(maxParallelSteps, approvalWaitGrace, executionTimeout);
    }

    public WorkflowRunnerConfig withExecutionTimeout(Duration executionTimeout) {
        return new WorkflowRunnerConfig(maxParallelSteps, approvalWaitGrace, executionTimeout);
    }
}
