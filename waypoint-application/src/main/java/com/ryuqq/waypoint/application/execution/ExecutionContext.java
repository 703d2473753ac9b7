package com.ryuqq.waypoint.application.execution;

import com.ryuqq.waypoint.core.statemachine.ExecutionStatus;
import com.ryuqq.waypoint.core.statemachine.StateTransition;
import com.ryuqq.waypoint.core.statemachine.StepStatus;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

/**
 * 워크플로우 실행 1회의 상태.
 *
 * <p><strong>상태 전이:</strong></p>
 * <pre>
 * PENDING → start → RUNNING → awaitApproval → AWAITING_APPROVAL → resumeFromApproval → RUNNING
 *         → { COMPLETED | FAILED | CANCELLED }
 * </pre>
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>pendingApprovalId는 상태가 AWAITING_APPROVAL일 때만 non-null</li>
 *   <li>대기 중인 승인은 최대 1개</li>
 *   <li>종료 상태 이후에는 어떤 기록도 변경되지 않음</li>
 * </ul>
 *
 * <p><strong>Thread-safety:</strong> 모든 공개 메서드는 {@code this}로 동기화됩니다.
 * 여러 호출을 원자적으로 묶어야 하면 {@code synchronized (context)} 블록을 사용합니다.</p>
 *
 * @author Waypoint Team
 * @since 1.0.0
 */
public final class ExecutionContext {

    private final String workflowId;
    private final String executionId;
    private final Map<String, Object> inputs;
    private final Clock clock;
    private final Instant createdAt;
    private final CompletableFuture<ExecutionStatus> termination = new CompletableFuture<>();

    private ExecutionStatus status = ExecutionStatus.PENDING;
    private String currentStep;
    private String pendingApprovalId;
    private Instant startedAt;
    private Instant endedAt;
    private Map<String, Object> outputs = Collections.emptyMap();
    private final Map<String, Object> stepResults = new LinkedHashMap<>();
    private final Map<String, StepStatus> stepStatuses = new LinkedHashMap<>();
    private final List<ExecutionError> errors = new ArrayList<>();

    /**
     * 실행 컨텍스트 생성.
     *
     * @param workflowId 워크플로우 ID
     * @param executionId 실행 ID
     * @param inputs 워크플로우 입력 (nullable)
     * @param clock 시각 공급자
     * @throws IllegalArgumentException 필수 값이 null인 경우
     */
    public ExecutionContext(String workflowId, String executionId, Map<String, Object> inputs, Clock clock) {
        if (workflowId == null || workflowId.isBlank()) {
            throw new IllegalArgumentException("workflowId cannot be null or blank");
        }
        if (executionId == null || executionId.isBlank()) {
            throw new IllegalArgumentException("executionId cannot be null or blank");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.workflowId = workflowId;
        this.executionId = executionId;
        this.inputs = inputs == null
            ? Collections.emptyMap()
            : Collections.unmodifiableMap(new LinkedHashMap<>(inputs));
        this.clock = clock;
        this.createdAt = clock.instant();
    }

    /**
     * 새 실행 ID로 컨텍스트 생성.
     *
     * @param workflowId 워크플로우 ID
     * @param inputs 워크플로우 입력
     * @param clock 시각 공급자
     * @return PENDING 컨텍스트
     */
    public static ExecutionContext create(String workflowId, Map<String, Object> inputs, Clock clock) {
        return new ExecutionContext(workflowId, "exec_" + UUID.randomUUID().toString().replace("-", ""), inputs, clock);
    }

    // ========== 상태 전이 ==========

    /**
     * PENDING → RUNNING.
     *
     * @throws IllegalStateException PENDING이 아닌 경우
     */
    public synchronized void start() {
        status = StateTransition.transition(status, ExecutionStatus.RUNNING);
        startedAt = clock.instant();
    }

    /**
     * RUNNING → AWAITING_APPROVAL.
     *
     * @param stepId 승인을 기다리는 step
     * @param approvalId 승인 요청 ID
     * @throws IllegalArgumentException stepId 또는 approvalId가 null인 경우
     * @throws IllegalStateException RUNNING이 아닌 경우 (이미 승인 대기 중인 경우 포함)
     */
    public synchronized void awaitApproval(String stepId, String approvalId) {
        if (stepId == null || approvalId == null) {
            throw new IllegalArgumentException("stepId and approvalId cannot be null");
        }
        status = StateTransition.transition(status, ExecutionStatus.AWAITING_APPROVAL);
        currentStep = stepId;
        pendingApprovalId = approvalId;
        stepStatuses.put(stepId, StepStatus.AWAITING_APPROVAL);
    }

    /**
     * AWAITING_APPROVAL → RUNNING. 대기 중인 승인 ID를 비웁니다.
     *
     * @throws IllegalStateException AWAITING_APPROVAL이 아닌 경우
     */
    public synchronized void resumeFromApproval() {
        if (status != ExecutionStatus.AWAITING_APPROVAL) {
            throw new IllegalStateException("Cannot resume from approval in state: " + status);
        }
        status = StateTransition.transition(status, ExecutionStatus.RUNNING);
        pendingApprovalId = null;
    }

    /**
     * → COMPLETED.
     *
     * @param outputs 실행 결과 (nullable)
     * @throws IllegalStateException RUNNING이 아닌 경우
     */
    public synchronized void complete(Map<String, Object> outputs) {
        status = StateTransition.transition(status, ExecutionStatus.COMPLETED);
        if (outputs != null) {
            this.outputs = Collections.unmodifiableMap(new LinkedHashMap<>(outputs));
        }
        terminate();
    }

    /**
     * → FAILED. 오류가 함께 기록되고, 끝나지 않은 step은 CANCELLED가 됩니다.
     *
     * @param stepId 실패 원인 step (nullable)
     * @param cause 실패 원인
     * @throws IllegalStateException 이미 종료된 경우
     */
    public synchronized void fail(String stepId, Throwable cause) {
        status = StateTransition.transition(status, ExecutionStatus.FAILED);
        errors.add(ExecutionError.of(stepId, cause, clock.instant()));
        cancelOpenSteps();
        terminate();
    }

    /**
     * → CANCELLED.
     *
     * <p>협조적 취소입니다. 진행 중인 Operation은 중단되지 않으며
     * 이후의 step 기록은 무시됩니다.</p>
     *
     * @return 취소되었으면 true, 이미 종료 상태였으면 false
     */
    public synchronized boolean cancel() {
        if (status.isTerminal()) {
            return false;
        }
        status = StateTransition.transition(status, ExecutionStatus.CANCELLED);
        cancelOpenSteps();
        terminate();
        return true;
    }

    private void cancelOpenSteps() {
        for (Map.Entry<String, StepStatus> entry : stepStatuses.entrySet()) {
            if (!entry.getValue().isTerminal()) {
                entry.setValue(StepStatus.CANCELLED);
            }
        }
    }

    private void terminate() {
        pendingApprovalId = null;
        endedAt = clock.instant();
        termination.complete(status);
    }

    // ========== step 기록 ==========

    /**
     * step 상태 기록. 종료된 실행에서는 무시됩니다.
     *
     * @param stepId step ID
     * @param stepStatus step 상태
     * @return 기록되었으면 true
     */
    public synchronized boolean markStep(String stepId, StepStatus stepStatus) {
        if (status.isTerminal()) {
            return false;
        }
        stepStatuses.put(stepId, stepStatus);
        // 승인 대기 중에는 currentStep이 승인 대상 step을 가리킴
        if (stepStatus == StepStatus.RUNNING && status == ExecutionStatus.RUNNING) {
            currentStep = stepId;
        }
        return true;
    }

    /**
     * step 성공 기록.
     *
     * @param stepId step ID
     * @param result step 결과 (nullable)
     * @return 기록되었으면 true
     */
    public synchronized boolean recordStepResult(String stepId, Object result) {
        if (status.isTerminal()) {
            return false;
        }
        stepResults.put(stepId, result);
        stepStatuses.put(stepId, StepStatus.SUCCEEDED);
        return true;
    }

    /**
     * step 실패 기록. 실행 상태는 바뀌지 않습니다.
     *
     * @param stepId step ID
     * @param cause 실패 원인
     * @return 기록되었으면 true
     */
    public synchronized boolean recordStepFailure(String stepId, Throwable cause) {
        if (status.isTerminal()) {
            return false;
        }
        stepStatuses.put(stepId, StepStatus.FAILED);
        errors.add(ExecutionError.of(stepId, cause, clock.instant()));
        return true;
    }

    // ========== 조회 ==========

    public String getWorkflowId() {
        return workflowId;
    }

    public String getExecutionId() {
        return executionId;
    }

    public Map<String, Object> getInputs() {
        return inputs;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public synchronized ExecutionStatus getStatus() {
        return status;
    }

    public synchronized boolean isTerminal() {
        return status.isTerminal();
    }

    public synchronized String getCurrentStep() {
        return currentStep;
    }

    /**
     * 대기 중인 승인 요청 ID.
     *
     * @return AWAITING_APPROVAL이 아니면 null
     */
    public synchronized String getPendingApprovalId() {
        return pendingApprovalId;
    }

    public synchronized Map<String, Object> getOutputs() {
        return outputs;
    }

    public synchronized Map<String, Object> getStepResults() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(stepResults));
    }

    public synchronized Optional<Object> getStepResult(String stepId) {
        return Optional.ofNullable(stepResults.get(stepId));
    }

    public synchronized boolean hasStepResult(String stepId) {
        return stepResults.containsKey(stepId);
    }

    public synchronized Map<String, StepStatus> getStepStatuses() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(stepStatuses));
    }

    /**
     * step 상태 조회.
     *
     * @param stepId step ID
     * @return 기록이 없으면 PENDING
     */
    public synchronized StepStatus getStepStatus(String stepId) {
        return stepStatuses.getOrDefault(stepId, StepStatus.PENDING);
    }

    public synchronized List<ExecutionError> getErrors() {
        return List.copyOf(errors);
    }

    /**
     * 마지막 오류.
     *
     * @return 기록된 오류가 없으면 empty
     */
    public synchronized Optional<ExecutionError> getLastError() {
        return errors.isEmpty() ? Optional.empty() : Optional.of(errors.get(errors.size() - 1));
    }

    public synchronized Instant getStartedAt() {
        return startedAt;
    }

    public synchronized Instant getEndedAt() {
        return endedAt;
    }

    /**
     * 실행 시간.
     *
     * @return 시작 전이면 empty, 진행 중이면 현재까지의 시간
     */
    public synchronized Optional<Duration> getDuration() {
        if (startedAt == null) {
            return Optional.empty();
        }
        Instant end = endedAt == null ? clock.instant() : endedAt;
        return Optional.of(Duration.between(startedAt, end));
    }

    /**
     * 종료 시 완료되는 Future.
     *
     * @return 종료 상태를 값으로 갖는 Future
     */
    public CompletableFuture<ExecutionStatus> termination() {
        return termination.copy();
    }

    @Override
    public synchronized String toString() {
        return "ExecutionContext{" +
            "workflowId='" + workflowId + '\'' +
            ", executionId='" + executionId + '\'' +
            ", status=" + status +
            ", currentStep='" + currentStep + '\'' +
            ", pendingApprovalId='" + pendingApprovalId + '\'' +
            '}';
    }
}
