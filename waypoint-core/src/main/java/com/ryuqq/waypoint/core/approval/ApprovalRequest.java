package com.ryuqq.waypoint.core.approval;

import com.ryuqq.waypoint.core.exception.ApprovalAlreadyDecidedException;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 사람의 결정을 기다리는 승인 요청.
 *
 * <p>불변 객체입니다. 상태 전이 메서드는 새 인스턴스를 반환하며,
 * PENDING을 벗어난 요청에 전이를 시도하면 {@link ApprovalAlreadyDecidedException}이 발생합니다.</p>
 *
 * <p><strong>만료:</strong> {@code expiresAt = createdAt + config.timeout}.
 * {@code autoRejectOnTimeout}이 켜져 있으면 만료는 {@value #SYSTEM_APPROVER}의 거절(REJECTED)이 됩니다.</p>
 *
 * @author Waypoint Team
 * @since 1.0.0
 */
public final class ApprovalRequest {

    /** 자동 거절 시 decidedBy 값. */
    public static final String SYSTEM_APPROVER = "system";

    private final String id;
    private final String workflowId;
    private final String executionId;
    private final String stepId;
    private final String stepName;
    private final String agentName;
    private final Map<String, Object> context;
    private final ApprovalConfig config;
    private final ApprovalStatus status;
    private final String decidedBy;
    private final String decisionReason;
    private final Instant createdAt;
    private final Instant expiresAt;
    private final Instant decidedAt;

    private ApprovalRequest(
        String id,
        String workflowId,
        String executionId,
        String stepId,
        String stepName,
        String agentName,
        Map<String, Object> context,
        ApprovalConfig config,
        ApprovalStatus status,
        String decidedBy,
        String decisionReason,
        Instant createdAt,
        Instant expiresAt,
        Instant decidedAt
    ) {
        this.id = id;
        this.workflowId = workflowId;
        this.executionId = executionId;
        this.stepId = stepId;
        this.stepName = stepName;
        this.agentName = agentName;
        this.context = context;
        this.config = config;
        this.status = status;
        this.decidedBy = decidedBy;
        this.decisionReason = decisionReason;
        this.createdAt = createdAt;
        this.expiresAt = expiresAt;
        this.decidedAt = decidedAt;
    }

    /**
     * PENDING 요청 생성.
     *
     * @param id 요청 ID
     * @param workflowId 워크플로우 ID
     * @param executionId 실행 ID
     * @param stepId step ID
     * @param stepName step 이름
     * @param agentName 작업 주체 이름 (nullable)
     * @param context 승인자에게 보여줄 데이터 (nullable)
     * @param config 승인 설정
     * @param createdAt 생성 시각
     * @return PENDING 요청
     * @throws IllegalArgumentException 필수 값이 null인 경우
     */
    public static ApprovalRequest create(
        String id,
        String workflowId,
        String executionId,
        String stepId,
        String stepName,
        String agentName,
        Map<String, Object> context,
        ApprovalConfig config,
        Instant createdAt
    ) {
        requireNonBlank(id, "id");
        requireNonBlank(workflowId, "workflowId");
        requireNonBlank(executionId, "executionId");
        requireNonBlank(stepId, "stepId");
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (createdAt == null) {
            throw new IllegalArgumentException("createdAt cannot be null");
        }
        Map<String, Object> copy = context == null
            ? Collections.emptyMap()
            : Collections.unmodifiableMap(new LinkedHashMap<>(context));
        return new ApprovalRequest(
            id, workflowId, executionId, stepId, stepName == null ? stepId : stepName, agentName,
            copy, config, ApprovalStatus.PENDING, null, null,
            createdAt, createdAt.plus(config.timeout()), null
        );
    }

    private static void requireNonBlank(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " cannot be null or blank");
        }
    }

    public ApprovalRequest approve(String approver, String reason, Instant now) {
        return decide(ApprovalStatus.APPROVED, approver, reason, now);
    }

    public ApprovalRequest reject(String approver, String reason, Instant now) {
        return decide(ApprovalStatus.REJECTED, approver, reason, now);
    }

    /**
     * 만료 처리.
     *
     * @param now 현재 시각
     * @return EXPIRED 요청, autoRejectOnTimeout이면 system이 거절한 REJECTED 요청
     */
    public ApprovalRequest expire(Instant now) {
        if (config.autoRejectOnTimeout()) {
            return decide(ApprovalStatus.REJECTED, SYSTEM_APPROVER, "Approval timed out", now);
        }
        return decide(ApprovalStatus.EXPIRED, null, null, now);
    }

    public ApprovalRequest cancel(Instant now) {
        return decide(ApprovalStatus.CANCELLED, null, null, now);
    }

    private ApprovalRequest decide(ApprovalStatus next, String by, String reason, Instant now) {
        if (status.isTerminal()) {
            throw new ApprovalAlreadyDecidedException(id, status);
        }
        if (now == null) {
            throw new IllegalArgumentException("now cannot be null");
        }
        return new ApprovalRequest(
            id, workflowId, executionId, stepId, stepName, agentName, context, config,
            next, by, reason, createdAt, expiresAt, now
        );
    }

    /**
     * 만료 시각이 지났지만 아직 PENDING인지 확인.
     *
     * @param now 현재 시각
     * @return 만료 처리 대상이면 true
     */
    public boolean isOverdue(Instant now) {
        return status == ApprovalStatus.PENDING && !now.isBefore(expiresAt);
    }

    public boolean isPending() {
        return status == ApprovalStatus.PENDING;
    }

    public String getId() {
        return id;
    }

    public String getWorkflowId() {
        return workflowId;
    }

    public String getExecutionId() {
        return executionId;
    }

    public String getStepId() {
        return stepId;
    }

    public String getStepName() {
        return stepName;
    }

    public String getAgentName() {
        return agentName;
    }

    public Map<String, Object> getContext() {
        return context;
    }

    public ApprovalConfig getConfig() {
        return config;
    }

    public ApprovalPriority getPriority() {
        return config.priority();
    }

    public ApprovalStatus getStatus() {
        return status;
    }

    public String getDecidedBy() {
        return decidedBy;
    }

    public String getDecisionReason() {
        return decisionReason;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getExpiresAt() {
        return expiresAt;
    }

    public Instant getDecidedAt() {
        return decidedAt;
    }

    @Override
    public String toString() {
        return "ApprovalRequest{" +
            "id='" + id + '\'' +
            ", workflowId='" + workflowId + '\'' +
            ", executionId='" + executionId + '\'' +
            ", stepId='" + stepId + '\'' +
            ", status=" + status +
            ", decidedBy='" + decidedBy + '\'' +
            ", expiresAt=" + expiresAt +
            '}';
    }
}
