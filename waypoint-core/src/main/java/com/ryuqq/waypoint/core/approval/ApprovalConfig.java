package com.ryuqq.waypoint.core.approval;

import java.time.Duration;
import java.util.Set;

/**
 * step 단위 승인 설정.
 *
 * <p><strong>기본값:</strong> required=false, approvers=∅(누구나 가능), timeout=3600초,
 * priority=MEDIUM, autoRejectOnTimeout=false, reasonRequired=false</p>
 *
 * @param required 승인 게이트 여부
 * @param approvers 결정 가능한 사용자 (비어 있으면 누구나)
 * @param timeout 요청 생성부터 만료까지의 시간
 * @param priority 우선순위
 * @param autoRejectOnTimeout 만료 시 EXPIRED 대신 system 거절(REJECTED)로 처리
 * @param reasonRequired 결정 시 사유 필수 여부
 * @author Waypoint Team
 * @since 1.0.0
 */
public record ApprovalConfig(
    boolean required,
    Set<String> approvers,
    Duration timeout,
    ApprovalPriority priority,
    boolean autoRejectOnTimeout,
    boolean reasonRequired
) {

    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(3600);

    public ApprovalConfig {
        if (approvers == null) {
            throw new IllegalArgumentException("approvers cannot be null");
        }
        if (timeout == null) {
            throw new IllegalArgumentException("timeout cannot be null");
        }
        if (timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be positive (current: " + timeout + ")");
        }
        if (priority == null) {
            throw new IllegalArgumentException("priority cannot be null");
        }
        approvers = Set.copyOf(approvers);
    }

    public ApprovalConfig() {
        this(false, Set.of(), DEFAULT_TIMEOUT, ApprovalPriority.MEDIUM, false, false);
    }

    /**
     * 승인이 필요한 기본 설정.
     *
     * @return required=true인 기본 설정
     */
    public static ApprovalConfig requiredByDefault() {
        return new ApprovalConfig().withRequired(true);
    }

    /**
     * 승인 권한 확인.
     *
     * @param approver 결정 시도자
     * @return 승인자 목록이 비어 있거나 포함된 경우 true
     */
    public boolean canDecide(String approver) {
        return approvers.isEmpty() || approvers.contains(approver);
    }

    public ApprovalConfig withRequired(boolean required) {
        return new ApprovalConfig(required, approvers, timeout, priority, autoRejectOnTimeout, reasonRequired);
    }

    public ApprovalConfig withApprovers(Set<String> approvers) {
        return new ApprovalConfig(required, approvers, timeout, priority, autoRejectOnTimeout, reasonRequired);
    }

    public ApprovalConfig withTimeout(Duration timeout) {
        return new ApprovalConfig(required, approvers, timeout, priority, autoRejectOnTimeout, reasonRequired);
    }

    public ApprovalConfig withPriority(ApprovalPriority priority) {
        return new ApprovalConfig(required, approvers, timeout, priority, autoRejectOnTimeout, reasonRequired);
    }

    public ApprovalConfig withAutoRejectOnTimeout(boolean autoRejectOnTimeout) {
        return new ApprovalConfig(required, approvers, timeout, priority, autoRejectOnTimeout, reasonRequired);
    }

    public ApprovalConfig withReasonRequired(boolean reasonRequired) {
        return new ApprovalConfig(required, approvers, timeout, priority, autoRejectOnTimeout, reasonRequired);
    }
}
