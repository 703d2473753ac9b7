package com.ryuqq.waypoint.core.exception;

import java.time.Duration;

/**
 * 결정 대기 시간이 초과되었을 때 발생합니다.
 *
 * <p>대기 시간 초과는 요청 자체를 변경하지 않습니다. 요청은 PENDING으로 남습니다.</p>
 *
 * @author Waypoint Team
 * @since 1.0.0
 */
public class ApprovalTimeoutException extends ApprovalException {

    private final Duration timeout;

    public ApprovalTimeoutException(String approvalId, Duration timeout) {
        super(approvalId, "Timed out after " + timeout.toMillis() + "ms waiting for approval request " + approvalId);
        this.timeout = timeout;
    }

    public Duration getTimeout() {
        return timeout;
    }
}
