package com.ryuqq.waypoint.adapter.runner;

import com.ryuqq.waypoint.core.retry.RetryAttempt;

import java.util.ArrayList;
import java.util.List;

/**
 * 하나의 재시도 루프가 남긴 시도 이력.
 *
 * <p>{@code (workflowId, executionId, stepName)} 단위로 {@link RetryManager}에 보관되며
 * 같은 키로 다시 실행하면 새 이력으로 교체됩니다.</p>
 *
 * @author Waypoint Team
 * @since 1.0.0
 */
public final class RetryContext {

    private final String workflowId;
    private final String executionId;
    private final String stepName;
    private final List<RetryAttempt> attempts = new ArrayList<>();
    private boolean succeeded;

    RetryContext(String workflowId, String executionId, String stepName) {
        this.workflowId = workflowId;
        this.executionId = executionId;
        this.stepName = stepName;
    }

    synchronized void add(RetryAttempt attempt) {
        attempts.add(attempt);
        if (attempt.success()) {
            succeeded = true;
        }
    }

    public String getWorkflowId() {
        return workflowId;
    }

    public String getExecutionId() {
        return executionId;
    }

    public String getStepName() {
        return stepName;
    }

    public synchronized List<RetryAttempt> getAttempts() {
        return List.copyOf(attempts);
    }

    public synchronized int getAttemptCount() {
        return attempts.size();
    }

    public synchronized int getRetries() {
        return Math.max(0, attempts.size() - 1);
    }

    public synchronized boolean isSucceeded() {
        return succeeded;
    }
}
