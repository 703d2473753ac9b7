package com.ryuqq.waypoint.core.statemachine;

/**
 * 실행 상태 전이 검증.
 *
 * <p><strong>허용되는 전이:</strong></p>
 * <ul>
 *   <li>PENDING → RUNNING, FAILED, CANCELLED</li>
 *   <li>RUNNING → AWAITING_APPROVAL, COMPLETED, FAILED, CANCELLED</li>
 *   <li>AWAITING_APPROVAL → RUNNING, FAILED, CANCELLED</li>
 * </ul>
 *
 * <p><strong>불변식:</strong> 종료 상태(COMPLETED, FAILED, CANCELLED)에서는 어떤 상태로도 전이 불가</p>
 *
 * @author Waypoint Team
 * @since 1.0.0
 */
public final class StateTransition {

    private StateTransition() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 상태 전이가 유효한지 검증.
     *
     * @param from 현재 상태
     * @param to 전이할 상태
     * @throws IllegalArgumentException from 또는 to가 null인 경우
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static void validate(ExecutionStatus from, ExecutionStatus to) {
        if (from == null || to == null) {
            throw new IllegalArgumentException("States cannot be null (from: " + from + ", to: " + to + ")");
        }

        if (from.isTerminal()) {
            throw new IllegalStateException(
                String.format("Cannot transition from terminal state: %s → %s", from, to)
            );
        }

        if (!isAllowed(from, to)) {
            throw new IllegalStateException(
                String.format("Invalid state transition: %s → %s", from, to)
            );
        }
    }

    /**
     * 전이 허용 여부 (예외 없이).
     *
     * @param from 현재 상태
     * @param to 전이할 상태
     * @return 허용되면 true
     */
    public static boolean isAllowed(ExecutionStatus from, ExecutionStatus to) {
        return switch (from) {
            case PENDING -> to == ExecutionStatus.RUNNING
                || to == ExecutionStatus.FAILED
                || to == ExecutionStatus.CANCELLED;
            case RUNNING -> to == ExecutionStatus.AWAITING_APPROVAL
                || to == ExecutionStatus.COMPLETED
                || to == ExecutionStatus.FAILED
                || to == ExecutionStatus.CANCELLED;
            case AWAITING_APPROVAL -> to == ExecutionStatus.RUNNING
                || to == ExecutionStatus.FAILED
                || to == ExecutionStatus.CANCELLED;
            case COMPLETED, FAILED, CANCELLED -> false;
        };
    }

    /**
     * 상태 전이 실행 (검증 후).
     *
     * @param current 현재 상태
     * @param next 다음 상태
     * @return 전이된 상태 (next)
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static ExecutionStatus transition(ExecutionStatus current, ExecutionStatus next) {
        validate(current, next);
        return next;
    }
}
