package com.ryuqq.waypoint.core.workflow;

/**
 * step 실패 시 워크플로우 수준의 처리 방식.
 *
 * @author Waypoint Team
 * @since 1.0.0
 */
public enum FailurePolicy {

    /** 첫 step 실패에서 실행 전체를 FAILED로 종료합니다. 아직 시작하지 않은 step은 SKIPPED가 됩니다. */
    FAIL_FAST,

    /**
     * 실패한 step에 의존하는 step만 SKIPPED로 처리하고 독립적인 step은 계속 실행합니다.
     * 실패한 step이 하나라도 있으면 실행은 FAILED로 끝납니다.
     */
    CONTINUE_INDEPENDENT
}
