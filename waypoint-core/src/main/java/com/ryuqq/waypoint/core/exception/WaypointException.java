package com.ryuqq.waypoint.core.exception;

/**
 * Waypoint 도메인 예외의 공통 상위 타입.
 *
 * <p>모든 도메인 예외는 unchecked이며, 호출자가 상황에 맞게
 * 구체 타입으로 구분하여 처리합니다.</p>
 *
 * @author Waypoint Team
 * @since 1.0.0
 */
public class WaypointException extends RuntimeException {

    public WaypointException(String message) {
        super(message);
    }

    public WaypointException(String message, Throwable cause) {
        super(message, cause);
    }
}
