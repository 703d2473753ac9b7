/**
 * Unchecked domain exceptions rooted at {@link com.ryuqq.waypoint.core.exception.WaypointException}.
 *
 * @since 1.0.0
 * @author Waypoint Team
 */
package com.ryuqq.waypoint.core.exception;
