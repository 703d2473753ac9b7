/**
 * Retry policies, error classification and retry results.
 *
 * @since 1.0.0
 * @author Waypoint Team
 */
package com.ryuqq.waypoint.core.retry;
