/**
 * Protection SPIs for downstream invocations.
 *
 * <ul>
 *   <li>{@link com.ryuqq.waypoint.core.protection.CircuitBreaker} - per-operation failure tracking
 *   with CLOSED / OPEN / HALF_OPEN states</li>
 *   <li>{@link com.ryuqq.waypoint.core.protection.Bulkhead} - non-queueing bound on concurrent calls</li>
 * </ul>
 *
 * <p>Disabled protections are represented by the implementations in
 * {@code com.ryuqq.waypoint.core.protection.noop}.</p>
 *
 * @since 1.0.0
 * @author Waypoint Team
 */
package com.ryuqq.waypoint.core.protection;
