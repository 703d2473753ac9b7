/**
 * Core value objects.
 *
 * <ul>
 *   <li>{@link com.ryuqq.waypoint.core.model.OperationName} - key shared by circuit breakers,
 *   bulkheads and metrics</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Waypoint Team
 */
package com.ryuqq.waypoint.core.model;
