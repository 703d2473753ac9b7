/**
 * Execution and step lifecycle states and the transition rules between them.
 *
 * @since 1.0.0
 * @author Waypoint Team
 */
package com.ryuqq.waypoint.core.statemachine;
