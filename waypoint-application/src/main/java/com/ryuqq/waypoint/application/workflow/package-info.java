/**
 * Workflow driver port.
 *
 * @since 1.0.0
 * @author Waypoint Team
 */
package com.ryuqq.waypoint.application.workflow;
