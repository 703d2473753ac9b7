/**
 * Read-only workflow definitions: steps, dependencies, approval gates and failure policy.
 *
 * @since 1.0.0
 * @author Waypoint Team
 */
package com.ryuqq.waypoint.core.workflow;
