/**
 * Per-run execution state: lifecycle transitions, step results and errors.
 *
 * @since 1.0.0
 * @author Waypoint Team
 */
package com.ryuqq.waypoint.application.execution;
