/**
 * Human-in-the-loop approval model: requests, configuration, filters and statistics.
 *
 * @since 1.0.0
 * @author Waypoint Team
 */
package com.ryuqq.waypoint.core.approval;
