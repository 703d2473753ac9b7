/**
 * Human-in-the-loop approval service.
 *
 * @since 1.0.0
 * @author Waypoint Team
 */
package com.ryuqq.waypoint.application.approval;
