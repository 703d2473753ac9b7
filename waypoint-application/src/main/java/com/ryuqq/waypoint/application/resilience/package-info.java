/**
 * Resilience port: the composed retry / circuit breaker / bulkhead / timeout / fallback call,
 * its result and metrics types, and the typed command set.
 *
 * @since 1.0.0
 * @author Waypoint Team
 */
package com.ryuqq.waypoint.application.resilience;
