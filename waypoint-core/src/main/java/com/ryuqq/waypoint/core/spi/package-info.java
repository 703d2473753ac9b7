/**
 * Service Provider Interfaces consumed by the Waypoint core.
 *
 * <h2>SPIs</h2>
 * <ul>
 *   <li>{@link com.ryuqq.waypoint.core.spi.Operation} / {@link com.ryuqq.waypoint.core.spi.Fallback} -
 *   the opaque unit of work and its substitute result</li>
 *   <li>{@link com.ryuqq.waypoint.core.spi.StepExecutor} - runs a workflow step</li>
 *   <li>{@link com.ryuqq.waypoint.core.spi.WorkflowDefinitionSource} - read-only step graphs</li>
 *   <li>{@link com.ryuqq.waypoint.core.spi.ApprovalStore} - linearizable approval request table</li>
 *   <li>{@link com.ryuqq.waypoint.core.spi.Sleeper} - backoff delay primitive</li>
 * </ul>
 *
 * <h2>Implementation Requirements</h2>
 * <ul>
 *   <li><strong>Thread-safe:</strong> All implementations must be thread-safe</li>
 *   <li><strong>In-memory:</strong> Durable recovery is out of scope</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Waypoint Team
 */
package com.ryuqq.waypoint.core.spi;
