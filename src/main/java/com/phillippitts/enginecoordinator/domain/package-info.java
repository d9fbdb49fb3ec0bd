/**
 * Domain model of the coordinator: tasks, their kind-specific payloads and merged results.
 *
 * <p>All types are immutable records or enums that validate themselves on construction.
 *
 * <ul>
 *   <li>{@link com.phillippitts.enginecoordinator.domain.Task} - one inbound unit of work</li>
 *   <li>{@link com.phillippitts.enginecoordinator.domain.TaskPayload} - tagged payload, dispatched
 *       through its visitor</li>
 *   <li>{@link com.phillippitts.enginecoordinator.domain.CoordinationResult} - merged outcome with
 *       per-engine sub-results, cost, latency and errors</li>
 * </ul>
 *
 * @since 1.0
 */
package com.phillippitts.enginecoordinator.domain;
