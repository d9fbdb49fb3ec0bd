/**
 * Coordination of one task across the LLM router, recall store, creative generator and worker
 * pool.
 *
 * <p>Key Components:
 * <ul>
 *   <li>{@link com.phillippitts.enginecoordinator.service.coordination.DispatchPlanner} - turns a
 *       payload into a plan of engine calls, each with its own timeout and optionally a
 *       dependency on another call</li>
 *   <li>{@link com.phillippitts.enginecoordinator.service.coordination.DefaultCoordinator} - runs the
 *       plan under the task's global deadline and merges the sub-results</li>
 *   <li>{@link com.phillippitts.enginecoordinator.service.coordination.TaskLifecycle} - per-task
 *       state machine that also tracks pending calls for shutdown</li>
 *   <li>{@link com.phillippitts.enginecoordinator.service.coordination.CoordinatorBuilder} - wires a
 *       coordinator from its engines</li>
 * </ul>
 *
 * <p>Final status precedence: a failed mandatory engine gives FAILED, then a fired deadline gives
 * TIMED_OUT, then any degraded or failed optional engine gives DEGRADED.
 *
 * @since 1.0
 */
package com.phillippitts.enginecoordinator.service.coordination;
