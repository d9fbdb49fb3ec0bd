/**
 * REST API controllers for HTTP endpoints.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>{@code POST /api/v1/tasks} - submit a task; answers 200 with the coordination result</li>
 *   <li>{@code POST /api/v1/memories} - store a memory for recall</li>
 *   <li>{@code GET /api/v1/providers} - provider registry with health states</li>
 *   <li>{@code GET /api/v1/costs} - cost ledger summary for the current UTC day</li>
 *   <li>{@code GET /api/v1/engines} - in-flight tasks, pool state and running totals</li>
 * </ul>
 *
 * <p>Controllers delegate to the coordinator and let {@code GlobalExceptionHandler} map
 * exceptions to responses.
 *
 * @see com.phillippitts.enginecoordinator.service.coordination.Coordinator
 * @since 1.0
 */
package com.phillippitts.enginecoordinator.presentation.controller;
