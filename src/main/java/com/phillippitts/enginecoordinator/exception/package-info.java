/**
 * Coordinator exception hierarchy.
 *
 * <p>All exceptions are unchecked and extend
 * {@link com.phillippitts.enginecoordinator.exception.CoordinatorException}:
 * <ul>
 *   <li>{@link com.phillippitts.enginecoordinator.exception.ProviderUnavailableException} - one
 *       provider failed; the router falls through to the next</li>
 *   <li>{@link com.phillippitts.enginecoordinator.exception.AllProvidersExhaustedException} - the
 *       whole chain failed; carries every attempt</li>
 *   <li>{@link com.phillippitts.enginecoordinator.exception.QueueFullException} - worker pool
 *       backpressure</li>
 *   <li>{@link com.phillippitts.enginecoordinator.exception.EngineCrashException} - a task raised
 *       while executing</li>
 * </ul>
 *
 * <p>Inside a coordinated task these never reach the caller; the coordinator converts them into
 * {@link com.phillippitts.enginecoordinator.domain.EngineError} entries. At the REST boundary,
 * {@code GlobalExceptionHandler} maps any that escape to HTTP statuses.
 *
 * @since 1.0
 */
package com.phillippitts.enginecoordinator.exception;
