/**
 * Translation of exceptions into {@code ApiError} responses.
 *
 * <p>Malformed requests map to 400, a full worker queue to 429, coordinator failures to 503
 * and anything else to 500. Internal messages are logged, never returned.
 *
 * @since 1.0
 */
package com.phillippitts.enginecoordinator.presentation.exception;
