package com.phillippitts.enginecoordinator.exception;

/**
 * Base exception for all coordinator-specific errors.
 * All domain exceptions extend this class to enable centralized error handling.
 */
public class CoordinatorException extends RuntimeException {

    public CoordinatorException(String message) {
        super(message);
    }

    public CoordinatorException(String message, Throwable cause) {
        super(message, cause);
    }
}
