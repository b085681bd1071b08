package com.phillippitts.culinara.exception;

/**
 * Base exception for all Culinara application-specific errors.
 * All domain exceptions should extend this class to enable centralized error handling.
 */
public class CulinaraException extends RuntimeException {

    public CulinaraException(String message) {
        super(message);
    }

    public CulinaraException(String message, Throwable cause) {
        super(message, cause);
    }

    public CulinaraException(Throwable cause) {
        super(cause);
    }
}
