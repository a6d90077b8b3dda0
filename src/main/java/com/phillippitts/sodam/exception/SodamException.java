package com.phillippitts.sodam.exception;

/**
 * Base exception for all Sodam agent errors.
 * All domain exceptions should extend this class to enable centralized error handling.
 */
public class SodamException extends RuntimeException {

    public SodamException(String message) {
        super(message);
    }

    public SodamException(String message, Throwable cause) {
        super(message, cause);
    }

    public SodamException(Throwable cause) {
        super(cause);
    }
}
