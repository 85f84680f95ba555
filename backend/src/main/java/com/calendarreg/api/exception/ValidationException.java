package com.calendarreg.api.exception;

/**
 * Thrown when input fails a domain rule (as opposed to request shape). Mapped to HTTP 400.
 */
public class ValidationException extends RuntimeException {

    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
