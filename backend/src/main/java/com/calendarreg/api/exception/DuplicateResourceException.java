package com.calendarreg.api.exception;

/**
 * Thrown when creating a course whose (code, acadyear, semester) already exists. Mapped to HTTP 409.
 */
public class DuplicateResourceException extends RuntimeException {

    public DuplicateResourceException(String message) {
        super(message);
    }
}
