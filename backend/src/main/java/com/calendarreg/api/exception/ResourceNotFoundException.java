package com.calendarreg.api.exception;

/**
 * Thrown when a requested course or cron job does not exist (or was soft-deleted).
 * Mapped to HTTP 404 by {@link com.calendarreg.api.controller.ApiExceptionHandler}.
 */
public class ResourceNotFoundException extends RuntimeException {

    public ResourceNotFoundException(String message) {
        super(message);
    }
}
