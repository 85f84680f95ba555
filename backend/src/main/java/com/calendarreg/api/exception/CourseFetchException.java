package com.calendarreg.api.exception;

/**
 * Failure talking to the upstream course catalog: transport error, timeout, non-2xx status or an
 * unusable payload. Never shown to API callers; a failed fetch reads as "not found".
 */
public class CourseFetchException extends Exception {

    public CourseFetchException(String message) {
        super(message);
    }

    public CourseFetchException(String message, Throwable cause) {
        super(message, cause);
    }
}
