package com.calendarreg.api.exception;

public class InvalidCronExpressionException extends ValidationException {

    public InvalidCronExpressionException(String message) {
        super(message);
    }

    public InvalidCronExpressionException(String message, Throwable cause) {
        super(message, cause);
    }
}
