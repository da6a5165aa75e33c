package com.koni.historyinjector.domain.exception;

/**
 * Exception thrown when input to the admin API does not meet business rules.
 */
public class ValidationException extends RuntimeException {

    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
