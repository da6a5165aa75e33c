package com.koni.historyinjector.infrastructure.api;

/**
 * Exception thrown when the entity management API could not be reached or answered with a 5xx.
 * The only failure the entity API retry policy retries.
 */
public class EntityApiUnavailableException extends RuntimeException {

    public EntityApiUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
