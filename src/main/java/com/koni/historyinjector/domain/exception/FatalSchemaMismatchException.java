package com.koni.historyinjector.domain.exception;

/**
 * Exception thrown when the target store does not have the schema this service knows how to write.
 * Ingestion must stop; writing speculatively into an unknown layout could corrupt the store.
 */
public class FatalSchemaMismatchException extends RuntimeException {

    public FatalSchemaMismatchException(String message) {
        super(message);
    }

    public FatalSchemaMismatchException(String message, Throwable cause) {
        super(message, cause);
    }
}
