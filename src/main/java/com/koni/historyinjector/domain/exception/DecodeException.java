package com.koni.historyinjector.domain.exception;

/**
 * Exception thrown when an inbound message cannot be decoded.
 * The whole message is dropped; other messages are unaffected.
 */
public class DecodeException extends RuntimeException {

    public DecodeException(String message) {
        super(message);
    }

    public DecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
