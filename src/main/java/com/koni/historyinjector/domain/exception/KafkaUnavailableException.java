package com.koni.historyinjector.domain.exception;

/**
 * Exception thrown when Kafka is unavailable or fails to publish events.
 */
public class KafkaUnavailableException extends RuntimeException {

    public KafkaUnavailableException(String message) {
        super(message);
    }

    public KafkaUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
