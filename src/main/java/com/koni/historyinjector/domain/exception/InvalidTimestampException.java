package com.koni.historyinjector.domain.exception;

import com.koni.historyinjector.domain.model.RejectionReason;

/**
 * Exception thrown when a record's timestamp cannot be parsed.
 */
public class InvalidTimestampException extends RecordRejectedException {

    public InvalidTimestampException(String message) {
        super(message);
    }

    public InvalidTimestampException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public RejectionReason getReason() {
        return RejectionReason.INVALID_TIMESTAMP;
    }
}
