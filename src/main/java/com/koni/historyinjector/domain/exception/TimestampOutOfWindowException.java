package com.koni.historyinjector.domain.exception;

import com.koni.historyinjector.domain.model.RejectionReason;

/**
 * Exception thrown when a record's timestamp falls outside the accepted freshness window.
 */
public class TimestampOutOfWindowException extends RecordRejectedException {

    public TimestampOutOfWindowException(String message) {
        super(message);
    }

    public TimestampOutOfWindowException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public RejectionReason getReason() {
        return RejectionReason.TIMESTAMP_OUT_OF_WINDOW;
    }
}
