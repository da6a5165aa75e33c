package com.koni.historyinjector.domain.exception;

import com.koni.historyinjector.domain.model.RejectionReason;

/**
 * Base class for failures that drop a single record.
 * Sibling records in the same message and unrelated messages keep processing.
 */
public abstract class RecordRejectedException extends RuntimeException {

    protected RecordRejectedException(String message) {
        super(message);
    }

    protected RecordRejectedException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract RejectionReason getReason();
}
