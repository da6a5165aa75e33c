package com.koni.historyinjector.domain.exception;

import com.koni.historyinjector.domain.model.RejectionReason;

/**
 * Exception thrown when the history store rejected or timed out a write transaction.
 * The transaction is rolled back, so no partial state row remains.
 */
public class StoreWriteException extends RecordRejectedException {

    public StoreWriteException(String message) {
        super(message);
    }

    public StoreWriteException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public RejectionReason getReason() {
        return RejectionReason.STORE_WRITE_FAILED;
    }
}
