package com.koni.historyinjector.domain.exception;

import com.koni.historyinjector.domain.model.RejectionReason;

/**
 * Exception thrown when a record waited too long for another record of the same entity to finish.
 */
public class EntityLockTimeoutException extends RecordRejectedException {

    public EntityLockTimeoutException(String message) {
        super(message);
    }

    public EntityLockTimeoutException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public RejectionReason getReason() {
        return RejectionReason.LOCK_TIMEOUT;
    }
}
