package com.koni.historyinjector.domain.exception;

import com.koni.historyinjector.domain.model.RejectionReason;

/**
 * Exception thrown when an entity is unknown to the store and automatic creation is disabled.
 */
public class EntityNotFoundException extends RecordRejectedException {

    public EntityNotFoundException(String message) {
        super(message);
    }

    public EntityNotFoundException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public RejectionReason getReason() {
        return RejectionReason.ENTITY_NOT_FOUND;
    }
}
