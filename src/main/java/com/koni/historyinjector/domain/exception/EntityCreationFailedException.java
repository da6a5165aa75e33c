package com.koni.historyinjector.domain.exception;

import com.koni.historyinjector.domain.model.RejectionReason;

/**
 * Exception thrown when the entity management API could not create an entity,
 * either permanently (4xx) or after the bounded retry policy gave up.
 */
public class EntityCreationFailedException extends RecordRejectedException {

    public EntityCreationFailedException(String message) {
        super(message);
    }

    public EntityCreationFailedException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public RejectionReason getReason() {
        return RejectionReason.ENTITY_CREATION_FAILED;
    }
}
