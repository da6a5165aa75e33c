package com.koni.historyinjector.domain.model;

/**
 * Lifecycle of a record inside the dispatcher.
 * {@link #COMMITTED} and {@link #REJECTED} are terminal.
 */
public enum RecordStage {
    RECEIVED,
    DECODED,
    TIMESTAMP_CHECKED,
    ENTITY_RESOLVED,
    ATTRIBUTES_ENCODED,
    COMMITTED,
    REJECTED;

    public boolean isTerminal() {
        return this == COMMITTED || this == REJECTED;
    }
}
