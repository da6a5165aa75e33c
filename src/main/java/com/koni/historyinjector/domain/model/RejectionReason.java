package com.koni.historyinjector.domain.model;

/**
 * Why a message or record was dropped.
 */
public enum RejectionReason {
    DECODE_ERROR,
    INVALID_TIMESTAMP,
    TIMESTAMP_OUT_OF_WINDOW,
    ENTITY_NOT_FOUND,
    ENTITY_CREATION_FAILED,
    LOCK_TIMEOUT,
    STORE_WRITE_FAILED
}
