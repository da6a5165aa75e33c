package com.koni.historyinjector.application.port;

import com.koni.historyinjector.domain.event.RecordRejected;

/**
 * Port for reporting dropped messages and records to operators.
 */
public interface RejectionPublisher {

    /**
     * Publishes a RecordRejected event.
     * Implementations must not throw when the transport is down; the rejection has already been logged.
     *
     * @param event the event to publish
     * @throws IllegalArgumentException if event is null
     */
    void publish(RecordRejected event);
}
