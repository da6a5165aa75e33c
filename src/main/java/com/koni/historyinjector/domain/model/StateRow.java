package com.koni.historyinjector.domain.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.time.Instant;

/**
 * One history row written into the target store.
 * {@code (metadataId, lastUpdated)} identifies the row; writing the same pair twice overwrites it.
 */
@Getter
@EqualsAndHashCode
public class StateRow {

    public static final String SOURCE = "history-injector";

    private final long metadataId;
    private final long attributesId;
    private final String state;
    private final Instant lastUpdated;
    private final Instant lastChanged;
    private final String source;

    public StateRow(long metadataId, long attributesId, String state, Instant timestamp) {
        this.metadataId = metadataId;
        this.attributesId = attributesId;
        this.state = state;
        this.lastUpdated = timestamp;
        this.lastChanged = timestamp;
        this.source = SOURCE;
    }

    @Override
    public String toString() {
        return "StateRow{" +
                "metadataId=" + metadataId +
                ", attributesId=" + attributesId +
                ", state='" + state + '\'' +
                ", lastUpdated=" + lastUpdated +
                '}';
    }
}
