package com.koni.historyinjector.domain.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A single historical reading decoded from an inbound message.
 * The timestamp is kept in its raw textual form until it is validated.
 */
@Getter
@EqualsAndHashCode
public class HistoryRecord {

    private final String entityId;
    private final int index;
    private final String state;
    private final String timestamp;
    private final Map<String, Object> attributes;

    /**
     * Creates a new HistoryRecord.
     *
     * @param entityId the entity the reading belongs to, e.g. {@code sensor.bedroom_temperature}
     * @param index the position of the record inside its message (0 for single-record messages)
     * @param state the state value as text
     * @param timestamp the raw timestamp as received
     * @param attributes the attribute mapping, never null
     */
    public HistoryRecord(String entityId, int index, String state, String timestamp, Map<String, Object> attributes) {
        this.entityId = entityId;
        this.index = index;
        this.state = state;
        this.timestamp = timestamp;
        this.attributes = attributes == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }

    @Override
    public String toString() {
        return "HistoryRecord{" +
                "entityId='" + entityId + '\'' +
                ", index=" + index +
                ", state='" + state + '\'' +
                ", timestamp='" + timestamp + '\'' +
                '}';
    }
}
