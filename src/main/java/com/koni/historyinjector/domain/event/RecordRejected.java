package com.koni.historyinjector.domain.event;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.koni.historyinjector.domain.model.RejectionReason;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;
import java.util.UUID;

/**
 * RecordRejected domain event.
 * Published whenever a message or a record is dropped so operators can act on it.
 * {@code recordIndex} is -1 when the whole message was rejected.
 */
@Getter
@EqualsAndHashCode
@ToString
public final class RecordRejected {

    private final UUID eventId;
    private final String entityId;
    private final String topic;
    private final int recordIndex;
    private final RejectionReason reason;
    private final String detail;
    private final Instant rejectedAt;

    @JsonCreator
    public RecordRejected(
            @JsonProperty("eventId") UUID eventId,
            @JsonProperty("entityId") String entityId,
            @JsonProperty("topic") String topic,
            @JsonProperty("recordIndex") int recordIndex,
            @JsonProperty("reason") RejectionReason reason,
            @JsonProperty("detail") String detail,
            @JsonProperty("rejectedAt") Instant rejectedAt) {
        this.eventId = eventId;
        this.entityId = entityId;
        this.topic = topic;
        this.recordIndex = recordIndex;
        this.reason = reason;
        this.detail = detail;
        this.rejectedAt = rejectedAt;
    }
}
