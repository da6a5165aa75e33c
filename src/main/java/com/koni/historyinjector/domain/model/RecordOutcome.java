package com.koni.historyinjector.domain.model;

import lombok.Getter;

/**
 * Terminal result of one record.
 */
@Getter
public class RecordOutcome {

    private final String entityId;
    private final int index;
    private final RecordStage stage;
    private final RecordStage lastReachedStage;
    private final RejectionReason reason;
    private final String detail;

    private RecordOutcome(String entityId, int index, RecordStage stage, RecordStage lastReachedStage,
                          RejectionReason reason, String detail) {
        this.entityId = entityId;
        this.index = index;
        this.stage = stage;
        this.lastReachedStage = lastReachedStage;
        this.reason = reason;
        this.detail = detail;
    }

    public static RecordOutcome committed(String entityId, int index) {
        return new RecordOutcome(entityId, index, RecordStage.COMMITTED, RecordStage.COMMITTED, null, null);
    }

    /**
     * @param lastReachedStage the last non-terminal stage the record passed before it was rejected
     */
    public static RecordOutcome rejected(String entityId, int index, RecordStage lastReachedStage,
                                         RejectionReason reason, String detail) {
        return new RecordOutcome(entityId, index, RecordStage.REJECTED, lastReachedStage, reason, detail);
    }

    public boolean isCommitted() {
        return stage == RecordStage.COMMITTED;
    }

    @Override
    public String toString() {
        return "RecordOutcome{" +
                "entityId='" + entityId + '\'' +
                ", index=" + index +
                ", stage=" + stage +
                (reason != null ? ", reason=" + reason + ", detail='" + detail + '\'' : "") +
                '}';
    }
}
