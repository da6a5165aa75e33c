package com.koni.historyinjector.domain.model;

import lombok.Getter;

import java.util.Collections;
import java.util.List;

/**
 * Summary of processing one inbound message.
 * A message that failed to decode carries no record outcomes and a message-level reason.
 */
@Getter
public class DispatchReport {

    private final String topic;
    private final List<RecordOutcome> outcomes;
    private final RejectionReason messageRejection;
    private final String messageDetail;

    private DispatchReport(String topic, List<RecordOutcome> outcomes, RejectionReason messageRejection,
                           String messageDetail) {
        this.topic = topic;
        this.outcomes = Collections.unmodifiableList(outcomes);
        this.messageRejection = messageRejection;
        this.messageDetail = messageDetail;
    }

    public static DispatchReport of(String topic, List<RecordOutcome> outcomes) {
        return new DispatchReport(topic, outcomes, null, null);
    }

    public static DispatchReport messageRejected(String topic, RejectionReason reason, String detail) {
        return new DispatchReport(topic, List.of(), reason, detail);
    }

    public boolean isMessageRejected() {
        return messageRejection != null;
    }

    public long committedCount() {
        return outcomes.stream().filter(RecordOutcome::isCommitted).count();
    }

    public long rejectedCount() {
        return outcomes.size() - committedCount();
    }

    @Override
    public String toString() {
        if (isMessageRejected()) {
            return "DispatchReport{topic='" + topic + "', messageRejection=" + messageRejection + '}';
        }
        return "DispatchReport{" +
                "topic='" + topic + '\'' +
                ", committed=" + committedCount() +
                ", rejected=" + rejectedCount() +
                '}';
    }
}
