package com.koni.historyinjector.infrastructure.observability;

import com.koni.historyinjector.domain.model.RejectionReason;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Component for tracking history injection metrics.
 * Provides counters and timers for monitoring ingestion behavior.
 */
@Slf4j
@Component
public class InjectionMetrics {

    private final Counter messagesReceived;
    private final Counter messagesRejected;
    private final Counter recordsCommitted;
    private final Map<RejectionReason, Counter> recordsRejected = new EnumMap<>(RejectionReason.class);
    private final Counter rowsOverwritten;
    private final Counter blobsReused;
    private final Counter blobsCreated;
    private final Counter entitiesCreated;
    private final Counter rejectionPublishFailures;
    private final Counter dlqMessagesSent;
    private final Timer processingTime;

    public InjectionMetrics(MeterRegistry registry) {
        this.messagesReceived = Counter.builder("history.messages.received.total")
                .description("Total history messages received")
                .register(registry);

        this.messagesRejected = Counter.builder("history.messages.rejected.total")
                .description("Total history messages dropped because they could not be decoded")
                .register(registry);

        this.recordsCommitted = Counter.builder("history.records.committed.total")
                .description("Total history records written to the store")
                .register(registry);

        for (RejectionReason reason : RejectionReason.values()) {
            recordsRejected.put(reason, Counter.builder("history.records.rejected.total")
                    .description("Total history records dropped, by reason")
                    .tag("reason", reason.name())
                    .register(registry));
        }

        this.rowsOverwritten = Counter.builder("history.records.overwritten.total")
                .description("Total state rows overwritten by a record with the same timestamp")
                .register(registry);

        this.blobsReused = Counter.builder("history.attributes.reused.total")
                .description("Total attribute blobs reused from the store")
                .register(registry);

        this.blobsCreated = Counter.builder("history.attributes.created.total")
                .description("Total attribute blobs inserted into the store")
                .register(registry);

        this.entitiesCreated = Counter.builder("history.entities.created.total")
                .description("Total entities created through the entity management API")
                .register(registry);

        this.rejectionPublishFailures = Counter.builder("history.rejections.publish_failed.total")
                .description("Total rejection events that could not be published")
                .register(registry);

        this.dlqMessagesSent = Counter.builder("history.dlq.sent.total")
                .description("Total messages sent to Dead Letter Queue")
                .register(registry);

        this.processingTime = Timer.builder("history.processing.time")
                .description("Time to process one history record")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry);
    }

    public void recordMessageReceived() {
        messagesReceived.increment();
    }

    public void recordMessageRejected() {
        messagesRejected.increment();
        log.debug("Message rejected counter incremented");
    }

    public void recordCommitted() {
        recordsCommitted.increment();
    }

    /**
     * Increment the rejection counter tagged with the given reason.
     */
    public void recordRejected(RejectionReason reason) {
        recordsRejected.get(reason).increment();
        log.debug("Record rejected counter incremented: reason={}", reason);
    }

    public void recordOverwrite() {
        rowsOverwritten.increment();
    }

    public void recordBlobReused() {
        blobsReused.increment();
    }

    public void recordBlobCreated() {
        blobsCreated.increment();
    }

    public void recordEntityCreated() {
        entitiesCreated.increment();
        log.debug("Entity created counter incremented");
    }

    public void recordRejectionPublishFailed() {
        rejectionPublishFailures.increment();
    }

    /**
     * Increment the counter for messages sent to Dead Letter Queue.
     */
    public void recordDlqMessageSent() {
        dlqMessagesSent.increment();
        log.debug("DLQ message sent counter incremented");
    }

    /**
     * Record the processing time for an operation.
     *
     * @param operation The operation to time
     * @param <T> The return type of the operation
     * @return The result of the operation
     */
    public <T> T recordProcessingTime(Supplier<T> operation) {
        return processingTime.record(operation);
    }

    /**
     * Record the processing time for a void operation.
     *
     * @param operation The operation to time
     */
    public void recordProcessingTime(Runnable operation) {
        processingTime.record(operation);
    }
}
