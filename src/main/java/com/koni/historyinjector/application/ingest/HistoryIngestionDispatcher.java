package com.koni.historyinjector.application.ingest;

import com.koni.historyinjector.application.port.RejectionPublisher;
import com.koni.historyinjector.domain.event.RecordRejected;
import com.koni.historyinjector.domain.exception.DecodeException;
import com.koni.historyinjector.domain.exception.EntityLockTimeoutException;
import com.koni.historyinjector.domain.exception.RecordRejectedException;
import com.koni.historyinjector.domain.model.AttributeBlob;
import com.koni.historyinjector.domain.model.DispatchReport;
import com.koni.historyinjector.domain.model.EntityMetadata;
import com.koni.historyinjector.domain.model.HistoryRecord;
import com.koni.historyinjector.domain.model.RecordOutcome;
import com.koni.historyinjector.domain.model.RecordStage;
import com.koni.historyinjector.domain.model.RejectionReason;
import com.koni.historyinjector.infrastructure.observability.InjectionMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Processes one inbound message end to end.
 *
 * Records of a message are applied strictly in array order. Entity resolution is single-flight
 * inside {@link EntityResolver}. The store write of a record is serialized with other records of
 * the same entity by a per-entity lock; different entities proceed in parallel.
 * Each record moves through
 * {@code RECEIVED -> DECODED -> TIMESTAMP_CHECKED -> ENTITY_RESOLVED -> ATTRIBUTES_ENCODED -> COMMITTED}
 * or ends in {@code REJECTED}. A rejected record never affects its siblings.
 *
 * {@link com.koni.historyinjector.domain.exception.FatalSchemaMismatchException} is not handled
 * here and aborts the message.
 */
@Slf4j
@Service
public class HistoryIngestionDispatcher {

    private final MessageDecoder messageDecoder;
    private final TimestampValidator timestampValidator;
    private final EntityResolver entityResolver;
    private final AttributeCodec attributeCodec;
    private final HistoryWriter historyWriter;
    private final StoreTransactions storeTransactions;
    private final RejectionPublisher rejectionPublisher;
    private final InjectionMetrics metrics;
    private final Clock clock;
    private final Duration lockTimeout;

    /** One lock per entity id seen, so the map is bounded by the number of entities in the store. */
    private final ConcurrentMap<String, ReentrantLock> entityLocks = new ConcurrentHashMap<>();

    public HistoryIngestionDispatcher(
            MessageDecoder messageDecoder,
            TimestampValidator timestampValidator,
            EntityResolver entityResolver,
            AttributeCodec attributeCodec,
            HistoryWriter historyWriter,
            StoreTransactions storeTransactions,
            RejectionPublisher rejectionPublisher,
            InjectionMetrics metrics,
            Clock clock,
            @Value("${injector.lock-timeout:10s}") Duration lockTimeout) {
        this.messageDecoder = messageDecoder;
        this.timestampValidator = timestampValidator;
        this.entityResolver = entityResolver;
        this.attributeCodec = attributeCodec;
        this.historyWriter = historyWriter;
        this.storeTransactions = storeTransactions;
        this.rejectionPublisher = rejectionPublisher;
        this.metrics = metrics;
        this.clock = clock;
        this.lockTimeout = lockTimeout;
    }

    /**
     * Decodes and applies one message.
     *
     * @param topic the originating topic the entity id is derived from
     * @param payload the raw payload
     * @return the outcome of every record, or the message-level rejection
     */
    public DispatchReport dispatch(String topic, byte[] payload) {
        metrics.recordMessageReceived();

        List<HistoryRecord> records;
        try {
            records = messageDecoder.decode(topic, payload);
        } catch (DecodeException e) {
            log.warn("Message dropped: topic={}, reason={}, detail={}", topic, RejectionReason.DECODE_ERROR, e.getMessage());
            metrics.recordMessageRejected();
            report(null, topic, -1, RejectionReason.DECODE_ERROR, e.getMessage());
            return DispatchReport.messageRejected(topic, RejectionReason.DECODE_ERROR, e.getMessage());
        }

        List<RecordOutcome> outcomes = new ArrayList<>(records.size());
        for (HistoryRecord record : records) {
            outcomes.add(process(topic, record));
        }
        DispatchReport dispatchReport = DispatchReport.of(topic, outcomes);
        log.debug("Message processed: {}", dispatchReport);
        return dispatchReport;
    }

    private RecordOutcome process(String topic, HistoryRecord record) {
        AtomicReference<RecordStage> stage = new AtomicReference<>(RecordStage.DECODED);
        try {
            return metrics.recordProcessingTime(() -> apply(record, stage));
        } catch (RecordRejectedException e) {
            log.warn("Record dropped: entityId={}, index={}, stage={}, reason={}, detail={}",
                    record.getEntityId(), record.getIndex(), stage.get(), e.getReason(), e.getMessage());
            metrics.recordRejected(e.getReason());
            report(record.getEntityId(), topic, record.getIndex(), e.getReason(), e.getMessage());
            return RecordOutcome.rejected(record.getEntityId(), record.getIndex(), stage.get(),
                    e.getReason(), e.getMessage());
        }
    }

    private RecordOutcome apply(HistoryRecord record, AtomicReference<RecordStage> stage) {
        Instant timestamp = timestampValidator.validate(record.getTimestamp());
        stage.set(RecordStage.TIMESTAMP_CHECKED);

        // outside the entity lock: concurrent records of a new entity wait on the in-flight resolution
        EntityMetadata entity = entityResolver.resolve(record.getEntityId(), record.getAttributes());
        stage.set(RecordStage.ENTITY_RESOLVED);

        ReentrantLock lock = acquire(record.getEntityId());
        try {
            HistoryWriter.WriteResult result = storeTransactions.execute(
                    "commit record " + record.getIndex() + " of " + record.getEntityId(),
                    status -> {
                        AttributeBlob blob = attributeCodec.encode(record.getAttributes());
                        stage.set(RecordStage.ATTRIBUTES_ENCODED);
                        return historyWriter.write(entity.getInternalId(), blob.getAttributesId(),
                                record.getState(), timestamp);
                    });
            stage.set(RecordStage.COMMITTED);

            metrics.recordCommitted();
            log.info("Record committed: entityId={}, index={}, timestamp={}, state={}, result={}",
                    record.getEntityId(), record.getIndex(), timestamp, record.getState(), result);
            return RecordOutcome.committed(record.getEntityId(), record.getIndex());
        } finally {
            lock.unlock();
        }
    }

    private ReentrantLock acquire(String entityId) {
        ReentrantLock lock = entityLocks.computeIfAbsent(entityId, id -> new ReentrantLock());
        try {
            if (!lock.tryLock(lockTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                throw new EntityLockTimeoutException("Timed out after " + lockTimeout
                        + " waiting for another record of " + entityId);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new EntityLockTimeoutException("Interrupted while waiting for the lock of " + entityId, e);
        }
        return lock;
    }

    private void report(String entityId, String topic, int index, RejectionReason reason, String detail) {
        rejectionPublisher.publish(new RecordRejected(
                UUID.randomUUID(),
                entityId,
                topic,
                index,
                reason,
                detail,
                clock.instant()
        ));
    }
}
