package com.koni.historyinjector.application.ingest;

import com.koni.historyinjector.domain.model.StateRow;
import com.koni.historyinjector.domain.repository.HistorySchemaAdapter;
import com.koni.historyinjector.infrastructure.observability.InjectionMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Optional;

/**
 * Writes history rows into the target store.
 *
 * A row is identified by {@code (metadataId, timestamp)}. Writing an identifier that already
 * exists overwrites state and attribute reference of that row (last received wins), so
 * redelivered messages never produce duplicates. Timestamps older than the entity's latest row
 * are written like any other.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class HistoryWriter {

    /**
     * What a write did to the store.
     */
    public enum WriteResult {
        INSERTED,
        OVERWRITTEN
    }

    private final HistorySchemaAdapter schemaAdapter;
    private final StoreTransactions storeTransactions;
    private final InjectionMetrics metrics;

    /**
     * Atomically upserts one state row. Joins the caller's transaction when one is active, so the
     * attribute blob referenced by {@code attributesId} can be created in the same unit of work.
     *
     * @param metadataId the resolved entity
     * @param attributesId an attribute blob that exists in the store
     * @param state the state text
     * @param timestamp the instant of the reading
     * @return whether a row was inserted or an existing row was overwritten
     * @throws com.koni.historyinjector.domain.exception.StoreWriteException if the transaction failed
     */
    public WriteResult write(long metadataId, long attributesId, String state, Instant timestamp) {
        StateRow row = new StateRow(metadataId, attributesId, state, timestamp);
        return storeTransactions.execute("write state row for metadataId " + metadataId, status -> upsert(row));
    }

    private WriteResult upsert(StateRow row) {
        Optional<Long> existing = schemaAdapter.findStateId(row.getMetadataId(), row.getLastUpdated());
        if (existing.isPresent()) {
            schemaAdapter.updateState(existing.get(), row);
            metrics.recordOverwrite();
            log.info("Duplicate timestamp, row overwritten: stateId={}, metadataId={}, lastUpdated={}, state={}",
                    existing.get(), row.getMetadataId(), row.getLastUpdated(), row.getState());
            return WriteResult.OVERWRITTEN;
        }

        long stateId = schemaAdapter.insertState(row);
        log.debug("State row inserted: stateId={}, metadataId={}, lastUpdated={}",
                stateId, row.getMetadataId(), row.getLastUpdated());
        return WriteResult.INSERTED;
    }
}
