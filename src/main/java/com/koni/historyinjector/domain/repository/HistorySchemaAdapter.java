package com.koni.historyinjector.domain.repository;

import com.koni.historyinjector.domain.model.StateRow;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Versioned adapter over the target store's history schema.
 * Each implementation knows one family of schema versions: its table and column names
 * and how attribute blobs are deduplicated. The adapter is selected once at startup from the
 * introspected schema version; an unknown version is fatal.
 *
 * All methods are expected to run inside a caller-managed transaction.
 */
public interface HistorySchemaAdapter {

    /**
     * @return a short name used in logs and health details
     */
    String getName();

    /**
     * @param schemaVersion the version read from the store
     * @return true if this adapter can safely write into a store of that version
     */
    boolean supports(int schemaVersion);

    /**
     * @return table name to the columns this adapter reads or writes
     */
    Map<String, Set<String>> requiredColumns();

    Optional<Long> findMetadataId(String entityId);

    /**
     * Registers the entity if it is not yet known and returns its identifier.
     * Safe against a concurrent insert of the same entity by another writer.
     */
    long registerMetadata(String entityId);

    /**
     * Computes the content digest the schema uses to index attribute blobs.
     */
    long attributeHash(byte[] encoded);

    Optional<Long> findAttributesId(long hash, String encoded);

    long insertAttributes(long hash, String encoded);

    /**
     * @return the number of state rows referencing the blob
     */
    long countAttributeReferences(long attributesId);

    /**
     * Finds the authoritative row for an entity at an exact timestamp.
     */
    Optional<Long> findStateId(long metadataId, Instant lastUpdated);

    long insertState(StateRow row);

    void updateState(long stateId, StateRow row);
}
