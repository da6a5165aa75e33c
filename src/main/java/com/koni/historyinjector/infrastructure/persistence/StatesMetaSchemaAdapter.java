package com.koni.historyinjector.infrastructure.persistence;

import com.koni.historyinjector.domain.model.StateRow;
import com.koni.historyinjector.domain.repository.HistorySchemaAdapter;
import org.springframework.jdbc.core.JdbcTemplate;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Adapter for Home Assistant recorder schemas that keep entity ids in {@code states_meta}
 * and timestamps as epoch seconds in {@code *_ts} columns.
 *
 * Supported schema versions: 41 to 50.
 */
public class StatesMetaSchemaAdapter implements HistorySchemaAdapter {

    public static final String NAME = "states-meta";
    static final int MIN_VERSION = 41;
    static final int MAX_VERSION = 50;

    /** Home Assistant's {@code origin_idx} for states coming from the local instance. */
    private static final int ORIGIN_LOCAL = 0;

    private static final Map<String, Set<String>> REQUIRED_COLUMNS = Map.of(
            "states_meta", Set.of("metadata_id", "entity_id"),
            "state_attributes", Set.of("attributes_id", "hash", "shared_attrs"),
            "states", Set.of("state_id", "state", "last_changed_ts", "last_updated_ts", "old_state_id",
                    "attributes_id", "origin_idx", "metadata_id")
    );

    private final JdbcTemplate jdbcTemplate;

    public StatesMetaSchemaAdapter(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public boolean supports(int schemaVersion) {
        return schemaVersion >= MIN_VERSION && schemaVersion <= MAX_VERSION;
    }

    @Override
    public Map<String, Set<String>> requiredColumns() {
        return REQUIRED_COLUMNS;
    }

    @Override
    public Optional<Long> findMetadataId(String entityId) {
        return first(jdbcTemplate.queryForList(
                "SELECT metadata_id FROM states_meta WHERE entity_id = ? ORDER BY metadata_id LIMIT 1",
                Long.class, entityId));
    }

    @Override
    public long registerMetadata(String entityId) {
        // insert-if-absent in one statement, also safe on stores without a unique index
        jdbcTemplate.update(
                "INSERT INTO states_meta (entity_id) SELECT ? WHERE NOT EXISTS "
                        + "(SELECT 1 FROM states_meta WHERE entity_id = ?)",
                entityId, entityId);
        return findMetadataId(entityId)
                .orElseThrow(() -> new IllegalStateException("states_meta row for " + entityId + " vanished"));
    }

    @Override
    public long attributeHash(byte[] encoded) {
        return Fnv1aHash.hash32(encoded);
    }

    @Override
    public Optional<Long> findAttributesId(long hash, String encoded) {
        return first(jdbcTemplate.queryForList(
                "SELECT attributes_id FROM state_attributes WHERE hash = ? AND shared_attrs = ? "
                        + "ORDER BY attributes_id LIMIT 1",
                Long.class, hash, encoded));
    }

    @Override
    public long insertAttributes(long hash, String encoded) {
        jdbcTemplate.update("INSERT INTO state_attributes (hash, shared_attrs) VALUES (?, ?)", hash, encoded);
        return lastInsertRowId();
    }

    @Override
    public long countAttributeReferences(long attributesId) {
        Long count = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM states WHERE attributes_id = ?", Long.class, attributesId);
        return count == null ? 0 : count;
    }

    @Override
    public Optional<Long> findStateId(long metadataId, Instant lastUpdated) {
        return first(jdbcTemplate.queryForList(
                "SELECT state_id FROM states WHERE metadata_id = ? AND last_updated_ts = ? "
                        + "ORDER BY state_id DESC LIMIT 1",
                Long.class, metadataId, toEpochSeconds(lastUpdated)));
    }

    @Override
    public long insertState(StateRow row) {
        jdbcTemplate.update(
                "INSERT INTO states (state, last_changed_ts, last_updated_ts, old_state_id, attributes_id, "
                        + "origin_idx, metadata_id) VALUES (?, ?, ?, NULL, ?, ?, ?)",
                row.getState(),
                toEpochSeconds(row.getLastChanged()),
                toEpochSeconds(row.getLastUpdated()),
                row.getAttributesId(),
                ORIGIN_LOCAL,
                row.getMetadataId());
        return lastInsertRowId();
    }

    @Override
    public void updateState(long stateId, StateRow row) {
        jdbcTemplate.update("UPDATE states SET state = ?, attributes_id = ? WHERE state_id = ?",
                row.getState(), row.getAttributesId(), stateId);
    }

    /**
     * Home Assistant stores timestamps as fractional epoch seconds.
     */
    static double toEpochSeconds(Instant instant) {
        return instant.getEpochSecond() + instant.getNano() / 1_000_000_000d;
    }

    private long lastInsertRowId() {
        // same connection as the insert: both run in the caller's transaction
        Long id = jdbcTemplate.queryForObject("SELECT last_insert_rowid()", Long.class);
        if (id == null || id == 0) {
            throw new IllegalStateException("SQLite reported no inserted row id");
        }
        return id;
    }

    private static Optional<Long> first(List<Long> ids) {
        return ids.isEmpty() ? Optional.empty() : Optional.ofNullable(ids.get(0));
    }
}
