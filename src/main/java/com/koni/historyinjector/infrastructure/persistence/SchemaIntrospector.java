package com.koni.historyinjector.infrastructure.persistence;

import com.koni.historyinjector.domain.exception.FatalSchemaMismatchException;
import com.koni.historyinjector.domain.repository.HistorySchemaAdapter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Inspects the history store once at startup and selects the schema adapter that can write into it.
 *
 * The store is never created or migrated: a missing file, an unknown schema version or a missing
 * table or column all raise {@link FatalSchemaMismatchException}.
 */
@Slf4j
public class SchemaIntrospector {

    private final JdbcTemplate jdbcTemplate;
    private final Path storePath;
    private final List<HistorySchemaAdapter> adapters;

    public SchemaIntrospector(JdbcTemplate jdbcTemplate, Path storePath, List<HistorySchemaAdapter> adapters) {
        this.jdbcTemplate = jdbcTemplate;
        this.storePath = storePath;
        this.adapters = adapters;
    }

    /**
     * @return the detected schema version and the adapter selected for it
     * @throws FatalSchemaMismatchException if no adapter can safely write into the store
     */
    public SchemaInfo introspect() {
        if (!Files.isRegularFile(storePath)) {
            throw new FatalSchemaMismatchException("History store not found at " + storePath);
        }

        int version = readSchemaVersion();
        HistorySchemaAdapter adapter = adapters.stream()
                .filter(candidate -> candidate.supports(version))
                .findFirst()
                .orElseThrow(() -> new FatalSchemaMismatchException(
                        "Unsupported history store schema version " + version));

        for (Map.Entry<String, Set<String>> table : adapter.requiredColumns().entrySet()) {
            Set<String> present = readColumns(table.getKey());
            if (present.isEmpty()) {
                throw new FatalSchemaMismatchException("History store has no table '" + table.getKey() + "'");
            }
            Set<String> missing = new TreeSet<>(table.getValue());
            missing.removeAll(present);
            if (!missing.isEmpty()) {
                throw new FatalSchemaMismatchException("History store table '" + table.getKey()
                        + "' is missing columns " + missing);
            }
        }

        SchemaInfo info = new SchemaInfo(version, adapter);
        log.info("History store verified: path={}, schemaVersion={}, adapter={}",
                storePath, version, adapter.getName());
        return info;
    }

    private int readSchemaVersion() {
        List<Integer> versions;
        try {
            versions = jdbcTemplate.queryForList(
                    "SELECT schema_version FROM schema_changes ORDER BY change_id DESC LIMIT 1", Integer.class);
        } catch (DataAccessException e) {
            throw new FatalSchemaMismatchException("Cannot read schema version from " + storePath
                    + ": " + e.getMessage(), e);
        }
        if (versions.isEmpty() || versions.get(0) == null) {
            throw new FatalSchemaMismatchException("History store at " + storePath + " records no schema version");
        }
        return versions.get(0);
    }

    private Set<String> readColumns(String table) {
        Set<String> columns = new HashSet<>();
        jdbcTemplate.query("PRAGMA table_info(" + table + ")",
                rs -> {
                    columns.add(rs.getString("name"));
                });
        return columns;
    }
}
