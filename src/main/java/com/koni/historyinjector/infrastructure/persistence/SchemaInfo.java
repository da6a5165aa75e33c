package com.koni.historyinjector.infrastructure.persistence;

import com.koni.historyinjector.domain.repository.HistorySchemaAdapter;
import lombok.Getter;

/**
 * Result of introspecting the history store at startup.
 */
@Getter
public class SchemaInfo {

    private final int schemaVersion;
    private final HistorySchemaAdapter adapter;

    public SchemaInfo(int schemaVersion, HistorySchemaAdapter adapter) {
        this.schemaVersion = schemaVersion;
        this.adapter = adapter;
    }

    public String getAdapterName() {
        return adapter.getName();
    }

    @Override
    public String toString() {
        return "SchemaInfo{schemaVersion=" + schemaVersion + ", adapter=" + adapter.getName() + '}';
    }
}
