package com.koni.historyinjector.infrastructure.observability;

import com.koni.historyinjector.infrastructure.messaging.IngestionHaltSwitch;
import com.koni.historyinjector.infrastructure.persistence.SchemaInfo;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

/**
 * Health indicator for the Home Assistant history store.
 *
 * Reports DOWN when ingestion has been halted after a fatal schema mismatch or when the store
 * cannot answer {@code SELECT 1}. Details carry the schema version and the selected adapter.
 */
@Slf4j
@Component("historyStore")
@RequiredArgsConstructor
public class HistoryStoreHealthIndicator implements HealthIndicator {

    private final JdbcTemplate historyJdbcTemplate;
    private final SchemaInfo historySchemaInfo;
    private final IngestionHaltSwitch haltSwitch;

    @Override
    public Health health() {
        if (haltSwitch.isHalted()) {
            return withSchema(Health.down())
                    .withDetail("halted", true)
                    .withDetail("message", haltSwitch.getHaltReason())
                    .build();
        }

        try {
            Integer result = historyJdbcTemplate.queryForObject("SELECT 1", Integer.class);
            if (result == null || result != 1) {
                log.error("History store health check failed: query did not return expected result");
                return withSchema(Health.down())
                        .withDetail("error", "QueryValidationFailed")
                        .withDetail("message", "SELECT 1 did not return expected result")
                        .build();
            }
            return withSchema(Health.up())
                    .withDetail("halted", false)
                    .build();

        } catch (Exception e) {
            log.error("History store health check failed", e);
            return withSchema(Health.down())
                    .withDetail("error", e.getClass().getSimpleName())
                    .withDetail("message", String.valueOf(e.getMessage()))
                    .build();
        }
    }

    private Health.Builder withSchema(Health.Builder builder) {
        return builder
                .withDetail("schemaVersion", historySchemaInfo.getSchemaVersion())
                .withDetail("adapter", historySchemaInfo.getAdapterName());
    }
}
