package com.koni.historyinjector.infrastructure.persistence;

import com.koni.historyinjector.domain.repository.HistorySchemaAdapter;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import javax.sql.DataSource;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

/**
 * Wiring for the Home Assistant history store.
 *
 * Introspection runs while the context starts, so an incompatible store aborts startup before
 * any listener container consumes a message.
 */
@Configuration
public class HistoryStoreConfiguration {

    @Value("${injector.store.path}")
    private String storePath;

    @Value("${injector.store.transaction-timeout:10s}")
    private Duration transactionTimeout;

    @Bean
    public JdbcTemplate historyJdbcTemplate(DataSource dataSource) {
        JdbcTemplate jdbcTemplate = new JdbcTemplate(dataSource);
        jdbcTemplate.setExceptionTranslator(new SQLiteExceptionTranslator());
        return jdbcTemplate;
    }

    /**
     * Every store write runs in this template: propagation REQUIRED, bounded by the transaction timeout.
     */
    @Bean
    public TransactionTemplate historyTransactionTemplate(PlatformTransactionManager transactionManager) {
        TransactionTemplate template = new TransactionTemplate(transactionManager);
        template.setTimeout((int) transactionTimeout.toSeconds());
        return template;
    }

    @Bean
    public SchemaInfo historySchemaInfo(JdbcTemplate historyJdbcTemplate) {
        List<HistorySchemaAdapter> adapters = List.of(new StatesMetaSchemaAdapter(historyJdbcTemplate));
        return new SchemaIntrospector(historyJdbcTemplate, Path.of(storePath), adapters).introspect();
    }

    @Bean
    public HistorySchemaAdapter historySchemaAdapter(SchemaInfo historySchemaInfo) {
        return historySchemaInfo.getAdapter();
    }
}
