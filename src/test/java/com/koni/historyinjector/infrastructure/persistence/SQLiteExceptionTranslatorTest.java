package com.koni.historyinjector.infrastructure.persistence;

import com.koni.historyinjector.tags.UnitTest;
import org.junit.jupiter.api.Test;
import org.springframework.dao.CannotAcquireLockException;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.BadSqlGrammarException;

import java.sql.SQLException;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for SQLiteExceptionTranslator.
 */
@UnitTest
class SQLiteExceptionTranslatorTest {

    private final SQLiteExceptionTranslator translator = new SQLiteExceptionTranslator();

    @Test
    void shouldTranslateBusyDatabaseToLockFailure() {
        // Given: SQLITE_BUSY_SNAPSHOT is an extended code of SQLITE_BUSY
        SQLException busy = new SQLException("[SQLITE_BUSY_SNAPSHOT] database is locked", null, 517);

        // When
        DataAccessException translated = translator.translate("insert", "INSERT INTO states", busy);

        // Then
        assertThat(translated).isInstanceOf(CannotAcquireLockException.class);
        assertThat(translated.getCause()).isSameAs(busy);
    }

    @Test
    void shouldTranslateMissingTableToGrammarError() {
        // Given
        SQLException missing = new SQLException("[SQLITE_ERROR] SQL error or missing database (no such table: states)",
                null, 1);

        // When
        DataAccessException translated = translator.translate("select", "SELECT * FROM states", missing);

        // Then
        assertThat(translated).isInstanceOf(BadSqlGrammarException.class);
    }

    @Test
    void shouldTranslateMissingColumnToGrammarError() {
        SQLException missing = new SQLException("table states has no column named origin_idx", null, 1);

        assertThat(translator.translate("insert", "INSERT INTO states", missing))
                .isInstanceOf(BadSqlGrammarException.class);
    }

    @Test
    void shouldFallBackForOtherErrors() {
        // Given
        SQLException constraint = new SQLException("[SQLITE_CONSTRAINT] UNIQUE constraint failed", null, 19);

        // When
        DataAccessException translated = translator.translate("insert", "INSERT INTO states_meta", constraint);

        // Then
        assertThat(translated)
                .isNotNull()
                .isNotInstanceOf(BadSqlGrammarException.class)
                .isNotInstanceOf(CannotAcquireLockException.class);
    }
}
