package com.koni.historyinjector.infrastructure.persistence;

import org.springframework.dao.CannotAcquireLockException;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.BadSqlGrammarException;
import org.springframework.jdbc.support.AbstractFallbackSQLExceptionTranslator;
import org.springframework.jdbc.support.SQLStateSQLExceptionTranslator;

import java.sql.SQLException;
import java.util.List;
import java.util.Locale;

/**
 * Translates SQLite errors into Spring's exception hierarchy.
 *
 * The SQLite driver reports no SQL state, so Spring's default translators can only produce
 * {@link org.springframework.jdbc.UncategorizedSQLException}. Missing tables or columns become
 * {@link BadSqlGrammarException}; a busy or locked database becomes {@link CannotAcquireLockException}.
 */
public class SQLiteExceptionTranslator extends AbstractFallbackSQLExceptionTranslator {

    static final int SQLITE_BUSY = 5;
    static final int SQLITE_LOCKED = 6;

    private static final List<String> GRAMMAR_MESSAGES = List.of(
            "no such table",
            "no such column",
            "has no column named"
    );

    public SQLiteExceptionTranslator() {
        setFallbackTranslator(new SQLStateSQLExceptionTranslator());
    }

    @Override
    protected DataAccessException doTranslate(String task, String sql, SQLException ex) {
        // extended result codes carry the primary code in the low byte
        int primaryCode = ex.getErrorCode() & 0xff;
        if (primaryCode == SQLITE_BUSY || primaryCode == SQLITE_LOCKED) {
            return new CannotAcquireLockException(buildMessage(task, sql, ex), ex);
        }
        String message = ex.getMessage() == null ? "" : ex.getMessage().toLowerCase(Locale.ROOT);
        for (String grammarMessage : GRAMMAR_MESSAGES) {
            if (message.contains(grammarMessage)) {
                return new BadSqlGrammarException(task, sql == null ? "" : sql, ex);
            }
        }
        return null;
    }
}
