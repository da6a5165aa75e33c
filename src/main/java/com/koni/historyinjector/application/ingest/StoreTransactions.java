package com.koni.historyinjector.application.ingest;

import com.koni.historyinjector.domain.exception.FatalSchemaMismatchException;
import com.koni.historyinjector.domain.exception.StoreWriteException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.BadSqlGrammarException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionCallback;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Runs work against the history store in a bounded transaction and translates store failures.
 *
 * - SQL grammar errors mean the schema changed underneath us: {@link FatalSchemaMismatchException}
 * - any other data access or transaction failure: {@link StoreWriteException}, rolled back
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StoreTransactions {

    private final TransactionTemplate historyTransactionTemplate;

    /**
     * @param description what the transaction does, for error messages
     * @param work the work to run; joins an already active transaction
     */
    public <T> T execute(String description, TransactionCallback<T> work) {
        try {
            return historyTransactionTemplate.execute(work);
        } catch (BadSqlGrammarException e) {
            log.error("History store rejected SQL while trying to {}: {}", description, e.getMessage(), e);
            throw new FatalSchemaMismatchException("History store schema no longer matches while trying to "
                    + description + ": " + e.getSQLException().getMessage(), e);
        } catch (DataAccessException | TransactionException e) {
            log.error("History store transaction failed while trying to {}", description, e);
            throw new StoreWriteException("Failed to " + description + ": " + e.getMessage(), e);
        }
    }
}
