package com.mediacache.infrastructure.persistence;

import com.mediacache.application.exceptions.ConflictException;
import com.mediacache.application.exceptions.ResourceExhaustedException;
import com.mediacache.application.exceptions.ValidationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.jdbc.CannotGetJdbcConnectionException;
import org.springframework.transaction.CannotCreateTransactionException;
import org.sqlite.SQLiteErrorCode;
import org.sqlite.SQLiteException;

/**
 * Maps Spring and SQLite data-access failures onto the engine's error categories.
 *
 * <p>Anything not recognized is returned unchanged and surfaces as an internal error.
 */
@Slf4j
public final class DataAccessErrors {

    private DataAccessErrors() {
    }

    public static RuntimeException translate(RuntimeException e, String operation) {
        if (e instanceof CannotCreateTransactionException
            || e instanceof CannotGetJdbcConnectionException) {
            log.warn("No database connection available for {}: {}", operation, e.getMessage());
            return new ResourceExhaustedException("Database connection pool exhausted", e);
        }

        SQLiteException sqlite = sqliteCause(e);
        if (sqlite != null && sqlite.getResultCode() != null) {
            SQLiteErrorCode code = sqlite.getResultCode();
            String name = code.name();
            if (name.startsWith("SQLITE_BUSY") || name.startsWith("SQLITE_LOCKED")) {
                log.warn("Database busy during {}: {}", operation, code);
                return new ResourceExhaustedException("Database busy", e);
            }
            if (code == SQLiteErrorCode.SQLITE_CONSTRAINT_UNIQUE
                || code == SQLiteErrorCode.SQLITE_CONSTRAINT_PRIMARYKEY) {
                return new ConflictException("A live record already exists for this path", e);
            }
            if (code == SQLiteErrorCode.SQLITE_CONSTRAINT && String.valueOf(sqlite.getMessage()).contains("UNIQUE")) {
                return new ConflictException("A live record already exists for this path", e);
            }
            if (name.startsWith("SQLITE_CONSTRAINT")) {
                return new ValidationException("Record violates a schema constraint", e);
            }
        }

        if (e instanceof DuplicateKeyException) {
            return new ConflictException("A live record already exists for this path", e);
        }
        if (e instanceof DataIntegrityViolationException) {
            return new ValidationException("Record violates a schema constraint", e);
        }
        if (e instanceof PessimisticLockingFailureException || e instanceof QueryTimeoutException) {
            return new ResourceExhaustedException("Database busy", e);
        }
        return e;
    }

    private static SQLiteException sqliteCause(Throwable e) {
        Throwable current = e;
        while (current != null) {
            if (current instanceof SQLiteException) {
                return (SQLiteException) current;
            }
            current = current.getCause();
        }
        return null;
    }
}
