package com.machine.signals.service;

import com.machine.signals.exception.BackpressureException;
import com.machine.signals.exception.ConstraintViolationException;
import com.machine.signals.exception.SignalStorageException;
import com.machine.signals.exception.StorageUnavailableException;
import com.machine.signals.exception.TransientStorageException;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.RecoverableDataAccessException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.jdbc.CannotGetJdbcConnectionException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.CannotCreateTransactionException;

import java.sql.SQLNonTransientConnectionException;
import java.sql.SQLTransientConnectionException;

/**
 * Maps Spring data access and transaction exceptions onto the signal storage taxonomy.
 *
 * HikariCP reports an acquisition timeout as {@link SQLTransientConnectionException}.
 * Without a cause the pool was merely exhausted (backpressure); with a cause the
 * pool could not open connections at all (storage unavailable).
 */
@Component
public class StorageExceptionTranslator {

    public RuntimeException translateWrite(RuntimeException e) {
        if (e instanceof SignalStorageException) {
            return e;
        }

        SignalStorageException connectionFailure = translateConnectionFailure(e);
        if (connectionFailure != null) {
            return connectionFailure;
        }
        if (e instanceof DataIntegrityViolationException) {
            return new ConstraintViolationException("Signal row rejected: " + e.getMessage(), e);
        }
        if (e instanceof TransientDataAccessException
                || e instanceof RecoverableDataAccessException
                || e instanceof DataAccessResourceFailureException) {
            return new TransientStorageException("Transient insert failure: " + e.getMessage(), e);
        }
        if (e instanceof DataAccessException) {
            return new StorageUnavailableException("Insert failed: " + e.getMessage(), e);
        }
        return e;
    }

    /**
     * Reads are not retried, so every data access failure is reported as unavailability
     * unless the pool was just busy.
     */
    public RuntimeException translateRead(RuntimeException e) {
        if (e instanceof SignalStorageException) {
            return e;
        }

        SignalStorageException connectionFailure = translateConnectionFailure(e);
        if (connectionFailure != null) {
            return connectionFailure;
        }
        if (e instanceof DataAccessException) {
            return new StorageUnavailableException("Query failed: " + e.getMessage(), e);
        }
        return e;
    }

    private SignalStorageException translateConnectionFailure(RuntimeException e) {
        SQLTransientConnectionException timeout = findCause(e, SQLTransientConnectionException.class);
        if (timeout != null) {
            if (timeout.getCause() == null) {
                return new BackpressureException("Connection pool exhausted: " + timeout.getMessage(), e);
            }
            return new StorageUnavailableException("Cannot connect to storage: " + timeout.getCause().getMessage(), e);
        }
        if (e instanceof CannotCreateTransactionException
                || e instanceof CannotGetJdbcConnectionException
                || findCause(e, SQLNonTransientConnectionException.class) != null) {
            return new StorageUnavailableException("Cannot connect to storage: " + e.getMessage(), e);
        }
        return null;
    }

    private static <T extends Throwable> T findCause(Throwable error, Class<T> type) {
        Throwable current = error;
        while (current != null) {
            if (type.isInstance(current)) {
                return type.cast(current);
            }
            if (current.getCause() == current) {
                break;
            }
            current = current.getCause();
        }
        return null;
    }
}
