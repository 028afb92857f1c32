package com.docledger.document.exception;

import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.transaction.TransactionSystemException;
import org.springframework.transaction.TransactionTimedOutException;

import java.sql.SQLException;
import java.sql.SQLTimeoutException;
import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.Set;

/**
 * Recognises a lock wait or transaction that ran out of time, wherever it sits in an exception.
 *
 * <p>A failed rollback can replace the lock failure that caused it, so the whole cause chain,
 * suppressed exceptions and the application exception of a {@link TransactionSystemException}
 * are inspected.
 */
public final class LockFailures {

    /** PostgreSQL lock_not_available */
    private static final String PG_LOCK_NOT_AVAILABLE = "55P03";
    /** PostgreSQL query_canceled, raised for statement and transaction timeouts */
    private static final String PG_QUERY_CANCELED = "57014";
    /** H2 lock and statement timeouts */
    private static final String H2_TIMEOUT = "HYT00";

    private LockFailures() {
    }

    public static boolean isLockTimeout(Throwable failure) {
        Set<Throwable> seen = Collections.newSetFromMap(new IdentityHashMap<>());
        Deque<Throwable> pending = new ArrayDeque<>();
        pending.push(failure);
        while (!pending.isEmpty()) {
            Throwable current = pending.pop();
            if (!seen.add(current)) {
                continue;
            }
            if (isTimeoutType(current)) {
                return true;
            }
            if (current.getCause() != null) {
                pending.push(current.getCause());
            }
            for (Throwable suppressed : current.getSuppressed()) {
                pending.push(suppressed);
            }
            if (current instanceof TransactionSystemException) {
                Throwable original = ((TransactionSystemException) current).getApplicationException();
                if (original != null) {
                    pending.push(original);
                }
            }
        }
        return false;
    }

    private static boolean isTimeoutType(Throwable failure) {
        if (failure instanceof PessimisticLockingFailureException
            || failure instanceof QueryTimeoutException
            || failure instanceof TransactionTimedOutException
            || failure instanceof jakarta.persistence.PessimisticLockException
            || failure instanceof jakarta.persistence.LockTimeoutException
            || failure instanceof jakarta.persistence.QueryTimeoutException
            || failure instanceof org.hibernate.PessimisticLockException
            || failure instanceof org.hibernate.exception.LockAcquisitionException
            || failure instanceof SQLTimeoutException) {
            return true;
        }
        if (failure instanceof SQLException) {
            String state = ((SQLException) failure).getSQLState();
            return PG_LOCK_NOT_AVAILABLE.equals(state) || PG_QUERY_CANCELED.equals(state) || H2_TIMEOUT.equals(state);
        }
        return false;
    }
}
