package com.docledger.document.exception;

import org.hibernate.PessimisticLockException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.orm.jpa.JpaSystemException;
import org.springframework.transaction.TransactionSystemException;

import java.sql.SQLException;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("LockFailures")
class LockFailuresTest {

    @Nested
    @DisplayName("Lock and timeout failures")
    class Recognised {

        @Test
        @DisplayName("Should recognise a translated pessimistic lock failure")
        void translatedLockFailure() {
            assertThat(LockFailures.isLockTimeout(new PessimisticLockingFailureException("lock wait"))).isTrue();
        }

        @Test
        @DisplayName("Should see a lock failure hidden behind a failed rollback")
        void lockFailureBehindRollbackFailure() {
            PessimisticLockException lockFailure = new PessimisticLockException(
                "Timeout trying to lock table \"documents\"", new SQLException("Timeout", "HYT00", 50200), "select");
            JpaSystemException rollbackFailure = new JpaSystemException(
                new RuntimeException("Unable to rollback against JDBC Connection", lockFailure));

            assertThat(LockFailures.isLockTimeout(rollbackFailure)).isTrue();
        }

        @Test
        @DisplayName("Should see the application exception a failed rollback replaced")
        void applicationExceptionOfTransactionSystemException() {
            TransactionSystemException rollbackFailure = new TransactionSystemException("Could not roll back");
            rollbackFailure.initApplicationException(new PessimisticLockingFailureException("lock wait"));

            assertThat(LockFailures.isLockTimeout(rollbackFailure)).isTrue();
        }

        @Test
        @DisplayName("Should recognise PostgreSQL lock_not_available by SQL state")
        void postgresLockNotAvailable() {
            SQLException sqlException = new SQLException("canceling statement due to lock timeout", "55P03");

            assertThat(LockFailures.isLockTimeout(new RuntimeException("wrapped", sqlException))).isTrue();
        }
    }

    @Nested
    @DisplayName("Other failures")
    class NotRecognised {

        @Test
        @DisplayName("Should ignore a unique key violation")
        void uniqueKeyViolation() {
            assertThat(LockFailures.isLockTimeout(new DataIntegrityViolationException("duplicate",
                new SQLException("duplicate key", "23505")))).isFalse();
        }

        @Test
        @DisplayName("Should ignore a rollback failure with an unrelated cause")
        void unrelatedRollbackFailure() {
            JpaSystemException rollbackFailure = new JpaSystemException(
                new RuntimeException("Unable to rollback against JDBC Connection", new SQLException("closed", "08003")));

            assertThat(LockFailures.isLockTimeout(rollbackFailure)).isFalse();
        }
    }
}
