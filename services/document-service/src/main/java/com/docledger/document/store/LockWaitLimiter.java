package com.docledger.document.store;

import com.docledger.document.config.DocumentProperties;
import com.docledger.document.repository.DocumentRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.support.JdbcUtils;
import org.springframework.jdbc.support.MetaDataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import javax.sql.DataSource;
import java.sql.DatabaseMetaData;

/**
 * Caps row lock waits inside the current transaction.
 *
 * <p>Hibernate ignores a positive lock timeout hint on PostgreSQL, so there the bound is set with
 * a transaction-local {@code lock_timeout}. Other databases keep their connection setting, such
 * as the H2 {@code LOCK_TIMEOUT} URL option.
 */
@Slf4j
@Component
public class LockWaitLimiter {

    private final DocumentRepository documentRepository;
    private final String lockTimeout;
    private final boolean transactionScoped;

    public LockWaitLimiter(DocumentRepository documentRepository, DataSource dataSource, DocumentProperties properties) {
        this.documentRepository = documentRepository;
        this.lockTimeout = properties.getLocking().getLockWait().toMillis() + "ms";
        this.transactionScoped = isPostgreSql(dataSource);
        log.info("Row lock wait bound {}", transactionScoped ? lockTimeout + " per transaction" : "left to the connection");
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public void apply() {
        if (transactionScoped) {
            documentRepository.setLocalLockTimeout(lockTimeout);
        }
    }

    private static boolean isPostgreSql(DataSource dataSource) {
        try {
            String product = JdbcUtils.extractDatabaseMetaData(dataSource, DatabaseMetaData::getDatabaseProductName);
            return product != null && product.contains("PostgreSQL");
        } catch (MetaDataAccessException e) {
            log.warn("Could not determine the database product, row lock waits use the connection setting", e);
            return false;
        }
    }
}
