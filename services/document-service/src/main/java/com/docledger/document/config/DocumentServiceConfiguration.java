package com.docledger.document.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.retry.support.RetryTemplate;

import java.util.List;

@Configuration
@EnableConfigurationProperties(DocumentProperties.class)
public class DocumentServiceConfiguration {

    /**
     * Retries whole transactions that lost a row race: a stale optimistic row version or a
     * unique-key collision on the ledger or draft tables. The retried attempt re-reads under
     * lock, so it either succeeds or reports a proper conflict.
     */
    @Bean
    public RetryTemplate documentRetryTemplate(DocumentProperties properties) {
        return RetryTemplate.builder()
            .maxAttempts(properties.getRetry().getMaxAttempts())
            .fixedBackoff(properties.getRetry().getBackoffMillis())
            .retryOn(List.of(ObjectOptimisticLockingFailureException.class, DataIntegrityViolationException.class))
            .build();
    }
}
