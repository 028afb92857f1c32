package com.docledger.document;

import com.docledger.common.tenant.TenantContext;
import com.docledger.common.tenant.TenantContextHolder;
import com.docledger.document.event.DocumentEvent;
import com.docledger.document.support.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.context.annotation.Primary;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.test.context.ActiveProfiles;

import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.when;

/**
 * Base Integration Test Class
 *
 * Boots the full document service against an in-memory H2 database in PostgreSQL mode.
 * Kafka is replaced by a mock template and the clock by a {@link MutableClock}. Every test
 * works in its own freshly named tenant, so tests never see each other's documents.
 */
@SpringBootTest
@ActiveProfiles("test")
@Import(BaseIntegrationTest.TestClockConfiguration.class)
public abstract class BaseIntegrationTest {

    @MockBean
    protected KafkaTemplate<String, DocumentEvent> kafkaTemplate;

    @Autowired
    protected MutableClock clock;

    protected String tenantId;

    @BeforeEach
    void setUpIntegrationTest() {
        clock.reset();
        tenantId = "tenant-" + UUID.randomUUID();
        when(kafkaTemplate.send(anyString(), anyString(), any(DocumentEvent.class)))
            .thenReturn(CompletableFuture.completedFuture(null));
    }

    @AfterEach
    void tearDownIntegrationTest() {
        TenantContextHolder.clear();
    }

    /**
     * Run {@code action} as {@code actorId} of the test's tenant.
     */
    protected <T> T as(String actorId, Supplier<T> action) {
        return TenantContextHolder.callAs(TenantContext.of(tenantId, actorId), action);
    }

    protected void runAs(String actorId, Runnable action) {
        TenantContextHolder.runAs(TenantContext.of(tenantId, actorId), action);
    }

    @TestConfiguration
    static class TestClockConfiguration {

        @Bean
        @Primary
        MutableClock testClock() {
            return new MutableClock();
        }
    }
}
