package com.docledger.common.tenant;

import com.docledger.common.error.BusinessException;
import com.docledger.common.error.ErrorCode;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for TenantContextHolder thread binding and MDC mirroring.
 */
@DisplayName("TenantContextHolder Tests")
class TenantContextHolderTest {

    private static final TenantContext TENANT_A = TenantContext.of("tenant-a", "alice");
    private static final TenantContext TENANT_B = TenantContext.of("tenant-b", "bob");

    @AfterEach
    void tearDown() {
        TenantContextHolder.clear();
    }

    @Nested
    @DisplayName("Binding")
    class BindingTests {

        @Test
        @DisplayName("Should expose bound context and mirror it into MDC")
        void shouldBindContextAndMdc() {
            // Act
            TenantContextHolder.set(TENANT_A);

            // Assert
            assertThat(TenantContextHolder.get()).contains(TENANT_A);
            assertThat(TenantContextHolder.require()).isEqualTo(TENANT_A);
            assertThat(MDC.get(TenantContextHolder.TENANT_ID_KEY)).isEqualTo("tenant-a");
            assertThat(MDC.get(TenantContextHolder.ACTOR_ID_KEY)).isEqualTo("alice");
        }

        @Test
        @DisplayName("Should reject require() when no context is bound")
        void shouldRejectMissingContext() {
            assertThatThrownBy(TenantContextHolder::require)
                .isInstanceOfSatisfying(BusinessException.class, e ->
                    assertThat(e.getErrorCode()).isEqualTo(ErrorCode.SEC_TENANT_CONTEXT_MISSING.getCode()));
        }

        @Test
        @DisplayName("Should clear context and MDC entries")
        void shouldClear() {
            TenantContextHolder.set(TENANT_A);

            TenantContextHolder.clear();

            assertThat(TenantContextHolder.get()).isEmpty();
            assertThat(MDC.get(TenantContextHolder.TENANT_ID_KEY)).isNull();
        }

        @Test
        @DisplayName("Should not leak context to other threads")
        void shouldNotLeakAcrossThreads() {
            TenantContextHolder.set(TENANT_A);

            boolean boundElsewhere = CompletableFuture
                .supplyAsync(() -> TenantContextHolder.get().isPresent())
                .join();

            assertThat(boundElsewhere).isFalse();
        }
    }

    @Nested
    @DisplayName("Scoped execution")
    class ScopedExecutionTests {

        @Test
        @DisplayName("Should restore the previous binding after callAs")
        void shouldRestorePreviousBinding() {
            TenantContextHolder.set(TENANT_A);

            String seen = TenantContextHolder.callAs(TENANT_B, () -> TenantContextHolder.require().getTenantId());

            assertThat(seen).isEqualTo("tenant-b");
            assertThat(TenantContextHolder.require()).isEqualTo(TENANT_A);
            assertThat(MDC.get(TenantContextHolder.TENANT_ID_KEY)).isEqualTo("tenant-a");
        }

        @Test
        @DisplayName("Should clear the binding after runAs even when the action fails")
        void shouldClearAfterFailure() {
            assertThatThrownBy(() -> TenantContextHolder.runAs(TENANT_B, () -> {
                throw new IllegalStateException("boom");
            })).isInstanceOf(IllegalStateException.class);

            assertThat(TenantContextHolder.get()).isEmpty();
        }
    }

    @Test
    @DisplayName("Should default role to MEMBER and require tenant and actor")
    void shouldBuildContext() {
        assertThat(TENANT_A.getRole()).isEqualTo(TenantRole.MEMBER);
        assertThatThrownBy(() -> TenantContext.of(null, "alice")).isInstanceOf(NullPointerException.class);
    }
}
