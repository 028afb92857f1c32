package com.docledger.common.audit;

import com.docledger.common.tenant.TenantContext;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Writes security-relevant events to the dedicated {@code SECURITY_AUDIT} logger and counts them,
 * so alerting can key on either.
 */
@Component
@RequiredArgsConstructor
public class SecurityEventLogger {

    public static final String AUDIT_LOGGER_NAME = "SECURITY_AUDIT";
    public static final String TENANT_MISMATCH_METRIC = "documents.security.tenant_mismatch";

    private static final Logger AUDIT = LoggerFactory.getLogger(AUDIT_LOGGER_NAME);

    private final MeterRegistry meterRegistry;

    public void tenantMismatch(TenantContext caller, String resourceType, String resourceId, String ownerTenantId) {
        AUDIT.error("SECURITY_EVENT type=TENANT_MISMATCH callerTenant={} actor={} role={} resourceType={} resourceId={} ownerTenant={}",
            caller.getTenantId(), caller.getActorId(), caller.getRole(), resourceType, resourceId, ownerTenantId);
        Counter.builder(TENANT_MISMATCH_METRIC)
            .tag("resource", resourceType)
            .register(meterRegistry)
            .increment();
    }
}
