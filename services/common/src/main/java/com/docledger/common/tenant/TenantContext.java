package com.docledger.common.tenant;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Identity of the caller for one operation: the tenant every storage access is scoped to,
 * the acting user and their role.
 */
@Value
@Builder
public class TenantContext {

    @NonNull
    String tenantId;

    @NonNull
    String actorId;

    @Builder.Default
    TenantRole role = TenantRole.MEMBER;

    public static TenantContext of(String tenantId, String actorId) {
        return TenantContext.builder().tenantId(tenantId).actorId(actorId).build();
    }
}
