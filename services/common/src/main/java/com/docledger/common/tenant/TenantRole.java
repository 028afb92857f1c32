package com.docledger.common.tenant;

/**
 * Role of the calling actor inside its tenant, as resolved by the upstream auth collaborator.
 */
public enum TenantRole {
    OWNER,
    ADMIN,
    MEMBER,
    VIEWER
}
