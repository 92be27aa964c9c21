package com.mydetail.backend.modules.audit.domain;

public enum PermissionAuditAction {
    BYPASS_GRANTED,
    MEMBERSHIP_ASSIGNED,
    MEMBERSHIP_DEACTIVATED,
    ROLE_DEACTIVATED,
    ROLE_REACTIVATED,
    MODULE_ACCESS_CHANGED,
    MODULE_CAPABILITY_GRANTED,
    MODULE_CAPABILITY_REVOKED,
    SYSTEM_CAPABILITY_GRANTED,
    SYSTEM_CAPABILITY_REVOKED,
    ROLE_GRANTS_APPLIED,
    LEGACY_GRANTS_IMPORTED,
    SNAPSHOT_INVALIDATED
}
