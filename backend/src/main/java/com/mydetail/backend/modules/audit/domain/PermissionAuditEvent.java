package com.mydetail.backend.modules.audit.domain;

import java.time.OffsetDateTime;
import java.util.Map;
import java.util.UUID;

/**
 * 권한 관련 감사 이벤트. 저장은 외부 수집기가 담당하고 이 서비스는 발행만 한다.
 */
public record PermissionAuditEvent(
        PermissionAuditAction action,
        String resourceType,
        String resourceKey,
        UUID actorId,
        String correlationId,
        Map<String, Object> detail,
        OffsetDateTime occurredAt
) {
}
