package com.mydetail.backend.modules.audit.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

import com.mydetail.backend.global.web.RequestIdFilter;
import com.mydetail.backend.modules.audit.domain.PermissionAuditAction;
import com.mydetail.backend.modules.audit.domain.PermissionAuditEvent;

import org.slf4j.MDC;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

@Service
public class PermissionAuditService {

    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    public PermissionAuditService(ApplicationEventPublisher eventPublisher, Clock clock) {
        this.eventPublisher = eventPublisher;
        this.clock = clock;
    }

    public void record(PermissionAuditAction action, String resourceType, String resourceKey, UUID actorId,
                       Map<String, Object> detail) {
        Objects.requireNonNull(action, "action is required");
        Objects.requireNonNull(resourceType, "resourceType is required");
        Objects.requireNonNull(resourceKey, "resourceKey is required");

        Map<String, Object> copy = detail == null ? Map.of() : new LinkedHashMap<>(detail);
        eventPublisher.publishEvent(new PermissionAuditEvent(
                action,
                resourceType,
                resourceKey,
                actorId,
                MDC.get(RequestIdFilter.REQUEST_ID_MDC_KEY),
                copy,
                OffsetDateTime.now(clock)
        ));
    }
}
