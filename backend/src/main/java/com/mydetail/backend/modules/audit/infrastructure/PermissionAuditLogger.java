package com.mydetail.backend.modules.audit.infrastructure;

import com.mydetail.backend.modules.audit.domain.PermissionAuditEvent;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * 감사 이벤트를 전용 로거로 내보낸다. 변경 이벤트는 커밋된 경우에만 기록된다.
 */
@Component
public class PermissionAuditLogger {

    private static final Logger audit = LoggerFactory.getLogger("PERMISSION_AUDIT");

    @TransactionalEventListener(fallbackExecution = true)
    public void onAuditEvent(PermissionAuditEvent event) {
        audit.info("action={} resourceType={} resourceKey={} actor={} correlationId={} detail={} at={}",
                event.action(),
                event.resourceType(),
                event.resourceKey(),
                event.actorId() == null ? "-" : event.actorId(),
                event.correlationId() == null ? "-" : event.correlationId(),
                event.detail(),
                event.occurredAt());
    }
}
