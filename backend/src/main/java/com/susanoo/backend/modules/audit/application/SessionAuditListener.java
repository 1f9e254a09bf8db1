package com.susanoo.backend.modules.audit.application;

import java.util.LinkedHashMap;
import java.util.Map;

import com.susanoo.backend.modules.audit.application.AuditLogService.AuditLogCommand;
import com.susanoo.backend.modules.auth.application.session.SessionEvent;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * Turns session lifecycle events into log lines and audit rows once the originating
 * transaction has committed. Audit failures are logged and dropped: the session operation
 * already happened.
 */
@Component
public class SessionAuditListener {

    private static final Logger log = LoggerFactory.getLogger(SessionAuditListener.class);

    static final String RESOURCE_TYPE = "USER_SESSION";
    private static final String REQUEST_ID_MDC_KEY = "requestId";

    private final AuditLogService auditLogService;

    public SessionAuditListener(AuditLogService auditLogService) {
        this.auditLogService = auditLogService;
    }

    @TransactionalEventListener(fallbackExecution = true)
    public void onSessionEvent(SessionEvent event) {
        log.info("[AUDIT][Session] action={} user={} session={} outcome={} affected={} ip={} ua={}",
                event.auditActionType(), event.userId(), event.sessionId(), event.outcome(),
                event.affected(), event.ip(), event.userAgent());

        if (event.userId() == null) {
            return;
        }

        String resourceKey = event.sessionId() != null ? event.sessionId().toString() : event.userId().toString();
        try {
            auditLogService.record(new AuditLogCommand(
                    event.auditActionType(),
                    RESOURCE_TYPE,
                    resourceKey,
                    event.userId(),
                    MDC.get(REQUEST_ID_MDC_KEY),
                    detailOf(event)
            ));
        } catch (RuntimeException ex) {
            log.warn("[ALERT][Audit] failed to persist action={} user={}: {}",
                    event.auditActionType(), event.userId(), ex.getMessage());
        }
    }

    private Map<String, Object> detailOf(SessionEvent event) {
        Map<String, Object> detail = new LinkedHashMap<>();
        detail.put("outcome", event.outcome());
        detail.put("affected", event.affected());
        if (event.previousSessionId() != null) {
            detail.put("previousSessionId", event.previousSessionId().toString());
        }
        if (event.ip() != null) {
            detail.put("ip", event.ip());
        }
        if (event.userAgent() != null) {
            detail.put("userAgent", event.userAgent());
        }
        return detail;
    }
}
