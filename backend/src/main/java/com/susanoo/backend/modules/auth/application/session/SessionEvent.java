package com.susanoo.backend.modules.auth.application.session;

import java.util.List;
import java.util.UUID;

/**
 * Lifecycle notification published after every session state change. Carries ids and request
 * metadata only, never a token value.
 *
 * @param previousSessionId the consumed session, set for {@code ROTATED} only
 * @param outcome           {@code LOGIN} or {@code REGISTRATION} for {@code CREATED}, a {@link RejectionReason} name for
 *                          {@code ROTATION_REJECTED}, an {@link InvalidationReason} name for
 *                          {@code ROTATED} and {@code INVALIDATED}, a {@link SessionAnomaly} name
 *                          for {@code ANOMALY}
 * @param affected          number of sessions touched
 */
public record SessionEvent(
        SessionEventType type,
        UUID userId,
        UUID sessionId,
        UUID previousSessionId,
        String outcome,
        int affected,
        String ip,
        String userAgent
) {

    public static final String OUTCOME_LOGIN = "LOGIN";
    public static final String OUTCOME_REGISTRATION = "REGISTRATION";
    public static final String AUDIT_ACTION_PREFIX = "SESSION_";

    /**
     * Audit action types that count as a user-initiated logout.
     */
    public static final List<String> LOGOUT_ACTION_TYPES = List.of(
            AUDIT_ACTION_PREFIX + InvalidationReason.LOGOUT.name(),
            AUDIT_ACTION_PREFIX + InvalidationReason.LOGOUT_ALL.name()
    );

    public static SessionEvent created(UUID userId, UUID sessionId, String outcome, ClientContext context) {
        return new SessionEvent(SessionEventType.CREATED, userId, sessionId, null, outcome, 1,
                context.ip(), context.userAgent());
    }

    public static SessionEvent rotated(UUID userId, UUID previousSessionId, UUID sessionId, ClientContext context) {
        return new SessionEvent(SessionEventType.ROTATED, userId, sessionId, previousSessionId,
                InvalidationReason.ROTATED.name(), 1, context.ip(), context.userAgent());
    }

    public static SessionEvent rejected(UUID userId, UUID sessionId, RejectionReason reason, ClientContext context) {
        return new SessionEvent(SessionEventType.ROTATION_REJECTED, userId, sessionId, null, reason.name(), 0,
                context.ip(), context.userAgent());
    }

    public static SessionEvent invalidated(UUID userId, UUID sessionId, InvalidationReason reason, int affected) {
        return new SessionEvent(SessionEventType.INVALIDATED, userId, sessionId, null, reason.name(), affected,
                null, null);
    }

    public static SessionEvent anomaly(UUID userId, SessionAnomaly anomaly, int observed, ClientContext context) {
        return new SessionEvent(SessionEventType.ANOMALY, userId, null, null, anomaly.name(), observed,
                context.ip(), context.userAgent());
    }

    /**
     * Action type under which the audit log records this event: {@code SESSION_<reason>} for
     * invalidations, {@code SESSION_<type>} otherwise.
     */
    public String auditActionType() {
        if (type == SessionEventType.INVALIDATED) {
            return AUDIT_ACTION_PREFIX + outcome;
        }
        return AUDIT_ACTION_PREFIX + type.name();
    }
}
