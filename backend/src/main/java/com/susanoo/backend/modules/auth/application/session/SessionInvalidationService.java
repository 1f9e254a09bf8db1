package com.susanoo.backend.modules.auth.application.session;

import java.util.Optional;
import java.util.UUID;

import com.susanoo.backend.modules.auth.domain.UserSession;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Bulk session termination. Every operation is idempotent and returns the number of sessions
 * actually removed. Access tokens already handed out are not affected and run to expiry.
 */
@Service
@Transactional
public class SessionInvalidationService {

    private static final Logger log = LoggerFactory.getLogger(SessionInvalidationService.class);

    private final SessionStore sessionStore;
    private final ApplicationEventPublisher eventPublisher;

    public SessionInvalidationService(SessionStore sessionStore, ApplicationEventPublisher eventPublisher) {
        this.sessionStore = sessionStore;
        this.eventPublisher = eventPublisher;
    }

    public int invalidateSession(String refreshToken) {
        return invalidateSession(refreshToken, InvalidationReason.LOGOUT);
    }

    public int invalidateSession(String refreshToken, InvalidationReason reason) {
        Optional<UserSession> session = sessionStore.getByRefreshToken(refreshToken);
        if (session.isEmpty()) {
            return 0;
        }
        int removed = sessionStore.removeWhere(SessionCriteria.byRefreshToken(refreshToken));
        publish(session.get().getUserId(), session.get().getId(), reason, removed);
        return removed;
    }

    public int invalidateAllUserSessions(UUID userId) {
        return invalidateAllUserSessions(userId, InvalidationReason.LOGOUT_ALL);
    }

    public int invalidateAllUserSessions(UUID userId, InvalidationReason reason) {
        int removed = sessionStore.removeWhere(SessionCriteria.byUser(userId));
        publish(userId, null, reason, removed);
        return removed;
    }

    public int invalidateOtherSessions(UUID userId, UUID currentSessionId) {
        return invalidateOtherSessions(userId, currentSessionId, InvalidationReason.LOGOUT_OTHERS);
    }

    public int invalidateOtherSessions(UUID userId, UUID currentSessionId, InvalidationReason reason) {
        int removed = sessionStore.removeWhere(SessionCriteria.byUserExcept(userId, currentSessionId));
        publish(userId, currentSessionId, reason, removed);
        return removed;
    }

    private void publish(UUID userId, UUID sessionId, InvalidationReason reason, int removed) {
        log.info("Invalidated {} session(s) user={} reason={}", removed, userId, reason);
        eventPublisher.publishEvent(SessionEvent.invalidated(userId, sessionId, reason, removed));
    }
}
