package com.susanoo.backend.modules.auth.infrastructure.persistence;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.susanoo.backend.modules.audit.infrastructure.AuditLogRepository;
import com.susanoo.backend.modules.auth.application.session.RefreshTokens;
import com.susanoo.backend.modules.auth.application.session.SessionConflictException;
import com.susanoo.backend.modules.auth.application.session.SessionCriteria;
import com.susanoo.backend.modules.auth.application.session.SessionEvent;
import com.susanoo.backend.modules.auth.application.session.SessionStore;
import com.susanoo.backend.modules.auth.domain.UserSession;

import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * PostgreSQL-backed {@link SessionStore}. Every removal is a single bulk delete, so the
 * affected-row count is exact even when several requests race on the same rows.
 */
@Repository
public class JpaSessionStore implements SessionStore {

    private final UserSessionRepository userSessionRepository;
    private final AuditLogRepository auditLogRepository;
    private final Clock clock;

    public JpaSessionStore(
            UserSessionRepository userSessionRepository,
            AuditLogRepository auditLogRepository,
            Clock clock
    ) {
        this.userSessionRepository = userSessionRepository;
        this.auditLogRepository = auditLogRepository;
        this.clock = clock;
    }

    @Override
    @Transactional
    public UserSession create(UserSession session) {
        try {
            return userSessionRepository.saveAndFlush(session);
        } catch (DataIntegrityViolationException ex) {
            throw new SessionConflictException("refresh token digest already in use", ex);
        }
    }

    @Override
    @Transactional
    public Optional<UserSession> getByRefreshToken(String refreshToken) {
        if (refreshToken == null || refreshToken.isBlank()) {
            return Optional.empty();
        }
        return userSessionRepository.findByRefreshTokenHash(RefreshTokens.hash(refreshToken));
    }

    @Override
    @Transactional
    public int removeWhere(SessionCriteria criteria) {
        if (criteria.refreshToken() != null) {
            return userSessionRepository.deleteByRefreshTokenHash(RefreshTokens.hash(criteria.refreshToken()));
        }
        if (criteria.excludedSessionId() != null) {
            return userSessionRepository.deleteAllByUserIdExcept(criteria.userId(), criteria.excludedSessionId());
        }
        return userSessionRepository.deleteAllByUserId(criteria.userId());
    }

    @Override
    @Transactional
    public int removeExpired(OffsetDateTime now) {
        return userSessionRepository.deleteExpired(now);
    }

    @Override
    @Transactional
    public long countByUserId(UUID userId) {
        return userSessionRepository.countByUserId(userId);
    }

    @Override
    @Transactional
    public List<UserSession> findActiveByUserId(UUID userId, OffsetDateTime now) {
        return userSessionRepository.findActiveByUserId(userId, now);
    }

    @Override
    @Transactional
    public long countActiveByIp(String ip, OffsetDateTime now) {
        return userSessionRepository.countActiveByIp(ip, now);
    }

    // isolated so a failing count cannot poison the caller's transaction
    @Override
    @Transactional(propagation = Propagation.REQUIRES_NEW, readOnly = true)
    public long countRecentLogouts(UUID userId, int windowMinutes) {
        OffsetDateTime since = OffsetDateTime.now(clock).minusMinutes(windowMinutes);
        return auditLogRepository.countByActorAndActionTypes(userId, SessionEvent.LOGOUT_ACTION_TYPES, since);
    }
}
