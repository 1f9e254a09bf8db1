package com.susanoo.backend.modules.auth.application.session;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.Objects;
import java.util.UUID;

import com.susanoo.backend.modules.auth.domain.UserSession;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Builds and persists a new session. Performs exactly one store write and nothing else.
 */
@Service
public class SessionCreationService {

    private final SessionStore sessionStore;
    private final Clock clock;
    private final Duration refreshTtl;
    private final Duration rememberMeTtl;

    public SessionCreationService(
            SessionStore sessionStore,
            Clock clock,
            @Value("${app.session.refresh-ttl:P7D}") Duration refreshTtl,
            @Value("${app.session.remember-me-ttl:P30D}") Duration rememberMeTtl
    ) {
        if (refreshTtl.isNegative() || refreshTtl.isZero()) {
            throw new IllegalArgumentException("app.session.refresh-ttl must be positive");
        }
        if (rememberMeTtl.compareTo(refreshTtl) < 0) {
            throw new IllegalArgumentException("app.session.remember-me-ttl must not be shorter than refresh-ttl");
        }
        this.sessionStore = sessionStore;
        this.clock = clock;
        this.refreshTtl = refreshTtl;
        this.rememberMeTtl = rememberMeTtl;
    }

    public IssuedSession createSession(UUID userId, ClientContext context) {
        Objects.requireNonNull(userId, "userId");
        Objects.requireNonNull(context, "context");

        OffsetDateTime now = OffsetDateTime.now(clock);
        String refreshToken = RefreshTokens.generate();

        UserSession session = new UserSession();
        session.setUserId(userId);
        session.setRefreshTokenHash(RefreshTokens.hash(refreshToken));
        session.setFingerprint(context.fingerprint());
        session.setIp(context.ip());
        session.setUserAgent(context.userAgent());
        session.setDeviceInfo(context.deviceInfo());
        session.setRememberMe(context.rememberMe());
        session.setCreatedAt(now);
        session.setExpiresAt(now.plus(context.rememberMe() ? rememberMeTtl : refreshTtl));

        return new IssuedSession(sessionStore.create(session), refreshToken);
    }
}
