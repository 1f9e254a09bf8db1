package com.susanoo.backend.modules.auth.application.session;

import java.util.Optional;
import java.util.UUID;

import com.susanoo.backend.modules.auth.application.JwtTokenService;
import com.susanoo.backend.modules.auth.application.JwtTokenService.IssuedAccessToken;
import com.susanoo.backend.modules.auth.domain.UserAccount;
import com.susanoo.backend.modules.auth.domain.UserSession;
import com.susanoo.backend.modules.auth.infrastructure.persistence.UserAccountRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.server.ResponseStatusException;

/**
 * Exchanges a refresh token for a new token pair.
 *
 * <p>The presented session is deleted <em>before</em> it is verified. The delete's row count is
 * the single-use guard: of any number of concurrent calls with the same token, only the one whose
 * delete removed the row can continue, and a token that fails verification is burned anyway.
 *
 * <p>Rejections commit (the delete must stick). Store failures roll back, leaving the old session
 * in place and no replacement, so the caller may retry.
 */
@Service
@Transactional(noRollbackFor = ResponseStatusException.class)
public class RefreshRotationService {

    private static final Logger log = LoggerFactory.getLogger(RefreshRotationService.class);

    private final SessionStore sessionStore;
    private final SessionVerifier sessionVerifier;
    private final SessionCreationService sessionCreationService;
    private final UserAccountRepository userAccountRepository;
    private final JwtTokenService jwtTokenService;
    private final ApplicationEventPublisher eventPublisher;

    public RefreshRotationService(
            SessionStore sessionStore,
            SessionVerifier sessionVerifier,
            SessionCreationService sessionCreationService,
            UserAccountRepository userAccountRepository,
            JwtTokenService jwtTokenService,
            ApplicationEventPublisher eventPublisher
    ) {
        this.sessionStore = sessionStore;
        this.sessionVerifier = sessionVerifier;
        this.sessionCreationService = sessionCreationService;
        this.userAccountRepository = userAccountRepository;
        this.jwtTokenService = jwtTokenService;
        this.eventPublisher = eventPublisher;
    }

    public RotationResult rotate(String presentedRefreshToken, ClientContext context) {
        UserSession previous = sessionStore.getByRefreshToken(presentedRefreshToken)
                .orElseThrow(() -> reject(null, RejectionReason.INVALID_TOKEN, context));

        int removed = sessionStore.removeWhere(SessionCriteria.byRefreshToken(presentedRefreshToken));
        if (removed == 0) {
            log.warn("[ALERT][Session] refresh token replayed concurrently session={} user={}",
                    previous.getId(), previous.getUserId());
            throw reject(previous, RejectionReason.INVALID_TOKEN, context);
        }

        try {
            sessionVerifier.verify(previous, context.fingerprint());
        } catch (SessionRejectedException ex) {
            throw reject(previous, ex.getRejectionReason(), context);
        }

        Optional<UserAccount> owner = userAccountRepository.findById(previous.getUserId());
        if (owner.isEmpty()) {
            log.warn("Session {} points at missing user {}", previous.getId(), previous.getUserId());
            throw reject(previous, RejectionReason.INVALID_TOKEN, context);
        }
        UserAccount user = owner.get();
        if (!user.isActive()) {
            throw reject(previous, RejectionReason.ACCOUNT_INACTIVE, context);
        }

        ClientContext nextContext = context
                .withRememberMe(previous.isRememberMe())
                .withDeviceInfoFallback(previous.getDeviceInfo());
        IssuedSession next = sessionCreationService.createSession(user.getId(), nextContext);
        IssuedAccessToken accessToken = jwtTokenService.issueAccessToken(user, next.session().getId());

        eventPublisher.publishEvent(SessionEvent.rotated(user.getId(), previous.getId(), next.session().getId(), nextContext));
        log.debug("Rotated session {} -> {} for user {}", previous.getId(), next.session().getId(), user.getId());

        return new RotationResult(
                user.getId(),
                next.session().getId(),
                accessToken,
                next.refreshToken(),
                next.session().getExpiresAt()
        );
    }

    private SessionRejectedException reject(UserSession session, RejectionReason reason, ClientContext context) {
        UUID userId = session != null ? session.getUserId() : null;
        UUID sessionId = session != null ? session.getId() : null;
        eventPublisher.publishEvent(SessionEvent.rejected(userId, sessionId, reason, context));
        return new SessionRejectedException(reason);
    }
}
