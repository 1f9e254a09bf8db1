package com.susanoo.backend.modules.auth.application;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.susanoo.backend.global.error.ProblemException;
import com.susanoo.backend.global.error.RetryableProblemException;
import com.susanoo.backend.modules.auth.application.JwtTokenService.IssuedAccessToken;
import com.susanoo.backend.modules.auth.application.session.ClientContext;
import com.susanoo.backend.modules.auth.application.session.InvalidationReason;
import com.susanoo.backend.modules.auth.application.session.IssuedSession;
import com.susanoo.backend.modules.auth.application.session.RefreshRotationService;
import com.susanoo.backend.modules.auth.application.session.RotationResult;
import com.susanoo.backend.modules.auth.application.session.SessionAnomalyDetector;
import com.susanoo.backend.modules.auth.application.session.SessionCreationService;
import com.susanoo.backend.modules.auth.application.session.SessionEvent;
import com.susanoo.backend.modules.auth.application.session.SessionInvalidationService;
import com.susanoo.backend.modules.auth.application.session.SessionStore;
import com.susanoo.backend.modules.auth.domain.UserAccount;
import com.susanoo.backend.modules.auth.domain.UserSession;
import com.susanoo.backend.modules.auth.infrastructure.persistence.UserAccountRepository;
import com.susanoo.backend.modules.auth.presentation.dto.LoginRequest;
import com.susanoo.backend.modules.auth.presentation.dto.LoginResponse;
import com.susanoo.backend.modules.auth.presentation.dto.LogoutRequest;
import com.susanoo.backend.modules.auth.presentation.dto.LogoutResponse;
import com.susanoo.backend.modules.auth.presentation.dto.SessionSummaryResponse;
import com.susanoo.backend.modules.auth.presentation.dto.TokenPairResponse;
import com.susanoo.backend.modules.auth.presentation.dto.UserProfileResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.http.HttpStatus;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.server.ResponseStatusException;

/**
 * Entry point used by the HTTP layer for login, refresh and logout. Session state is only
 * touched through {@link SessionStore} and the session services, never directly.
 */
@Service
@Transactional(noRollbackFor = ResponseStatusException.class)
public class AuthService {

    private static final Logger log = LoggerFactory.getLogger(AuthService.class);

    private final UserAccountRepository userAccountRepository;
    private final SessionStore sessionStore;
    private final SessionCreationService sessionCreationService;
    private final RefreshRotationService refreshRotationService;
    private final SessionInvalidationService sessionInvalidationService;
    private final SessionAnomalyDetector sessionAnomalyDetector;
    private final PasswordEncoder passwordEncoder;
    private final JwtTokenService jwtTokenService;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;
    private final int maxSessionsPerUser;
    private final int logoutRateLimit;
    private final int logoutRateWindowMinutes;

    public AuthService(
            UserAccountRepository userAccountRepository,
            SessionStore sessionStore,
            SessionCreationService sessionCreationService,
            RefreshRotationService refreshRotationService,
            SessionInvalidationService sessionInvalidationService,
            SessionAnomalyDetector sessionAnomalyDetector,
            PasswordEncoder passwordEncoder,
            JwtTokenService jwtTokenService,
            ApplicationEventPublisher eventPublisher,
            Clock clock,
            @Value("${app.session.max-per-user:5}") int maxSessionsPerUser,
            @Value("${app.session.logout-rate-limit.max:20}") int logoutRateLimit,
            @Value("${app.session.logout-rate-limit.window-minutes:15}") int logoutRateWindowMinutes
    ) {
        this.userAccountRepository = userAccountRepository;
        this.sessionStore = sessionStore;
        this.sessionCreationService = sessionCreationService;
        this.refreshRotationService = refreshRotationService;
        this.sessionInvalidationService = sessionInvalidationService;
        this.sessionAnomalyDetector = sessionAnomalyDetector;
        this.passwordEncoder = passwordEncoder;
        this.jwtTokenService = jwtTokenService;
        this.eventPublisher = eventPublisher;
        this.clock = clock;
        this.maxSessionsPerUser = maxSessionsPerUser;
        this.logoutRateLimit = logoutRateLimit;
        this.logoutRateWindowMinutes = logoutRateWindowMinutes;
    }

    public LoginResponse login(LoginRequest request, ClientContext context) {
        UserAccount user = userAccountRepository.findByEmailIgnoreCase(request.email().trim())
                .orElseThrow(() -> new ProblemException(HttpStatus.UNAUTHORIZED, "INVALID_CREDENTIALS"));

        if (!passwordEncoder.matches(request.password(), user.getPasswordHash())) {
            throw new ProblemException(HttpStatus.UNAUTHORIZED, "INVALID_CREDENTIALS");
        }
        if (!user.isActive()) {
            throw new ProblemException(HttpStatus.FORBIDDEN, "USER_INACTIVE");
        }

        return openSession(user, context, SessionEvent.OUTCOME_LOGIN);
    }

    /**
     * Signs a freshly confirmed account in without a password round trip. Called by the
     * registration flow once the account is active.
     */
    public LoginResponse openSessionAfterRegistration(UUID userId, ClientContext context) {
        UserAccount user = userAccountRepository.findById(userId)
                .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, "USER_NOT_FOUND"));
        if (!user.isActive()) {
            throw new ProblemException(HttpStatus.FORBIDDEN, "USER_INACTIVE");
        }
        return openSession(user, context, SessionEvent.OUTCOME_REGISTRATION);
    }

    private LoginResponse openSession(UserAccount user, ClientContext context, String origin) {
        sessionAnomalyDetector.inspect(user.getId(), context);
        enforceSessionLimit(user.getId());

        IssuedSession issued = sessionCreationService.createSession(user.getId(), context);
        IssuedAccessToken accessToken = jwtTokenService.issueAccessToken(user, issued.session().getId());
        eventPublisher.publishEvent(SessionEvent.created(user.getId(), issued.session().getId(), origin, context));

        TokenPairResponse tokens = toTokenPair(accessToken, issued.refreshToken(), issued.session());
        return new LoginResponse(tokens, toProfile(user));
    }

    public TokenPairResponse refresh(String refreshToken, ClientContext context) {
        RotationResult rotation = refreshRotationService.rotate(refreshToken, context);
        return new TokenPairResponse(
                rotation.accessToken().token(),
                TokenPairResponse.DEFAULT_TOKEN_TYPE,
                secondsUntil(rotation.accessToken().issuedAt(), rotation.accessToken().expiresAt()),
                rotation.refreshToken(),
                secondsUntil(rotation.accessToken().issuedAt(), rotation.refreshExpiresAt()),
                rotation.accessToken().issuedAt(),
                rotation.sessionId()
        );
    }

    public LogoutResponse logout(LogoutRequest request) {
        Optional<UserSession> session = sessionStore.getByRefreshToken(request.refreshToken());
        if (session.isEmpty()) {
            // unknown tokens get the same answer, logout reveals nothing about them
            return new LogoutResponse(0);
        }

        UUID userId = session.get().getUserId();
        ensureLogoutAllowed(userId);

        int invalidated = request.allDevicesOrDefault()
                ? sessionInvalidationService.invalidateAllUserSessions(userId, InvalidationReason.LOGOUT_ALL)
                : sessionInvalidationService.invalidateSession(request.refreshToken(), InvalidationReason.LOGOUT);
        return new LogoutResponse(invalidated);
    }

    public LogoutResponse logoutOtherSessions(UUID userId, UUID currentSessionId) {
        if (currentSessionId == null) {
            throw new ProblemException(HttpStatus.BAD_REQUEST, "CURRENT_SESSION_UNKNOWN");
        }
        return new LogoutResponse(sessionInvalidationService.invalidateOtherSessions(userId, currentSessionId));
    }

    @Transactional(readOnly = true)
    public List<SessionSummaryResponse> listSessions(UUID userId, UUID currentSessionId) {
        return sessionStore.findActiveByUserId(userId, OffsetDateTime.now(clock)).stream()
                .map(session -> new SessionSummaryResponse(
                        session.getId(),
                        session.getIp(),
                        session.getUserAgent(),
                        session.getDeviceInfo(),
                        session.getCreatedAt(),
                        session.getExpiresAt(),
                        session.getId().equals(currentSessionId)
                ))
                .toList();
    }

    private void enforceSessionLimit(UUID userId) {
        if (maxSessionsPerUser <= 0) {
            return;
        }
        long existing = sessionStore.countByUserId(userId);
        if (existing >= maxSessionsPerUser) {
            log.info("User {} holds {} sessions (limit {}), wiping them before login", userId, existing, maxSessionsPerUser);
            sessionInvalidationService.invalidateAllUserSessions(userId, InvalidationReason.SESSION_LIMIT);
        }
    }

    private void ensureLogoutAllowed(UUID userId) {
        long recent;
        try {
            recent = sessionStore.countRecentLogouts(userId, logoutRateWindowMinutes);
        } catch (RuntimeException ex) {
            log.warn("Logout rate check failed for user {}, allowing logout: {}", userId, ex.getMessage());
            return;
        }
        if (recent > logoutRateLimit) {
            log.warn("[ALERT][Session] logout rate limit hit user={} count={} window={}m", userId, recent, logoutRateWindowMinutes);
            throw new RetryableProblemException(HttpStatus.TOO_MANY_REQUESTS, "LOGOUT_RATE_LIMITED",
                    (int) Duration.ofMinutes(logoutRateWindowMinutes).toSeconds());
        }
    }

    private TokenPairResponse toTokenPair(IssuedAccessToken accessToken, String refreshToken, UserSession session) {
        return new TokenPairResponse(
                accessToken.token(),
                TokenPairResponse.DEFAULT_TOKEN_TYPE,
                secondsUntil(accessToken.issuedAt(), accessToken.expiresAt()),
                refreshToken,
                secondsUntil(accessToken.issuedAt(), session.getExpiresAt()),
                accessToken.issuedAt(),
                session.getId()
        );
    }

    private UserProfileResponse toProfile(UserAccount user) {
        return new UserProfileResponse(user.getId(), user.getEmail(), user.getDisplayName(), user.getRole().name());
    }

    private static long secondsUntil(OffsetDateTime from, OffsetDateTime to) {
        return Math.max(0L, Duration.between(from, to).toSeconds());
    }
}
