package com.susanoo.backend.modules.auth.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.susanoo.backend.global.error.ProblemException;
import com.susanoo.backend.global.error.RetryableProblemException;
import com.susanoo.backend.modules.auth.application.session.ClientContext;
import com.susanoo.backend.modules.auth.application.session.InvalidationReason;
import com.susanoo.backend.modules.auth.application.session.RefreshRotationService;
import com.susanoo.backend.modules.auth.application.session.SessionAnomalyDetector;
import com.susanoo.backend.modules.auth.application.session.SessionCreationService;
import com.susanoo.backend.modules.auth.application.session.SessionEvent;
import com.susanoo.backend.modules.auth.application.session.SessionEventType;
import com.susanoo.backend.modules.auth.application.session.SessionInvalidationService;
import com.susanoo.backend.modules.auth.application.session.SessionVerifier;
import com.susanoo.backend.modules.auth.domain.UserAccount;
import com.susanoo.backend.modules.auth.infrastructure.jwt.JwtTokenProvider;
import com.susanoo.backend.modules.auth.infrastructure.persistence.UserAccountRepository;
import com.susanoo.backend.modules.auth.presentation.dto.LoginRequest;
import com.susanoo.backend.modules.auth.presentation.dto.LoginResponse;
import com.susanoo.backend.modules.auth.presentation.dto.LogoutRequest;
import com.susanoo.backend.modules.auth.presentation.dto.SessionSummaryResponse;
import com.susanoo.backend.modules.auth.presentation.dto.TokenPairResponse;
import com.susanoo.backend.support.InMemorySessionStore;
import com.susanoo.backend.support.MutableClock;
import com.susanoo.backend.support.TestAccounts;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.http.HttpStatus;
import org.springframework.security.crypto.password.PasswordEncoder;

@ExtendWith(MockitoExtension.class)
class AuthServiceTest {

    private static final String SECRET = "unit-test-secret-that-is-long-enough-for-hs256";
    private static final int MAX_SESSIONS = 3;
    private static final int LOGOUT_LIMIT = 20;
    private static final int MAX_PER_IP = 4;

    @Mock
    private UserAccountRepository userAccountRepository;

    @Mock
    private PasswordEncoder passwordEncoder;

    @Mock
    private ApplicationEventPublisher eventPublisher;

    private InMemorySessionStore store;
    private MutableClock clock;
    private AuthService authService;
    private UserAccount user;

    @BeforeEach
    void setUp() {
        store = new InMemorySessionStore();
        clock = MutableClock.at("2025-03-01T10:00:00Z");
        SessionCreationService creationService =
                new SessionCreationService(store, clock, Duration.ofDays(7), Duration.ofDays(30));
        JwtTokenService jwtTokenService = new JwtTokenService(new JwtTokenProvider(SECRET), 900_000L, "susanoo", clock);
        SessionInvalidationService invalidationService = new SessionInvalidationService(store, eventPublisher);
        RefreshRotationService rotationService = new RefreshRotationService(
                store, new SessionVerifier(clock), creationService, userAccountRepository, jwtTokenService, eventPublisher);

        authService = new AuthService(
                userAccountRepository,
                store,
                creationService,
                rotationService,
                invalidationService,
                new SessionAnomalyDetector(store, eventPublisher, clock, MAX_PER_IP, 0),
                passwordEncoder,
                jwtTokenService,
                eventPublisher,
                clock,
                MAX_SESSIONS,
                LOGOUT_LIMIT,
                15
        );

        user = TestAccounts.active("alice@example.com");
        lenient().when(userAccountRepository.findByEmailIgnoreCase("alice@example.com")).thenReturn(Optional.of(user));
        lenient().when(userAccountRepository.findById(user.getId())).thenReturn(Optional.of(user));
        lenient().when(passwordEncoder.matches("correct", user.getPasswordHash())).thenReturn(true);
    }

    @Test
    void loginIssuesTokenPairAndPublishesCreated() {
        LoginResponse response = login("fpA", false);

        TokenPairResponse tokens = response.tokens();
        assertThat(tokens.tokenType()).isEqualTo("Bearer");
        assertThat(tokens.expiresIn()).isEqualTo(900);
        assertThat(tokens.refreshExpiresIn()).isEqualTo(Duration.ofDays(7).toSeconds());
        assertThat(response.user().email()).isEqualTo("alice@example.com");
        assertThat(store.containsToken(tokens.refreshToken())).isTrue();

        ArgumentCaptor<SessionEvent> captor = ArgumentCaptor.forClass(SessionEvent.class);
        verify(eventPublisher).publishEvent(captor.capture());
        assertThat(captor.getValue().type()).isEqualTo(SessionEventType.CREATED);
    }

    @Test
    void rememberMeExtendsRefreshLifetime() {
        LoginResponse response = login("fpA", true);

        assertThat(response.tokens().refreshExpiresIn()).isEqualTo(Duration.ofDays(30).toSeconds());
    }

    @Test
    void wrongPasswordAndUnknownEmailLookTheSame() {
        when(passwordEncoder.matches("wrong", user.getPasswordHash())).thenReturn(false);
        when(userAccountRepository.findByEmailIgnoreCase("nobody@example.com")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> authService.login(
                new LoginRequest("alice@example.com", "wrong", "fp", null, null), ClientContext.of("fp", null, null)))
                .isInstanceOfSatisfying(ProblemException.class, ex -> assertThat(ex.getCode()).isEqualTo("INVALID_CREDENTIALS"));
        assertThatThrownBy(() -> authService.login(
                new LoginRequest("nobody@example.com", "correct", "fp", null, null), ClientContext.of("fp", null, null)))
                .isInstanceOfSatisfying(ProblemException.class, ex -> assertThat(ex.getCode()).isEqualTo("INVALID_CREDENTIALS"));
        assertThat(store.size()).isZero();
    }

    @Test
    void inactiveAccountCannotLogIn() {
        UserAccount disabled = TestAccounts.inactive("bob@example.com");
        when(userAccountRepository.findByEmailIgnoreCase("bob@example.com")).thenReturn(Optional.of(disabled));
        when(passwordEncoder.matches("correct", disabled.getPasswordHash())).thenReturn(true);

        assertThatThrownBy(() -> authService.login(
                new LoginRequest("bob@example.com", "correct", "fp", null, null), ClientContext.of("fp", null, null)))
                .isInstanceOfSatisfying(ProblemException.class, ex -> {
                    assertThat(ex.getStatusCode()).isEqualTo(HttpStatus.FORBIDDEN);
                    assertThat(ex.getCode()).isEqualTo("USER_INACTIVE");
                });
    }

    @Test
    void reachingTheSessionCapWipesExistingSessions() {
        String first = login("fp1", false).tokens().refreshToken();
        login("fp2", false);
        login("fp3", false);

        String fourth = login("fp4", false).tokens().refreshToken();

        assertThat(store.countByUserId(user.getId())).isEqualTo(1);
        assertThat(store.containsToken(first)).isFalse();
        assertThat(store.containsToken(fourth)).isTrue();
    }

    @Test
    void confirmedRegistrationOpensARefreshableSession() {
        ClientContext context = new ClientContext("fpNew", "10.0.0.2", "junit", null, false);

        LoginResponse response = authService.openSessionAfterRegistration(user.getId(), context);

        assertThat(response.user().userId()).isEqualTo(user.getId());
        ArgumentCaptor<SessionEvent> captor = ArgumentCaptor.forClass(SessionEvent.class);
        verify(eventPublisher).publishEvent(captor.capture());
        assertThat(captor.getValue().outcome()).isEqualTo(SessionEvent.OUTCOME_REGISTRATION);

        TokenPairResponse rotated = authService.refresh(response.tokens().refreshToken(), context);
        assertThat(rotated.refreshToken()).isNotEqualTo(response.tokens().refreshToken());
    }

    @Test
    void registrationSessionRequiresAnActiveAccount() {
        UserAccount pending = TestAccounts.inactive("pending@example.com");
        when(userAccountRepository.findById(pending.getId())).thenReturn(Optional.of(pending));
        UUID unknown = UUID.randomUUID();
        when(userAccountRepository.findById(unknown)).thenReturn(Optional.empty());
        ClientContext context = ClientContext.of("fp", null, null);

        assertThatThrownBy(() -> authService.openSessionAfterRegistration(pending.getId(), context))
                .isInstanceOfSatisfying(ProblemException.class, ex -> assertThat(ex.getCode()).isEqualTo("USER_INACTIVE"));
        assertThatThrownBy(() -> authService.openSessionAfterRegistration(unknown, context))
                .isInstanceOfSatisfying(ProblemException.class, ex -> assertThat(ex.getCode()).isEqualTo("USER_NOT_FOUND"));
        assertThat(store.size()).isZero();
    }

    @Test
    void refreshReturnsNewPair() {
        String refreshToken = login("fpA", false).tokens().refreshToken();

        TokenPairResponse rotated = authService.refresh(refreshToken, ClientContext.of("fpA", null, null));

        assertThat(rotated.refreshToken()).isNotEqualTo(refreshToken);
        assertThat(rotated.expiresIn()).isEqualTo(900);
        assertThat(store.containsToken(refreshToken)).isFalse();
    }

    @Test
    void logoutEndsOnlyThePresentedSession() {
        String kept = login("fp1", false).tokens().refreshToken();
        String ended = login("fp2", false).tokens().refreshToken();

        assertThat(authService.logout(new LogoutRequest(ended, null)).sessionsInvalidated()).isEqualTo(1);
        assertThat(store.containsToken(kept)).isTrue();
        assertThat(authService.logout(new LogoutRequest(ended, null)).sessionsInvalidated()).isZero();
    }

    @Test
    void logoutAllDevicesEndsEverySession() {
        login("fp1", false);
        String token = login("fp2", false).tokens().refreshToken();

        assertThat(authService.logout(new LogoutRequest(token, true)).sessionsInvalidated()).isEqualTo(2);
        assertThat(store.size()).isZero();
    }

    @Test
    void logoutIsRateLimited() {
        String token = login("fp1", false).tokens().refreshToken();
        store.setRecentLogouts(LOGOUT_LIMIT + 1);

        assertThatThrownBy(() -> authService.logout(new LogoutRequest(token, false)))
                .isInstanceOfSatisfying(RetryableProblemException.class, ex -> {
                    assertThat(ex.getStatusCode()).isEqualTo(HttpStatus.TOO_MANY_REQUESTS);
                    assertThat(ex.getRetryAfterSeconds()).isEqualTo(900);
                });
        assertThat(store.containsToken(token)).isTrue();
    }

    @Test
    void logoutAtTheLimitIsStillAllowed() {
        String token = login("fp1", false).tokens().refreshToken();
        store.setRecentLogouts(LOGOUT_LIMIT);

        assertThat(authService.logout(new LogoutRequest(token, false)).sessionsInvalidated()).isEqualTo(1);
    }

    @Test
    void loginFromAnIpAtItsSessionLimitIsRefusedWithoutTouchingExistingSessions() {
        UserAccount other = TestAccounts.active("carol@example.com");
        when(userAccountRepository.findByEmailIgnoreCase("carol@example.com")).thenReturn(Optional.of(other));
        when(passwordEncoder.matches("correct", other.getPasswordHash())).thenReturn(true);
        login("fp1", false);
        login("fp2", false);
        login("fp3", false);
        authService.login(new LoginRequest("carol@example.com", "correct", "fpC", null, null),
                new ClientContext("fpC", "10.0.0.1", "junit", null, false));

        assertThatThrownBy(() -> login("fp4", false))
                .isInstanceOfSatisfying(ProblemException.class, ex -> {
                    assertThat(ex.getStatusCode()).isEqualTo(HttpStatus.TOO_MANY_REQUESTS);
                    assertThat(ex.getCode()).isEqualTo("IP_SESSION_LIMIT");
                });
        assertThat(store.countByUserId(user.getId())).isEqualTo(3);
        assertThat(store.size()).isEqualTo(MAX_PER_IP);
    }

    @Test
    void failingRateCheckNeverBlocksLogout() {
        String token = login("fp1", false).tokens().refreshToken();
        InMemorySessionStore failingCounts = new InMemorySessionStore() {
            @Override
            public long countRecentLogouts(UUID userId, int windowMinutes) {
                throw new QueryTimeoutException("audit table slow");
            }
        };
        failingCounts.put(store.getByRefreshToken(token).orElseThrow());
        AuthService service = new AuthService(
                userAccountRepository, failingCounts, null, null,
                new SessionInvalidationService(failingCounts, eventPublisher), null,
                passwordEncoder, null, eventPublisher, clock, MAX_SESSIONS, LOGOUT_LIMIT, 15);

        assertThat(service.logout(new LogoutRequest(token, false)).sessionsInvalidated()).isEqualTo(1);
    }

    @Test
    void listingFlagsTheCurrentSessionAndHidesExpiredOnes() {
        LoginResponse current = login("fp1", false);
        login("fp2", true);
        clock.advance(Duration.ofDays(8));
        login("fp3", false);

        List<SessionSummaryResponse> sessions = authService.listSessions(user.getId(), current.tokens().sessionId());

        assertThat(sessions).hasSize(2);
        assertThat(sessions).noneMatch(SessionSummaryResponse::current);
    }

    @Test
    void logoutOthersRequiresKnownCurrentSession() {
        assertThatThrownBy(() -> authService.logoutOtherSessions(user.getId(), null))
                .isInstanceOf(ProblemException.class);
    }

    @Test
    void logoutOthersKeepsCaller() {
        LoginResponse current = login("fp1", false);
        login("fp2", false);

        assertThat(authService.logoutOtherSessions(user.getId(), current.tokens().sessionId()).sessionsInvalidated())
                .isEqualTo(1);
        assertThat(store.containsToken(current.tokens().refreshToken())).isTrue();
    }

    @Test
    void sessionLimitInvalidationUsesItsOwnReason() {
        login("fp1", false);
        login("fp2", false);
        login("fp3", false);
        login("fp4", false);

        ArgumentCaptor<SessionEvent> captor = ArgumentCaptor.forClass(SessionEvent.class);
        verify(eventPublisher, atLeastOnce()).publishEvent(captor.capture());
        assertThat(captor.getAllValues())
                .filteredOn(event -> event.type() == SessionEventType.INVALIDATED)
                .singleElement()
                .satisfies(event -> {
                    assertThat(event.outcome()).isEqualTo(InvalidationReason.SESSION_LIMIT.name());
                    assertThat(event.affected()).isEqualTo(3);
                });
        verify(passwordEncoder, times(4)).matches(any(), any());
    }

    private LoginResponse login(String fingerprint, boolean rememberMe) {
        LoginRequest request = new LoginRequest("alice@example.com", "correct", fingerprint, null, rememberMe);
        return authService.login(request, new ClientContext(fingerprint, "10.0.0.1", "junit", null, rememberMe));
    }
}
