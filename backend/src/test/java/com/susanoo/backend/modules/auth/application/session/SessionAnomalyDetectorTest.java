package com.susanoo.backend.modules.auth.application.session;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

import java.time.Duration;
import java.util.UUID;

import com.susanoo.backend.global.error.ProblemException;
import com.susanoo.backend.support.InMemorySessionStore;
import com.susanoo.backend.support.MutableClock;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.http.HttpStatus;

@ExtendWith(MockitoExtension.class)
class SessionAnomalyDetectorTest {

    private static final int MAX_PER_IP = 3;
    private static final int MAX_CONCURRENT_IPS = 2;

    @Mock
    private ApplicationEventPublisher eventPublisher;

    private InMemorySessionStore store;
    private MutableClock clock;
    private SessionCreationService creationService;
    private SessionAnomalyDetector detector;

    @BeforeEach
    void setUp() {
        store = new InMemorySessionStore();
        clock = MutableClock.at("2025-03-01T10:00:00Z");
        creationService = new SessionCreationService(store, clock, Duration.ofDays(7), Duration.ofDays(30));
        detector = new SessionAnomalyDetector(store, eventPublisher, clock, MAX_PER_IP, MAX_CONCURRENT_IPS);
    }

    @Test
    void ordinaryLoginRaisesNothing() {
        UUID userId = UUID.randomUUID();
        open(userId, "10.0.0.1");

        assertThatCode(() -> detector.inspect(userId, context("10.0.0.1", "Mozilla/5.0")))
                .doesNotThrowAnyException();
        verifyNoInteractions(eventPublisher);
    }

    @Test
    void ipHoldingTooManySessionsIsRefusedAcrossUsers() {
        open(UUID.randomUUID(), "10.0.0.9");
        open(UUID.randomUUID(), "10.0.0.9");
        open(UUID.randomUUID(), "10.0.0.9");
        UUID newcomer = UUID.randomUUID();

        assertThatThrownBy(() -> detector.inspect(newcomer, context("10.0.0.9", "Mozilla/5.0")))
                .isInstanceOfSatisfying(ProblemException.class, ex -> {
                    assertThat(ex.getStatusCode()).isEqualTo(HttpStatus.TOO_MANY_REQUESTS);
                    assertThat(ex.getCode()).isEqualTo("IP_SESSION_LIMIT");
                });

        SessionEvent event = publishedEvent();
        assertThat(event.type()).isEqualTo(SessionEventType.ANOMALY);
        assertThat(event.outcome()).isEqualTo(SessionAnomaly.IP_SESSION_LIMIT.name());
        assertThat(event.affected()).isEqualTo(3);
        assertThat(event.auditActionType()).isEqualTo("SESSION_ANOMALY");
    }

    @Test
    void expiredSessionsDoNotCountTowardsTheIpLimit() {
        open(UUID.randomUUID(), "10.0.0.9");
        open(UUID.randomUUID(), "10.0.0.9");
        open(UUID.randomUUID(), "10.0.0.9");
        clock.advance(Duration.ofDays(8));

        assertThatCode(() -> detector.inspect(UUID.randomUUID(), context("10.0.0.9", "Mozilla/5.0")))
                .doesNotThrowAnyException();
    }

    @Test
    void concurrentIpsAreReportedButAllowed() {
        UUID userId = UUID.randomUUID();
        open(userId, "10.0.0.1");
        open(userId, "192.168.1.7");

        assertThatCode(() -> detector.inspect(userId, context("172.16.0.3", "Mozilla/5.0")))
                .doesNotThrowAnyException();

        SessionEvent event = publishedEvent();
        assertThat(event.outcome()).isEqualTo(SessionAnomaly.CONCURRENT_IPS.name());
        assertThat(event.affected()).isEqualTo(2);
        assertThat(event.ip()).isEqualTo("172.16.0.3");
    }

    @Test
    void automatedUserAgentIsReported() {
        UUID userId = UUID.randomUUID();

        detector.inspect(userId, context("10.0.0.1", "Mozilla/5.0 HeadlessChrome/120.0"));

        SessionEvent event = publishedEvent();
        assertThat(event.outcome()).isEqualTo(SessionAnomaly.SUSPICIOUS_USER_AGENT.name());
        assertThat(event.userId()).isEqualTo(userId);
    }

    @Test
    void nonPositiveLimitsDisableTheChecks() {
        SessionAnomalyDetector disabled = new SessionAnomalyDetector(store, eventPublisher, clock, 0, 0);
        UUID userId = UUID.randomUUID();
        for (int i = 0; i < 5; i++) {
            open(userId, "10.0.0." + i);
        }

        assertThatCode(() -> disabled.inspect(userId, context("10.0.0.1", "Mozilla/5.0")))
                .doesNotThrowAnyException();
        verifyNoInteractions(eventPublisher);
    }

    @Test
    void missingIpSkipsTheIpLimit() {
        open(UUID.randomUUID(), null);
        open(UUID.randomUUID(), null);
        open(UUID.randomUUID(), null);

        assertThatCode(() -> detector.inspect(UUID.randomUUID(), context(null, null)))
                .doesNotThrowAnyException();
    }

    private void open(UUID userId, String ip) {
        creationService.createSession(userId, context(ip, "Mozilla/5.0"));
    }

    private SessionEvent publishedEvent() {
        ArgumentCaptor<SessionEvent> captor = ArgumentCaptor.forClass(SessionEvent.class);
        verify(eventPublisher).publishEvent(captor.capture());
        return captor.getValue();
    }

    private static ClientContext context(String ip, String userAgent) {
        return new ClientContext("fp", ip, userAgent, null, false);
    }
}
