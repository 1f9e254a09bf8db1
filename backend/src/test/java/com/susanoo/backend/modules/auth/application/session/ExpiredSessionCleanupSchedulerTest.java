package com.susanoo.backend.modules.auth.application.session;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

import java.time.Duration;
import java.util.UUID;

import com.susanoo.backend.support.InMemorySessionStore;
import com.susanoo.backend.support.MutableClock;

import org.junit.jupiter.api.Test;
import org.springframework.context.ApplicationEventPublisher;

class ExpiredSessionCleanupSchedulerTest {

    @Test
    void purgesOnlySessionsPastExpiry() {
        InMemorySessionStore store = new InMemorySessionStore();
        MutableClock clock = MutableClock.at("2025-03-01T10:00:00Z");
        SessionCreationService creationService =
                new SessionCreationService(store, clock, Duration.ofDays(7), Duration.ofDays(30));
        UUID userId = UUID.randomUUID();

        creationService.createSession(userId, ClientContext.of("fp", null, null));
        String remembered = creationService.createSession(userId,
                ClientContext.of("fp", null, null).withRememberMe(true)).refreshToken();
        clock.advance(Duration.ofDays(7));

        ApplicationEventPublisher eventPublisher = mock(ApplicationEventPublisher.class);
        ExpiredSessionCleanupScheduler scheduler = new ExpiredSessionCleanupScheduler(store, eventPublisher, clock);

        assertThat(scheduler.purgeExpiredSessions()).isEqualTo(1);
        assertThat(store.containsToken(remembered)).isTrue();
        assertThat(scheduler.purgeExpiredSessions()).isZero();
        verify(eventPublisher).publishEvent(SessionEvent.invalidated(null, null, InvalidationReason.EXPIRED, 1));
    }
}
