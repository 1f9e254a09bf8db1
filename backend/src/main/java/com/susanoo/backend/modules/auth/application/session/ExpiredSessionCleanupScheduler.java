package com.susanoo.backend.modules.auth.application.session;

import java.time.Clock;
import java.time.OffsetDateTime;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/**
 * Physically removes sessions past their expiry. Expired rows are already unusable, so this
 * only reclaims space.
 */
@Component
public class ExpiredSessionCleanupScheduler {

    private static final Logger log = LoggerFactory.getLogger(ExpiredSessionCleanupScheduler.class);

    private final SessionStore sessionStore;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    public ExpiredSessionCleanupScheduler(SessionStore sessionStore, ApplicationEventPublisher eventPublisher, Clock clock) {
        this.sessionStore = sessionStore;
        this.eventPublisher = eventPublisher;
        this.clock = clock;
    }

    @Scheduled(fixedDelayString = "${app.session.cleanup-interval:PT1H}", initialDelayString = "${app.session.cleanup-initial-delay:PT1M}")
    @Transactional
    public int purgeExpiredSessions() {
        int removed = sessionStore.removeExpired(OffsetDateTime.now(clock));
        if (removed > 0) {
            log.info("Purged {} expired sessions", removed);
            eventPublisher.publishEvent(SessionEvent.invalidated(null, null, InvalidationReason.EXPIRED, removed));
        }
        return removed;
    }
}
