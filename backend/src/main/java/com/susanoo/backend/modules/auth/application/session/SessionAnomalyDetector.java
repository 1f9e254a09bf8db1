package com.susanoo.backend.modules.auth.application.session;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

import com.susanoo.backend.global.error.ProblemException;
import com.susanoo.backend.modules.auth.domain.UserSession;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;

/**
 * Screens a login before its session is created. Too many live sessions from one IP refuse the
 * login; concurrent IPs and automated-looking user agents only raise an {@code ANOMALY} event.
 * A limit of zero or less turns that check off.
 */
@Component
public class SessionAnomalyDetector {

    private static final Logger log = LoggerFactory.getLogger(SessionAnomalyDetector.class);

    private static final Pattern SUSPICIOUS_USER_AGENT =
            Pattern.compile("bot|crawler|spider|scraper|automated|headless", Pattern.CASE_INSENSITIVE);

    private final SessionStore sessionStore;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;
    private final int maxSessionsPerIp;
    private final int maxConcurrentIps;

    public SessionAnomalyDetector(
            SessionStore sessionStore,
            ApplicationEventPublisher eventPublisher,
            Clock clock,
            @Value("${app.session.max-per-ip:10}") int maxSessionsPerIp,
            @Value("${app.session.max-concurrent-ips:3}") int maxConcurrentIps
    ) {
        this.sessionStore = sessionStore;
        this.eventPublisher = eventPublisher;
        this.clock = clock;
        this.maxSessionsPerIp = maxSessionsPerIp;
        this.maxConcurrentIps = maxConcurrentIps;
    }

    /**
     * @throws ProblemException 429 {@code IP_SESSION_LIMIT} when the client IP already holds the
     *                          maximum number of live sessions
     */
    public void inspect(UUID userId, ClientContext context) {
        OffsetDateTime now = OffsetDateTime.now(clock);

        if (maxSessionsPerIp > 0 && context.ip() != null) {
            long fromIp = sessionStore.countActiveByIp(context.ip(), now);
            if (fromIp >= maxSessionsPerIp) {
                log.warn("[ALERT][Session] ip session limit hit ip={} count={} user={}", context.ip(), fromIp, userId);
                eventPublisher.publishEvent(SessionEvent.anomaly(userId, SessionAnomaly.IP_SESSION_LIMIT, (int) fromIp, context));
                throw new ProblemException(HttpStatus.TOO_MANY_REQUESTS, "IP_SESSION_LIMIT");
            }
        }

        if (maxConcurrentIps > 0) {
            Set<String> ips = sessionStore.findActiveByUserId(userId, now).stream()
                    .map(UserSession::getIp)
                    .filter(Objects::nonNull)
                    .collect(Collectors.toSet());
            if (ips.size() >= maxConcurrentIps) {
                log.warn("[ALERT][Session] concurrent ips user={} ips={} newIp={}", userId, ips, context.ip());
                eventPublisher.publishEvent(SessionEvent.anomaly(userId, SessionAnomaly.CONCURRENT_IPS, ips.size(), context));
            }
        }

        if (context.userAgent() != null && SUSPICIOUS_USER_AGENT.matcher(context.userAgent()).find()) {
            log.warn("[ALERT][Session] suspicious user agent user={} ua={}", userId, context.userAgent());
            eventPublisher.publishEvent(SessionEvent.anomaly(userId, SessionAnomaly.SUSPICIOUS_USER_AGENT, 1, context));
        }
    }
}
