package com.susanoo.backend.modules.auth.application.session;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.Optional;

import com.susanoo.backend.modules.auth.domain.UserSession;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Decides whether a stored session may be used by the presenting client. Checks run in a
 * fixed order: existence, expiry, fingerprint.
 */
@Component
public class SessionVerifier {

    private static final Logger log = LoggerFactory.getLogger(SessionVerifier.class);

    private final Clock clock;

    public SessionVerifier(Clock clock) {
        this.clock = clock;
    }

    public Optional<RejectionReason> findViolation(UserSession session, String presentedFingerprint) {
        if (session == null) {
            return Optional.of(RejectionReason.INVALID_TOKEN);
        }
        if (session.isExpiredAt(OffsetDateTime.now(clock))) {
            return Optional.of(RejectionReason.EXPIRED_SESSION);
        }
        if (!fingerprintMatches(session.getFingerprint(), presentedFingerprint)) {
            return Optional.of(RejectionReason.FINGERPRINT_MISMATCH);
        }
        return Optional.empty();
    }

    /**
     * @throws SessionRejectedException carrying the failed check; callers must not echo it
     */
    public void verify(UserSession session, String presentedFingerprint) {
        Optional<RejectionReason> violation = findViolation(session, presentedFingerprint);
        if (violation.isEmpty()) {
            return;
        }
        RejectionReason reason = violation.get();
        if (reason == RejectionReason.FINGERPRINT_MISMATCH) {
            log.warn("[ALERT][Session] fingerprint mismatch session={} user={}", session.getId(), session.getUserId());
        } else {
            log.info("Session rejected reason={} session={}", reason, session != null ? session.getId() : null);
        }
        throw new SessionRejectedException(reason);
    }

    private boolean fingerprintMatches(String stored, String presented) {
        if (stored == null || presented == null) {
            return false;
        }
        return MessageDigest.isEqual(
                stored.getBytes(StandardCharsets.UTF_8),
                presented.trim().getBytes(StandardCharsets.UTF_8)
        );
    }
}
