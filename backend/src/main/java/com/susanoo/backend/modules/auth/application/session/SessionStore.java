package com.susanoo.backend.modules.auth.application.session;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.susanoo.backend.modules.auth.domain.UserSession;

/**
 * Durable home of every live session. This is the only synchronisation point for session
 * liveness; nothing else may cache whether a refresh token is valid.
 */
public interface SessionStore {

    /**
     * Persists a new session.
     *
     * @throws SessionConflictException if the refresh token digest is already taken
     */
    UserSession create(UserSession session);

    /**
     * Looks a session up by its plaintext refresh token. Expired rows are returned as well,
     * callers decide what to do with them.
     */
    Optional<UserSession> getByRefreshToken(String refreshToken);

    /**
     * Physically deletes every session matching the criteria.
     *
     * @return number of rows removed, {@code 0} when nothing matched
     */
    int removeWhere(SessionCriteria criteria);

    /**
     * Deletes every session whose expiry is at or before {@code now}.
     */
    int removeExpired(OffsetDateTime now);

    long countByUserId(UUID userId);

    List<UserSession> findActiveByUserId(UUID userId, OffsetDateTime now);

    /**
     * Number of unexpired sessions, across all users, opened from {@code ip}.
     */
    long countActiveByIp(String ip, OffsetDateTime now);

    /**
     * Number of logouts the user performed in the trailing window. Used for best-effort
     * throttling only, so callers must tolerate a failure here.
     */
    long countRecentLogouts(UUID userId, int windowMinutes);
}
