package com.susanoo.backend.modules.auth.application.session;

import java.util.Objects;
import java.util.UUID;

/**
 * Selection for {@link SessionStore#removeWhere}: one token, every session of a user, or every
 * session of a user except one.
 */
public record SessionCriteria(String refreshToken, UUID userId, UUID excludedSessionId) {

    public SessionCriteria {
        if (refreshToken == null && userId == null) {
            throw new IllegalArgumentException("either refreshToken or userId is required");
        }
        if (refreshToken != null && userId != null) {
            throw new IllegalArgumentException("refreshToken and userId are mutually exclusive");
        }
        if (excludedSessionId != null && userId == null) {
            throw new IllegalArgumentException("excludedSessionId requires userId");
        }
    }

    public static SessionCriteria byRefreshToken(String refreshToken) {
        return new SessionCriteria(Objects.requireNonNull(refreshToken, "refreshToken"), null, null);
    }

    public static SessionCriteria byUser(UUID userId) {
        return new SessionCriteria(null, Objects.requireNonNull(userId, "userId"), null);
    }

    public static SessionCriteria byUserExcept(UUID userId, UUID keptSessionId) {
        return new SessionCriteria(null, Objects.requireNonNull(userId, "userId"),
                Objects.requireNonNull(keptSessionId, "keptSessionId"));
    }

    // refreshToken is a secret
    @Override
    public String toString() {
        if (refreshToken != null) {
            return "SessionCriteria[refreshToken=***]";
        }
        return "SessionCriteria[userId=" + userId + ", excludedSessionId=" + excludedSessionId + "]";
    }
}
