package com.susanoo.backend.modules.auth.application.session;

import com.susanoo.backend.modules.auth.domain.UserSession;

/**
 * A freshly persisted session together with its plaintext refresh token. This is the only
 * place the plaintext exists after creation.
 */
public record IssuedSession(UserSession session, String refreshToken) {

    @Override
    public String toString() {
        return "IssuedSession[sessionId=" + session.getId() + ", userId=" + session.getUserId() + "]";
    }
}
