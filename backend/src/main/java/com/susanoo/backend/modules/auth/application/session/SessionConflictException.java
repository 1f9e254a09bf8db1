package com.susanoo.backend.modules.auth.application.session;

/**
 * A new session collided with an existing refresh token digest. Rolls the surrounding
 * transaction back, unlike {@code ResponseStatusException}.
 */
public class SessionConflictException extends RuntimeException {

    public SessionConflictException(String message, Throwable cause) {
        super(message, cause);
    }
}
