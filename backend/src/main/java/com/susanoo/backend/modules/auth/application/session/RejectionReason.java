package com.susanoo.backend.modules.auth.application.session;

import org.springframework.http.HttpStatus;

/**
 * Why a presented session was refused. Only the HTTP status leaves the server; the reason
 * itself is for logs and audit.
 */
public enum RejectionReason {
    INVALID_TOKEN(HttpStatus.UNAUTHORIZED),
    EXPIRED_SESSION(HttpStatus.UNAUTHORIZED),
    FINGERPRINT_MISMATCH(HttpStatus.UNAUTHORIZED),
    ACCOUNT_INACTIVE(HttpStatus.FORBIDDEN);

    private final HttpStatus status;

    RejectionReason(HttpStatus status) {
        this.status = status;
    }

    public HttpStatus status() {
        return status;
    }
}
