package com.susanoo.backend.modules.auth.application.session;

import com.susanoo.backend.global.error.ProblemException;

public class SessionRejectedException extends ProblemException {

    public static final String CODE = "SESSION_REJECTED";
    private static final String DETAIL = "Session is not valid, sign in again";

    private final RejectionReason rejectionReason;

    public SessionRejectedException(RejectionReason rejectionReason) {
        super(rejectionReason.status(), CODE, DETAIL);
        this.rejectionReason = rejectionReason;
    }

    public RejectionReason getRejectionReason() {
        return rejectionReason;
    }
}
