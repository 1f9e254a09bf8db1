package com.susanoo.backend.modules.auth.application.session;

public enum InvalidationReason {
    LOGOUT,
    LOGOUT_ALL,
    LOGOUT_OTHERS,
    PASSWORD_CHANGE,
    SESSION_LIMIT,
    ADMIN_FORCED,
    EXPIRED,
    ROTATED
}
