package com.susanoo.backend.modules.auth.application;

/**
 * Which sessions survive a password change.
 */
public enum PasswordChangePolicy {
    /** every session, the caller's included, is terminated */
    ALL,
    /** the session that performed the change stays logged in */
    OTHERS
}
