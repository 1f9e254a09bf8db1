package com.susanoo.backend.modules.auth.application.session;

public enum SessionAnomaly {
    IP_SESSION_LIMIT,
    CONCURRENT_IPS,
    SUSPICIOUS_USER_AGENT
}
