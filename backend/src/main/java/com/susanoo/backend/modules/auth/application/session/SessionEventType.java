package com.susanoo.backend.modules.auth.application.session;

public enum SessionEventType {
    CREATED,
    ROTATED,
    ROTATION_REJECTED,
    INVALIDATED,
    ANOMALY
}
