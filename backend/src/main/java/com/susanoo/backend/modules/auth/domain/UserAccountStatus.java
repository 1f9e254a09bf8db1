package com.susanoo.backend.modules.auth.domain;

public enum UserAccountStatus {
    ACTIVE,
    INACTIVE
}
