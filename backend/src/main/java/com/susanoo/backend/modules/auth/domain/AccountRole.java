package com.susanoo.backend.modules.auth.domain;

public enum AccountRole {
    USER,
    EDITOR,
    SENIOR_EDITOR,
    ADMIN,
    SUPERADMIN
}
