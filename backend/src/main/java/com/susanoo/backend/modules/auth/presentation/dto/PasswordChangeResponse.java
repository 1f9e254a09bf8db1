package com.susanoo.backend.modules.auth.presentation.dto;

public record PasswordChangeResponse(int sessionsInvalidated) {
}
