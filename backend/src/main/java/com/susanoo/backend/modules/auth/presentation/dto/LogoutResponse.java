package com.susanoo.backend.modules.auth.presentation.dto;

public record LogoutResponse(int sessionsInvalidated) {
}
