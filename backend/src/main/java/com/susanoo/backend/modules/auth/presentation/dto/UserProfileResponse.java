package com.susanoo.backend.modules.auth.presentation.dto;

import java.util.UUID;

public record UserProfileResponse(UUID userId, String email, String displayName, String role) {
}
