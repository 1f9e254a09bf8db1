package com.susanoo.backend.global.security;

import java.util.UUID;

public record JwtAuthenticationPrincipal(UUID userId, UUID sessionId, String email, String role) {
}
