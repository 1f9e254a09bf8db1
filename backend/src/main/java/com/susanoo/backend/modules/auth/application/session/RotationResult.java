package com.susanoo.backend.modules.auth.application.session;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.susanoo.backend.modules.auth.application.JwtTokenService.IssuedAccessToken;

public record RotationResult(UUID userId, UUID sessionId, IssuedAccessToken accessToken, String refreshToken,
                             OffsetDateTime refreshExpiresAt) {

    @Override
    public String toString() {
        return "RotationResult[userId=" + userId + ", sessionId=" + sessionId + "]";
    }
}
