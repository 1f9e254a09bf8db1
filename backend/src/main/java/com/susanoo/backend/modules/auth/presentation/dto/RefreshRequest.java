package com.susanoo.backend.modules.auth.presentation.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

public record RefreshRequest(
        @NotBlank(message = "refreshToken is required")
        @Size(max = RefreshTokenFormat.MAX_LENGTH, message = "refreshToken exceeds maximum length")
        @Pattern(regexp = RefreshTokenFormat.PATTERN, message = "refreshToken contains invalid characters")
        String refreshToken,
        @NotBlank(message = "fingerprint is required") @Size(max = 255) String fingerprint,
        @Size(max = 255) String deviceInfo
) {

    public RefreshRequest {
        refreshToken = RefreshTokenFormat.trim(refreshToken);
    }
}
