package com.susanoo.backend.modules.auth.presentation.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

public record LogoutRequest(
        @NotBlank(message = "refreshToken is required")
        @Size(max = RefreshTokenFormat.MAX_LENGTH, message = "refreshToken exceeds maximum length")
        @Pattern(regexp = RefreshTokenFormat.PATTERN, message = "refreshToken contains invalid characters")
        String refreshToken,
        Boolean allDevices
) {

    public LogoutRequest {
        refreshToken = RefreshTokenFormat.trim(refreshToken);
    }

    public boolean allDevicesOrDefault() {
        return Boolean.TRUE.equals(allDevices);
    }
}
