package com.susanoo.backend.modules.auth.presentation.dto;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record LoginRequest(
        @NotBlank(message = "email is required") @Email String email,
        @NotBlank(message = "password is required") String password,
        @NotBlank(message = "fingerprint is required") @Size(max = 255) String fingerprint,
        @Size(max = 255) String deviceInfo,
        Boolean rememberMe
) {

    public boolean rememberMeOrDefault() {
        return Boolean.TRUE.equals(rememberMe);
    }
}
