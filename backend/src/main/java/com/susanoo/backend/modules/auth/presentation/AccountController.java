package com.susanoo.backend.modules.auth.presentation;

import com.susanoo.backend.global.security.JwtAuthenticationPrincipal;
import com.susanoo.backend.modules.auth.application.PasswordChangeService;
import com.susanoo.backend.modules.auth.presentation.dto.ChangePasswordRequest;
import com.susanoo.backend.modules.auth.presentation.dto.PasswordChangeResponse;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;

import jakarta.validation.Valid;

import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class AccountController {

    private final PasswordChangeService passwordChangeService;

    public AccountController(PasswordChangeService passwordChangeService) {
        this.passwordChangeService = passwordChangeService;
    }

    @Operation(summary = "Change password", description = "Stores the new password and ends sessions according to `app.session.password-change-policy`.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Password changed"),
            @ApiResponse(responseCode = "400", description = "`INVALID_CURRENT_PASSWORD`")
    })
    @PutMapping("/users/me/password")
    public ResponseEntity<PasswordChangeResponse> changePassword(
            @AuthenticationPrincipal JwtAuthenticationPrincipal principal,
            @Valid @RequestBody ChangePasswordRequest request
    ) {
        return ResponseEntity.ok(passwordChangeService.changePassword(principal.userId(), principal.sessionId(), request));
    }
}
