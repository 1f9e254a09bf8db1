package com.susanoo.backend.modules.auth.presentation;

import com.susanoo.backend.modules.auth.application.AuthService;
import com.susanoo.backend.modules.auth.presentation.dto.LoginRequest;
import com.susanoo.backend.modules.auth.presentation.dto.LoginResponse;
import com.susanoo.backend.modules.auth.presentation.dto.LogoutRequest;
import com.susanoo.backend.modules.auth.presentation.dto.LogoutResponse;
import com.susanoo.backend.modules.auth.presentation.dto.RefreshRequest;
import com.susanoo.backend.modules.auth.presentation.dto.TokenPairResponse;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class AuthController {

    private final AuthService authService;

    public AuthController(AuthService authService) {
        this.authService = authService;
    }

    @Operation(summary = "Log in", description = "Checks the password and opens a new session bound to the client fingerprint.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Session created"),
            @ApiResponse(responseCode = "401", description = "`INVALID_CREDENTIALS`"),
            @ApiResponse(responseCode = "403", description = "`USER_INACTIVE`")
    })
    @PostMapping("/auth/login")
    public ResponseEntity<LoginResponse> login(@Valid @RequestBody LoginRequest request, HttpServletRequest httpRequest) {
        return ResponseEntity.ok(authService.login(
                request,
                ClientContexts.from(httpRequest, request.fingerprint(), request.deviceInfo(), request.rememberMeOrDefault())
        ));
    }

    @Operation(
            summary = "Rotate refresh token",
            description = """
                    Exchanges a refresh token for a new token pair. \
                    The presented token is consumed even when the call is rejected, \
                    so a replayed or stolen token can never be used twice.
                    """
    )
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "New token pair issued"),
            @ApiResponse(responseCode = "401", description = "`SESSION_REJECTED` for unknown, expired or mismatched tokens"),
            @ApiResponse(responseCode = "403", description = "`SESSION_REJECTED` for deactivated accounts"),
            @ApiResponse(responseCode = "503", description = "Session store unavailable, retry later")
    })
    @PostMapping("/auth/refresh")
    public ResponseEntity<TokenPairResponse> refresh(@Valid @RequestBody RefreshRequest request, HttpServletRequest httpRequest) {
        // remember-me is inherited from the consumed session
        return ResponseEntity.ok(authService.refresh(
                request.refreshToken(),
                ClientContexts.from(httpRequest, request.fingerprint(), request.deviceInfo(), false)
        ));
    }

    @Operation(summary = "Log out", description = "Ends the session owning the refresh token, or every session of its user with `allDevices`.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Number of sessions ended, 0 for unknown tokens"),
            @ApiResponse(responseCode = "429", description = "`LOGOUT_RATE_LIMITED`")
    })
    @PostMapping("/auth/logout")
    public ResponseEntity<LogoutResponse> logout(@Valid @RequestBody LogoutRequest request) {
        return ResponseEntity.ok(authService.logout(request));
    }
}
