package com.susanoo.backend.modules.auth.presentation;

import java.util.List;

import com.susanoo.backend.global.security.JwtAuthenticationPrincipal;
import com.susanoo.backend.modules.auth.application.AuthService;
import com.susanoo.backend.modules.auth.presentation.dto.LogoutResponse;
import com.susanoo.backend.modules.auth.presentation.dto.SessionSummaryResponse;

import io.swagger.v3.oas.annotations.Operation;

import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/auth/sessions")
public class SessionController {

    private final AuthService authService;

    public SessionController(AuthService authService) {
        this.authService = authService;
    }

    @Operation(summary = "List active sessions", description = "Unexpired sessions of the caller, newest first. The caller's own session is flagged `current`.")
    @GetMapping
    public ResponseEntity<List<SessionSummaryResponse>> listSessions(@AuthenticationPrincipal JwtAuthenticationPrincipal principal) {
        return ResponseEntity.ok(authService.listSessions(principal.userId(), principal.sessionId()));
    }

    @Operation(summary = "Log out other devices", description = "Ends every session of the caller except the one the access token belongs to.")
    @PostMapping("/logout-others")
    public ResponseEntity<LogoutResponse> logoutOthers(@AuthenticationPrincipal JwtAuthenticationPrincipal principal) {
        return ResponseEntity.ok(authService.logoutOtherSessions(principal.userId(), principal.sessionId()));
    }
}
