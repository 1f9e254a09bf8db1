package com.susanoo.backend.modules.auth.presentation;

import java.util.UUID;

import com.susanoo.backend.modules.auth.application.AdminSessionService;
import com.susanoo.backend.modules.auth.presentation.dto.LogoutResponse;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/admin/users")
public class AdminSessionController {

    private final AdminSessionService adminSessionService;

    public AdminSessionController(AdminSessionService adminSessionService) {
        this.adminSessionService = adminSessionService;
    }

    @Operation(summary = "Force logout", description = "Ends every session of the given user.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Sessions ended"),
            @ApiResponse(responseCode = "403", description = "Admin role required"),
            @ApiResponse(responseCode = "404", description = "`USER_NOT_FOUND`")
    })
    @DeleteMapping("/{userId}/sessions")
    public ResponseEntity<LogoutResponse> revokeSessions(@PathVariable UUID userId) {
        return ResponseEntity.ok(adminSessionService.revokeAllSessions(userId));
    }
}
