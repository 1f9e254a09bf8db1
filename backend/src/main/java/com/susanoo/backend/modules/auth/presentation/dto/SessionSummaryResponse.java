package com.susanoo.backend.modules.auth.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

public record SessionSummaryResponse(
        UUID sessionId,
        String ip,
        String userAgent,
        String deviceInfo,
        OffsetDateTime createdAt,
        OffsetDateTime expiresAt,
        boolean current
) {
}
