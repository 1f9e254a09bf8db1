package com.susanoo.backend.modules.auth.application;

import java.util.UUID;

import com.susanoo.backend.global.error.ProblemException;
import com.susanoo.backend.modules.auth.application.session.InvalidationReason;
import com.susanoo.backend.modules.auth.application.session.SessionInvalidationService;
import com.susanoo.backend.modules.auth.infrastructure.persistence.UserAccountRepository;
import com.susanoo.backend.modules.auth.presentation.dto.LogoutResponse;

import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional
public class AdminSessionService {

    private final UserAccountRepository userAccountRepository;
    private final SessionInvalidationService sessionInvalidationService;

    public AdminSessionService(
            UserAccountRepository userAccountRepository,
            SessionInvalidationService sessionInvalidationService
    ) {
        this.userAccountRepository = userAccountRepository;
        this.sessionInvalidationService = sessionInvalidationService;
    }

    public LogoutResponse revokeAllSessions(UUID userId) {
        if (!userAccountRepository.existsById(userId)) {
            throw new ProblemException(HttpStatus.NOT_FOUND, "USER_NOT_FOUND");
        }
        return new LogoutResponse(sessionInvalidationService.invalidateAllUserSessions(userId, InvalidationReason.ADMIN_FORCED));
    }
}
