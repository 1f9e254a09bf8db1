package com.susanoo.backend.modules.auth.application;

import java.util.UUID;

import com.susanoo.backend.global.error.ProblemException;
import com.susanoo.backend.modules.auth.application.session.InvalidationReason;
import com.susanoo.backend.modules.auth.application.session.SessionInvalidationService;
import com.susanoo.backend.modules.auth.domain.UserAccount;
import com.susanoo.backend.modules.auth.infrastructure.persistence.UserAccountRepository;
import com.susanoo.backend.modules.auth.presentation.dto.ChangePasswordRequest;
import com.susanoo.backend.modules.auth.presentation.dto.PasswordChangeResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional
public class PasswordChangeService {

    private static final Logger log = LoggerFactory.getLogger(PasswordChangeService.class);

    private final UserAccountRepository userAccountRepository;
    private final SessionInvalidationService sessionInvalidationService;
    private final PasswordEncoder passwordEncoder;
    private final PasswordChangePolicy policy;

    public PasswordChangeService(
            UserAccountRepository userAccountRepository,
            SessionInvalidationService sessionInvalidationService,
            PasswordEncoder passwordEncoder,
            @Value("${app.session.password-change-policy:ALL}") PasswordChangePolicy policy
    ) {
        this.userAccountRepository = userAccountRepository;
        this.sessionInvalidationService = sessionInvalidationService;
        this.passwordEncoder = passwordEncoder;
        this.policy = policy;
    }

    public PasswordChangeResponse changePassword(UUID userId, UUID currentSessionId, ChangePasswordRequest request) {
        UserAccount user = userAccountRepository.findById(userId)
                .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, "USER_NOT_FOUND"));

        if (!passwordEncoder.matches(request.currentPassword(), user.getPasswordHash())) {
            throw new ProblemException(HttpStatus.BAD_REQUEST, "INVALID_CURRENT_PASSWORD");
        }

        user.setPasswordHash(passwordEncoder.encode(request.newPassword()));
        userAccountRepository.save(user);

        int invalidated;
        if (policy == PasswordChangePolicy.OTHERS && currentSessionId != null) {
            invalidated = sessionInvalidationService.invalidateOtherSessions(userId, currentSessionId, InvalidationReason.PASSWORD_CHANGE);
        } else {
            invalidated = sessionInvalidationService.invalidateAllUserSessions(userId, InvalidationReason.PASSWORD_CHANGE);
        }
        log.info("Password changed for user {} (policy {}, {} sessions invalidated)", userId, policy, invalidated);
        return new PasswordChangeResponse(invalidated);
    }
}
