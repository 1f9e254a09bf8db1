package com.susanoo.backend.modules.audit.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

import com.susanoo.backend.modules.audit.domain.AuditLog;
import com.susanoo.backend.modules.audit.infrastructure.AuditLogRepository;
import com.susanoo.backend.modules.auth.domain.UserAccount;

import jakarta.persistence.EntityManager;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

@Service
public class AuditLogService {

    private final AuditLogRepository auditLogRepository;
    private final EntityManager entityManager;
    private final Clock clock;

    public AuditLogService(AuditLogRepository auditLogRepository, EntityManager entityManager, Clock clock) {
        this.auditLogRepository = auditLogRepository;
        this.entityManager = entityManager;
        this.clock = clock;
    }

    /**
     * Writes one audit row in its own transaction, so it also works from after-commit listeners.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void record(AuditLogCommand command) {
        Objects.requireNonNull(command.actionType(), "actionType is required");
        Objects.requireNonNull(command.resourceType(), "resourceType is required");
        Objects.requireNonNull(command.resourceKey(), "resourceKey is required");

        AuditLog auditLog = new AuditLog();
        auditLog.setActionType(command.actionType());
        auditLog.setResourceType(command.resourceType());
        auditLog.setResourceKey(command.resourceKey());
        // same clock as the logout rate window
        auditLog.setCreatedAt(OffsetDateTime.now(clock));

        if (command.actorUserId() != null) {
            auditLog.setActor(entityManager.getReference(UserAccount.class, command.actorUserId()));
        }

        auditLog.setCorrelationId(command.correlationId());

        if (command.detail() != null && !command.detail().isEmpty()) {
            auditLog.setDetail(new HashMap<>(command.detail()));
        }

        auditLogRepository.save(auditLog);
    }

    public record AuditLogCommand(
            String actionType,
            String resourceType,
            String resourceKey,
            UUID actorUserId,
            String correlationId,
            Map<String, Object> detail
    ) {
    }
}
