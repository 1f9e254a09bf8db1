package com.susanoo.backend.modules.audit.infrastructure;

import java.time.OffsetDateTime;
import java.util.Collection;
import java.util.List;
import java.util.UUID;

import com.susanoo.backend.modules.audit.domain.AuditLog;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface AuditLogRepository extends JpaRepository<AuditLog, UUID> {

    @Query("""
            select count(al)
              from AuditLog al
             where al.actor.id = :actorId
               and al.actionType in :actionTypes
               and al.createdAt >= :since
            """)
    long countByActorAndActionTypes(@Param("actorId") UUID actorId,
                                    @Param("actionTypes") Collection<String> actionTypes,
                                    @Param("since") OffsetDateTime since);

    List<AuditLog> findByActorIdOrderByCreatedAtAsc(UUID actorId);
}
