package com.susanoo.backend.modules.auth.infrastructure.persistence;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.susanoo.backend.modules.auth.domain.UserSession;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface UserSessionRepository extends JpaRepository<UserSession, UUID> {

    Optional<UserSession> findByRefreshTokenHash(String refreshTokenHash);

    long countByUserId(UUID userId);

    @Query("""
            select us
              from UserSession us
             where us.userId = :userId
               and us.expiresAt > :now
             order by us.createdAt desc
            """)
    List<UserSession> findActiveByUserId(@Param("userId") UUID userId, @Param("now") OffsetDateTime now);

    @Query("select count(us) from UserSession us where us.ip = :ip and us.expiresAt > :now")
    long countActiveByIp(@Param("ip") String ip, @Param("now") OffsetDateTime now);

    @Modifying(clearAutomatically = true)
    @Query("delete from UserSession us where us.refreshTokenHash = :refreshTokenHash")
    int deleteByRefreshTokenHash(@Param("refreshTokenHash") String refreshTokenHash);

    @Modifying(clearAutomatically = true)
    @Query("delete from UserSession us where us.userId = :userId")
    int deleteAllByUserId(@Param("userId") UUID userId);

    @Modifying(clearAutomatically = true)
    @Query("delete from UserSession us where us.userId = :userId and us.id <> :keptSessionId")
    int deleteAllByUserIdExcept(@Param("userId") UUID userId, @Param("keptSessionId") UUID keptSessionId);

    @Modifying(clearAutomatically = true)
    @Query("delete from UserSession us where us.expiresAt <= :now")
    int deleteExpired(@Param("now") OffsetDateTime now);
}
