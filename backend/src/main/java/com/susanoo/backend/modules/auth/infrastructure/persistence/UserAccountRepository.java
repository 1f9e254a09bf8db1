package com.susanoo.backend.modules.auth.infrastructure.persistence;

import java.util.Optional;
import java.util.UUID;

import com.susanoo.backend.modules.auth.domain.UserAccount;

import org.springframework.data.jpa.repository.JpaRepository;

public interface UserAccountRepository extends JpaRepository<UserAccount, UUID> {

    Optional<UserAccount> findByEmailIgnoreCase(String email);
}
