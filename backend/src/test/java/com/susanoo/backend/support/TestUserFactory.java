package com.susanoo.backend.support;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;

import com.susanoo.backend.modules.auth.domain.AccountRole;
import com.susanoo.backend.modules.auth.domain.UserAccount;
import com.susanoo.backend.modules.auth.domain.UserAccountStatus;
import com.susanoo.backend.modules.auth.infrastructure.persistence.UserAccountRepository;

import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

@Component
@Transactional
public class TestUserFactory {

    private final UserAccountRepository userAccountRepository;
    private final PasswordEncoder passwordEncoder;

    public TestUserFactory(UserAccountRepository userAccountRepository, PasswordEncoder passwordEncoder) {
        this.userAccountRepository = userAccountRepository;
        this.passwordEncoder = passwordEncoder;
    }

    public UserAccount ensureAdmin(String email, String rawPassword) {
        return ensureUser(email, rawPassword, AccountRole.ADMIN);
    }

    public UserAccount ensureUser(String email, String rawPassword) {
        return ensureUser(email, rawPassword, AccountRole.USER);
    }

    public UserAccount ensureUser(String email, String rawPassword, AccountRole role) {
        UserAccount user = userAccountRepository.findByEmailIgnoreCase(email)
                .orElseGet(UserAccount::new);
        user.setEmail(email);
        user.setPasswordHash(passwordEncoder.encode(rawPassword));
        user.setDisplayName(email.substring(0, email.indexOf('@')));
        user.setRole(role);
        user.setStatus(UserAccountStatus.ACTIVE);
        user.setDeactivatedAt(null);
        return userAccountRepository.save(user);
    }

    public void deactivate(UserAccount user) {
        UserAccount managed = userAccountRepository.findById(user.getId()).orElseThrow();
        managed.setStatus(UserAccountStatus.INACTIVE);
        managed.setDeactivatedAt(OffsetDateTime.now(ZoneOffset.UTC));
        userAccountRepository.save(managed);
    }
}
