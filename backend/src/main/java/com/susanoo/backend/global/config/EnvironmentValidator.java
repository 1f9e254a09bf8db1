package com.susanoo.backend.global.config;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

/**
 * Fails startup when the keys the session core depends on are missing or out of range.
 */
@Component
public class EnvironmentValidator {

    private static final Logger log = LoggerFactory.getLogger(EnvironmentValidator.class);

    static final String[] REQUIRED_PROPERTIES = {
            "spring.datasource.url",
            "jwt.secret",
            "jwt.expiration"
    };

    static final String DEFAULT_DEV_SECRET = "dev-jwt-secret-key-change-in-production-2025";
    static final long MIN_ACCESS_TTL_MILLIS = 60_000L;
    static final long MAX_ACCESS_TTL_MILLIS = 86_400_000L;

    private final Environment environment;

    public EnvironmentValidator(Environment environment) {
        this.environment = environment;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void validateEnvironment() {
        List<String> problems = collectProblems();
        if (!problems.isEmpty()) {
            throw new IllegalStateException("Environment validation failed: " + String.join("; ", problems));
        }
        log.info("Environment validation passed");
    }

    List<String> collectProblems() {
        List<String> problems = new ArrayList<>();

        for (String key : REQUIRED_PROPERTIES) {
            Optional<String> value = Optional.ofNullable(environment.getProperty(key));
            if (value.map(String::trim).orElse("").isEmpty()) {
                problems.add("missing " + key);
            }
        }

        Optional.ofNullable(environment.getProperty("jwt.secret"))
                .filter(DEFAULT_DEV_SECRET::equals)
                .filter(secret -> isProductionProfile())
                .ifPresent(secret -> problems.add("jwt.secret: default development secret is not allowed in prod"));

        Optional.ofNullable(environment.getProperty("jwt.expiration")).ifPresent(raw -> {
            try {
                long expiration = Long.parseLong(raw.trim());
                if (expiration < MIN_ACCESS_TTL_MILLIS || expiration > MAX_ACCESS_TTL_MILLIS) {
                    problems.add("jwt.expiration: must be between " + MIN_ACCESS_TTL_MILLIS
                            + " and " + MAX_ACCESS_TTL_MILLIS + " ms");
                }
            } catch (NumberFormatException e) {
                problems.add("jwt.expiration: must be a number of milliseconds");
            }
        });

        return problems;
    }

    private boolean isProductionProfile() {
        for (String profile : environment.getActiveProfiles()) {
            if ("prod".equalsIgnoreCase(profile)) {
                return true;
            }
        }
        return false;
    }
}
