package com.susanoo.backend.modules.auth.presentation.dto;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Set;
import java.util.stream.Collectors;

import com.susanoo.backend.modules.auth.application.session.RefreshTokens;

import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import jakarta.validation.ValidatorFactory;

import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

class RefreshTokenFormatTest {

    private static ValidatorFactory factory;
    private static Validator validator;

    @BeforeAll
    static void createValidator() {
        factory = Validation.buildDefaultValidatorFactory();
        validator = factory.getValidator();
    }

    @AfterAll
    static void closeValidator() {
        factory.close();
    }

    @Test
    void issuedTokensPass() {
        assertThat(validator.validate(new RefreshRequest(RefreshTokens.generate(), "fp", null))).isEmpty();
        assertThat(validator.validate(new LogoutRequest(RefreshTokens.generate(), true))).isEmpty();
    }

    @Test
    void oversizedTokensAreRejected() {
        String huge = "a".repeat(100_000);

        assertThat(refreshTokenViolations(validator.validate(new RefreshRequest(huge, "fp", null)))).isNotEmpty();
        assertThat(refreshTokenViolations(validator.validate(new LogoutRequest(huge, false)))).isNotEmpty();
        assertThat(validator.validate(new RefreshRequest("a".repeat(RefreshTokenFormat.MAX_LENGTH), "fp", null))).isEmpty();
    }

    @Test
    void tokensOutsideTheAlphabetAreRejected() {
        assertThat(refreshTokenViolations(validator.validate(
                new RefreshRequest("<script>alert(1)</script>", "fp", null)))).isNotEmpty();
        assertThat(refreshTokenViolations(validator.validate(new LogoutRequest("abc def", null)))).isNotEmpty();
    }

    @Test
    void surroundingWhitespaceIsTrimmed() {
        RefreshRequest request = new RefreshRequest("  abc_DEF-123\t", "fp", null);

        assertThat(request.refreshToken()).isEqualTo("abc_DEF-123");
        assertThat(validator.validate(request)).isEmpty();
    }

    private static <T> Set<ConstraintViolation<T>> refreshTokenViolations(Set<ConstraintViolation<T>> violations) {
        return violations.stream()
                .filter(violation -> violation.getPropertyPath().toString().equals(RefreshTokenFormat.FIELD))
                .collect(Collectors.toSet());
    }
}
