package com.susanoo.backend.modules.auth.application.session;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class ClientContextTest {

    @Test
    void fingerprintIsRequired() {
        assertThatThrownBy(() -> ClientContext.of("   ", "1.2.3.4", "ua"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ClientContext.of(null, "1.2.3.4", "ua"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void overlongFingerprintIsRejectedRatherThanTruncated() {
        assertThatThrownBy(() -> ClientContext.of("f".repeat(256), null, null))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void metadataIsTrimmedBlankedAndTruncated() {
        ClientContext context = new ClientContext(" fp ", "  ", "u".repeat(600), " phone ", false);

        assertThat(context.fingerprint()).isEqualTo("fp");
        assertThat(context.ip()).isNull();
        assertThat(context.userAgent()).hasSize(512);
        assertThat(context.deviceInfo()).isEqualTo("phone");
    }

    @Test
    void deviceInfoFallbackOnlyAppliesWhenMissing() {
        ClientContext without = ClientContext.of("fp", null, null);
        ClientContext with = new ClientContext("fp", null, null, "laptop", false);

        assertThat(without.withDeviceInfoFallback("tablet").deviceInfo()).isEqualTo("tablet");
        assertThat(with.withDeviceInfoFallback("tablet").deviceInfo()).isEqualTo("laptop");
    }

    @Test
    void criteriaNeverPrintsTheToken() {
        assertThat(SessionCriteria.byRefreshToken("secret-token").toString()).doesNotContain("secret-token");
    }
}
