package com.susanoo.backend.modules.auth.application.session;

/**
 * Everything a caller may attach to a new session. The fingerprint is mandatory; the rest is
 * descriptive metadata kept for audit and for the session listing.
 */
public record ClientContext(String fingerprint, String ip, String userAgent, String deviceInfo, boolean rememberMe) {

    static final int FINGERPRINT_MAX_LENGTH = 255;
    static final int IP_MAX_LENGTH = 64;
    static final int USER_AGENT_MAX_LENGTH = 512;
    static final int DEVICE_INFO_MAX_LENGTH = 255;

    public ClientContext {
        if (fingerprint == null || fingerprint.isBlank()) {
            throw new IllegalArgumentException("fingerprint is required");
        }
        fingerprint = fingerprint.trim();
        if (fingerprint.length() > FINGERPRINT_MAX_LENGTH) {
            throw new IllegalArgumentException("fingerprint must be at most " + FINGERPRINT_MAX_LENGTH + " characters");
        }
        ip = normalize(ip, IP_MAX_LENGTH);
        userAgent = normalize(userAgent, USER_AGENT_MAX_LENGTH);
        deviceInfo = normalize(deviceInfo, DEVICE_INFO_MAX_LENGTH);
    }

    public static ClientContext of(String fingerprint, String ip, String userAgent) {
        return new ClientContext(fingerprint, ip, userAgent, null, false);
    }

    public ClientContext withRememberMe(boolean value) {
        return new ClientContext(fingerprint, ip, userAgent, deviceInfo, value);
    }

    public ClientContext withDeviceInfoFallback(String fallback) {
        return deviceInfo != null ? this : new ClientContext(fingerprint, ip, userAgent, fallback, rememberMe);
    }

    private static String normalize(String raw, int maxLength) {
        if (raw == null) {
            return null;
        }
        String trimmed = raw.trim();
        if (trimmed.isEmpty()) {
            return null;
        }
        return trimmed.length() > maxLength ? trimmed.substring(0, maxLength) : trimmed;
    }
}
