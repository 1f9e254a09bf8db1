package com.susanoo.backend.modules.auth.presentation.dto;

/**
 * Shape every refresh token must have before it reaches the session store. Issued tokens are
 * URL-safe Base64; the standard alphabet and JWT-style dots are accepted as well.
 */
public final class RefreshTokenFormat {

    public static final int MAX_LENGTH = 512;
    public static final String PATTERN = "[A-Za-z0-9_+/=.\\-]+";
    public static final String FIELD = "refreshToken";

    private RefreshTokenFormat() {
    }

    static String trim(String refreshToken) {
        return refreshToken != null ? refreshToken.trim() : null;
    }
}
