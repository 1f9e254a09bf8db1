package com.susanoo.backend.modules.auth.presentation;

import com.susanoo.backend.global.web.RequestIdFilter;
import com.susanoo.backend.modules.auth.application.session.ClientContext;

import jakarta.servlet.http.HttpServletRequest;

import org.springframework.http.HttpHeaders;

final class ClientContexts {

    private ClientContexts() {
    }

    static ClientContext from(HttpServletRequest request, String fingerprint, String deviceInfo, boolean rememberMe) {
        return new ClientContext(
                fingerprint,
                RequestIdFilter.clientIp(request),
                request.getHeader(HttpHeaders.USER_AGENT),
                deviceInfo,
                rememberMe
        );
    }
}
