package com.portico.backend.global.security;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.Optional;

import com.portico.backend.modules.auth.domain.UserSession;

import jakarta.servlet.http.Cookie;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseCookie;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.util.WebUtils;

/**
 * The {@code session_id} cookie: HttpOnly, SameSite=Lax, Secure on TLS requests,
 * lifetime equal to the remaining session lifetime.
 */
@Component
public class SessionCookieManager {

    public static final String COOKIE_NAME = "session_id";
    private static final String SAME_SITE = "Lax";

    private final Clock clock;

    public SessionCookieManager(Clock clock) {
        this.clock = clock;
    }

    public static Optional<String> readSessionId(HttpServletRequest request) {
        Cookie cookie = WebUtils.getCookie(request, COOKIE_NAME);
        if (cookie == null || !StringUtils.hasText(cookie.getValue())) {
            return Optional.empty();
        }
        return Optional.of(cookie.getValue());
    }

    public void write(HttpServletRequest request, HttpServletResponse response, UserSession session) {
        Duration maxAge = Duration.between(OffsetDateTime.now(clock), session.getExpiresAt());
        ResponseCookie cookie = baseCookie(request, session.getId())
                .maxAge(maxAge.isNegative() ? Duration.ZERO : maxAge)
                .build();
        response.addHeader(HttpHeaders.SET_COOKIE, cookie.toString());
    }

    public void clear(HttpServletRequest request, HttpServletResponse response) {
        ResponseCookie cookie = baseCookie(request, "")
                .maxAge(Duration.ZERO)
                .build();
        response.addHeader(HttpHeaders.SET_COOKIE, cookie.toString());
    }

    private static ResponseCookie.ResponseCookieBuilder baseCookie(HttpServletRequest request, String value) {
        return ResponseCookie.from(COOKIE_NAME, value)
                .httpOnly(true)
                .secure(request.isSecure())
                .sameSite(SAME_SITE)
                .path("/");
    }
}
