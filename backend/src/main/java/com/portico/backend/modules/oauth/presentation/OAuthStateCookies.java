package com.portico.backend.modules.oauth.presentation;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.time.Duration;

import com.portico.backend.global.crypto.SecureTokenGenerator;

import jakarta.servlet.http.Cookie;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseCookie;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.util.WebUtils;

/**
 * Binds an authorization request to the browser that started it. The {@code oauth_state}
 * cookie is SameSite=Lax so it survives the provider's top-level redirect back.
 */
@Component
public class OAuthStateCookies {

    public static final String COOKIE_NAME = "oauth_state";
    private static final String COOKIE_PATH = "/auth/oauth";
    private static final Duration MAX_AGE = Duration.ofMinutes(10);

    private final SecureTokenGenerator tokenGenerator;

    public OAuthStateCookies(SecureTokenGenerator tokenGenerator) {
        this.tokenGenerator = tokenGenerator;
    }

    public String newState() {
        return tokenGenerator.generate();
    }

    public void write(HttpServletRequest request, HttpServletResponse response, String state) {
        response.addHeader(HttpHeaders.SET_COOKIE, baseCookie(request, state).maxAge(MAX_AGE).build().toString());
    }

    public void clear(HttpServletRequest request, HttpServletResponse response) {
        response.addHeader(HttpHeaders.SET_COOKIE, baseCookie(request, "").maxAge(Duration.ZERO).build().toString());
    }

    public boolean matches(HttpServletRequest request, String state) {
        Cookie cookie = WebUtils.getCookie(request, COOKIE_NAME);
        if (cookie == null || !StringUtils.hasText(cookie.getValue()) || !StringUtils.hasText(state)) {
            return false;
        }
        return MessageDigest.isEqual(
                cookie.getValue().getBytes(StandardCharsets.UTF_8), state.getBytes(StandardCharsets.UTF_8));
    }

    private static ResponseCookie.ResponseCookieBuilder baseCookie(HttpServletRequest request, String value) {
        return ResponseCookie.from(COOKIE_NAME, value)
                .httpOnly(true)
                .secure(request.isSecure())
                .sameSite("Lax")
                .path(COOKIE_PATH);
    }
}
