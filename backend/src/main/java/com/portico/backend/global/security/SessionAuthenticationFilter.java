package com.portico.backend.global.security;

import java.io.IOException;
import java.util.List;
import java.util.Optional;

import com.portico.backend.global.error.AuthException;
import com.portico.backend.modules.auth.application.SessionService;
import com.portico.backend.modules.auth.domain.UserAccount;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.NonNull;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.web.authentication.WebAuthenticationDetailsSource;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Resolves the session cookie into an authenticated principal. A rejected session leaves the
 * request anonymous; the reason is kept in {@link #AUTH_FAILURE_ATTRIBUTE} for the entry point.
 */
@Component
public class SessionAuthenticationFilter extends OncePerRequestFilter {

    public static final String AUTH_FAILURE_ATTRIBUTE = SessionAuthenticationFilter.class.getName() + ".FAILURE";

    private static final Logger log = LoggerFactory.getLogger(SessionAuthenticationFilter.class);

    private final SessionService sessionService;
    private final SessionCookieManager sessionCookieManager;

    public SessionAuthenticationFilter(SessionService sessionService, SessionCookieManager sessionCookieManager) {
        this.sessionService = sessionService;
        this.sessionCookieManager = sessionCookieManager;
    }

    @Override
    protected void doFilterInternal(@NonNull HttpServletRequest request,
                                    @NonNull HttpServletResponse response,
                                    @NonNull FilterChain filterChain) throws ServletException, IOException {
        Optional<String> sessionId = SessionCookieManager.readSessionId(request);
        if (sessionId.isPresent()) {
            try {
                UserAccount user = sessionService.validate(sessionId.get());
                SessionPrincipal principal = new SessionPrincipal(
                        user.getId(), user.getEmail(), user.getRole(), sessionId.get());
                List<SimpleGrantedAuthority> authorities = user.getRole().grantedAuthorities().stream()
                        .map(SimpleGrantedAuthority::new)
                        .toList();
                UsernamePasswordAuthenticationToken authentication =
                        new UsernamePasswordAuthenticationToken(principal, null, authorities);
                authentication.setDetails(new WebAuthenticationDetailsSource().buildDetails(request));
                SecurityContextHolder.getContext().setAuthentication(authentication);
            } catch (AuthException ex) {
                SecurityContextHolder.clearContext();
                request.setAttribute(AUTH_FAILURE_ATTRIBUTE, ex.getProblemCode());
                sessionCookieManager.clear(request, response);
                log.debug("Session rejected: {}", ex.getCode());
            }
        }
        filterChain.doFilter(request, response);
    }

    @Override
    protected boolean shouldNotFilter(@NonNull HttpServletRequest request) {
        return "OPTIONS".equalsIgnoreCase(request.getMethod());
    }
}
