package com.portico.backend.global.ratelimit;

import java.io.IOException;
import java.util.Set;

import com.portico.backend.global.error.ProblemCode;
import com.portico.backend.global.error.ProblemResponseWriter;
import com.portico.backend.global.web.ClientIpResolver;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Admission control in front of the unauthenticated credential endpoints.
 */
@Component
public class RateLimitingFilter extends OncePerRequestFilter {

    private static final Logger log = LoggerFactory.getLogger(RateLimitingFilter.class);

    static final Set<String> LIMITED_PATHS = Set.of(
            "/auth/login",
            "/auth/register",
            "/auth/password/forgot",
            "/auth/password/reset",
            "/auth/email-link"
    );

    private final ClientRateLimiter rateLimiter;
    private final ProblemResponseWriter problemResponseWriter;

    public RateLimitingFilter(ClientRateLimiter rateLimiter, ProblemResponseWriter problemResponseWriter) {
        this.rateLimiter = rateLimiter;
        this.problemResponseWriter = problemResponseWriter;
    }

    @Override
    protected void doFilterInternal(@NonNull HttpServletRequest request,
                                    @NonNull HttpServletResponse response,
                                    @NonNull FilterChain filterChain) throws ServletException, IOException {
        String clientIp = ClientIpResolver.resolve(request);
        RateLimitDecision decision = rateLimiter.tryAcquireWithRetry(clientIp);
        if (!decision.allowed()) {
            log.warn("Rate limit exceeded ip={} path={}", clientIp, request.getRequestURI());
            response.setHeader(HttpHeaders.RETRY_AFTER, String.valueOf(decision.retryAfterSeconds()));
            problemResponseWriter.write(response, ProblemCode.RATE_LIMITED, request.getRequestURI());
            return;
        }
        filterChain.doFilter(request, response);
    }

    @Override
    protected boolean shouldNotFilter(@NonNull HttpServletRequest request) {
        if (!"POST".equalsIgnoreCase(request.getMethod())) {
            return true;
        }
        String path = request.getRequestURI().substring(request.getContextPath().length());
        return !LIMITED_PATHS.contains(path);
    }
}
