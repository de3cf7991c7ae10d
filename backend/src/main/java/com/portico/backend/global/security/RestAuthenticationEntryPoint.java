package com.portico.backend.global.security;

import java.io.IOException;

import com.portico.backend.global.error.ProblemCode;
import com.portico.backend.global.error.ProblemResponseWriter;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import org.springframework.security.core.AuthenticationException;
import org.springframework.security.web.AuthenticationEntryPoint;
import org.springframework.stereotype.Component;

/**
 * Answers for protected routes reached without a usable session. A valid session of a
 * suspended or banned account is reported as 403, everything else as 401.
 */
@Component
public class RestAuthenticationEntryPoint implements AuthenticationEntryPoint {

    private final ProblemResponseWriter problemResponseWriter;

    public RestAuthenticationEntryPoint(ProblemResponseWriter problemResponseWriter) {
        this.problemResponseWriter = problemResponseWriter;
    }

    @Override
    public void commence(HttpServletRequest request, HttpServletResponse response, AuthenticationException authException)
            throws IOException {
        HtmxRedirects.redirectToSignIn(request, response);
        problemResponseWriter.write(response, resolveCode(request), request.getRequestURI());
    }

    static ProblemCode resolveCode(HttpServletRequest request) {
        Object failure = request.getAttribute(SessionAuthenticationFilter.AUTH_FAILURE_ATTRIBUTE);
        if (failure == ProblemCode.ACCOUNT_INACTIVE || failure == ProblemCode.SESSION_EXPIRED) {
            return (ProblemCode) failure;
        }
        return ProblemCode.UNAUTHENTICATED;
    }
}
