package com.portico.backend.global.security;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

/**
 * Partial-page clients cannot follow a 401 on their own; they get a redirect hint instead.
 */
final class HtmxRedirects {

    static final String HX_REQUEST_HEADER = "HX-Request";
    static final String HX_REDIRECT_HEADER = "HX-Redirect";
    static final String REQUESTED_WITH_HEADER = "X-Requested-With";
    static final String SIGN_IN_PATH = "/signin";

    private HtmxRedirects() {
    }

    static boolean isPartialRequest(HttpServletRequest request) {
        return "true".equalsIgnoreCase(request.getHeader(HX_REQUEST_HEADER))
                || "XMLHttpRequest".equalsIgnoreCase(request.getHeader(REQUESTED_WITH_HEADER));
    }

    static void redirectToSignIn(HttpServletRequest request, HttpServletResponse response) {
        if (isPartialRequest(request)) {
            response.setHeader(HX_REDIRECT_HEADER, SIGN_IN_PATH);
        }
    }
}
