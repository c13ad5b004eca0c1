package com.company.adaptive.web;

import jakarta.servlet.http.HttpServletRequest;

/**
 * Reads the isolation scope of an HTTP caller from the {@code X-Scope-Id} header.
 */
public final class ScopeResolver {

    public static final String SCOPE_HEADER = "X-Scope-Id";
    public static final String DEFAULT_SCOPE = "default";

    private ScopeResolver() {
    }

    public static String resolve(HttpServletRequest request) {
        return resolve(request.getHeader(SCOPE_HEADER));
    }

    public static String resolve(String headerValue) {
        return headerValue == null || headerValue.isBlank() ? DEFAULT_SCOPE : headerValue.trim();
    }
}
