package com.bulwark.core.csrf;

import com.bulwark.core.gateway.GatewayRequest;

import java.util.Locale;
import java.util.Set;

/**
 * Matches the CSRF token sent with a request against the one stored in the caller's session.
 */
public class CsrfValidator {

    private static final Set<String> SAFE_METHODS = Set.of("GET", "HEAD", "OPTIONS");

    private final String headerName;
    private final String parameterName;
    private final String sessionAttribute;

    public CsrfValidator() {
        this("X-CSRF-Token", "_csrf", "csrfToken");
    }

    public CsrfValidator(String headerName, String parameterName, String sessionAttribute) {
        this.headerName = headerName;
        this.parameterName = parameterName;
        this.sessionAttribute = sessionAttribute;
    }

    /**
     * @return true for safe methods, or when the request token equals the session token
     */
    public boolean validate(GatewayRequest request) {
        if (isSafeMethod(request.getMethod())) {
            return true;
        }

        String requestToken = extractToken(request);
        String sessionToken = request.getSessionAttribute(sessionAttribute);

        return isPresent(requestToken) && isPresent(sessionToken) && requestToken.equals(sessionToken);
    }

    /**
     * Header first, then body field, then query parameter.
     */
    String extractToken(GatewayRequest request) {
        String token = request.getHeader(headerName);
        if (!isPresent(token)) {
            token = request.getBodyParameter(parameterName);
        }
        if (!isPresent(token)) {
            token = request.getQueryParameter(parameterName);
        }
        return token;
    }

    public static boolean isSafeMethod(String method) {
        return method != null && SAFE_METHODS.contains(method.toUpperCase(Locale.ROOT));
    }

    private static boolean isPresent(String value) {
        return value != null && !value.isEmpty();
    }
}
