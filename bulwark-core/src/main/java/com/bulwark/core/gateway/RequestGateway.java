package com.bulwark.core.gateway;

import com.bulwark.core.config.BulwarkProperties;
import com.bulwark.core.csrf.CsrfValidator;
import com.bulwark.core.error.ErrorResponse;
import com.bulwark.core.error.SecurityError;
import com.bulwark.core.ratelimit.ClientFingerprint;
import com.bulwark.core.ratelimit.RateLimiter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Wraps request handlers with Bulwark's defensive checks.
 *
 * <p>
 * Checks run in a fixed order and stop at the first failure:
 * </p>
 * <ol>
 * <li>HTTPS requirement (400)</li>
 * <li>Security headers, always applied so they are present on later failures</li>
 * <li>Rate limit per client fingerprint (429)</li>
 * <li>CSRF token for unsafe methods (403)</li>
 * <li>{@link #validateInput(GatewayRequest)}, a hook for subclasses</li>
 * </ol>
 *
 * <p>
 * Failures are turned into an error response and never thrown past the wrapper.
 * The only state shared between requests is the {@link RateLimiter}.
 * </p>
 */
public class RequestGateway {

    private static final Logger log = LoggerFactory.getLogger(RequestGateway.class);

    public static final Map<String, String> SECURITY_HEADERS;

    static {
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put("Content-Security-Policy", "default-src 'self'; script-src 'self'; object-src 'none';");
        headers.put("X-Content-Type-Options", "nosniff");
        headers.put("X-Frame-Options", "DENY");
        headers.put("X-XSS-Protection", "1; mode=block");
        headers.put("Strict-Transport-Security", "max-age=31536000; includeSubDomains");
        headers.put("Referrer-Policy", "no-referrer-when-downgrade");
        headers.put("Cache-Control", "no-store");
        headers.put("Pragma", "no-cache");
        SECURITY_HEADERS = Collections.unmodifiableMap(headers);
    }

    private final BulwarkProperties.Gateway properties;
    private final RateLimiter rateLimiter;
    private final CsrfValidator csrfValidator;

    public RequestGateway(BulwarkProperties.Gateway properties) {
        this(properties,
                new RateLimiter(properties.getRateLimitRequests(), properties.getRateLimitWindowMs()),
                new CsrfValidator(properties.getCsrfHeaderName(), properties.getCsrfParameterName(),
                        properties.getCsrfSessionAttribute()));
    }

    public RequestGateway(BulwarkProperties.Gateway properties, RateLimiter rateLimiter,
            CsrfValidator csrfValidator) {
        if (properties == null) {
            throw SecurityError.config("Gateway properties are required");
        }
        if (rateLimiter == null || csrfValidator == null) {
            throw SecurityError.config("Gateway requires a rate limiter and a CSRF validator");
        }
        this.properties = properties;
        this.rateLimiter = rateLimiter;
        this.csrfValidator = csrfValidator;

        log.info("[Bulwark] Gateway initialized: requireHttps={}, csrfProtection={}, rateLimit={}/{}ms, policy={}",
                properties.isRequireHttps(), properties.isCsrfProtection(),
                rateLimiter.getMaxRequests(), rateLimiter.getWindowMs(), properties.getPolicyLevel());
    }

    /**
     * Wrap a handler. The wrapped handler returns null when a check or the handler itself failed;
     * in that case the error response has already been written.
     */
    public <T> RequestHandler<T> secure(RequestHandler<T> handler) {
        return (request, response) -> {
            try {
                runChecks(request, response);
                return handler.handle(request, response);
            } catch (Exception e) {
                respondWithError(request, response, e);
                return null;
            }
        };
    }

    /**
     * The same checks as {@link #secure(RequestHandler)} for chain-style hosts.
     */
    public GatewayMiddleware createMiddleware() {
        return (request, response, next) -> {
            try {
                runChecks(request, response);
            } catch (Exception e) {
                respondWithError(request, response, e);
                return;
            }
            next.proceed();
        };
    }

    /**
     * Validate request input. Does nothing by default; deployments override it
     * and throw {@link SecurityError} to reject a request.
     */
    protected void validateInput(GatewayRequest request) {
    }

    void runChecks(GatewayRequest request, GatewayResponse response) {
        if (properties.isRequireHttps() && !request.isSecure()) {
            throw SecurityError.validation("HTTPS is required");
        }

        applySecurityHeaders(response);

        String fingerprint = fingerprint(request);
        if (!rateLimiter.tryAcquire(fingerprint)) {
            long retryAfter = rateLimiter.timeUntilReset(fingerprint);
            response.setHeader("Retry-After", String.valueOf((retryAfter + 999) / 1000));
            throw SecurityError.validation("Rate limit exceeded", 429, Map.of("retryAfter", retryAfter));
        }

        if (properties.isCsrfProtection() && !csrfValidator.validate(request)) {
            throw SecurityError.validation("Invalid CSRF token", 403, Map.of());
        }

        if (properties.isInputValidation()) {
            validateInput(request);
        }
    }

    private void applySecurityHeaders(GatewayResponse response) {
        SECURITY_HEADERS.forEach(response::setHeader);
    }

    private String fingerprint(GatewayRequest request) {
        return ClientFingerprint.of(
                request.getHeader("X-Forwarded-For"),
                request.getRemoteAddress(),
                request.getHeader("User-Agent"),
                properties.isTrustForwardedHeaders());
    }

    private void respondWithError(GatewayRequest request, GatewayResponse response, Exception error) {
        ErrorResponse errorResponse = ErrorResponse.from(error, properties.isStrict());

        if (error instanceof SecurityError) {
            log.warn("[Bulwark] Rejected {} {}: {} ({})", request.getMethod(), request.getPath(),
                    errorResponse.getMessage(), errorResponse.getStatus());
        } else {
            log.error("[Bulwark] Request error on {} {}", request.getMethod(), request.getPath(), error);
        }

        try {
            response.sendError(errorResponse);
        } catch (IOException e) {
            log.error("[Bulwark] Could not write error response: {}", e.getMessage());
        }
    }

    public RateLimiter getRateLimiter() {
        return rateLimiter;
    }

    public BulwarkProperties.Gateway getProperties() {
        return properties;
    }
}
