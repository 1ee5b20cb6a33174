package com.bulwark.autoconfigure;

import com.bulwark.core.config.BulwarkProperties;
import com.bulwark.core.gateway.GatewayMiddleware;
import com.bulwark.core.gateway.RequestGateway;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;

/**
 * Runs every servlet request through the {@link RequestGateway} before it reaches the application.
 * Rejected requests get the JSON error body and never reach the rest of the chain.
 */
public class BulwarkSecurityFilter extends OncePerRequestFilter {

    private static final Logger log = LoggerFactory.getLogger(BulwarkSecurityFilter.class);

    private final GatewayMiddleware middleware;
    private final BulwarkProperties properties;
    private final ObjectMapper objectMapper;

    public BulwarkSecurityFilter(RequestGateway gateway, BulwarkProperties properties, ObjectMapper objectMapper) {
        this.middleware = gateway.createMiddleware();
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        return !properties.isEnabled() || isExcludedPath(request.getRequestURI());
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response,
            FilterChain filterChain) throws ServletException, IOException {
        ServletGatewayRequest gatewayRequest = new ServletGatewayRequest(request,
                properties.getGateway().isTrustForwardedHeaders());
        ServletGatewayResponse gatewayResponse = new ServletGatewayResponse(response, objectMapper);

        try {
            middleware.apply(gatewayRequest, gatewayResponse, () -> filterChain.doFilter(request, response));
        } catch (IOException | ServletException | RuntimeException e) {
            throw e;
        } catch (Exception e) {
            log.error("[Bulwark] Unexpected error in filter chain for {}", request.getRequestURI(), e);
            throw new ServletException(e);
        }
    }

    /**
     * Exact paths, or prefixes when the pattern ends with {@code /**}.
     */
    boolean isExcludedPath(String path) {
        if (path == null) {
            return false;
        }
        for (String pattern : properties.getExcludePaths()) {
            if (pattern.endsWith("/**")) {
                String prefix = pattern.substring(0, pattern.length() - 3);
                if (path.startsWith(prefix))
                    return true;
            } else if (pattern.equals(path)) {
                return true;
            }
        }
        return false;
    }
}
