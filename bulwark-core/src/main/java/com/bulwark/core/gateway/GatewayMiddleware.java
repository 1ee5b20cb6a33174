package com.bulwark.core.gateway;

/**
 * Gateway checks packaged as a chain-style middleware.
 * On success {@code next} is called; on failure the error response is written and {@code next} is not called.
 * Exceptions thrown by {@code next} propagate unchanged.
 */
@FunctionalInterface
public interface GatewayMiddleware {

    void apply(GatewayRequest request, GatewayResponse response, MiddlewareChain next) throws Exception;
}
