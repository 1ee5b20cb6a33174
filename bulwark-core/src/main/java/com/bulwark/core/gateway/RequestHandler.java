package com.bulwark.core.gateway;

/**
 * Application code the gateway wraps.
 *
 * @param <T> Whatever the handler produces for the host framework
 */
@FunctionalInterface
public interface RequestHandler<T> {

    T handle(GatewayRequest request, GatewayResponse response) throws Exception;
}
