package com.bulwark.core.gateway;

/**
 * Continuation of a chain-style host pipeline ("call next on success").
 */
@FunctionalInterface
public interface MiddlewareChain {

    void proceed() throws Exception;
}
