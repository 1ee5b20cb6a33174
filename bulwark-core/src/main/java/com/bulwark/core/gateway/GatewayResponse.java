package com.bulwark.core.gateway;

import com.bulwark.core.error.ErrorResponse;

import java.io.IOException;

/**
 * Framework-neutral view of the outbound response.
 */
public interface GatewayResponse {

    void setHeader(String name, String value);

    /**
     * Set the status to {@link ErrorResponse#getStatus()} and write the error envelope as JSON.
     */
    void sendError(ErrorResponse error) throws IOException;
}
