package com.bulwark.autoconfigure;

import com.bulwark.core.error.ErrorResponse;
import com.bulwark.core.gateway.GatewayResponse;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.http.MediaType;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * {@link GatewayResponse} over a servlet response. Errors are written as the JSON envelope.
 */
class ServletGatewayResponse implements GatewayResponse {

    private final HttpServletResponse response;
    private final ObjectMapper objectMapper;

    ServletGatewayResponse(HttpServletResponse response, ObjectMapper objectMapper) {
        this.response = response;
        this.objectMapper = objectMapper;
    }

    @Override
    public void setHeader(String name, String value) {
        response.setHeader(name, value);
    }

    @Override
    public void sendError(ErrorResponse error) throws IOException {
        if (response.isCommitted()) {
            throw new IOException("Response already committed, cannot send " + error);
        }
        response.setStatus(error.getStatus());
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        response.setCharacterEncoding(StandardCharsets.UTF_8.name());
        response.getWriter().write(objectMapper.writeValueAsString(error.toBody()));
    }
}
