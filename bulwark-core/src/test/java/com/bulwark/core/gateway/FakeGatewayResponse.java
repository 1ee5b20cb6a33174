package com.bulwark.core.gateway;

import com.bulwark.core.error.ErrorResponse;

import java.util.LinkedHashMap;
import java.util.Map;

/** Records headers and the error sent, for gateway tests. */
public class FakeGatewayResponse implements GatewayResponse {

    private final Map<String, String> headers = new LinkedHashMap<>();
    private ErrorResponse error;

    @Override
    public void setHeader(String name, String value) {
        headers.put(name, value);
    }

    @Override
    public void sendError(ErrorResponse error) {
        this.error = error;
    }

    public Map<String, String> getHeaders() {
        return headers;
    }

    public ErrorResponse getError() {
        return error;
    }

    public int getStatus() {
        return error != null ? error.getStatus() : 200;
    }
}
