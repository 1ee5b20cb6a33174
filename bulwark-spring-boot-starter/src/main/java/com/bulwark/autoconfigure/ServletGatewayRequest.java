package com.bulwark.autoconfigure;

import com.bulwark.core.gateway.GatewayRequest;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpSession;
import org.springframework.http.MediaType;
import org.springframework.util.MultiValueMap;
import org.springframework.web.util.UriComponentsBuilder;
import org.springframework.web.util.UriUtils;

import java.nio.charset.StandardCharsets;

/**
 * {@link GatewayRequest} over a servlet request.
 *
 * <p>
 * Body parameters are read from form-encoded bodies only; JSON bodies are not parsed here.
 * The session is never created by a lookup.
 * </p>
 */
class ServletGatewayRequest implements GatewayRequest {

    private final HttpServletRequest request;
    private final boolean trustForwardedHeaders;
    private MultiValueMap<String, String> queryParameters;

    ServletGatewayRequest(HttpServletRequest request, boolean trustForwardedHeaders) {
        this.request = request;
        this.trustForwardedHeaders = trustForwardedHeaders;
    }

    @Override
    public String getMethod() {
        return request.getMethod();
    }

    @Override
    public String getPath() {
        return request.getRequestURI();
    }

    @Override
    public boolean isSecure() {
        if (request.isSecure()) {
            return true;
        }
        return trustForwardedHeaders && "https".equalsIgnoreCase(request.getHeader("X-Forwarded-Proto"));
    }

    @Override
    public String getHeader(String name) {
        return request.getHeader(name);
    }

    @Override
    public String getBodyParameter(String name) {
        String contentType = request.getContentType();
        if (contentType == null) {
            return null;
        }
        try {
            if (!MediaType.APPLICATION_FORM_URLENCODED.includes(MediaType.parseMediaType(contentType))) {
                return null;
            }
        } catch (IllegalArgumentException e) {
            return null;
        }
        String[] values = request.getParameterValues(name);
        if (values == null) {
            return null;
        }
        // servlet parameters merge query and body; skip the ones that came from the query string
        String fromQuery = getQueryParameter(name);
        for (String value : values) {
            if (fromQuery == null || !fromQuery.equals(value)) {
                return value;
            }
        }
        return null;
    }

    /**
     * Decoded the way the container decodes request parameters, so {@code +} reads as a space.
     */
    @Override
    public String getQueryParameter(String name) {
        if (queryParameters == null) {
            String query = request.getQueryString();
            queryParameters = UriComponentsBuilder.newInstance()
                    .query(query != null ? query : "")
                    .build()
                    .getQueryParams();
        }
        String value = queryParameters.getFirst(name);
        return value != null ? UriUtils.decode(value.replace("+", "%20"), StandardCharsets.UTF_8) : null;
    }

    @Override
    public String getRemoteAddress() {
        return request.getRemoteAddr();
    }

    @Override
    public String getSessionAttribute(String name) {
        HttpSession session = request.getSession(false);
        if (session == null) {
            return null;
        }
        Object value = session.getAttribute(name);
        return value != null ? value.toString() : null;
    }
}
