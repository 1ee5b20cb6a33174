package com.bulwark.core.gateway;

/**
 * Framework-neutral view of an inbound request.
 * Host integrations (servlet, reactive, test doubles) adapt their own request type to this.
 */
public interface GatewayRequest {

    /** HTTP method, e.g. {@code GET}. */
    String getMethod();

    String getPath();

    /** Whether the request arrived over TLS. */
    boolean isSecure();

    /** Header value, case-insensitive name; null when absent. */
    String getHeader(String name);

    /** Field of a form or JSON body; null when absent or when the body is not parsed. */
    String getBodyParameter(String name);

    /** Query string parameter; null when absent. */
    String getQueryParameter(String name);

    /** Address of the socket peer. */
    String getRemoteAddress();

    /**
     * Attribute of the caller's session, as supplied by the host's session store.
     * Null when there is no session or no such attribute.
     */
    String getSessionAttribute(String name);
}
