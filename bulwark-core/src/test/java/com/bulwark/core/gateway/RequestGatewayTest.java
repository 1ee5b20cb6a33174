package com.bulwark.core.gateway;

import com.bulwark.core.config.BulwarkProperties;
import com.bulwark.core.config.SecurityPolicyLevel;
import com.bulwark.core.error.SecurityError;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RequestGatewayTest {

    private BulwarkProperties.Gateway properties;

    @BeforeEach
    void setUp() {
        properties = new BulwarkProperties.Gateway();
    }

    @Test
    void getOverHttpsReachesHandlerWithSecurityHeaders() throws Exception {
        RequestGateway gateway = new RequestGateway(properties);
        FakeGatewayResponse response = new FakeGatewayResponse();

        String result = gateway.secure((req, res) -> "ok").handle(FakeGatewayRequest.get("/data"), response);

        assertEquals("ok", result);
        assertNull(response.getError());
        assertEquals(RequestGateway.SECURITY_HEADERS, response.getHeaders());
        assertEquals("DENY", response.getHeaders().get("X-Frame-Options"));
    }

    @Test
    void plainHttpIsRejectedWhenHttpsRequired() throws Exception {
        RequestGateway gateway = new RequestGateway(properties);
        FakeGatewayResponse response = new FakeGatewayResponse();

        Object result = gateway.secure((req, res) -> "ok").handle(FakeGatewayRequest.get("/data").insecure(), response);

        assertNull(result);
        assertEquals(400, response.getStatus());
        assertEquals("HTTPS is required", response.getError().getMessage());
        assertEquals("ERR_VALIDATION", response.getError().getCode());
    }

    @Test
    void plainHttpAllowedWhenHttpsNotRequired() throws Exception {
        properties.setRequireHttps(false);
        RequestGateway gateway = new RequestGateway(properties);
        FakeGatewayResponse response = new FakeGatewayResponse();

        assertEquals("ok", gateway.secure((req, res) -> "ok").handle(FakeGatewayRequest.get("/").insecure(), response));
    }

    @Test
    void secondRequestOverLimitGets429WithRetryAfter() throws Exception {
        properties.setRateLimitRequests(1);
        RequestGateway gateway = new RequestGateway(properties);
        RequestHandler<String> handler = gateway.secure((req, res) -> "ok");

        FakeGatewayResponse first = new FakeGatewayResponse();
        assertEquals("ok", handler.handle(FakeGatewayRequest.get("/a"), first));

        FakeGatewayResponse second = new FakeGatewayResponse();
        assertNull(handler.handle(FakeGatewayRequest.get("/a"), second));
        assertEquals(429, second.getStatus());
        assertEquals("Rate limit exceeded", second.getError().getMessage());
        assertNotNull(second.getError().getRetryAfter());
        assertTrue(second.getError().getRetryAfter() > 0);
        assertNotNull(second.getHeaders().get("Retry-After"));
        // headers are applied before the rate limit stage
        assertEquals("nosniff", second.getHeaders().get("X-Content-Type-Options"));
    }

    @Test
    void differentClientsHaveSeparateBudgets() throws Exception {
        properties.setRateLimitRequests(1);
        RequestGateway gateway = new RequestGateway(properties);
        RequestHandler<String> handler = gateway.secure((req, res) -> "ok");

        assertEquals("ok", handler.handle(FakeGatewayRequest.get("/").from("10.0.0.1"), new FakeGatewayResponse()));
        assertEquals("ok", handler.handle(FakeGatewayRequest.get("/").from("10.0.0.2"), new FakeGatewayResponse()));
    }

    @Test
    void forwardedForIgnoredUnlessTrusted() throws Exception {
        properties.setRateLimitRequests(1);
        RequestGateway gateway = new RequestGateway(properties);
        RequestHandler<String> handler = gateway.secure((req, res) -> "ok");

        handler.handle(FakeGatewayRequest.get("/").header("X-Forwarded-For", "1.1.1.1"), new FakeGatewayResponse());
        FakeGatewayResponse response = new FakeGatewayResponse();
        handler.handle(FakeGatewayRequest.get("/").header("X-Forwarded-For", "2.2.2.2"), response);

        assertEquals(429, response.getStatus());
    }

    @Test
    void rotatingForwardedForPrefixDoesNotResetTheBudget() throws Exception {
        properties.setRateLimitRequests(1);
        properties.setTrustForwardedHeaders(true);
        RequestGateway gateway = new RequestGateway(properties);
        RequestHandler<String> handler = gateway.secure((req, res) -> "ok");

        int served = 0;
        for (int i = 1; i <= 5; i++) {
            FakeGatewayRequest request = FakeGatewayRequest.get("/")
                    .header("X-Forwarded-For", "198.51.100." + i + ", 203.0.113.7");
            if ("ok".equals(handler.handle(request, new FakeGatewayResponse()))) {
                served++;
            }
        }

        assertEquals(1, served);
    }

    @Test
    void postWithMismatchedCsrfTokenIsForbidden() throws Exception {
        RequestGateway gateway = new RequestGateway(properties);
        FakeGatewayResponse response = new FakeGatewayResponse();

        FakeGatewayRequest request = FakeGatewayRequest.post("/submit")
                .header("X-CSRF-Token", "abc")
                .sessionAttribute("csrfToken", "xyz");
        assertNull(gateway.secure((req, res) -> "ok").handle(request, response));

        assertEquals(403, response.getStatus());
        assertEquals("Invalid CSRF token", response.getError().getMessage());
        assertEquals("api", response.getError().getComponent());
    }

    @Test
    void postWithMatchingCsrfTokenPasses() throws Exception {
        RequestGateway gateway = new RequestGateway(properties);

        FakeGatewayRequest request = FakeGatewayRequest.post("/submit")
                .bodyParameter("_csrf", "xyz")
                .sessionAttribute("csrfToken", "xyz");
        assertEquals("ok", gateway.secure((req, res) -> "ok").handle(request, new FakeGatewayResponse()));
    }

    @Test
    void csrfCheckSkippedWhenDisabled() throws Exception {
        properties.setCsrfProtection(false);
        RequestGateway gateway = new RequestGateway(properties);

        assertEquals("ok", gateway.secure((req, res) -> "ok")
                .handle(FakeGatewayRequest.post("/submit"), new FakeGatewayResponse()));
    }

    @Test
    void inputValidationHookCanReject() throws Exception {
        RequestGateway gateway = new RequestGateway(properties) {
            @Override
            protected void validateInput(GatewayRequest request) {
                if (request.getQueryParameter("q") != null) {
                    throw SecurityError.validation("Query not allowed");
                }
            }
        };
        FakeGatewayResponse response = new FakeGatewayResponse();

        gateway.secure((req, res) -> "ok").handle(FakeGatewayRequest.get("/").queryParameter("q", "x"), response);

        assertEquals(400, response.getStatus());
        assertEquals("Query not allowed", response.getError().getMessage());
    }

    @Test
    void handlerFailureIsMaskedUnderStrictPolicy() throws Exception {
        RequestGateway gateway = new RequestGateway(properties);
        FakeGatewayResponse response = new FakeGatewayResponse();

        Object result = gateway.secure((req, res) -> {
            throw new IllegalStateException("database password is hunter2");
        }).handle(FakeGatewayRequest.get("/"), response);

        assertNull(result);
        assertEquals(500, response.getStatus());
        assertEquals("ERR_UNKNOWN", response.getError().getCode());
        assertEquals("An unexpected error occurred", response.getError().getMessage());
    }

    @Test
    void handlerFailureMessageKeptUnderOpenPolicy() throws Exception {
        properties.setPolicyLevel(SecurityPolicyLevel.OPEN);
        RequestGateway gateway = new RequestGateway(properties);
        FakeGatewayResponse response = new FakeGatewayResponse();

        gateway.secure((req, res) -> {
            throw new IllegalStateException("boom");
        }).handle(FakeGatewayRequest.get("/"), response);

        assertEquals("boom", response.getError().getMessage());
    }

    @Test
    void middlewareCallsNextOnlyWhenChecksPass() throws Exception {
        properties.setRateLimitRequests(1);
        GatewayMiddleware middleware = new RequestGateway(properties).createMiddleware();
        List<String> calls = new ArrayList<>();

        middleware.apply(FakeGatewayRequest.get("/"), new FakeGatewayResponse(), () -> calls.add("next"));
        FakeGatewayResponse rejected = new FakeGatewayResponse();
        middleware.apply(FakeGatewayRequest.get("/"), rejected, () -> calls.add("next"));

        assertEquals(List.of("next"), calls);
        assertEquals(429, rejected.getStatus());
    }

    @Test
    void middlewareRejectsPlainHttp() throws Exception {
        GatewayMiddleware middleware = new RequestGateway(properties).createMiddleware();
        FakeGatewayResponse response = new FakeGatewayResponse();
        List<String> calls = new ArrayList<>();

        middleware.apply(FakeGatewayRequest.get("/").insecure(), response, () -> calls.add("next"));

        assertTrue(calls.isEmpty());
        assertEquals(400, response.getStatus());
    }

    @Test
    void invalidConfigurationFailsAtConstruction() {
        properties.setRateLimitRequests(0);
        SecurityError error = assertThrows(SecurityError.class, () -> new RequestGateway(properties));
        assertEquals("ERR_SECURITY_CONFIG", error.getCode());
    }
}
