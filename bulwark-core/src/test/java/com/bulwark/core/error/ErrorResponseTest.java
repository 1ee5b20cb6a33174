package com.bulwark.core.error;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ErrorResponseTest {

    @Test
    void kindsMapToDefaultStatusAndCode() {
        ErrorResponse validation = ErrorResponse.from(SecurityError.validation("bad input"), true);
        assertEquals(400, validation.getStatus());
        assertEquals("ERR_VALIDATION", validation.getCode());
        assertEquals("api", validation.getComponent());
        assertEquals("bad input", validation.getMessage());

        ErrorResponse violation = ErrorResponse.from(SecurityError.violation("nope"), true);
        assertEquals(403, violation.getStatus());
        assertEquals("ERR_SECURITY_VIOLATION", violation.getCode());

        ErrorResponse config = ErrorResponse.from(SecurityError.config("misconfigured"), true);
        assertEquals(500, config.getStatus());
        assertEquals("ERR_SECURITY_CONFIG", config.getCode());
        assertEquals("security", config.getComponent());
    }

    @Test
    void explicitStatusOverridesDefault() {
        SecurityError error = SecurityError.validation("Rate limit exceeded", 429, Map.of("retryAfter", 1500L));
        ErrorResponse response = ErrorResponse.from(error, true);

        assertEquals(429, response.getStatus());
        assertEquals("ERR_VALIDATION", response.getCode());
        assertEquals(1500L, response.getRetryAfter());
    }

    @Test
    void unclassifiedErrorsAreMaskedWhenStrict() {
        ErrorResponse strict = ErrorResponse.from(new RuntimeException("secret detail"), true);
        assertEquals(500, strict.getStatus());
        assertEquals(ErrorResponse.UNKNOWN_CODE, strict.getCode());
        assertEquals(ErrorResponse.GENERIC_MESSAGE, strict.getMessage());
        assertNull(strict.getComponent());

        ErrorResponse lenient = ErrorResponse.from(new RuntimeException("secret detail"), false);
        assertEquals("secret detail", lenient.getMessage());

        assertEquals(ErrorResponse.GENERIC_MESSAGE, ErrorResponse.from(new RuntimeException(), false).getMessage());
    }

    @Test
    void bodyIsWrappedInErrorEnvelopeWithoutNulls() throws Exception {
        ObjectMapper mapper = new ObjectMapper();
        JsonNode body = mapper.readTree(mapper.writeValueAsString(
                ErrorResponse.from(SecurityError.violation("Invalid CSRF token"), true).toBody()));

        JsonNode error = body.get("error");
        assertEquals("Invalid CSRF token", error.get("message").asText());
        assertEquals(403, error.get("status").asInt());
        assertEquals("ERR_SECURITY_VIOLATION", error.get("code").asText());
        assertFalse(error.has("retryAfter"));
        assertFalse(error.has("stackTrace"));
    }

    @Test
    void metadataIsCopied() {
        SecurityError error = SecurityError.violation("x", Map.of("rule", "r1"));
        assertEquals("r1", error.getMetadata().get("rule"));
        assertThrows(UnsupportedOperationException.class, () -> error.getMetadata().put("a", "b"));
        assertNotNull(error.getTimestamp());
    }
}
