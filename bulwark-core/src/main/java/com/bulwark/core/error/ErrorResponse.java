package com.bulwark.core.error;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Map;

/**
 * The error payload written to clients: {@code { "error": { message, code, status, component } }}.
 * Rate-limit rejections also carry {@code retryAfter} in milliseconds. Never contains stack traces.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ErrorResponse {

    static final String GENERIC_MESSAGE = "An unexpected error occurred";
    static final String UNKNOWN_CODE = "ERR_UNKNOWN";

    private final String message;
    private final String code;
    private final int status;
    private final String component;
    private final Long retryAfter;

    public ErrorResponse(String message, String code, int status, String component) {
        this(message, code, status, component, null);
    }

    public ErrorResponse(String message, String code, int status, String component, Long retryAfter) {
        this.message = message;
        this.code = code;
        this.status = status;
        this.component = component;
        this.retryAfter = retryAfter;
    }

    /**
     * Classify any throwable into a response.
     *
     * @param error  What went wrong
     * @param strict When true, messages of unclassified errors are replaced with a generic one
     */
    public static ErrorResponse from(Throwable error, boolean strict) {
        if (error instanceof SecurityError securityError) {
            String component = switch (securityError.getKind()) {
                case VALIDATION, SECURITY_VIOLATION -> "api";
                case SECURITY_CONFIG -> "security";
            };
            Object retryAfter = securityError.getMetadata().get("retryAfter");
            return new ErrorResponse(securityError.getMessage(), securityError.getCode(),
                    securityError.getStatus(), component,
                    retryAfter instanceof Number n ? n.longValue() : null);
        }

        String message = GENERIC_MESSAGE;
        if (!strict && error != null && error.getMessage() != null) {
            message = error.getMessage();
        }
        return new ErrorResponse(message, UNKNOWN_CODE, 500, null);
    }

    public String getMessage() {
        return message;
    }

    public String getCode() {
        return code;
    }

    public int getStatus() {
        return status;
    }

    public String getComponent() {
        return component;
    }

    public Long getRetryAfter() {
        return retryAfter;
    }

    /** Wraps this payload in the top-level {@code error} envelope. */
    @JsonIgnore
    public Map<String, ErrorResponse> toBody() {
        return Map.of("error", this);
    }

    @Override
    public String toString() {
        return "ErrorResponse{status=" + status + ", code='" + code + "', message='" + message + "'}";
    }
}
