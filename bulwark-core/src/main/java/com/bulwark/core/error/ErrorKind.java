package com.bulwark.core.error;

/**
 * Classification of errors raised by the gateway and the review engine.
 * Each kind carries the status and code used when none is given explicitly.
 */
public enum ErrorKind {

    /** Request failed a gateway check: transport, rate limit, CSRF, input. */
    VALIDATION(400, "ERR_VALIDATION"),

    /** Request breached a security policy. */
    SECURITY_VIOLATION(403, "ERR_SECURITY_VIOLATION"),

    /** The gateway or engine is misconfigured. */
    SECURITY_CONFIG(500, "ERR_SECURITY_CONFIG");

    private final int defaultStatus;
    private final String defaultCode;

    ErrorKind(int defaultStatus, String defaultCode) {
        this.defaultStatus = defaultStatus;
        this.defaultCode = defaultCode;
    }

    public int getDefaultStatus() {
        return defaultStatus;
    }

    public String getDefaultCode() {
        return defaultCode;
    }
}
