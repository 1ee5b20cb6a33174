package com.bulwark.core.error;

import java.time.Instant;
import java.util.Map;

/**
 * The single error type raised by Bulwark components.
 * The {@link ErrorKind} tag decides how it is reported to clients.
 */
public class SecurityError extends RuntimeException {

    private final ErrorKind kind;
    private final String code;
    private final int status;
    private final Map<String, Object> metadata;
    private final Instant timestamp;

    public SecurityError(ErrorKind kind, String message, String code, int status,
            Map<String, Object> metadata, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.code = code != null ? code : kind.getDefaultCode();
        this.status = status > 0 ? status : kind.getDefaultStatus();
        this.metadata = metadata != null ? Map.copyOf(metadata) : Map.of();
        this.timestamp = Instant.now();
    }

    // --- Factory methods ---

    public static SecurityError validation(String message) {
        return new SecurityError(ErrorKind.VALIDATION, message, null, 0, null, null);
    }

    public static SecurityError validation(String message, int status, Map<String, Object> metadata) {
        return new SecurityError(ErrorKind.VALIDATION, message, null, status, metadata, null);
    }

    public static SecurityError violation(String message) {
        return new SecurityError(ErrorKind.SECURITY_VIOLATION, message, null, 0, null, null);
    }

    public static SecurityError violation(String message, Map<String, Object> metadata) {
        return new SecurityError(ErrorKind.SECURITY_VIOLATION, message, null, 0, metadata, null);
    }

    public static SecurityError config(String message) {
        return new SecurityError(ErrorKind.SECURITY_CONFIG, message, null, 0, null, null);
    }

    public static SecurityError config(String message, Throwable cause) {
        return new SecurityError(ErrorKind.SECURITY_CONFIG, message, null, 0, null, cause);
    }

    public ErrorKind getKind() {
        return kind;
    }

    public String getCode() {
        return code;
    }

    public int getStatus() {
        return status;
    }

    public Map<String, Object> getMetadata() {
        return metadata;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    @Override
    public String toString() {
        return "SecurityError{" +
                "kind=" + kind +
                ", code='" + code + '\'' +
                ", status=" + status +
                ", message='" + getMessage() + '\'' +
                '}';
    }
}
