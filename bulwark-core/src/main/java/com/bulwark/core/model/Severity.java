package com.bulwark.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Severity of a vulnerability and the score penalty it carries.
 */
public enum Severity {

    CRITICAL(20),
    HIGH(10),
    MEDIUM(5),
    LOW(2);

    /** Penalty for a vulnerability whose severity is not recognized. */
    public static final int UNKNOWN_PENALTY = 1;

    private final int penalty;

    Severity(int penalty) {
        this.penalty = penalty;
    }

    public int getPenalty() {
        return penalty;
    }

    /** Sort rank, critical first. */
    public int rank() {
        return ordinal();
    }

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Case-insensitive parse.
     *
     * @return the severity, or null when the value is not one of the four levels
     */
    public static Severity fromValue(String value) {
        if (value == null) {
            return null;
        }
        for (Severity severity : values()) {
            if (severity.name().equalsIgnoreCase(value.trim())) {
                return severity;
            }
        }
        return null;
    }
}
