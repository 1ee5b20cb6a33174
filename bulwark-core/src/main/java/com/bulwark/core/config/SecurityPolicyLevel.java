package com.bulwark.core.config;

/**
 * How much the gateway reveals to clients when a request fails.
 */
public enum SecurityPolicyLevel {

    /** Unclassified errors are reported with a generic message only. */
    STRICT,

    /** Unclassified error messages are passed through to the client. */
    MODERATE,

    /** Same error reporting as MODERATE; intended for local development. */
    OPEN
}
