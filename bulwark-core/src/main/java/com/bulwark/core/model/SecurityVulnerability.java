package com.bulwark.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * A security issue ranked by severity, usually with a remediation hint.
 * A null severity means the validator reported a level Bulwark does not know.
 */
@JsonPropertyOrder({ "id", "validator", "type", "title", "description", "severity", "location",
        "recommendation", "timestamp" })
public class SecurityVulnerability extends SecurityIssue {

    private final Severity severity;
    private final String recommendation;

    private SecurityVulnerability(Builder builder) {
        super(builder, "vuln", "Unknown Vulnerability");
        this.severity = builder.severitySet ? builder.severity : Severity.MEDIUM;
        this.recommendation = builder.recommendation;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Severity getSeverity() {
        return severity;
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public String getRecommendation() {
        return recommendation;
    }

    @JsonIgnore
    public boolean isCriticalOrHigh() {
        return severity == Severity.CRITICAL || severity == Severity.HIGH;
    }

    @Override
    public String toString() {
        return "SecurityVulnerability{" +
                "id='" + getId() + '\'' +
                ", validator='" + getValidator() + '\'' +
                ", severity=" + severity +
                ", title='" + getTitle() + '\'' +
                ", location='" + getLocation() + '\'' +
                '}';
    }

    public static class Builder extends AbstractBuilder<Builder> {
        private Severity severity;
        private boolean severitySet;
        private String recommendation;

        public Builder severity(Severity severity) {
            this.severity = severity;
            this.severitySet = true;
            return this;
        }

        /** Unrecognized values leave the severity unknown (null). */
        public Builder severity(String severity) {
            return severity(Severity.fromValue(severity));
        }

        public Builder recommendation(String recommendation) {
            this.recommendation = recommendation;
            return this;
        }

        public SecurityVulnerability build() {
            return new SecurityVulnerability(this);
        }
    }
}
