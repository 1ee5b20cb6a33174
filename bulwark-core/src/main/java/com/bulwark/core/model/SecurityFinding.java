package com.bulwark.core.model;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * A security observation that does not carry a severity.
 */
@JsonPropertyOrder({ "id", "validator", "type", "title", "description", "location", "timestamp" })
public class SecurityFinding extends SecurityIssue {

    private SecurityFinding(Builder builder) {
        super(builder, "finding", "Unknown Finding");
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String toString() {
        return "SecurityFinding{" +
                "id='" + getId() + '\'' +
                ", validator='" + getValidator() + '\'' +
                ", type='" + getType() + '\'' +
                ", title='" + getTitle() + '\'' +
                ", location='" + getLocation() + '\'' +
                '}';
    }

    public static class Builder extends AbstractBuilder<Builder> {

        public SecurityFinding build() {
            return new SecurityFinding(this);
        }
    }
}
