package com.bulwark.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Remediation advice derived from a review run. Only exists as part of a {@link SecurityReport}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SecurityRecommendation {

    public static final String VULNERABILITY_TYPE = "vulnerability";

    private final String type;
    private final Integer findings;
    private final Severity severity;
    private final String title;
    private final String description;

    public SecurityRecommendation(String type, Integer findings, Severity severity,
            String title, String description) {
        this.type = type;
        this.findings = findings;
        this.severity = severity;
        this.title = title;
        this.description = description;
    }

    /** One recommendation covering every finding of a type. */
    public static SecurityRecommendation forFindingType(String type, int findingsCount,
            String title, String description) {
        return new SecurityRecommendation(type, findingsCount, null, title, description);
    }

    /** One recommendation for a single critical or high vulnerability. */
    public static SecurityRecommendation forVulnerability(Severity severity, String title, String description) {
        return new SecurityRecommendation(VULNERABILITY_TYPE, null, severity, title, description);
    }

    public String getType() {
        return type;
    }

    /** Number of findings covered; null for vulnerability recommendations. */
    public Integer getFindings() {
        return findings;
    }

    public Severity getSeverity() {
        return severity;
    }

    public String getTitle() {
        return title;
    }

    public String getDescription() {
        return description;
    }

    @JsonIgnore
    public boolean isVulnerability() {
        return VULNERABILITY_TYPE.equals(type);
    }

    @Override
    public String toString() {
        return "SecurityRecommendation{type='" + type + "', title='" + title + "'}";
    }
}
