package com.bulwark.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.time.Instant;
import java.util.List;

/**
 * Result of one review run. Immutable; {@link #withReportPath(String)} returns a copy.
 */
@JsonPropertyOrder({ "id", "timestamp", "framework", "summary", "findings", "vulnerabilities",
        "recommendations", "reportPath" })
public class SecurityReport {

    private final String id;
    private final Instant timestamp;
    private final Framework framework;
    private final SecurityReportSummary summary;
    private final List<SecurityFinding> findings;
    private final List<SecurityVulnerability> vulnerabilities;
    private final List<SecurityRecommendation> recommendations;
    private final String reportPath;

    public SecurityReport(String id, Instant timestamp, Framework framework, SecurityReportSummary summary,
            List<SecurityFinding> findings, List<SecurityVulnerability> vulnerabilities,
            List<SecurityRecommendation> recommendations, String reportPath) {
        this.id = id;
        this.timestamp = timestamp;
        this.framework = framework;
        this.summary = summary;
        this.findings = List.copyOf(findings);
        this.vulnerabilities = List.copyOf(vulnerabilities);
        this.recommendations = List.copyOf(recommendations);
        this.reportPath = reportPath;
    }

    public SecurityReport withReportPath(String reportPath) {
        return new SecurityReport(id, timestamp, framework, summary, findings, vulnerabilities,
                recommendations, reportPath);
    }

    public String getId() {
        return id;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public Framework getFramework() {
        return framework;
    }

    public SecurityReportSummary getSummary() {
        return summary;
    }

    public List<SecurityFinding> getFindings() {
        return findings;
    }

    public List<SecurityVulnerability> getVulnerabilities() {
        return vulnerabilities;
    }

    public List<SecurityRecommendation> getRecommendations() {
        return recommendations;
    }

    /** Where the report was persisted; null if it was not. */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public String getReportPath() {
        return reportPath;
    }

    @Override
    public String toString() {
        return "SecurityReport{id='" + id + "', summary=" + summary + '}';
    }

    public static class Framework {
        private final String name;
        private final String version;

        public Framework(String name, String version) {
            this.name = name;
            this.version = version;
        }

        public String getName() {
            return name;
        }

        public String getVersion() {
            return version;
        }
    }
}
