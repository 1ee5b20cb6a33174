package com.bulwark.core.plugin;

import com.bulwark.core.model.SecurityFinding;
import com.bulwark.core.model.SecurityVulnerability;

import java.util.List;

/**
 * What a single validator reported.
 */
public class ValidationResult {

    private static final ValidationResult EMPTY = new ValidationResult(List.of(), List.of());

    private final List<SecurityFinding> findings;
    private final List<SecurityVulnerability> vulnerabilities;

    public ValidationResult(List<SecurityFinding> findings, List<SecurityVulnerability> vulnerabilities) {
        this.findings = findings != null ? List.copyOf(findings) : List.of();
        this.vulnerabilities = vulnerabilities != null ? List.copyOf(vulnerabilities) : List.of();
    }

    public static ValidationResult empty() {
        return EMPTY;
    }

    public static ValidationResult ofFindings(List<SecurityFinding> findings) {
        return new ValidationResult(findings, List.of());
    }

    public List<SecurityFinding> getFindings() {
        return findings;
    }

    public List<SecurityVulnerability> getVulnerabilities() {
        return vulnerabilities;
    }

    public boolean isEmpty() {
        return findings.isEmpty() && vulnerabilities.isEmpty();
    }
}
