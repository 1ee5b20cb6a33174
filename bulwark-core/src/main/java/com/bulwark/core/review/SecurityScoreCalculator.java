package com.bulwark.core.review;

import com.bulwark.core.model.SecurityFinding;
import com.bulwark.core.model.SecurityIssue;
import com.bulwark.core.model.SecurityVulnerability;
import com.bulwark.core.model.Severity;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Turns the output of a review run into the 0-100 security score and the passed-validator count.
 */
public final class SecurityScoreCalculator {

    public static final int MAX_SCORE = 100;
    public static final double FINDING_PENALTY = 0.5;

    private SecurityScoreCalculator() {
    }

    /**
     * 100 minus the severity penalty of every vulnerability minus half a point per finding,
     * rounded half up and clamped to [0, 100].
     */
    public static int score(List<SecurityFinding> findings, List<SecurityVulnerability> vulnerabilities) {
        double score = MAX_SCORE;
        for (SecurityVulnerability vulnerability : vulnerabilities) {
            score -= penaltyFor(vulnerability.getSeverity());
        }
        score -= findings.size() * FINDING_PENALTY;

        long rounded = Math.round(score);
        return (int) Math.max(0, Math.min(MAX_SCORE, rounded));
    }

    public static int penaltyFor(Severity severity) {
        return severity != null ? severity.getPenalty() : Severity.UNKNOWN_PENALTY;
    }

    /**
     * Validators that reported nothing: the total minus the distinct validator names seen in the output.
     */
    public static int passedValidators(int totalValidators, List<SecurityFinding> findings,
            List<SecurityVulnerability> vulnerabilities) {
        Set<String> reporting = new HashSet<>();
        for (SecurityIssue finding : findings) {
            reporting.add(finding.getValidator());
        }
        for (SecurityIssue vulnerability : vulnerabilities) {
            reporting.add(vulnerability.getValidator());
        }
        return Math.max(0, totalValidators - reporting.size());
    }
}
