package com.bulwark.core.review;

import com.bulwark.core.model.SecurityFinding;
import com.bulwark.core.model.SecurityRecommendation;
import com.bulwark.core.model.SecurityVulnerability;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Derives recommendations from a review run: one per finding type, then one per
 * critical or high vulnerability.
 */
public final class RecommendationGenerator {

    private RecommendationGenerator() {
    }

    public static List<SecurityRecommendation> generate(List<SecurityFinding> findings,
            List<SecurityVulnerability> vulnerabilities) {
        List<SecurityRecommendation> recommendations = new ArrayList<>();

        // group by type, keeping the order in which types first appear
        Map<String, Integer> countsByType = new LinkedHashMap<>();
        for (SecurityFinding finding : findings) {
            countsByType.merge(finding.getType(), 1, Integer::sum);
        }

        countsByType.forEach((type, count) -> recommendations.add(
                SecurityRecommendation.forFindingType(type, count, titleFor(type), descriptionFor(type, count))));

        for (SecurityVulnerability vulnerability : vulnerabilities) {
            if (!vulnerability.isCriticalOrHigh()) {
                continue;
            }
            String severity = vulnerability.getSeverity().value();
            String description = vulnerability.getRecommendation() != null
                    ? vulnerability.getRecommendation()
                    : "Address the " + severity + " severity issue in " + vulnerability.getLocation();
            recommendations.add(SecurityRecommendation.forVulnerability(
                    vulnerability.getSeverity(),
                    "Fix " + severity + " severity issue: " + vulnerability.getTitle(),
                    description));
        }

        return recommendations;
    }

    static String titleFor(String type) {
        switch (type) {
            case "api-key":
                return "Secure API Keys";
            case "dependency":
                return "Update Vulnerable Dependencies";
            case "config":
                return "Fix Configuration Issues";
            case "permission":
                return "Secure File Permissions";
            case "communication":
                return "Implement Secure Communication";
            case "validation":
                return "Improve Input Validation";
            case "authentication":
                return "Strengthen Authentication";
            case "logging":
                return "Enhance Audit Logging";
            default:
                return "Address " + type + " Issues";
        }
    }

    static String descriptionFor(String type, int count) {
        switch (type) {
            case "api-key":
                return "Secure " + count + " potential API key exposures by using environment variables or secure storage solutions.";
            case "dependency":
                return "Update " + count + " dependencies with known vulnerabilities to their latest secure versions.";
            case "config":
                return "Fix " + count + " configuration issues to enhance security compliance.";
            case "permission":
                return "Address " + count + " file permission issues to prevent unauthorized access.";
            case "communication":
                return "Implement secure communication protocols for " + count + " identified communication channels.";
            case "validation":
                return "Improve input validation for " + count + " potential entry points.";
            case "authentication":
                return "Strengthen authentication mechanisms for " + count + " identified weaknesses.";
            case "logging":
                return "Enhance audit logging for " + count + " sensitive operations.";
            default:
                return "Address " + count + " " + type + " issues to improve security.";
        }
    }
}
