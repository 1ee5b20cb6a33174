package com.bulwark.cli;

import com.bulwark.core.model.SecurityFinding;
import com.bulwark.core.model.SecurityRecommendation;
import com.bulwark.core.model.SecurityReport;
import com.bulwark.core.model.SecurityReportSummary;
import com.bulwark.core.model.SecurityVulnerability;
import com.bulwark.core.model.Severity;
import com.bulwark.core.review.RecommendationPrioritizer;
import picocli.CommandLine.Help.Ansi;

import java.io.PrintWriter;
import java.util.List;

/**
 * Console rendering of a {@link SecurityReport}. Colors use picocli markup and
 * disappear when the terminal does not support them.
 */
class ReportPrinter {

    static final int TOP_RECOMMENDATIONS = 3;

    private static final String THIN_RULE = "─".repeat(50);
    private static final String THICK_RULE = "═".repeat(70);

    private final PrintWriter out;
    private final Ansi ansi;

    ReportPrinter(PrintWriter out, Ansi ansi) {
        this.out = out;
        this.ansi = ansi;
    }

    void printBanner() {
        out.println();
        out.println(color("bold", "=== Bulwark Security Check ==="));
        out.println();
    }

    void printSummary(SecurityReport report) {
        SecurityReportSummary summary = report.getSummary();

        out.println();
        out.println(color("bold", "Security Review Summary:"));
        out.println(THIN_RULE);

        out.println("Security Score: " + color(scoreColor(summary.getSecurityScore()), summary.getSecurityScore() + "/100"));
        out.println("Validators: " + color("green", summary.getPassedValidators() + " passed") + ", "
                + color("red", (summary.getTotalValidators() - summary.getPassedValidators()) + " failed")
                + " (" + summary.getTotalValidators() + " total)");
        out.println("Vulnerabilities: " + (summary.getVulnerabilitiesCount() > 0
                ? color("red", summary.getVulnerabilitiesCount() + " found")
                : color("green", "None found")));
        out.println("Findings: " + (summary.getFindingsCount() > 0
                ? color("yellow", summary.getFindingsCount() + " found")
                : color("green", "None found")));

        out.println();
        out.println("Detailed report saved to: "
                + color("cyan", report.getReportPath() != null ? report.getReportPath() : "(not saved)"));

        List<SecurityRecommendation> recommendations = report.getRecommendations();
        if (!recommendations.isEmpty()) {
            out.println();
            out.println(color("bold", "Top Recommendations:"));
            List<SecurityRecommendation> top = RecommendationPrioritizer.top(recommendations, TOP_RECOMMENDATIONS);
            for (int i = 0; i < top.size(); i++) {
                SecurityRecommendation recommendation = top.get(i);
                out.println((i + 1) + ". " + color(isUrgent(recommendation) ? "red" : "yellow", recommendation.getTitle()));
            }
            if (recommendations.size() > TOP_RECOMMENDATIONS) {
                out.println("... and " + (recommendations.size() - TOP_RECOMMENDATIONS) + " more recommendations");
            }
        }
        out.println();
    }

    void printDetails(SecurityReport report) {
        out.println();
        out.println(color("bold", "Detailed Security Review Results:"));
        out.println(THICK_RULE);

        if (!report.getVulnerabilities().isEmpty()) {
            out.println();
            out.println(color("bold,red", "Vulnerabilities:"));
            out.println(THIN_RULE);
            for (SecurityVulnerability vulnerability : report.getVulnerabilities()) {
                Severity severity = vulnerability.getSeverity();
                String label = severity != null ? severity.name() : "UNKNOWN";
                out.println(color(severityColor(severity), label) + " - " + color("bold", vulnerability.getTitle()));
                out.println("Description: " + vulnerability.getDescription());
                out.println("Location: " + color("cyan", vulnerability.getLocation()));
                if (vulnerability.getRecommendation() != null) {
                    out.println("Recommendation: " + vulnerability.getRecommendation());
                }
                out.println(THIN_RULE);
            }
        }

        if (!report.getFindings().isEmpty()) {
            out.println();
            out.println(color("bold,yellow", "Findings:"));
            out.println(THIN_RULE);
            for (SecurityFinding finding : report.getFindings()) {
                out.println(color("yellow", "FINDING") + " - " + color("bold", finding.getTitle()));
                out.println("Description: " + finding.getDescription());
                out.println("Location: " + color("cyan", finding.getLocation()));
                out.println("Validator: " + finding.getValidator());
                out.println(THIN_RULE);
            }
        }

        if (!report.getRecommendations().isEmpty()) {
            out.println();
            out.println(color("bold", "Recommendations:"));
            out.println(THIN_RULE);
            for (SecurityRecommendation recommendation : report.getRecommendations()) {
                out.println(color(isUrgent(recommendation) ? "red" : "yellow", recommendation.getTitle()));
                out.println(recommendation.getDescription());
                out.println(THIN_RULE);
            }
        }
        out.println();
    }

    private String color(String style, String text) {
        return ansi.string("@|" + style + " " + text + "|@");
    }

    private static boolean isUrgent(SecurityRecommendation recommendation) {
        return recommendation.isVulnerability()
                && (recommendation.getSeverity() == Severity.CRITICAL || recommendation.getSeverity() == Severity.HIGH);
    }

    private static String scoreColor(int score) {
        if (score >= 90) {
            return "green";
        }
        return score >= 70 ? "yellow" : "red";
    }

    private static String severityColor(Severity severity) {
        if (severity == null) {
            return "white";
        }
        switch (severity) {
            case CRITICAL:
                return "bg_red,white";
            case HIGH:
                return "red";
            case MEDIUM:
                return "yellow";
            default:
                return "blue";
        }
    }
}
