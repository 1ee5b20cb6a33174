package com.bulwark.core.model;

/**
 * Headline numbers of a review run.
 */
public class SecurityReportSummary {

    private final int securityScore;
    private final int findingsCount;
    private final int vulnerabilitiesCount;
    private final int passedValidators;
    private final int totalValidators;

    public SecurityReportSummary(int securityScore, int findingsCount, int vulnerabilitiesCount,
            int passedValidators, int totalValidators) {
        this.securityScore = securityScore;
        this.findingsCount = findingsCount;
        this.vulnerabilitiesCount = vulnerabilitiesCount;
        this.passedValidators = passedValidators;
        this.totalValidators = totalValidators;
    }

    /** 0 to 100, higher is healthier. */
    public int getSecurityScore() {
        return securityScore;
    }

    public int getFindingsCount() {
        return findingsCount;
    }

    public int getVulnerabilitiesCount() {
        return vulnerabilitiesCount;
    }

    /** Validators that reported nothing. */
    public int getPassedValidators() {
        return passedValidators;
    }

    public int getTotalValidators() {
        return totalValidators;
    }

    @Override
    public String toString() {
        return "SecurityReportSummary{" +
                "securityScore=" + securityScore +
                ", findings=" + findingsCount +
                ", vulnerabilities=" + vulnerabilitiesCount +
                ", passed=" + passedValidators + "/" + totalValidators +
                '}';
    }
}
