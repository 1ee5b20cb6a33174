package com.bulwark.core.config;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Core configuration properties for Bulwark.
 * These map directly to the `bulwark.*` properties in your application.yml.
 */
public class BulwarkProperties {

    private boolean enabled = true;
    private List<String> excludePaths = List.of("/health", "/actuator/**");

    private Gateway gateway = new Gateway();
    private Review review = new Review();
    private Map<String, ValidatorProperties> validators = new HashMap<>();

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public List<String> getExcludePaths() {
        return excludePaths;
    }

    public void setExcludePaths(List<String> excludePaths) {
        this.excludePaths = excludePaths;
    }

    public Gateway getGateway() {
        return gateway;
    }

    public void setGateway(Gateway gateway) {
        this.gateway = gateway;
    }

    public Review getReview() {
        return review;
    }

    public void setReview(Review review) {
        this.review = review;
    }

    public Map<String, ValidatorProperties> getValidators() {
        return validators;
    }

    public void setValidators(Map<String, ValidatorProperties> validators) {
        this.validators = validators;
    }

    /**
     * Validators are enabled by default unless explicitly disabled.
     */
    public boolean isValidatorEnabled(String name) {
        ValidatorProperties props = validators.get(name);
        if (props == null)
            return true;
        return props.isEnabled();
    }

    public static class Gateway {
        private int rateLimitRequests = 100;
        private long rateLimitWindowMs = 15 * 60 * 1000L;
        private boolean requireHttps = true;
        private boolean csrfProtection = true;
        private boolean inputValidation = true;
        private SecurityPolicyLevel policyLevel = SecurityPolicyLevel.STRICT;
        private boolean trustForwardedHeaders = false;
        private String csrfHeaderName = "X-CSRF-Token";
        private String csrfParameterName = "_csrf";
        private String csrfSessionAttribute = "csrfToken";

        public int getRateLimitRequests() {
            return rateLimitRequests;
        }

        public void setRateLimitRequests(int rateLimitRequests) {
            this.rateLimitRequests = rateLimitRequests;
        }

        public long getRateLimitWindowMs() {
            return rateLimitWindowMs;
        }

        public void setRateLimitWindowMs(long rateLimitWindowMs) {
            this.rateLimitWindowMs = rateLimitWindowMs;
        }

        public boolean isRequireHttps() {
            return requireHttps;
        }

        public void setRequireHttps(boolean requireHttps) {
            this.requireHttps = requireHttps;
        }

        public boolean isCsrfProtection() {
            return csrfProtection;
        }

        public void setCsrfProtection(boolean csrfProtection) {
            this.csrfProtection = csrfProtection;
        }

        public boolean isInputValidation() {
            return inputValidation;
        }

        public void setInputValidation(boolean inputValidation) {
            this.inputValidation = inputValidation;
        }

        public SecurityPolicyLevel getPolicyLevel() {
            return policyLevel;
        }

        public void setPolicyLevel(SecurityPolicyLevel policyLevel) {
            this.policyLevel = policyLevel;
        }

        public boolean isStrict() {
            return policyLevel == null || policyLevel == SecurityPolicyLevel.STRICT;
        }

        public boolean isTrustForwardedHeaders() {
            return trustForwardedHeaders;
        }

        public void setTrustForwardedHeaders(boolean trustForwardedHeaders) {
            this.trustForwardedHeaders = trustForwardedHeaders;
        }

        public String getCsrfHeaderName() {
            return csrfHeaderName;
        }

        public void setCsrfHeaderName(String csrfHeaderName) {
            this.csrfHeaderName = csrfHeaderName;
        }

        public String getCsrfParameterName() {
            return csrfParameterName;
        }

        public void setCsrfParameterName(String csrfParameterName) {
            this.csrfParameterName = csrfParameterName;
        }

        public String getCsrfSessionAttribute() {
            return csrfSessionAttribute;
        }

        public void setCsrfSessionAttribute(String csrfSessionAttribute) {
            this.csrfSessionAttribute = csrfSessionAttribute;
        }
    }

    public static class Review {
        private boolean autoFix = false;
        private boolean strictMode = true;
        private String reportPath; // null = report is not persisted
        private long validatorTimeoutMs = 60_000L;
        private String frameworkName = "Bulwark";
        private String frameworkVersion = "0.1.0";

        public boolean isAutoFix() {
            return autoFix;
        }

        public void setAutoFix(boolean autoFix) {
            this.autoFix = autoFix;
        }

        public boolean isStrictMode() {
            return strictMode;
        }

        public void setStrictMode(boolean strictMode) {
            this.strictMode = strictMode;
        }

        public String getReportPath() {
            return reportPath;
        }

        public void setReportPath(String reportPath) {
            this.reportPath = reportPath;
        }

        public long getValidatorTimeoutMs() {
            return validatorTimeoutMs;
        }

        public void setValidatorTimeoutMs(long validatorTimeoutMs) {
            this.validatorTimeoutMs = validatorTimeoutMs;
        }

        public String getFrameworkName() {
            return frameworkName;
        }

        public void setFrameworkName(String frameworkName) {
            this.frameworkName = frameworkName;
        }

        public String getFrameworkVersion() {
            return frameworkVersion;
        }

        public void setFrameworkVersion(String frameworkVersion) {
            this.frameworkVersion = frameworkVersion;
        }
    }

    public static class ValidatorProperties {
        private boolean enabled = true;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }
    }
}
