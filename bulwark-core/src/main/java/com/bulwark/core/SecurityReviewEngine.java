package com.bulwark.core;

import com.bulwark.core.config.BulwarkProperties;
import com.bulwark.core.model.Identifiers;
import com.bulwark.core.model.SecurityFinding;
import com.bulwark.core.model.SecurityRecommendation;
import com.bulwark.core.model.SecurityReport;
import com.bulwark.core.model.SecurityReportSummary;
import com.bulwark.core.model.SecurityVulnerability;
import com.bulwark.core.plugin.ValidationContext;
import com.bulwark.core.plugin.ValidationResult;
import com.bulwark.core.plugin.Validator;
import com.bulwark.core.plugin.ValidatorRegistry;
import com.bulwark.core.review.RecommendationGenerator;
import com.bulwark.core.review.SecurityScoreCalculator;
import com.bulwark.core.store.ReportSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs every registered validator against a target and turns their output into a {@link SecurityReport}.
 * Validators run in parallel on the supplied executor. A validator that throws, times out
 * or returns null contributes nothing; the rest of the run is unaffected.
 */
public class SecurityReviewEngine {

    private static final Logger log = LoggerFactory.getLogger(SecurityReviewEngine.class);

    private final ValidatorRegistry registry;
    private final BulwarkProperties.Review properties;
    private final Executor executor;
    private final ReportSink reportSink;

    public SecurityReviewEngine(ValidatorRegistry registry, BulwarkProperties.Review properties,
            Executor executor, ReportSink reportSink) {
        this.registry = registry;
        this.properties = properties;
        this.executor = executor;
        this.reportSink = reportSink;
        log.info("[Bulwark] Review engine started with {} validators", registry.size());
    }

    public boolean registerValidator(String name, Validator validator) {
        return registry.register(name, validator);
    }

    public boolean unregisterValidator(String name) {
        return registry.unregister(name);
    }

    public List<String> getValidatorNames() {
        return registry.getNames();
    }

    public int getValidatorCount() {
        return registry.size();
    }

    /**
     * Run all validators registered at call time. Safe to call concurrently.
     * Auto-fix is on when either the context or the engine configuration asks for it.
     */
    public SecurityReport runValidators(ValidationContext requested) {
        ValidationContext context = properties.isAutoFix() ? requested.withAutoFix(true) : requested;
        Map<String, Validator> validators = registry.snapshot();
        log.debug("[Bulwark] Running {} validators against {}", validators.size(), context.getTargetDir());

        Map<String, CompletableFuture<ValidationResult>> pending = new LinkedHashMap<>();
        validators.forEach((name, validator) -> pending.put(name, submit(name, validator, context)));

        CompletableFuture.allOf(pending.values().toArray(new CompletableFuture<?>[0])).join();

        List<SecurityFinding> findings = new ArrayList<>();
        List<SecurityVulnerability> vulnerabilities = new ArrayList<>();
        for (CompletableFuture<ValidationResult> future : pending.values()) {
            ValidationResult result = future.join();
            findings.addAll(result.getFindings());
            vulnerabilities.addAll(result.getVulnerabilities());
        }

        int score = SecurityScoreCalculator.score(findings, vulnerabilities);
        int passed = SecurityScoreCalculator.passedValidators(validators.size(), findings, vulnerabilities);
        List<SecurityRecommendation> recommendations = RecommendationGenerator.generate(findings, vulnerabilities);

        SecurityReport report = new SecurityReport(
                Identifiers.randomHex(),
                Instant.now(),
                new SecurityReport.Framework(properties.getFrameworkName(), properties.getFrameworkVersion()),
                new SecurityReportSummary(score, findings.size(), vulnerabilities.size(), passed, validators.size()),
                findings,
                vulnerabilities,
                recommendations,
                null);

        log.info("[Bulwark] Review {} finished: score={}, findings={}, vulnerabilities={}, passed={}/{}",
                report.getId(), score, findings.size(), vulnerabilities.size(), passed, validators.size());

        return persist(report);
    }

    private CompletableFuture<ValidationResult> submit(String name, Validator validator, ValidationContext context) {
        CompletableFuture<ValidationResult> running;
        try {
            running = CompletableFuture.supplyAsync(() -> {
                try {
                    return validator.check(context);
                } catch (Exception e) {
                    throw new CompletionException(e);
                }
            }, executor);
        } catch (RejectedExecutionException e) {
            log.warn("[Bulwark] Validator '{}' not run, executor rejected it: {}", name, e.getMessage());
            return CompletableFuture.completedFuture(ValidationResult.empty());
        }
        return running
                .orTimeout(properties.getValidatorTimeoutMs(), TimeUnit.MILLISECONDS)
                .handle((result, error) -> {
                    if (error != null) {
                        Throwable cause = error instanceof CompletionException && error.getCause() != null
                                ? error.getCause()
                                : error;
                        if (cause instanceof TimeoutException) {
                            log.warn("[Bulwark] Validator '{}' timed out after {}ms", name,
                                    properties.getValidatorTimeoutMs());
                        } else {
                            log.warn("[Bulwark] Validator '{}' failed: {}", name, cause.getMessage());
                        }
                        return ValidationResult.empty();
                    }
                    if (result == null) {
                        log.warn("[Bulwark] Validator '{}' returned no result", name);
                        return ValidationResult.empty();
                    }
                    return result;
                });
    }

    private SecurityReport persist(SecurityReport report) {
        if (reportSink == null) {
            return report;
        }
        try {
            String path = reportSink.save(report);
            return report.withReportPath(path);
        } catch (Exception e) {
            log.error("[Bulwark] Failed to save report {}: {}", report.getId(), e.getMessage());
            return report;
        }
    }
}
