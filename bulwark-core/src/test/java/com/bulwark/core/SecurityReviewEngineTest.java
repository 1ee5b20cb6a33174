package com.bulwark.core;

import com.bulwark.core.config.BulwarkProperties;
import com.bulwark.core.model.SecurityFinding;
import com.bulwark.core.model.SecurityReport;
import com.bulwark.core.model.SecurityVulnerability;
import com.bulwark.core.model.Severity;
import com.bulwark.core.plugin.ValidationContext;
import com.bulwark.core.plugin.ValidationResult;
import com.bulwark.core.plugin.ValidatorRegistry;
import com.bulwark.core.store.ReportSink;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class SecurityReviewEngineTest {

    private ExecutorService executor;
    private BulwarkProperties.Review properties;

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(4);
        properties = new BulwarkProperties.Review();
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void failingValidatorIsIsolated() {
        SecurityReviewEngine engine = engine(null);
        engine.registerValidator("broken", context -> {
            throw new IOException("disk on fire");
        });
        engine.registerValidator("two-findings", context -> ValidationResult.ofFindings(List.of(
                finding("two-findings", "config"),
                finding("two-findings", "config"))));

        SecurityReport report = engine.runValidators(ValidationContext.empty());

        assertEquals(2, report.getFindings().size());
        assertEquals(0, report.getVulnerabilities().size());
        assertEquals(2, report.getSummary().getTotalValidators());
        assertEquals(1, report.getSummary().getPassedValidators());
        assertEquals(99, report.getSummary().getSecurityScore());
        assertEquals(1, report.getRecommendations().size());
        assertNull(report.getReportPath());
    }

    @Test
    void nullResultCountsAsEmpty() {
        SecurityReviewEngine engine = engine(null);
        engine.registerValidator("silent", context -> null);

        SecurityReport report = engine.runValidators(ValidationContext.empty());

        assertEquals(100, report.getSummary().getSecurityScore());
        assertEquals(1, report.getSummary().getPassedValidators());
    }

    @Test
    void slowValidatorTimesOut() {
        properties.setValidatorTimeoutMs(200);
        SecurityReviewEngine engine = engine(null);
        engine.registerValidator("slow", context -> {
            Thread.sleep(10_000);
            return ValidationResult.ofFindings(List.of(finding("slow", "config")));
        });
        engine.registerValidator("fast", context -> ValidationResult.ofFindings(List.of(finding("fast", "config"))));

        long start = System.currentTimeMillis();
        SecurityReport report = engine.runValidators(ValidationContext.empty());

        assertTrue(System.currentTimeMillis() - start < 5_000);
        assertEquals(1, report.getFindings().size());
        assertEquals("fast", report.getFindings().get(0).getValidator());
    }

    @Test
    void runsDoNotCarryStateOver() {
        SecurityReviewEngine engine = engine(null);
        engine.registerValidator("one", context -> new ValidationResult(
                List.of(finding("one", "api-key")),
                List.of(SecurityVulnerability.builder().validator("one").severity(Severity.CRITICAL).build())));

        SecurityReport first = engine.runValidators(ValidationContext.empty());
        SecurityReport second = engine.runValidators(ValidationContext.empty());

        assertEquals(1, second.getFindings().size());
        assertEquals(1, second.getVulnerabilities().size());
        assertEquals(first.getSummary().getSecurityScore(), second.getSummary().getSecurityScore());
        assertEquals(80, second.getSummary().getSecurityScore());
        assertNotEquals(first.getId(), second.getId());
    }

    @Test
    void concurrentRunsOnOneEngineKeepTheirOwnResults() throws Exception {
        SecurityReviewEngine engine = engine(null);
        engine.registerValidator("per-target", context -> ValidationResult.ofFindings(List.of(
                located(context.getTargetDir()),
                located(context.getTargetDir()),
                located(context.getTargetDir()))));
        engine.registerValidator("clean", context -> ValidationResult.empty());

        int runs = 16;
        ExecutorService callers = Executors.newFixedThreadPool(runs);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<SecurityReport>> futures = new ArrayList<>();
            List<Path> targets = new ArrayList<>();
            for (int i = 0; i < runs; i++) {
                Path target = Paths.get("/review/target-" + i);
                targets.add(target);
                futures.add(callers.submit(() -> {
                    start.await();
                    return engine.runValidators(ValidationContext.builder().targetDir(target).build());
                }));
            }
            start.countDown();

            for (int i = 0; i < runs; i++) {
                SecurityReport report = futures.get(i).get(30, TimeUnit.SECONDS);
                String expected = targets.get(i).toString();
                assertEquals(3, report.getFindings().size());
                assertTrue(report.getFindings().stream().allMatch(f -> expected.equals(f.getLocation())));
                assertEquals(2, report.getSummary().getTotalValidators());
                assertEquals(1, report.getSummary().getPassedValidators());
                assertEquals(99, report.getSummary().getSecurityScore());
            }
        } finally {
            callers.shutdownNow();
        }
    }

    @Test
    void rejectedSubmissionCountsAsEmptyResult() {
        AtomicInteger submissions = new AtomicInteger();
        Executor saturated = task -> {
            if (submissions.incrementAndGet() > 1) {
                throw new RejectedExecutionException("queue full");
            }
            task.run();
        };
        SecurityReviewEngine engine = new SecurityReviewEngine(new ValidatorRegistry(), properties, saturated, null);
        engine.registerValidator("first", context -> ValidationResult.ofFindings(List.of(finding("first", "config"))));
        engine.registerValidator("second", context -> ValidationResult.ofFindings(List.of(finding("second", "config"))));

        SecurityReport report = engine.runValidators(ValidationContext.empty());

        assertEquals(1, report.getFindings().size());
        assertEquals("first", report.getFindings().get(0).getValidator());
        assertEquals(2, report.getSummary().getTotalValidators());
    }

    @Test
    void emptyRegistryProducesPerfectReport() {
        SecurityReport report = engine(null).runValidators(ValidationContext.empty());

        assertEquals(100, report.getSummary().getSecurityScore());
        assertEquals(0, report.getSummary().getTotalValidators());
        assertEquals(0, report.getSummary().getPassedValidators());
        assertEquals(16, report.getId().length());
        assertEquals("Bulwark", report.getFramework().getName());
    }

    @Test
    void reportPathSetWhenSinkSucceeds() {
        SecurityReport report = engine(r -> "/tmp/report.json").runValidators(ValidationContext.empty());
        assertEquals("/tmp/report.json", report.getReportPath());
    }

    @Test
    void sinkFailureDoesNotFailRun() {
        ReportSink failing = r -> {
            throw new IOException("read-only file system");
        };
        SecurityReport report = engine(failing).runValidators(ValidationContext.empty());

        assertNotNull(report);
        assertNull(report.getReportPath());
    }

    @Test
    void configuredAutoFixReachesValidators() {
        properties.setAutoFix(true);
        SecurityReviewEngine engine = engine(null);
        engine.registerValidator("fixer", context -> context.isAutoFix()
                ? ValidationResult.empty()
                : ValidationResult.ofFindings(List.of(finding("fixer", "config"))));

        SecurityReport report = engine.runValidators(ValidationContext.empty());

        assertTrue(report.getFindings().isEmpty());
    }

    @Test
    void registrationIsDelegatedToRegistry() {
        SecurityReviewEngine engine = engine(null);

        assertTrue(engine.registerValidator("a", context -> ValidationResult.empty()));
        assertFalse(engine.registerValidator("", context -> ValidationResult.empty()));
        assertEquals(List.of("a"), engine.getValidatorNames());
        assertTrue(engine.unregisterValidator("a"));
        assertEquals(0, engine.getValidatorCount());
    }

    private SecurityReviewEngine engine(ReportSink sink) {
        return new SecurityReviewEngine(new ValidatorRegistry(), properties, executor, sink);
    }

    private static SecurityFinding located(Path target) {
        return SecurityFinding.builder().validator("per-target").type("config").location(target.toString()).build();
    }

    private static SecurityFinding finding(String validator, String type) {
        return SecurityFinding.builder().validator(validator).type(type).location("app.yml").build();
    }
}
