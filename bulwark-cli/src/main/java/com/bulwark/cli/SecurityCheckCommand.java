package com.bulwark.cli;

import ch.qos.logback.classic.Level;
import com.bulwark.core.SecurityReviewEngine;
import com.bulwark.core.config.BulwarkProperties;
import com.bulwark.core.model.SecurityReport;
import com.bulwark.core.plugin.ValidationContext;
import com.bulwark.core.plugin.ValidatorRegistry;
import com.bulwark.core.store.JsonFileReportSink;
import com.bulwark.validator.apikey.ApiKeyExposureValidator;
import com.bulwark.validator.filepermissions.FilePermissionValidator;
import com.bulwark.validator.securecommunication.SecureCommunicationValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Runs a security review over a directory and writes the JSON report.
 */
@Command(
        name = "security-check",
        mixinStandardHelpOptions = true,
        version = "Bulwark security-check 0.1.0",
        description = "Scans a project for exposed credentials, unsafe file permissions and insecure "
                + "communication, then writes a JSON security report.")
public class SecurityCheckCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(SecurityCheckCommand.class);

    @Spec
    private CommandSpec spec;

    @Option(names = {"-d", "--dir"}, description = "Directory to review (default: current directory)")
    private Path dir;

    @Option(names = {"-f", "--files"}, split = ",", description = "Comma-separated files to review, relative to --dir")
    private List<String> files;

    @Option(names = {"-e", "--exclude"}, split = ",", description = "Comma-separated glob patterns to skip")
    private List<String> exclude;

    @Option(names = {"-o", "--output"}, description = "Report file (default: ${DEFAULT-VALUE})")
    private Path output = Paths.get("security-report.json");

    @Option(names = {"-a", "--autofix"}, description = "Fix simple issues in place where a validator supports it")
    private boolean autofix;

    @Option(names = {"-r", "--relaxed"}, description = "Do not fail on findings, only on vulnerabilities")
    private boolean relaxed;

    @Option(names = {"-v", "--verbose"}, description = "Print every finding, vulnerability and recommendation")
    private boolean verbose;

    public static void main(String[] args) {
        int exitCode = new CommandLine(new SecurityCheckCommand()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();
        CommandLine.Help.Ansi ansi = spec.commandLine().getColorScheme().ansi();
        ReportPrinter printer = new ReportPrinter(out, ansi);

        if (verbose) {
            enableDebugLogging();
        }

        printer.printBanner();

        ExecutorService executor = Executors.newFixedThreadPool(3);
        try {
            Path targetDir = (dir != null ? dir : Paths.get("")).toAbsolutePath().normalize();
            if (!Files.isDirectory(targetDir)) {
                throw new IllegalArgumentException("Not a directory: " + targetDir);
            }

            BulwarkProperties.Review review = new BulwarkProperties.Review();
            review.setAutoFix(autofix);
            review.setStrictMode(!relaxed);
            review.setReportPath(output.toString());

            ValidatorRegistry registry = new ValidatorRegistry();
            registry.register(ApiKeyExposureValidator.NAME, new ApiKeyExposureValidator());
            registry.register(FilePermissionValidator.NAME, new FilePermissionValidator());
            registry.register(SecureCommunicationValidator.NAME, new SecureCommunicationValidator());

            SecurityReviewEngine engine = new SecurityReviewEngine(registry, review, executor,
                    new JsonFileReportSink(output));

            ValidationContext context = ValidationContext.builder()
                    .targetDir(targetDir)
                    .targetFiles(files)
                    .excludePatterns(exclude)
                    .autoFix(autofix)
                    .excludePath(output)
                    .build();

            out.println("Running security review...");
            SecurityReport report = engine.runValidators(context);

            printer.printSummary(report);
            if (verbose) {
                printer.printDetails(report);
            }
            out.flush();

            return exitCode(report, !review.isStrictMode());
        } catch (Exception e) {
            err.println(ansi.string("@|red Error: " + e.getMessage() + "|@"));
            if (verbose) {
                e.printStackTrace(err);
            }
            log.debug("[Bulwark] Security check failed", e);
            return 1;
        } finally {
            executor.shutdownNow();
        }
    }

    /**
     * 1 when vulnerabilities exist, or findings exist and the check is not relaxed; 0 otherwise.
     */
    static int exitCode(SecurityReport report, boolean relaxed) {
        int vulnerabilities = report.getSummary().getVulnerabilitiesCount();
        int findings = report.getSummary().getFindingsCount();
        if (vulnerabilities > 0) {
            return 1;
        }
        return findings > 0 && !relaxed ? 1 : 0;
    }

    private static void enableDebugLogging() {
        Logger bulwark = LoggerFactory.getLogger("com.bulwark");
        if (bulwark instanceof ch.qos.logback.classic.Logger) {
            ((ch.qos.logback.classic.Logger) bulwark).setLevel(Level.DEBUG);
        }
    }
}
