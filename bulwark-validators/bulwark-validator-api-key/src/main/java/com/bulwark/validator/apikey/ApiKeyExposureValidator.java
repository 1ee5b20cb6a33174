package com.bulwark.validator.apikey;

import com.bulwark.core.model.SecurityFinding;
import com.bulwark.core.model.SecurityVulnerability;
import com.bulwark.core.model.Severity;
import com.bulwark.core.plugin.TargetFiles;
import com.bulwark.core.plugin.ValidationContext;
import com.bulwark.core.plugin.ValidationResult;
import com.bulwark.core.plugin.Validator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Scans source and configuration files for credentials committed in plain text.
 * Known key formats (AWS, OpenAI, GitHub, Stripe, Slack, JWT) and hard-coded
 * secret assignments are reported as findings; PEM private keys as a high
 * severity vulnerability.
 */
@Component(ApiKeyExposureValidator.NAME)
public class ApiKeyExposureValidator implements Validator {

    private static final Logger log = LoggerFactory.getLogger(ApiKeyExposureValidator.class);

    public static final String NAME = "api-key-exposure";
    static final String FINDING_TYPE = "api-key";

    private static final Set<String> SCANNED_EXTENSIONS = Set.of(
            "java", "kt", "groovy", "js", "jsx", "ts", "tsx", "py", "rb", "go", "php", "cs",
            "properties", "yml", "yaml", "json", "xml", "conf", "cfg", "ini", "toml", "env", "sh", "txt");

    private static final List<KeyDetector> DETECTORS = List.of(
            new KeyDetector("aws-access-key", Pattern.compile("\\bAKIA[0-9A-Z]{16}\\b"), "AWS access key"),
            new KeyDetector("openai-api-key", Pattern.compile("\\bsk-[A-Za-z0-9]{20,}"), "OpenAI API key"),
            new KeyDetector("github-token", Pattern.compile("\\bgh[pousr]_[A-Za-z0-9_]{36,}"), "GitHub token"),
            new KeyDetector("stripe-secret-key", Pattern.compile("\\b[sr]k_live_[A-Za-z0-9]{20,}"), "Stripe secret key"),
            new KeyDetector("slack-token", Pattern.compile("\\bxox[baprs]-[A-Za-z0-9-]{10,}"), "Slack token"),
            new KeyDetector("google-api-key", Pattern.compile("\\bAIza[0-9A-Za-z_-]{35}"), "Google API key"),
            new KeyDetector("jwt-token",
                    Pattern.compile("eyJ[A-Za-z0-9_-]{10,}\\.eyJ[A-Za-z0-9_-]{10,}\\.[A-Za-z0-9_-]+"), "JWT"),
            new KeyDetector("hardcoded-secret",
                    Pattern.compile("(?i)\\b(?:api[_-]?key|secret[_-]?key|client[_-]?secret|access[_-]?token|auth[_-]?token|password)"
                            + "\\s*[:=]\\s*[\"']([^\"'\\s$]{8,})[\"']"),
                    "Hard-coded secret"));

    private static final Pattern PRIVATE_KEY = Pattern.compile("-----BEGIN (?:RSA |EC |DSA |OPENSSH )?PRIVATE KEY-----");

    @Override
    public ValidationResult check(ValidationContext context) throws IOException {
        List<SecurityFinding> findings = new ArrayList<>();
        List<SecurityVulnerability> vulnerabilities = new ArrayList<>();

        List<Path> files = TargetFiles.collect(context, ApiKeyExposureValidator::isScannable);
        for (Path file : files) {
            String location = TargetFiles.relativeLocation(context, file);
            List<String> lines = TargetFiles.readLines(file);

            for (int i = 0; i < lines.size(); i++) {
                String line = lines.get(i);
                int lineNumber = i + 1;

                if (PRIVATE_KEY.matcher(line).find()) {
                    vulnerabilities.add(SecurityVulnerability.builder()
                            .validator(NAME)
                            .type(FINDING_TYPE)
                            .severity(Severity.HIGH)
                            .title("Private key committed to source")
                            .description("A PEM private key is stored in " + location)
                            .location(location + ":" + lineNumber)
                            .recommendation("Remove the key from the repository, rotate it and load it from a secret store")
                            .detail("pattern", "private-key")
                            .build());
                    continue;
                }

                for (KeyDetector detector : DETECTORS) {
                    Matcher matcher = detector.pattern.matcher(line);
                    while (matcher.find()) {
                        String value = matcher.groupCount() > 0 && matcher.group(1) != null
                                ? matcher.group(1)
                                : matcher.group();
                        findings.add(SecurityFinding.builder()
                                .validator(NAME)
                                .type(FINDING_TYPE)
                                .title(detector.label + " exposed")
                                .description("Possible " + detector.label + " found in " + location)
                                .location(location + ":" + lineNumber)
                                .detail("pattern", detector.name)
                                .detail("match", mask(value))
                                .build());
                    }
                }
            }
        }

        log.debug("[Bulwark] [{}] Scanned {} files: {} findings, {} vulnerabilities",
                NAME, files.size(), findings.size(), vulnerabilities.size());
        return new ValidationResult(findings, vulnerabilities);
    }

    static boolean isScannable(Path file) {
        String name = String.valueOf(file.getFileName()).toLowerCase(Locale.ROOT);
        if (name.startsWith(".env")) {
            return true;
        }
        int dot = name.lastIndexOf('.');
        return dot >= 0 && SCANNED_EXTENSIONS.contains(name.substring(dot + 1));
    }

    /** Keeps the first and last four characters so the value can be located but not reused. */
    static String mask(String value) {
        if (value.length() <= 8) {
            return "****";
        }
        return value.substring(0, 4) + "..." + value.substring(value.length() - 4);
    }

    private static class KeyDetector {
        final String name;
        final Pattern pattern;
        final String label;

        KeyDetector(String name, Pattern pattern, String label) {
            this.name = name;
            this.pattern = pattern;
            this.label = label;
        }
    }
}
