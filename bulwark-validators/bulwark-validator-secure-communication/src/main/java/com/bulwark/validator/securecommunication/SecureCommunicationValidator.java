package com.bulwark.validator.securecommunication;

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
 * Looks for unencrypted endpoints ({@code http://}, {@code ws://}, {@code ftp://}) in source
 * and configuration, and for code that switches TLS certificate verification off.
 */
@Component(SecureCommunicationValidator.NAME)
public class SecureCommunicationValidator implements Validator {

    private static final Logger log = LoggerFactory.getLogger(SecureCommunicationValidator.class);

    public static final String NAME = "secure-communication";
    static final String FINDING_TYPE = "communication";

    private static final Set<String> SCANNED_EXTENSIONS = Set.of(
            "java", "kt", "groovy", "js", "jsx", "ts", "tsx", "py", "rb", "go", "php", "cs",
            "properties", "yml", "yaml", "json", "conf", "cfg", "ini", "toml", "env", "html", "vue");

    private static final Pattern INSECURE_URL = Pattern.compile(
            "\\b(http|ws|ftp)://([A-Za-z0-9.-]+|\\[[0-9a-fA-F:]+\\])(?::\\d+)?[^\\s\"'<>)]*");

    // loopback, wildcard and documentation hosts
    private static final Set<String> IGNORED_HOSTS = Set.of(
            "localhost", "127.0.0.1", "0.0.0.0", "[::1]", "example.com", "example.org", "example.net");

    // schema and namespace identifiers are never fetched
    private static final Set<String> NAMESPACE_HOSTS = Set.of(
            "www.w3.org", "maven.apache.org", "www.springframework.org", "java.sun.com",
            "xmlns.jcp.org", "json-schema.org", "schemas.xmlsoap.org");

    private static final List<TlsBypass> TLS_BYPASSES = List.of(
            new TlsBypass("reject-unauthorized", Pattern.compile("rejectUnauthorized\\s*[:=]\\s*false")),
            new TlsBypass("node-tls-env", Pattern.compile("NODE_TLS_REJECT_UNAUTHORIZED\\s*[:=]\\s*[\"']?0")),
            new TlsBypass("python-verify-false", Pattern.compile("\\bverify\\s*=\\s*False\\b")),
            new TlsBypass("go-insecure-skip-verify", Pattern.compile("InsecureSkipVerify\\s*:\\s*true")),
            new TlsBypass("java-trust-all",
                    Pattern.compile("\\b(?:NoopHostnameVerifier|TrustAllStrategy|ALLOW_ALL_HOSTNAME_VERIFIER|TrustAllCerts\\w*)\\b")));

    @Override
    public ValidationResult check(ValidationContext context) throws IOException {
        List<SecurityFinding> findings = new ArrayList<>();
        List<SecurityVulnerability> vulnerabilities = new ArrayList<>();

        for (Path file : TargetFiles.collect(context, SecureCommunicationValidator::isScannable)) {
            String location = TargetFiles.relativeLocation(context, file);
            List<String> lines = TargetFiles.readLines(file);

            for (int i = 0; i < lines.size(); i++) {
                String line = lines.get(i);
                String lineLocation = location + ":" + (i + 1);

                Matcher matcher = INSECURE_URL.matcher(line);
                while (matcher.find()) {
                    String scheme = matcher.group(1).toLowerCase(Locale.ROOT);
                    String host = matcher.group(2).toLowerCase(Locale.ROOT);
                    if (isIgnoredHost(host)) {
                        continue;
                    }
                    findings.add(SecurityFinding.builder()
                            .validator(NAME)
                            .type(FINDING_TYPE)
                            .title("Unencrypted " + scheme + " endpoint")
                            .description("Traffic to " + host + " is sent in clear text; use "
                                    + secureScheme(scheme) + " instead")
                            .location(lineLocation)
                            .detail("url", matcher.group())
                            .detail("scheme", scheme)
                            .build());
                }

                for (TlsBypass bypass : TLS_BYPASSES) {
                    if (bypass.pattern.matcher(line).find()) {
                        vulnerabilities.add(SecurityVulnerability.builder()
                                .validator(NAME)
                                .type(FINDING_TYPE)
                                .severity(Severity.HIGH)
                                .title("TLS certificate verification disabled")
                                .description("Connections made here accept any certificate and can be intercepted")
                                .location(lineLocation)
                                .recommendation("Keep certificate verification on and trust the required CA explicitly")
                                .detail("pattern", bypass.name)
                                .build());
                    }
                }
            }
        }

        log.debug("[Bulwark] [{}] {} insecure endpoints, {} TLS bypasses", NAME, findings.size(),
                vulnerabilities.size());
        return new ValidationResult(findings, vulnerabilities);
    }

    static boolean isIgnoredHost(String host) {
        return IGNORED_HOSTS.contains(host)
                || NAMESPACE_HOSTS.contains(host)
                || host.endsWith(".localhost")
                || host.endsWith(".example.com")
                || host.startsWith("127.");
    }

    static boolean isScannable(Path file) {
        String name = String.valueOf(file.getFileName()).toLowerCase(Locale.ROOT);
        if (name.startsWith(".env")) {
            return true;
        }
        int dot = name.lastIndexOf('.');
        return dot >= 0 && SCANNED_EXTENSIONS.contains(name.substring(dot + 1));
    }

    private static String secureScheme(String scheme) {
        switch (scheme) {
            case "ws":
                return "wss";
            case "ftp":
                return "sftp or ftps";
            default:
                return "https";
        }
    }

    private static class TlsBypass {
        final String name;
        final Pattern pattern;

        TlsBypass(String name, Pattern pattern) {
            this.name = name;
            this.pattern = pattern;
        }
    }
}
