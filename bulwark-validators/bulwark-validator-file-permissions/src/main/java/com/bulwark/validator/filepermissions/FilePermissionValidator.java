package com.bulwark.validator.filepermissions;

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
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermission;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Checks POSIX permissions of the target files.
 *
 * <ul>
 * <li>World-writable files are a high severity vulnerability.</li>
 * <li>Secrets (keys, keystores, .env files, credentials) readable by group or others are findings.</li>
 * </ul>
 *
 * With auto-fix enabled the offending permission bits are removed; the issue is still
 * reported with an {@code autoFixed} detail. On file systems without POSIX
 * permissions the validator reports nothing.
 */
@Component(FilePermissionValidator.NAME)
public class FilePermissionValidator implements Validator {

    private static final Logger log = LoggerFactory.getLogger(FilePermissionValidator.class);

    public static final String NAME = "file-permissions";
    static final String FINDING_TYPE = "permission";

    private static final Set<String> SENSITIVE_NAMES = Set.of(
            "id_rsa", "id_dsa", "id_ecdsa", "id_ed25519", "credentials", ".npmrc", ".pgpass", ".netrc",
            ".htpasswd");
    private static final Set<String> SENSITIVE_EXTENSIONS = Set.of(
            "pem", "key", "p12", "pfx", "jks", "keystore", "kdbx");

    private static final Set<PosixFilePermission> SHARED_READ = EnumSet.of(
            PosixFilePermission.GROUP_READ, PosixFilePermission.GROUP_WRITE,
            PosixFilePermission.OTHERS_READ, PosixFilePermission.OTHERS_WRITE);

    @Override
    public ValidationResult check(ValidationContext context) throws IOException {
        if (!Files.getFileStore(context.getTargetDir()).supportsFileAttributeView("posix")) {
            log.debug("[Bulwark] [{}] File system of {} has no POSIX permissions, skipping",
                    NAME, context.getTargetDir());
            return ValidationResult.empty();
        }

        List<SecurityFinding> findings = new ArrayList<>();
        List<SecurityVulnerability> vulnerabilities = new ArrayList<>();

        for (Path file : TargetFiles.collect(context, path -> true)) {
            Set<PosixFilePermission> permissions = Files.getPosixFilePermissions(file);
            String location = TargetFiles.relativeLocation(context, file);
            String mode = PosixFilePermissions.toString(permissions);

            if (permissions.contains(PosixFilePermission.OTHERS_WRITE)) {
                boolean fixed = context.isAutoFix()
                        && fix(file, permissions, EnumSet.of(PosixFilePermission.OTHERS_WRITE));
                vulnerabilities.add(SecurityVulnerability.builder()
                        .validator(NAME)
                        .type(FINDING_TYPE)
                        .severity(Severity.HIGH)
                        .title("World-writable file")
                        .description("Any local user can modify " + location)
                        .location(location)
                        .recommendation("Remove write access for other users (chmod o-w " + location + ")")
                        .detail("mode", mode)
                        .detail("autoFixed", String.valueOf(fixed))
                        .build());
                continue;
            }

            if (isSensitive(file) && permissions.stream().anyMatch(SHARED_READ::contains)) {
                boolean fixed = context.isAutoFix() && fix(file, permissions, SHARED_READ);
                findings.add(SecurityFinding.builder()
                        .validator(NAME)
                        .type(FINDING_TYPE)
                        .title("Sensitive file accessible by other users")
                        .description(location + " holds secrets but is readable beyond its owner")
                        .location(location)
                        .detail("mode", mode)
                        .detail("autoFixed", String.valueOf(fixed))
                        .build());
            }
        }

        return new ValidationResult(findings, vulnerabilities);
    }

    static boolean isSensitive(Path file) {
        String name = String.valueOf(file.getFileName()).toLowerCase(Locale.ROOT);
        if (SENSITIVE_NAMES.contains(name) || name.startsWith(".env")) {
            return true;
        }
        int dot = name.lastIndexOf('.');
        return dot >= 0 && SENSITIVE_EXTENSIONS.contains(name.substring(dot + 1));
    }

    private boolean fix(Path file, Set<PosixFilePermission> current, Set<PosixFilePermission> remove) {
        Set<PosixFilePermission> updated = EnumSet.noneOf(PosixFilePermission.class);
        updated.addAll(current);
        updated.removeAll(remove);
        try {
            Files.setPosixFilePermissions(file, updated);
            log.info("[Bulwark] [{}] Fixed permissions of {}: {}", NAME, file,
                    PosixFilePermissions.toString(updated));
            return true;
        } catch (IOException e) {
            log.warn("[Bulwark] [{}] Could not fix permissions of {}: {}", NAME, file, e.getMessage());
            return false;
        }
    }
}
