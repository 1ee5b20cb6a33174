package com.bulwark.validator.filepermissions;

import com.bulwark.core.model.SecurityVulnerability;
import com.bulwark.core.model.Severity;
import com.bulwark.core.plugin.ValidationContext;
import com.bulwark.core.plugin.ValidationResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermission;
import java.nio.file.attribute.PosixFilePermissions;

import static org.junit.jupiter.api.Assertions.*;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

class FilePermissionValidatorTest {

    @TempDir
    Path root;

    private final FilePermissionValidator validator = new FilePermissionValidator();

    @BeforeEach
    void requirePosix() throws Exception {
        assumeTrue(Files.getFileStore(root).supportsFileAttributeView("posix"));
    }

    @Test
    void worldWritableFileIsHighSeverity() throws Exception {
        write("shared.conf", "rw-rw-rw-");
        write("private.conf", "rw-------");

        ValidationResult result = validator.check(context(false));

        assertEquals(1, result.getVulnerabilities().size());
        SecurityVulnerability vulnerability = result.getVulnerabilities().get(0);
        assertEquals("shared.conf", vulnerability.getLocation());
        assertEquals(Severity.HIGH, vulnerability.getSeverity());
        assertEquals("permission", vulnerability.getType());
        assertEquals("rw-rw-rw-", vulnerability.getDetail("mode"));
        assertTrue(result.getFindings().isEmpty());
    }

    @Test
    void sharedSecretsAreFindings() throws Exception {
        write("certs/server.key", "rw-r--r--");
        write(".env.production", "rw-r-----");
        write("id_rsa", "rw-------");
        write("README.md", "rw-r--r--");

        ValidationResult result = validator.check(context(false));

        assertEquals(2, result.getFindings().size());
        assertTrue(result.getVulnerabilities().isEmpty());
        assertTrue(result.getFindings().stream().allMatch(f -> "false".equals(f.getDetail("autoFixed"))));
    }

    @Test
    void autoFixRemovesOffendingBits() throws Exception {
        Path key = write("server.pem", "rw-r--r--");
        Path shared = write("data.txt", "rwxrwxrwx");

        ValidationResult result = validator.check(context(true));

        assertEquals(1, result.getFindings().size());
        assertEquals("true", result.getFindings().get(0).getDetail("autoFixed"));
        assertEquals("rw-------", PosixFilePermissions.toString(Files.getPosixFilePermissions(key)));
        assertFalse(Files.getPosixFilePermissions(shared).contains(PosixFilePermission.OTHERS_WRITE));

        assertTrue(validator.check(context(false)).isEmpty());
    }

    @Test
    void recognizesSensitiveNames() {
        assertTrue(FilePermissionValidator.isSensitive(Path.of("keystore.jks")));
        assertTrue(FilePermissionValidator.isSensitive(Path.of(".env")));
        assertTrue(FilePermissionValidator.isSensitive(Path.of("home/.pgpass")));
        assertFalse(FilePermissionValidator.isSensitive(Path.of("Main.java")));
    }

    private ValidationContext context(boolean autoFix) {
        return ValidationContext.builder().targetDir(root).autoFix(autoFix).build();
    }

    private Path write(String relative, String mode) throws Exception {
        Path file = root.resolve(relative);
        if (file.getParent() != null) {
            Files.createDirectories(file.getParent());
        }
        Files.writeString(file, "x");
        Files.setPosixFilePermissions(file, PosixFilePermissions.fromString(mode));
        return file;
    }
}
