package com.bulwark.core.plugin;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class TargetFilesTest {

    @TempDir
    Path root;

    @Test
    void walksDirectorySkippingBuildAndVcsFolders() throws Exception {
        write("src/App.java");
        write("config/app.properties");
        write(".git/config");
        write("node_modules/lib/index.js");
        write("target/classes/App.class");

        ValidationContext context = ValidationContext.builder().targetDir(root).build();

        assertEquals(Set.of("src/App.java", "config/app.properties"), relative(context, path -> true));
    }

    @Test
    void appliesFilterAndExcludePatterns() throws Exception {
        write("src/App.java");
        write("src/AppTest.java");
        write("docs/readme.md");
        write("generated/Gen.java");

        ValidationContext context = ValidationContext.builder()
                .targetDir(root)
                .excludePatterns(List.of("*Test.java", "generated", " "))
                .build();

        assertEquals(Set.of("src/App.java"), relative(context, path -> path.toString().endsWith(".java")));
    }

    @Test
    void excludedPathsAreSkippedWhenWalkingAndWhenListed() throws Exception {
        write("app.js");
        write("security-report.json");

        ValidationContext walked = ValidationContext.builder()
                .targetDir(root)
                .excludePath(root.resolve("./security-report.json"))
                .build();
        assertEquals(Set.of("app.js"), relative(walked, path -> true));

        ValidationContext listed = ValidationContext.builder()
                .targetDir(root)
                .targetFiles(List.of("app.js", "security-report.json"))
                .excludePath(root.resolve("security-report.json"))
                .build();
        assertEquals(Set.of("app.js"), relative(listed, path -> true));
        assertEquals(walked.getExcludedPaths(), walked.withAutoFix(true).getExcludedPaths());
    }

    @Test
    void explicitTargetFilesAreUsedAsGiven() throws Exception {
        write("a.txt");
        write("b.txt");
        write("c.txt");

        ValidationContext context = ValidationContext.builder()
                .targetDir(root)
                .targetFiles(List.of("a.txt", " c.txt", "missing.txt"))
                .build();

        assertEquals(Set.of("a.txt", "c.txt"), relative(context, path -> true));
    }

    @Test
    void missingDirectoryYieldsNothing() throws Exception {
        ValidationContext context = ValidationContext.builder().targetDir(root.resolve("nope")).build();
        assertTrue(TargetFiles.collect(context, path -> true).isEmpty());
    }

    private void write(String relative) throws Exception {
        Path file = root.resolve(relative);
        Files.createDirectories(file.getParent());
        Files.writeString(file, "x");
    }

    private Set<String> relative(ValidationContext context, java.util.function.Predicate<Path> filter)
            throws Exception {
        return TargetFiles.collect(context, filter).stream()
                .map(file -> TargetFiles.relativeLocation(context, file))
                .collect(Collectors.toSet());
    }
}
