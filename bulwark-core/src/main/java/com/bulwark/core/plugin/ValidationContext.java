package com.bulwark.core.plugin;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Read-only description of what a review run inspects.
 * Shared by every validator of the run.
 */
public class ValidationContext {

    private final Path targetDir;
    private final List<String> targetFiles;
    private final List<String> excludePatterns;
    private final boolean autoFix;
    private final Set<Path> excludedPaths;

    private ValidationContext(Builder builder) {
        this.targetDir = builder.targetDir != null ? builder.targetDir : Paths.get("").toAbsolutePath();
        this.targetFiles = builder.targetFiles != null ? List.copyOf(builder.targetFiles) : List.of();
        this.excludePatterns = builder.excludePatterns != null ? List.copyOf(builder.excludePatterns) : List.of();
        this.autoFix = builder.autoFix;
        this.excludedPaths = Set.copyOf(builder.excludedPaths);
    }

    /** Context for the current working directory with no filters. */
    public static ValidationContext empty() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Path getTargetDir() {
        return targetDir;
    }

    /** Specific files to inspect, relative to the target directory. Empty means the whole directory. */
    public List<String> getTargetFiles() {
        return targetFiles;
    }

    /** Glob patterns of paths to skip. */
    public List<String> getExcludePatterns() {
        return excludePatterns;
    }

    /** Absolute, normalized files that are never inspected, such as the report being written. */
    public Set<Path> getExcludedPaths() {
        return excludedPaths;
    }

    /** Whether validators may fix simple issues in place. */
    public boolean isAutoFix() {
        return autoFix;
    }

    /** Copy of this context with auto-fix switched on or off. */
    public ValidationContext withAutoFix(boolean autoFix) {
        if (autoFix == this.autoFix) {
            return this;
        }
        return builder()
                .targetDir(targetDir)
                .targetFiles(targetFiles)
                .excludePatterns(excludePatterns)
                .autoFix(autoFix)
                .excludedPaths(excludedPaths)
                .build();
    }

    @Override
    public String toString() {
        return "ValidationContext{" +
                "targetDir=" + targetDir +
                ", targetFiles=" + targetFiles +
                ", excludePatterns=" + excludePatterns +
                ", autoFix=" + autoFix +
                '}';
    }

    public static class Builder {
        private Path targetDir;
        private List<String> targetFiles;
        private List<String> excludePatterns;
        private boolean autoFix;
        private final Set<Path> excludedPaths = new HashSet<>();

        public Builder targetDir(Path targetDir) {
            this.targetDir = targetDir;
            return this;
        }

        public Builder targetFiles(List<String> targetFiles) {
            this.targetFiles = targetFiles;
            return this;
        }

        public Builder excludePatterns(List<String> excludePatterns) {
            this.excludePatterns = excludePatterns;
            return this;
        }

        public Builder autoFix(boolean autoFix) {
            this.autoFix = autoFix;
            return this;
        }

        public Builder excludePath(Path path) {
            if (path != null) {
                this.excludedPaths.add(path.toAbsolutePath().normalize());
            }
            return this;
        }

        public Builder excludedPaths(Set<Path> paths) {
            paths.forEach(this::excludePath);
            return this;
        }

        public ValidationContext build() {
            return new ValidationContext(this);
        }
    }
}
