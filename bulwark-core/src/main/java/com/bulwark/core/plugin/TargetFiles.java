package com.bulwark.core.plugin;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileSystems;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Set;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Resolves the files a file-based validator should inspect for a {@link ValidationContext}.
 *
 * <p>
 * With explicit target files, those are used (relative to the target directory).
 * Otherwise the target directory is walked, skipping VCS and build output folders.
 * An exclude pattern matches when it is a glob matching the relative path or the file name,
 * or a plain string contained in the relative path. Files listed in
 * {@link ValidationContext#getExcludedPaths()} are always skipped.
 * </p>
 */
public final class TargetFiles {

    /** Text files larger than this are not read. */
    public static final long MAX_TEXT_FILE_BYTES = 1_048_576;

    private static final Set<String> SKIPPED_DIRECTORIES = Set.of(
            ".git", ".svn", ".hg", ".idea", "node_modules", "target", "build", ".gradle");

    private TargetFiles() {
    }

    public static List<Path> collect(ValidationContext context, Predicate<Path> filter) throws IOException {
        Path root = context.getTargetDir();
        List<String> patterns = context.getExcludePatterns().stream()
                .map(String::trim)
                .filter(p -> !p.isEmpty())
                .collect(Collectors.toList());
        List<PathMatcher> matchers = patterns.stream()
                .map(p -> FileSystems.getDefault().getPathMatcher("glob:" + p))
                .collect(Collectors.toList());

        Predicate<Path> accepted = file -> !context.getExcludedPaths().contains(file.toAbsolutePath().normalize())
                && !isExcluded(root, file, patterns, matchers)
                && filter.test(file);

        List<Path> files = new ArrayList<>();

        if (!context.getTargetFiles().isEmpty()) {
            for (String name : context.getTargetFiles()) {
                Path file = root.resolve(name.trim()).normalize();
                if (Files.isRegularFile(file) && accepted.test(file)) {
                    files.add(file);
                }
            }
            return files;
        }

        if (!Files.isDirectory(root)) {
            return files;
        }

        Files.walkFileTree(root, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                if (!dir.equals(root) && (SKIPPED_DIRECTORIES.contains(String.valueOf(dir.getFileName()))
                        || isExcluded(root, dir, patterns, matchers))) {
                    return FileVisitResult.SKIP_SUBTREE;
                }
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                if (attrs.isRegularFile() && accepted.test(file)) {
                    files.add(file);
                }
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFileFailed(Path file, IOException exc) {
                // unreadable entries are skipped
                return FileVisitResult.CONTINUE;
            }
        });
        return files;
    }

    /** Path relative to the target directory, with forward slashes, for finding locations. */
    public static String relativeLocation(ValidationContext context, Path file) {
        Path root = context.getTargetDir();
        Path relative = file.startsWith(root) ? root.relativize(file) : file;
        return relative.toString().replace('\\', '/');
    }

    /**
     * Lines of a text file, decoded as UTF-8 with malformed input replaced.
     * Files over {@link #MAX_TEXT_FILE_BYTES} yield no lines.
     */
    public static List<String> readLines(Path file) throws IOException {
        if (Files.size(file) > MAX_TEXT_FILE_BYTES) {
            return List.of();
        }
        String content = new String(Files.readAllBytes(file), StandardCharsets.UTF_8);
        return Arrays.asList(content.split("\\r?\\n", -1));
    }

    static boolean isExcluded(Path root, Path path, List<String> patterns, List<PathMatcher> matchers) {
        Path relative = path.startsWith(root) ? root.relativize(path) : path;
        String relativeText = relative.toString().replace('\\', '/');
        for (int i = 0; i < matchers.size(); i++) {
            PathMatcher matcher = matchers.get(i);
            if (matcher.matches(relative)
                    || (relative.getFileName() != null && matcher.matches(relative.getFileName()))
                    || relativeText.contains(patterns.get(i))) {
                return true;
            }
        }
        return false;
    }
}
