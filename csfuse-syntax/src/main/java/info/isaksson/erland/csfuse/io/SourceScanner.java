package info.isaksson.erland.csfuse.io;

import java.io.IOException;
import java.nio.file.FileSystem;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.function.Predicate;
import java.util.stream.Stream;

/**
 * Deterministic C# source discovery with exclude rules.
 *
 * The scanner returns a stable list of .cs files under a source root, sorted by their
 * '/'-separated path relative to the root.
 */
public final class SourceScanner {

    /** File name suffixes of tool-generated sources (compared case-insensitively). */
    public static final List<String> GENERATED_SUFFIXES = List.of(".g.cs", ".designer.cs", ".assemblyinfo.cs");

    /** .NET build output folders; they only hold generated sources. */
    private static final List<String> BUILD_DIRS = List.of("bin", "obj");

    private SourceScanner() {}

    /**
     * Scan for .cs files under {@code sourceRoot}.
     *
     * @param sourceRoot root folder to scan
     * @param recursive whether to descend into subfolders
     * @param excludeGenerated whether to skip files named like generated sources
     * @param excludeBuildOutput whether to skip everything below a bin/ or obj/ folder
     * @param excludeGlobs glob patterns matched against the path relative to sourceRoot, using '/' separators
     * @param excludedFile a file that must never be returned (typically the fusion output), may be null
     */
    public static List<Path> scan(
            Path sourceRoot,
            boolean recursive,
            boolean excludeGenerated,
            boolean excludeBuildOutput,
            List<String> excludeGlobs,
            Path excludedFile
    ) throws IOException {
        Objects.requireNonNull(sourceRoot, "sourceRoot");

        final List<Predicate<Path>> excludeMatchers = compileExcludeMatchers(excludeGlobs);
        final String excluded = excludedFile == null ? null : excludedFile.toAbsolutePath().normalize().toString();

        try (Stream<Path> stream = Files.walk(sourceRoot, recursive ? Integer.MAX_VALUE : 1)) {
            List<Path> out = new ArrayList<>();
            stream
                .filter(Files::isRegularFile)
                .filter(p -> p.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".cs"))
                .filter(p -> !excludeGenerated || !isGenerated(p))
                .filter(p -> !excludeBuildOutput || !isBuildOutput(sourceRoot, p))
                .filter(p -> !matchesAny(sourceRoot, p, excludeMatchers))
                .filter(p -> excluded == null || !p.toAbsolutePath().normalize().toString().equalsIgnoreCase(excluded))
                .forEach(out::add);

            // Stable deterministic ordering (relative path)
            out.sort(Comparator.comparing(p -> normalizeRel(sourceRoot, p)));
            return out;
        }
    }

    static boolean isGenerated(Path file) {
        String name = file.getFileName().toString().toLowerCase(Locale.ROOT);
        for (String suffix : GENERATED_SUFFIXES) {
            if (name.endsWith(suffix)) return true;
        }
        return false;
    }

    /** True for files below a bin/ or obj/ folder, at any depth under {@code root}. */
    static boolean isBuildOutput(Path root, Path file) {
        Path parent = root.relativize(file).getParent();
        if (parent == null) return false;
        for (Path segment : parent) {
            if (BUILD_DIRS.contains(segment.toString().toLowerCase(Locale.ROOT))) return true;
        }
        return false;
    }

    private static boolean matchesAny(Path root, Path absolutePath, List<Predicate<Path>> matchers) {
        if (matchers.isEmpty()) return false;
        final Path rel = root.relativize(absolutePath);
        for (Predicate<Path> m : matchers) {
            if (m.test(rel)) return true;
        }
        return false;
    }

    private static List<Predicate<Path>> compileExcludeMatchers(List<String> excludeGlobs) {
        if (excludeGlobs == null || excludeGlobs.isEmpty()) return Collections.emptyList();

        FileSystem fs = FileSystems.getDefault();
        List<Predicate<Path>> out = new ArrayList<>();
        for (String raw : excludeGlobs) {
            if (raw == null) continue;
            String pattern = raw.trim();
            if (pattern.isEmpty()) continue;

            // Normalize to use forward slashes to be consistent across OSes.
            pattern = pattern.replace("\\", "/");

            if (pattern.endsWith("/")) pattern = pattern + "**";

            final var matcher = fs.getPathMatcher("glob:" + pattern);
            // A pattern without wildcards names a file or a folder: exclude both.
            if (!pattern.contains("*") && !pattern.contains("?") && !pattern.contains("[")) {
                final var under = fs.getPathMatcher("glob:" + pattern + "/**");
                out.add(p -> {
                    Path rel = Path.of(normalizePathString(p));
                    return matcher.matches(rel) || under.matches(rel);
                });
            } else {
                out.add(p -> matcher.matches(Path.of(normalizePathString(p))));
            }
        }
        return out;
    }

    private static String normalizeRel(Path root, Path p) {
        return normalizePathString(root.relativize(p));
    }

    private static String normalizePathString(Path p) {
        return p.toString().replace("\\", "/");
    }
}
