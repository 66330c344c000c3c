package info.isaksson.erland.csfuse.core;

import info.isaksson.erland.csfuse.io.SourceFile;
import info.isaksson.erland.csfuse.io.SourceScanner;
import info.isaksson.erland.csfuse.syntax.CSharpParser;
import info.isaksson.erland.csfuse.syntax.CompilationUnit;
import info.isaksson.erland.csfuse.syntax.UsingDirective;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Core API for fusing a folder of C# sources into one file.
 *
 * <p>CLI and other wrappers should use this class instead of re-implementing the pipeline:
 * scan, read, parse, collect, merge usings, resolve the root namespace, assemble, write.
 * A run is all-or-nothing; the output file is only replaced once everything else
 * succeeded.</p>
 */
public final class FusionService {

    private final CSharpParser parser = new CSharpParser();
    private final UsingMerger usingMerger = new UsingMerger();
    private final RootNamespaceResolver resolver = new RootNamespaceResolver();
    private final TreeAssembler assembler = new TreeAssembler();

    private final Clock clock;
    private final String version;

    public FusionService() {
        this(Clock.systemDefaultZone(), ToolVersion.version());
    }

    /** @param clock source of the banner timestamp */
    public FusionService(Clock clock, String version) {
        this.clock = Objects.requireNonNull(clock, "clock");
        this.version = version == null || version.isBlank() ? ToolVersion.UNKNOWN : version;
    }

    /**
     * Fuse all C# sources under {@code inputDirectory} into {@code outputFile}.
     *
     * @throws NoSuchFileException if {@code inputDirectory} is not a directory
     * @throws info.isaksson.erland.csfuse.syntax.SourceSyntaxException if a source fails to parse
     */
    public FusionResult fuse(Path inputDirectory, Path outputFile, FusionOptions options) throws IOException {
        if (inputDirectory == null) throw new IllegalArgumentException("inputDirectory must not be null");
        if (outputFile == null) throw new IllegalArgumentException("outputFile must not be null");
        if (options == null) options = new FusionOptions();

        if (!Files.isDirectory(inputDirectory)) {
            throw new NoSuchFileException(inputDirectory.toString(), null, "input directory not found");
        }
        Path output = outputFile.toAbsolutePath().normalize();

        List<Path> files = SourceScanner.scan(
                inputDirectory,
                options.recursive,
                options.excludeGeneratedFiles,
                options.excludeBuildOutput,
                options.excludeGlobs,
                output);

        List<SourceFile> sources = new ArrayList<>(files.size());
        for (Path f : files) {
            sources.add(SourceFile.read(f));
        }

        FusionResult result = fuseSources(inputDirectory, sources, options);
        writeReplacing(output, result.outputText);
        return result.withOutputFile(output);
    }

    /**
     * Run the in-memory part of the pipeline on already-read sources. Nothing is written.
     *
     * @param sourceRoot used to relativize paths in the per-file summaries, may be null
     */
    public FusionResult fuseSources(Path sourceRoot, List<SourceFile> sources, FusionOptions options) {
        if (sources == null) throw new IllegalArgumentException("sources must not be null");
        if (options == null) options = new FusionOptions();

        MemberCollector collector = new MemberCollector(options.addFileHeaders);
        CollectedMembers collected = new CollectedMembers();
        List<FileSummary> summaries = new ArrayList<>();
        List<Path> paths = new ArrayList<>();

        for (SourceFile source : sources) {
            String name = relativeName(sourceRoot, source.path);
            CompilationUnit unit = parser.parse(source.text, name);

            int members = collected.declarations.size();
            int usings = collected.usings.size();
            int namespaces = collected.namespaceNames.size();
            collector.collect(new ParsedUnit(source, unit), collected);

            summaries.add(new FileSummary(
                    name,
                    collected.namespaceNames.subList(namespaces, collected.namespaceNames.size()),
                    collected.declarations.size() - members,
                    collected.usings.size() - usings));
            paths.add(source.path);
        }

        String rootNamespace = resolver.resolve(collected.namespaceNames, options.forcedRootNamespace);
        List<UsingDirective> usings = usingMerger.merge(collected.usings);
        MergedUnit merged = new MergedUnit(
                rootNamespace,
                UsingMerger.firstOccurrences(collected.externAliases),
                usings,
                UsingMerger.firstOccurrences(collected.attributeLists),
                collected.declarations);

        LocalDateTime now = LocalDateTime.now(clock);
        String text = assembler.render(merged, version, now);

        return new FusionResult(
                paths,
                collected.usings.size(),
                collected.namespaceNames,
                summaries,
                merged,
                text,
                null,
                version,
                now);
    }

    /** Write via a temporary sibling so a failed write never leaves a partial file behind. */
    private static void writeReplacing(Path output, String text) throws IOException {
        Path dir = output.getParent();
        if (dir != null) Files.createDirectories(dir);

        Path tmp = Files.createTempFile(dir, ".csfuse-", ".tmp");
        try {
            Files.writeString(tmp, text, StandardCharsets.UTF_8);
            try {
                Files.move(tmp, output, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, output, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            try {
                Files.deleteIfExists(tmp);
            } catch (IOException cleanup) {
                e.addSuppressed(cleanup);
            }
            throw e;
        }
    }

    private static String relativeName(Path root, Path file) {
        if (root == null) return file.toString().replace('\\', '/');
        try {
            return root.toAbsolutePath().normalize()
                    .relativize(file.toAbsolutePath().normalize())
                    .toString().replace('\\', '/');
        } catch (IllegalArgumentException e) {
            return file.toString().replace('\\', '/');
        }
    }
}
