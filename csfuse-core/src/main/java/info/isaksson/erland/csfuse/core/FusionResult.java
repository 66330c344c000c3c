package info.isaksson.erland.csfuse.core;

import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.List;

/** Result of a fusion run. */
public final class FusionResult {
    public final String rootNamespace;
    /** Input files in fusion order. */
    public final List<Path> sourceFiles;
    public final int membersEmitted;
    /** Usings found before deduplication. */
    public final int usingsCollected;
    public final int usingsEmitted;
    /** Every namespace name observed, in encounter order. */
    public final List<String> namespaceNames;
    public final List<FileSummary> files;
    public final MergedUnit mergedUnit;
    /** Complete output, banner included. */
    public final String outputText;
    /** Where the output was written; null when the run did not write a file. */
    public final Path outputFile;
    public final String version;
    public final LocalDateTime generatedAt;

    FusionResult(
            List<Path> sourceFiles,
            int usingsCollected,
            List<String> namespaceNames,
            List<FileSummary> files,
            MergedUnit mergedUnit,
            String outputText,
            Path outputFile,
            String version,
            LocalDateTime generatedAt
    ) {
        this.rootNamespace = mergedUnit.rootNamespace;
        this.sourceFiles = List.copyOf(sourceFiles);
        this.membersEmitted = mergedUnit.declarations.size();
        this.usingsCollected = usingsCollected;
        this.usingsEmitted = mergedUnit.usings.size();
        this.namespaceNames = List.copyOf(namespaceNames);
        this.files = List.copyOf(files);
        this.mergedUnit = mergedUnit;
        this.outputText = outputText;
        this.outputFile = outputFile;
        this.version = version;
        this.generatedAt = generatedAt;
    }

    FusionResult withOutputFile(Path file) {
        return new FusionResult(sourceFiles, usingsCollected, namespaceNames, files, mergedUnit,
                outputText, file, version, generatedAt);
    }
}
