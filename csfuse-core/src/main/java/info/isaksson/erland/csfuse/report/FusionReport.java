package info.isaksson.erland.csfuse.report;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import info.isaksson.erland.csfuse.core.FileSummary;
import info.isaksson.erland.csfuse.core.FusionResult;
import info.isaksson.erland.csfuse.core.GenerationBanner;
import info.isaksson.erland.csfuse.core.ToolVersion;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * JSON view of one fusion run.
 *
 * <p>Paths are '/' separated. {@code outputFile} is omitted when the run did not write a file.</p>
 */
@JsonPropertyOrder({
        "tool", "version", "generatedAt", "inputDirectory", "outputFile", "rootNamespace",
        "namespaces", "filesProcessed", "membersEmitted", "usingsCollected", "usingsEmitted", "files"
})
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class FusionReport {

    public final String tool;
    public final String version;
    /** {@code yyyy-MM-dd HH:mm:ss}, the same timestamp as the banner. */
    public final String generatedAt;
    public final String inputDirectory;
    public final String outputFile;
    public final String rootNamespace;
    /** Distinct namespace names in encounter order. */
    public final List<String> namespaces;
    public final int filesProcessed;
    public final int membersEmitted;
    public final int usingsCollected;
    public final int usingsEmitted;
    public final List<FileEntry> files;

    @JsonPropertyOrder({"path", "namespaces", "members", "usings"})
    public static final class FileEntry {
        public final String path;
        public final List<String> namespaces;
        public final int members;
        public final int usings;

        FileEntry(String path, List<String> namespaces, int members, int usings) {
            this.path = path;
            this.namespaces = namespaces;
            this.members = members;
            this.usings = usings;
        }
    }

    private FusionReport(FusionResult result, Path inputDirectory) {
        this.tool = ToolVersion.TOOL_NAME;
        this.version = result.version;
        this.generatedAt = result.generatedAt == null ? null : GenerationBanner.TIMESTAMP.format(result.generatedAt);
        this.inputDirectory = inputDirectory == null ? null : slashes(inputDirectory.toAbsolutePath().normalize());
        this.outputFile = result.outputFile == null ? null : slashes(result.outputFile);
        this.rootNamespace = result.rootNamespace;
        this.namespaces = distinct(result.namespaceNames);
        this.filesProcessed = result.sourceFiles.size();
        this.membersEmitted = result.membersEmitted;
        this.usingsCollected = result.usingsCollected;
        this.usingsEmitted = result.usingsEmitted;

        List<FileEntry> entries = new ArrayList<>();
        for (FileSummary f : result.files) {
            entries.add(new FileEntry(f.path, distinct(f.namespaces), f.members, f.usings));
        }
        this.files = List.copyOf(entries);
    }

    public static FusionReport from(FusionResult result, Path inputDirectory) {
        if (result == null) throw new IllegalArgumentException("result is null");
        return new FusionReport(result, inputDirectory);
    }

    private static List<String> distinct(List<String> names) {
        List<String> out = new ArrayList<>();
        for (String n : names) {
            if (!out.contains(n)) out.add(n);
        }
        return List.copyOf(out);
    }

    private static String slashes(Path p) {
        return p.toString().replace('\\', '/');
    }
}
