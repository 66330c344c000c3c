package info.isaksson.erland.csfuse.core;

import java.util.List;

/** What one input file contributed to the fused output. */
public final class FileSummary {
    /** Path relative to the input directory, '/' separated. */
    public final String path;
    public final List<String> namespaces;
    public final int members;
    public final int usings;

    FileSummary(String path, List<String> namespaces, int members, int usings) {
        this.path = path;
        this.namespaces = List.copyOf(namespaces);
        this.members = members;
        this.usings = usings;
    }
}
