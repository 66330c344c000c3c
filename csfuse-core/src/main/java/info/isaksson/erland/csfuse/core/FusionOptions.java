package info.isaksson.erland.csfuse.core;

import java.util.ArrayList;
import java.util.List;

/**
 * Options for one fusion run.
 *
 * <p>Mirrors the CLI flags in a structured form.</p>
 */
public final class FusionOptions {
    /** If non-blank, used as the root namespace instead of inferring one. */
    public String forcedRootNamespace;

    /** Adds "// ===== From: File.cs =====" above each declaration. */
    public boolean addFileHeaders = true;

    public boolean recursive = true;

    /** Skip *.g.cs, *.designer.cs and *.AssemblyInfo.cs. */
    public boolean excludeGeneratedFiles = true;

    /** Skip anything under a bin/ or obj/ folder. */
    public boolean excludeBuildOutput = true;

    /** Glob patterns relative to the input directory, '/' separated. */
    public List<String> excludeGlobs = new ArrayList<>();
}
