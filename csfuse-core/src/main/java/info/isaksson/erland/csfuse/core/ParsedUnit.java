package info.isaksson.erland.csfuse.core;

import info.isaksson.erland.csfuse.io.SourceFile;
import info.isaksson.erland.csfuse.syntax.CompilationUnit;

import java.util.Objects;

/** A source file together with its parsed compilation unit. */
public final class ParsedUnit {
    public final SourceFile sourceFile;
    public final CompilationUnit root;

    public ParsedUnit(SourceFile sourceFile, CompilationUnit root) {
        this.sourceFile = Objects.requireNonNull(sourceFile, "sourceFile");
        this.root = Objects.requireNonNull(root, "root");
    }
}
