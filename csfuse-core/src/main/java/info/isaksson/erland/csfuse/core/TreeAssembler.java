package info.isaksson.erland.csfuse.core;

import info.isaksson.erland.csfuse.syntax.CSharpFormatter;
import info.isaksson.erland.csfuse.syntax.CompilationUnit;
import info.isaksson.erland.csfuse.syntax.NamespaceDeclaration;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Builds the output tree (usings at the top, one block namespace holding every declaration)
 * and renders it with the banner in front.
 */
public final class TreeAssembler {

    private final CSharpFormatter formatter;

    public TreeAssembler() {
        this(new CSharpFormatter());
    }

    public TreeAssembler(CSharpFormatter formatter) {
        this.formatter = formatter;
    }

    public CompilationUnit assemble(MergedUnit merged) {
        NamespaceDeclaration root = NamespaceDeclaration.block(merged.rootNamespace, merged.declarations);
        return new CompilationUnit(
                merged.externAliases,
                merged.usings,
                merged.attributeLists,
                List.of(root),
                List.of());
    }

    /** Banner, then the formatted tree. */
    public String render(MergedUnit merged, String version, LocalDateTime generatedAt) {
        return GenerationBanner.render(version, generatedAt) + "\n" + formatter.format(assemble(merged));
    }
}
