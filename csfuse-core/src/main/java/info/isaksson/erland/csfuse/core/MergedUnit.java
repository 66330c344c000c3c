package info.isaksson.erland.csfuse.core;

import info.isaksson.erland.csfuse.syntax.ExternAliasDirective;
import info.isaksson.erland.csfuse.syntax.GlobalAttributeList;
import info.isaksson.erland.csfuse.syntax.MemberDeclaration;
import info.isaksson.erland.csfuse.syntax.UsingDirective;

import java.util.List;
import java.util.Objects;

/** Everything the assembler needs: one root namespace and flat, ordered contents. */
public final class MergedUnit {
    public final String rootNamespace;
    public final List<ExternAliasDirective> externAliases;
    /** Deduplicated and ordered. */
    public final List<UsingDirective> usings;
    public final List<GlobalAttributeList> attributeLists;
    /** Flattened, in collection order. */
    public final List<MemberDeclaration> declarations;

    public MergedUnit(
            String rootNamespace,
            List<ExternAliasDirective> externAliases,
            List<UsingDirective> usings,
            List<GlobalAttributeList> attributeLists,
            List<MemberDeclaration> declarations
    ) {
        this.rootNamespace = Objects.requireNonNull(rootNamespace, "rootNamespace");
        this.externAliases = externAliases == null ? List.of() : List.copyOf(externAliases);
        this.usings = usings == null ? List.of() : List.copyOf(usings);
        this.attributeLists = attributeLists == null ? List.of() : List.copyOf(attributeLists);
        this.declarations = declarations == null ? List.of() : List.copyOf(declarations);
    }
}
