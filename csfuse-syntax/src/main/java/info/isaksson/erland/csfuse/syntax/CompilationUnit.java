package info.isaksson.erland.csfuse.syntax;

import java.util.List;

/** Root of a parsed C# file. */
public final class CompilationUnit {

    public final List<ExternAliasDirective> externAliases;
    public final List<UsingDirective> usings;
    public final List<GlobalAttributeList> attributeLists;
    public final List<MemberNode> members;
    /** Trivia after the last token of the file. */
    public final List<Trivia> endOfFileTrivia;

    public CompilationUnit(
            List<ExternAliasDirective> externAliases,
            List<UsingDirective> usings,
            List<GlobalAttributeList> attributeLists,
            List<? extends MemberNode> members,
            List<Trivia> endOfFileTrivia
    ) {
        this.externAliases = externAliases == null ? List.of() : List.copyOf(externAliases);
        this.usings = usings == null ? List.of() : List.copyOf(usings);
        this.attributeLists = attributeLists == null ? List.of() : List.copyOf(attributeLists);
        this.members = members == null ? List.of() : List.copyOf(members);
        this.endOfFileTrivia = endOfFileTrivia == null ? List.of() : List.copyOf(endOfFileTrivia);
    }

    /** True when the file declares nothing at all (only trivia). */
    public boolean isEmpty() {
        return externAliases.isEmpty() && usings.isEmpty() && attributeLists.isEmpty() && members.isEmpty();
    }
}
