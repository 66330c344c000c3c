package info.isaksson.erland.csfuse.syntax;

import java.util.List;
import java.util.Objects;

/** {@code namespace A.B { ... }} or the file-scoped {@code namespace A.B;}. */
public final class NamespaceDeclaration extends MemberNode {

    public final String name;
    public final boolean fileScoped;
    public final List<ExternAliasDirective> externAliases;
    public final List<UsingDirective> usings;
    public final List<MemberNode> members;
    /** Trivia in front of the closing brace (always empty for file-scoped namespaces). */
    public final List<Trivia> closingTrivia;

    public NamespaceDeclaration(
            List<Trivia> leadingTrivia,
            String name,
            boolean fileScoped,
            List<ExternAliasDirective> externAliases,
            List<UsingDirective> usings,
            List<MemberNode> members,
            List<Trivia> closingTrivia
    ) {
        super(leadingTrivia);
        this.name = Objects.requireNonNull(name, "name");
        this.fileScoped = fileScoped;
        this.externAliases = externAliases == null ? List.of() : List.copyOf(externAliases);
        this.usings = usings == null ? List.of() : List.copyOf(usings);
        this.members = members == null ? List.of() : List.copyOf(members);
        this.closingTrivia = closingTrivia == null ? List.of() : List.copyOf(closingTrivia);
    }

    /** A block namespace without trivia or directives. */
    public static NamespaceDeclaration block(String name, List<? extends MemberNode> members) {
        return new NamespaceDeclaration(List.of(), name, false, List.of(), List.of(), List.copyOf(members), List.of());
    }

    @Override
    public String toString() {
        return "namespace " + name + (fileScoped ? ";" : " {" + members.size() + "}");
    }
}
