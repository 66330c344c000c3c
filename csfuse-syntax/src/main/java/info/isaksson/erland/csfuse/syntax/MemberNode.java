package info.isaksson.erland.csfuse.syntax;

import java.util.List;

/** Anything that can appear in a compilation unit or namespace body. */
public abstract class MemberNode {

    /** Comments, directives and line breaks preceding the member. */
    public final List<Trivia> leadingTrivia;

    protected MemberNode(List<Trivia> leadingTrivia) {
        this.leadingTrivia = leadingTrivia == null ? List.of() : List.copyOf(leadingTrivia);
    }
}
