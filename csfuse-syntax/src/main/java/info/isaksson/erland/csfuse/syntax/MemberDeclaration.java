package info.isaksson.erland.csfuse.syntax;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * An opaque top-level construct: a type declaration, a delegate or a top-level statement.
 *
 * <p>The body is kept as source text starting at the first token (attributes included) and
 * ending after the last token plus any comment on that same line. Line endings are
 * normalized to {@code \n}. Instances are immutable; decoration returns a copy.</p>
 */
public final class MemberDeclaration extends MemberNode {

    public final DeclarationKind kind;
    /** Declared type name, or null for statements. */
    public final String name;
    public final String text;
    /** Source column of the first character of {@link #text}; continuation lines are indented relative to it. */
    public final int column;
    /**
     * Line indexes (0-based, within {@link #text}) that start inside a multi-line string
     * literal. Their content is significant and must not be re-indented.
     */
    public final List<Integer> verbatimLines;
    /** Trivia written on the lines right after the body; the parser never fills it. */
    public final List<Trivia> trailingTrivia;

    public MemberDeclaration(
            List<Trivia> leadingTrivia,
            DeclarationKind kind,
            String name,
            String text,
            int column,
            List<Integer> verbatimLines
    ) {
        this(leadingTrivia, kind, name, text, column, verbatimLines, List.of());
    }

    public MemberDeclaration(
            List<Trivia> leadingTrivia,
            DeclarationKind kind,
            String name,
            String text,
            int column,
            List<Integer> verbatimLines,
            List<Trivia> trailingTrivia
    ) {
        super(leadingTrivia);
        this.kind = Objects.requireNonNull(kind, "kind");
        this.name = name;
        this.text = Objects.requireNonNull(text, "text");
        this.column = column;
        this.verbatimLines = verbatimLines == null ? List.of() : List.copyOf(verbatimLines);
        this.trailingTrivia = trailingTrivia == null ? List.of() : List.copyOf(trailingTrivia);
    }

    /** Copy with {@code comment} placed on its own line ahead of the existing leading trivia. */
    public MemberDeclaration withLeadingComment(String comment) {
        List<Trivia> trivia = new ArrayList<>(leadingTrivia.size() + 2);
        trivia.add(Trivia.comment(comment));
        trivia.add(Trivia.endOfLine());
        trivia.addAll(leadingTrivia);
        return new MemberDeclaration(trivia, kind, name, text, column, verbatimLines, trailingTrivia);
    }

    /** Copy with both trivia lists replaced. */
    public MemberDeclaration withTrivia(List<Trivia> leading, List<Trivia> trailing) {
        return new MemberDeclaration(leading, kind, name, text, column, verbatimLines, trailing);
    }

    public List<String> lines() {
        return List.of(text.split("\n", -1));
    }

    @Override
    public String toString() {
        return kind + (name == null ? "" : " " + name);
    }
}
