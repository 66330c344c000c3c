package info.isaksson.erland.csfuse.syntax;

import java.util.Objects;

/**
 * A piece of trivia (whitespace, line break, comment or directive).
 *
 * <p>{@code column} is the 0-based column the trivia started at in its source, with tabs
 * expanded to multiples of {@link SourceColumns#TAB_WIDTH}. Synthetic trivia uses column 0.</p>
 */
public final class Trivia {
    public final TriviaKind kind;
    public final String text;
    public final int column;

    public Trivia(TriviaKind kind, String text, int column) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.text = Objects.requireNonNull(text, "text");
        this.column = column;
    }

    public static Trivia comment(String text) {
        return new Trivia(TriviaKind.SINGLE_LINE_COMMENT, text, 0);
    }

    public static Trivia endOfLine() {
        return new Trivia(TriviaKind.END_OF_LINE, "\n", 0);
    }

    @Override
    public String toString() {
        return kind + "(" + text + ")";
    }
}
