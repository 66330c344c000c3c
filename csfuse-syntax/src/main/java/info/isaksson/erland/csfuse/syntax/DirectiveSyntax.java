package info.isaksson.erland.csfuse.syntax;

import java.util.ArrayList;
import java.util.List;

/** Base for single-statement directives that are compared by their canonical text. */
public abstract class DirectiveSyntax {

    /** Tokens from the first keyword through the closing {@code ;} or {@code ]}. */
    public final List<Token> tokens;

    protected DirectiveSyntax(List<Token> tokens) {
        if (tokens == null || tokens.isEmpty()) throw new IllegalArgumentException("tokens must not be empty");
        this.tokens = List.copyOf(tokens);
    }

    public final String canonicalText() {
        return CanonicalText.of(tokens);
    }

    public List<Trivia> leadingTrivia() {
        return tokens.get(0).leadingTrivia;
    }

    /** Preprocessor directives found in the leading trivia of any of the tokens, in source order. */
    public List<Trivia> preprocessorDirectives() {
        List<Trivia> out = new ArrayList<>();
        for (Token t : tokens) {
            for (Trivia trivia : t.leadingTrivia) {
                if (trivia.kind == TriviaKind.DIRECTIVE) out.add(trivia);
            }
        }
        return out;
    }

    @Override
    public String toString() {
        return canonicalText();
    }
}
