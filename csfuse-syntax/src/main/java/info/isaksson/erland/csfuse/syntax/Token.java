package info.isaksson.erland.csfuse.syntax;

import java.util.List;

/**
 * A lexed token with its trivia.
 *
 * <p>Trailing trivia runs up to and including the end of the token's line; everything
 * else before the next token is that token's leading trivia.</p>
 */
public final class Token {
    public final TokenKind kind;
    public final String text;
    /** Offset of the first character in the source. */
    public final int start;
    /** Offset just past the last character in the source. */
    public final int end;
    public final List<Trivia> leadingTrivia;
    public final List<Trivia> trailingTrivia;

    public Token(TokenKind kind, String text, int start, int end, List<Trivia> leadingTrivia, List<Trivia> trailingTrivia) {
        this.kind = kind;
        this.text = text;
        this.start = start;
        this.end = end;
        this.leadingTrivia = leadingTrivia == null ? List.of() : List.copyOf(leadingTrivia);
        this.trailingTrivia = trailingTrivia == null ? List.of() : List.copyOf(trailingTrivia);
    }

    public boolean is(String lexeme) {
        return (kind == TokenKind.IDENTIFIER || kind == TokenKind.PUNCTUATION) && text.equals(lexeme);
    }

    public boolean isIdentifier() {
        return kind == TokenKind.IDENTIFIER;
    }

    /** Identifiers, literals: tokens that need a separating space from one another. */
    boolean isWordLike() {
        return kind == TokenKind.IDENTIFIER || kind == TokenKind.NUMBER
                || kind == TokenKind.STRING || kind == TokenKind.CHAR;
    }

    @Override
    public String toString() {
        return kind + "(" + text + ")@" + start;
    }
}
