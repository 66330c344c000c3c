package info.isaksson.erland.csfuse.syntax;

import java.util.List;

/**
 * Renders a token run with all trivia dropped and single spaces only where the tokens
 * need one. Two directives with the same canonical text are interchangeable.
 */
public final class CanonicalText {

    private CanonicalText() {}

    public static String of(List<Token> tokens) {
        StringBuilder sb = new StringBuilder();
        Token prev = null;
        for (Token t : tokens) {
            if (t.kind == TokenKind.EOF) continue;
            if (prev != null && needsSpace(prev, t)) sb.append(' ');
            sb.append(t.text);
            prev = t;
        }
        return sb.toString();
    }

    private static boolean needsSpace(Token a, Token b) {
        if (a.isWordLike() && b.isWordLike()) return true;
        if (a.is("=") || b.is("=") || a.is("=>") || b.is("=>")) return true;
        return a.is(",") || a.is(":");
    }
}
