package info.isaksson.erland.csfuse.syntax;

import java.util.ArrayList;
import java.util.List;

/**
 * Structural lexer for C# source text.
 *
 * <p>Produces identifiers, numbers, string and char literals and punctuation, each with
 * leading and trailing trivia. It knows enough of the literal grammar (verbatim,
 * interpolated with nested holes, raw string literals) that braces inside literals and
 * comments never reach the parser. Keywords are reported as identifiers.</p>
 *
 * <p>Multi-character operators are not combined except {@code ::} and {@code =>}.</p>
 */
public final class CSharpLexer {

    private final String sourceName;

    public CSharpLexer() {
        this(null);
    }

    /** @param sourceName file name used in syntax error messages (may be null) */
    public CSharpLexer(String sourceName) {
        this.sourceName = sourceName;
    }

    /**
     * Tokenize {@code input}. The returned list always ends with an {@link TokenKind#EOF}
     * token carrying the trivia that follows the last real token.
     *
     * @throws SourceSyntaxException on unterminated literals or comments
     */
    public List<Token> lex(String input) {
        if (input == null) throw new IllegalArgumentException("input is null");
        return new Run(input).tokens();
    }

    private final class Run {
        private final String in;
        private final int n;
        private int pos;

        Run(String in) {
            this.in = in;
            this.n = in.length();
            // byte order mark
            this.pos = (n > 0 && in.charAt(0) == '\uFEFF') ? 1 : 0;
        }

        List<Token> tokens() {
            List<Token> out = new ArrayList<>();
            while (true) {
                List<Trivia> leading = leadingTrivia();
                if (pos >= n) {
                    out.add(new Token(TokenKind.EOF, "", n, n, leading, List.of()));
                    return out;
                }
                int start = pos;
                TokenKind kind = scanToken();
                int end = pos;
                List<Trivia> trailing = trailingTrivia();
                out.add(new Token(kind, in.substring(start, end), start, end, leading, trailing));
            }
        }

        private List<Trivia> leadingTrivia() {
            List<Trivia> out = new ArrayList<>();
            while (pos < n) {
                char c = in.charAt(pos);
                if (c == '\r' || c == '\n') {
                    out.add(endOfLine());
                } else if (isInlineWhitespace(c)) {
                    out.add(whitespace());
                } else if (c == '#' && onlyWhitespaceBefore(pos)) {
                    out.add(directive());
                } else if (c == '/' && peek(1) == '/') {
                    out.add(lineComment());
                } else if (c == '/' && peek(1) == '*') {
                    out.add(blockComment());
                } else {
                    break;
                }
            }
            return out;
        }

        private List<Trivia> trailingTrivia() {
            List<Trivia> out = new ArrayList<>();
            while (pos < n) {
                char c = in.charAt(pos);
                if (c == '\r' || c == '\n') {
                    out.add(endOfLine());
                    break;
                } else if (isInlineWhitespace(c)) {
                    out.add(whitespace());
                } else if (c == '/' && peek(1) == '/') {
                    out.add(lineComment());
                } else if (c == '/' && peek(1) == '*') {
                    out.add(blockComment());
                } else {
                    break;
                }
            }
            return out;
        }

        private Trivia endOfLine() {
            int start = pos;
            if (in.charAt(pos) == '\r' && peek(1) == '\n') {
                pos += 2;
            } else {
                pos++;
            }
            return new Trivia(TriviaKind.END_OF_LINE, in.substring(start, pos), SourceColumns.columnOf(in, start));
        }

        private Trivia whitespace() {
            int start = pos;
            while (pos < n && isInlineWhitespace(in.charAt(pos))) pos++;
            return new Trivia(TriviaKind.WHITESPACE, in.substring(start, pos), SourceColumns.columnOf(in, start));
        }

        private Trivia directive() {
            int start = pos;
            pos = endOfLineOffset(pos);
            return new Trivia(TriviaKind.DIRECTIVE, in.substring(start, pos), SourceColumns.columnOf(in, start));
        }

        private Trivia lineComment() {
            int start = pos;
            pos = endOfLineOffset(pos);
            String text = in.substring(start, pos);
            TriviaKind kind = text.startsWith("///") && !text.startsWith("////")
                    ? TriviaKind.DOC_COMMENT
                    : TriviaKind.SINGLE_LINE_COMMENT;
            return new Trivia(kind, text, SourceColumns.columnOf(in, start));
        }

        private Trivia blockComment() {
            int start = pos;
            int close = in.indexOf("*/", pos + 2);
            if (close < 0) {
                throw SourceSyntaxException.at(sourceName, in, start, "unterminated comment");
            }
            pos = close + 2;
            return new Trivia(TriviaKind.MULTI_LINE_COMMENT, in.substring(start, pos), SourceColumns.columnOf(in, start));
        }

        private TokenKind scanToken() {
            char c = in.charAt(pos);

            int stringEnd = stringLiteralEnd(pos);
            if (stringEnd >= 0) {
                pos = stringEnd;
                return TokenKind.STRING;
            }
            if (c == '\'') {
                pos = charLiteralEnd(pos);
                return TokenKind.CHAR;
            }
            if (c == '@' && isIdentifierStart(peek(1))) {
                pos++;
                scanIdentifierRest();
                return TokenKind.IDENTIFIER;
            }
            if (isIdentifierStart(c)) {
                scanIdentifierRest();
                return TokenKind.IDENTIFIER;
            }
            if (Character.isDigit(c) || (c == '.' && Character.isDigit(peek(1)))) {
                pos++;
                while (pos < n) {
                    char ch = in.charAt(pos);
                    if (Character.isLetterOrDigit(ch) || ch == '_' || (ch == '.' && Character.isDigit(peek(1)))) {
                        pos++;
                    } else {
                        break;
                    }
                }
                return TokenKind.NUMBER;
            }
            if ((c == ':' && peek(1) == ':') || (c == '=' && peek(1) == '>')) {
                pos += 2;
                return TokenKind.PUNCTUATION;
            }
            pos++;
            return TokenKind.PUNCTUATION;
        }

        private void scanIdentifierRest() {
            pos++;
            while (pos < n && isIdentifierPart(in.charAt(pos))) pos++;
        }

        /**
         * End offset of the string literal starting at {@code i}, or -1 if no string literal
         * starts there. Handles {@code "..."}, {@code @"..."}, {@code $"..."}, {@code $@"..."},
         * {@code @$"..."} and raw literals with any number of leading {@code $}.
         */
        private int stringLiteralEnd(int i) {
            int j = i;
            int dollars = 0;
            boolean verbatim = false;
            while (j < n) {
                char ch = in.charAt(j);
                if (ch == '$') {
                    dollars++;
                } else if (ch == '@' && !verbatim) {
                    verbatim = true;
                } else {
                    break;
                }
                j++;
            }
            if (j >= n || in.charAt(j) != '"') return -1;

            boolean interpolated = dollars > 0;
            if (!verbatim && in.startsWith("\"\"\"", j)) {
                return rawStringEnd(i, j);
            }
            if (verbatim) {
                return verbatimStringEnd(i, j + 1, interpolated);
            }
            return regularStringEnd(i, j + 1, interpolated);
        }

        private int rawStringEnd(int literalStart, int quotes) {
            int open = 0;
            while (quotes + open < n && in.charAt(quotes + open) == '"') open++;
            int p = quotes + open;
            while (p < n) {
                if (in.charAt(p) == '"') {
                    int run = 0;
                    while (p + run < n && in.charAt(p + run) == '"') run++;
                    if (run >= open) return p + run;
                    p += run;
                } else {
                    p++;
                }
            }
            throw SourceSyntaxException.at(sourceName, in, literalStart, "unterminated raw string literal");
        }

        private int regularStringEnd(int literalStart, int p, boolean interpolated) {
            while (p < n) {
                char ch = in.charAt(p);
                if (ch == '\\') {
                    p += 2;
                    continue;
                }
                if (ch == '"') return p + 1;
                if (ch == '\r' || ch == '\n') {
                    throw SourceSyntaxException.at(sourceName, in, literalStart, "newline in string literal");
                }
                if (interpolated && ch == '{') {
                    if (peekAt(p + 1) == '{') {
                        p += 2;
                    } else {
                        p = interpolationHoleEnd(literalStart, p + 1);
                    }
                    continue;
                }
                p++;
            }
            throw SourceSyntaxException.at(sourceName, in, literalStart, "unterminated string literal");
        }

        private int verbatimStringEnd(int literalStart, int p, boolean interpolated) {
            while (p < n) {
                char ch = in.charAt(p);
                if (ch == '"') {
                    if (peekAt(p + 1) == '"') {
                        p += 2;
                        continue;
                    }
                    return p + 1;
                }
                if (interpolated && ch == '{') {
                    if (peekAt(p + 1) == '{') {
                        p += 2;
                    } else {
                        p = interpolationHoleEnd(literalStart, p + 1);
                    }
                    continue;
                }
                p++;
            }
            throw SourceSyntaxException.at(sourceName, in, literalStart, "unterminated verbatim string literal");
        }

        /** {@code p} is just past the opening brace; returns the offset just past the closing one. */
        private int interpolationHoleEnd(int literalStart, int p) {
            int depth = 1;
            while (p < n) {
                int nested = stringLiteralEnd(p);
                if (nested >= 0) {
                    p = nested;
                    continue;
                }
                char ch = in.charAt(p);
                if (ch == '\'') {
                    p = charLiteralEnd(p);
                    continue;
                }
                if (ch == '{') {
                    depth++;
                } else if (ch == '}') {
                    depth--;
                    if (depth == 0) return p + 1;
                }
                p++;
            }
            throw SourceSyntaxException.at(sourceName, in, literalStart, "unterminated interpolated string literal");
        }

        private int charLiteralEnd(int i) {
            int p = i + 1;
            while (p < n) {
                char ch = in.charAt(p);
                if (ch == '\\') {
                    p += 2;
                    continue;
                }
                if (ch == '\'') return p + 1;
                if (ch == '\r' || ch == '\n') break;
                p++;
            }
            throw SourceSyntaxException.at(sourceName, in, i, "unterminated character literal");
        }

        private int endOfLineOffset(int from) {
            int p = from;
            while (p < n && in.charAt(p) != '\n' && in.charAt(p) != '\r') p++;
            return p;
        }

        private boolean onlyWhitespaceBefore(int offset) {
            int p = offset - 1;
            while (p >= 0) {
                char ch = in.charAt(p);
                if (ch == '\n' || ch == '\r') return true;
                if (!isInlineWhitespace(ch) && ch != '\uFEFF') return false;
                p--;
            }
            return true;
        }

        private char peek(int ahead) {
            return peekAt(pos + ahead);
        }

        private char peekAt(int offset) {
            return offset < n ? in.charAt(offset) : '\0';
        }
    }

    static boolean isInlineWhitespace(char c) {
        return c == ' ' || c == '\t' || c == '\f' || c == '\u000B'
                || Character.getType(c) == Character.SPACE_SEPARATOR;
    }

    private static boolean isIdentifierStart(char c) {
        return c == '_' || Character.isLetter(c);
    }

    private static boolean isIdentifierPart(char c) {
        return c == '_' || Character.isLetterOrDigit(c);
    }
}
