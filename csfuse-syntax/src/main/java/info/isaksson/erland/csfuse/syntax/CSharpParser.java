package info.isaksson.erland.csfuse.syntax;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Set;

/**
 * Structural C# parser.
 *
 * <p>Recognizes the compilation-unit skeleton: extern aliases, using directives, global
 * attribute lists, block and file-scoped namespaces (nested to any depth) and the members
 * inside them. Members themselves are not parsed further; they are delimited by bracket
 * matching and kept as {@link MemberDeclaration} text.</p>
 *
 * <p>Ordering rules of the language that matter for fusion are enforced: directives must
 * precede members, and a file-scoped namespace must be the only namespace in its file
 * and come before any member.</p>
 */
public final class CSharpParser {

    private static final Set<String> MODIFIERS = Set.of(
            "public", "private", "protected", "internal", "file",
            "static", "sealed", "abstract", "partial", "unsafe", "new",
            "readonly", "ref", "extern", "virtual", "override", "async", "required", "volatile");

    /** Tokens that keep a top-level statement going after a closing brace. */
    private static final Set<String> STATEMENT_CONTINUATIONS = Set.of("else", "catch", "finally", "while", "when");

    public CompilationUnit parse(String source) {
        return parse(source, null);
    }

    /**
     * @param sourceName file name used in error messages (may be null)
     * @throws SourceSyntaxException when the text is not structurally valid C#
     */
    public CompilationUnit parse(String source, String sourceName) {
        if (source == null) throw new IllegalArgumentException("source is null");
        List<Token> tokens = new CSharpLexer(sourceName).lex(source);
        return new Parse(source, sourceName, tokens).compilationUnit();
    }

    private static final class Parse {
        private final String source;
        private final String sourceName;
        private final List<Token> tokens;
        private int index;

        Parse(String source, String sourceName, List<Token> tokens) {
            this.source = source;
            this.sourceName = sourceName;
            this.tokens = tokens;
        }

        CompilationUnit compilationUnit() {
            List<ExternAliasDirective> externs = externAliases();
            List<UsingDirective> usings = usingDirectives();

            List<GlobalAttributeList> attributes = new ArrayList<>();
            while (isGlobalAttributeStart()) {
                attributes.add(globalAttributeList());
            }

            List<MemberNode> members = new ArrayList<>();
            while (!atEnd()) {
                Token t = peek(0);
                if (t.is("namespace")) {
                    members.add(namespace(true, members.isEmpty()));
                    continue;
                }
                rejectMisplacedDirective();
                if (t.is("}")) throw error(t, "unexpected '}'");
                members.add(member());
            }
            return new CompilationUnit(externs, usings, attributes, members, peek(0).leadingTrivia);
        }

        private List<ExternAliasDirective> externAliases() {
            List<ExternAliasDirective> out = new ArrayList<>();
            while (peek(0).is("extern") && peek(1).is("alias")) {
                List<Token> toks = new ArrayList<>();
                toks.add(next());
                toks.add(next());
                Token alias = peek(0);
                if (!alias.isIdentifier()) throw error(alias, "expected an alias name");
                toks.add(next());
                toks.add(expect(";"));
                out.add(new ExternAliasDirective(toks, alias.text));
            }
            return out;
        }

        private List<UsingDirective> usingDirectives() {
            List<UsingDirective> out = new ArrayList<>();
            while (isUsingDirectiveStart()) {
                out.add(usingDirective());
            }
            return out;
        }

        private boolean isUsingDirectiveStart() {
            int k;
            if (peek(0).is("using")) {
                k = 1;
            } else if (peek(0).is("global") && peek(1).is("using")) {
                k = 2;
            } else {
                return false;
            }
            Token next = peek(k);
            // using statements and declarations: using (...) / using var x = ... / using T x = ...
            if (next.is("(") || next.is("var")) return false;
            return !(next.isIdentifier() && !next.is("static") && !next.is("unsafe") && peek(k + 1).isIdentifier());
        }

        private UsingDirective usingDirective() {
            List<Token> toks = new ArrayList<>();
            boolean global = false;
            if (peek(0).is("global")) {
                global = true;
                toks.add(next());
            }
            toks.add(expect("using"));

            boolean isStatic = false;
            if (peek(0).is("static")) {
                isStatic = true;
                toks.add(next());
            }
            if (peek(0).is("unsafe")) {
                toks.add(next());
            }

            String alias = null;
            if (peek(0).isIdentifier() && peek(1).is("=")) {
                alias = peek(0).text;
                toks.add(next());
                toks.add(next());
            }

            List<Token> nameTokens = new ArrayList<>();
            while (!peek(0).is(";")) {
                Token t = peek(0);
                if (t.kind == TokenKind.EOF || t.is("{") || t.is("}")) throw error(t, "expected ';'");
                nameTokens.add(next());
            }
            if (nameTokens.isEmpty()) throw error(peek(0), "expected a namespace or type name");
            toks.addAll(nameTokens);
            toks.add(next());
            return new UsingDirective(toks, global, isStatic, alias, CanonicalText.of(nameTokens));
        }

        private boolean isGlobalAttributeStart() {
            return peek(0).is("[") && (peek(1).is("assembly") || peek(1).is("module")) && peek(2).is(":");
        }

        private GlobalAttributeList globalAttributeList() {
            String target = peek(1).text;
            List<Token> toks = new ArrayList<>();
            Deque<Token> open = new ArrayDeque<>();
            do {
                Token t = peek(0);
                if (t.kind == TokenKind.EOF) throw error(open.peek(), "'" + open.peek().text + "' is never closed");
                if (isOpener(t)) {
                    open.push(t);
                } else if (isCloser(t)) {
                    Token o = open.pop();
                    if (!matches(o, t)) throw error(t, "'" + t.text + "' does not match '" + o.text + "'");
                }
                toks.add(next());
            } while (!open.isEmpty());
            return new GlobalAttributeList(toks, target);
        }

        private void rejectMisplacedDirective() {
            Token t = peek(0);
            if (isUsingDirectiveStart()) throw error(t, "a using directive must precede all other elements");
            if (t.is("extern") && peek(1).is("alias")) throw error(t, "an extern alias must precede all other elements");
            if (isGlobalAttributeStart()) throw error(t, "assembly and module attributes must precede all members");
        }

        private NamespaceDeclaration namespace(boolean topLevel, boolean firstMember) {
            Token keyword = next();
            StringBuilder name = new StringBuilder();
            name.append(identifier("a namespace name").text);
            while (peek(0).is(".")) {
                next();
                name.append('.').append(identifier("an identifier").text);
            }

            if (peek(0).is(";")) {
                Token semicolon = next();
                if (!topLevel) throw error(keyword, "a file-scoped namespace must be declared at the top level");
                if (!firstMember) throw error(keyword, "a file-scoped namespace must precede all other members");
                List<ExternAliasDirective> externs = externAliases();
                List<UsingDirective> usings = usingDirectives();
                List<MemberNode> members = new ArrayList<>();
                while (!atEnd()) {
                    Token t = peek(0);
                    if (t.is("namespace")) {
                        throw error(t, "a file-scoped namespace cannot be combined with other namespace declarations");
                    }
                    rejectMisplacedDirective();
                    if (t.is("}")) throw error(t, "unexpected '}'");
                    members.add(member());
                }
                return new NamespaceDeclaration(
                        keyword.leadingTrivia, name.toString(), true, externs, usings, members, List.of());
            }

            if (!peek(0).is("{")) throw error(peek(0), "expected '{' or ';' after the namespace name");
            Token open = next();
            List<ExternAliasDirective> externs = externAliases();
            List<UsingDirective> usings = usingDirectives();
            List<MemberNode> members = new ArrayList<>();
            while (!peek(0).is("}")) {
                Token t = peek(0);
                if (t.kind == TokenKind.EOF) throw error(open, "namespace '" + name + "' is never closed");
                if (t.is("namespace")) {
                    members.add(namespace(false, false));
                    continue;
                }
                rejectMisplacedDirective();
                members.add(member());
            }
            Token close = next();
            if (peek(0).is(";")) next();
            return new NamespaceDeclaration(
                    keyword.leadingTrivia, name.toString(), false, externs, usings, members, close.leadingTrivia);
        }

        private MemberDeclaration member() {
            int startIndex = index;
            Token first = peek(0);

            int k = 0;
            while (true) {
                Token t = peek(k);
                if (t.is("[")) {
                    k = skipBalancedAhead(k);
                } else if (t.isIdentifier() && MODIFIERS.contains(t.text)) {
                    k++;
                } else {
                    break;
                }
            }
            Token keyword = peek(k);
            DeclarationKind kind = keyword.isIdentifier() ? DeclarationKind.fromKeyword(keyword.text) : null;
            String name = null;
            if (kind == null) {
                kind = DeclarationKind.STATEMENT;
            } else {
                name = declaredName(kind, k);
            }

            Deque<Token> open = new ArrayDeque<>();
            Token last;
            while (true) {
                Token t = peek(0);
                if (t.kind == TokenKind.EOF) {
                    if (!open.isEmpty()) throw error(open.peek(), "'" + open.peek().text + "' is never closed");
                    throw error(t, kind.isType() ? "expected '{' or ';'" : "expected ';'");
                }
                if (isOpener(t)) {
                    open.push(next());
                    continue;
                }
                if (isCloser(t)) {
                    if (open.isEmpty()) throw error(t, "unexpected '" + t.text + "'");
                    Token o = open.pop();
                    if (!matches(o, t)) throw error(t, "'" + t.text + "' does not match '" + o.text + "'");
                    last = next();
                    if (open.isEmpty() && t.is("}")) {
                        if (peek(0).is(";")) {
                            last = next();
                            break;
                        }
                        if (kind.isType() || !continuesStatement(peek(0))) break;
                    }
                    continue;
                }
                last = next();
                if (open.isEmpty() && t.is(";")) break;
            }

            int end = endIncludingSameLineComments(last);
            String raw = source.substring(first.start, end);
            List<Integer> verbatimLines = verbatimLines(startIndex, index, first.start);
            return new MemberDeclaration(
                    first.leadingTrivia,
                    kind,
                    name,
                    raw.replace("\r\n", "\n"),
                    SourceColumns.columnOf(source, first.start),
                    verbatimLines);
        }

        private String declaredName(DeclarationKind kind, int keywordIndex) {
            int j = keywordIndex + 1;
            if (kind == DeclarationKind.RECORD && (peek(j).is("struct") || peek(j).is("class"))) j++;
            if (kind == DeclarationKind.DELEGATE) {
                // delegate <return type> Name<T>(...)
                String lastIdentifier = null;
                while (peek(j).kind != TokenKind.EOF && !peek(j).is("(") && !peek(j).is("<") && !peek(j).is(";")) {
                    if (peek(j).isIdentifier()) lastIdentifier = peek(j).text;
                    j++;
                }
                return lastIdentifier;
            }
            return peek(j).isIdentifier() ? peek(j).text : null;
        }

        private boolean continuesStatement(Token next) {
            if (next.kind == TokenKind.EOF) return false;
            if (next.isIdentifier()) return STATEMENT_CONTINUATIONS.contains(next.text);
            if (next.kind != TokenKind.PUNCTUATION) return false;
            return !(next.is("[") || next.is("{") || next.is("}") || next.is("("));
        }

        /** Offset after {@code last} and any comment that follows it on the same line. */
        private int endIncludingSameLineComments(Token last) {
            int offset = last.end;
            int end = last.end;
            for (Trivia trivia : last.trailingTrivia) {
                if (trivia.kind == TriviaKind.END_OF_LINE) break;
                offset += trivia.text.length();
                if (trivia.kind.isComment()) end = offset;
            }
            return end;
        }

        private List<Integer> verbatimLines(int fromToken, int toToken, int textStart) {
            List<Integer> out = new ArrayList<>();
            for (int i = fromToken; i < toToken; i++) {
                Token t = tokens.get(i);
                if (t.kind != TokenKind.STRING || t.text.indexOf('\n') < 0) continue;
                for (int p = t.start; p < t.end - 1; p++) {
                    if (source.charAt(p) == '\n') {
                        out.add(newlinesBetween(textStart, p + 1));
                    }
                }
            }
            return out;
        }

        private int newlinesBetween(int from, int to) {
            int count = 0;
            for (int i = from; i < to; i++) {
                if (source.charAt(i) == '\n') count++;
            }
            return count;
        }

        /** Index just past the bracket group that opens at lookahead {@code k}. */
        private int skipBalancedAhead(int k) {
            int depth = 0;
            int j = k;
            while (true) {
                Token t = peek(j);
                if (t.kind == TokenKind.EOF) return j;
                if (isOpener(t)) depth++;
                if (isCloser(t)) depth--;
                j++;
                if (depth <= 0) return j;
            }
        }

        private Token identifier(String what) {
            Token t = peek(0);
            if (!t.isIdentifier()) throw error(t, "expected " + what);
            return next();
        }

        private Token expect(String lexeme) {
            Token t = peek(0);
            if (!t.is(lexeme)) throw error(t, "expected '" + lexeme + "'");
            return next();
        }

        private Token peek(int ahead) {
            int i = Math.min(index + ahead, tokens.size() - 1);
            return tokens.get(i);
        }

        private Token next() {
            Token t = tokens.get(index);
            if (index < tokens.size() - 1) index++;
            return t;
        }

        private boolean atEnd() {
            return peek(0).kind == TokenKind.EOF;
        }

        private SourceSyntaxException error(Token at, String detail) {
            String found = at.kind == TokenKind.EOF ? "end of file" : "'" + at.text + "'";
            return SourceSyntaxException.at(sourceName, source, at.start, detail + " (found " + found + ")");
        }
    }

    private static boolean isOpener(Token t) {
        return t.kind == TokenKind.PUNCTUATION && (t.text.equals("{") || t.text.equals("(") || t.text.equals("["));
    }

    private static boolean isCloser(Token t) {
        return t.kind == TokenKind.PUNCTUATION && (t.text.equals("}") || t.text.equals(")") || t.text.equals("]"));
    }

    private static boolean matches(Token open, Token close) {
        switch (open.text) {
            case "{":
                return close.text.equals("}");
            case "(":
                return close.text.equals(")");
            case "[":
                return close.text.equals("]");
            default:
                return false;
        }
    }
}
