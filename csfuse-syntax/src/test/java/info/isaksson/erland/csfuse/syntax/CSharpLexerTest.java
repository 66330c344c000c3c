package info.isaksson.erland.csfuse.syntax;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

public class CSharpLexerTest {

    private static List<Token> lex(String s) {
        return new CSharpLexer("Test.cs").lex(s);
    }

    private static long count(List<Token> tokens, String lexeme) {
        return tokens.stream().filter(t -> t.is(lexeme)).count();
    }

    @Test
    void bracesInsideLiteralsAndCommentsAreNotTokens() {
        String src = "var s = \"{\"; // }\n"
                + "/* { */ var t = @\"a \"\"}\"\" b\";\n"
                + "var u = $\"{(x ? \"}\" : \"{\")} and {{\";\n"
                + "var c = '{';\n";

        List<Token> tokens = lex(src);

        assertEquals(0, count(tokens, "{"));
        assertEquals(0, count(tokens, "}"));
        assertEquals(3, tokens.stream().filter(t -> t.kind == TokenKind.STRING).count());
        assertEquals(1, tokens.stream().filter(t -> t.kind == TokenKind.CHAR).count());
        assertEquals(TokenKind.EOF, tokens.get(tokens.size() - 1).kind);
    }

    @Test
    void rawStringLiteralIsOneToken() {
        String src = "var r = \"\"\"\n    { \"quoted\" }\n    \"\"\";";

        List<Token> tokens = lex(src);

        List<String> kinds = tokens.stream().map(t -> t.kind.name()).collect(Collectors.toList());
        assertEquals(List.of("IDENTIFIER", "IDENTIFIER", "PUNCTUATION", "STRING", "PUNCTUATION", "EOF"), kinds);
        assertTrue(tokens.get(3).text.contains("{ \"quoted\" }"));
    }

    @Test
    void trailingTriviaEndsWithTheLine() {
        List<Token> tokens = lex("x; // note\ny;");

        Token semicolon = tokens.get(1);
        assertEquals(";", semicolon.text);
        List<TriviaKind> kinds = semicolon.trailingTrivia.stream().map(t -> t.kind).collect(Collectors.toList());
        assertEquals(List.of(TriviaKind.WHITESPACE, TriviaKind.SINGLE_LINE_COMMENT, TriviaKind.END_OF_LINE), kinds);
        assertTrue(tokens.get(2).leadingTrivia.isEmpty());
    }

    @Test
    void directivesAndDocCommentsAreLeadingTrivia() {
        String src = "#if DEBUG\n/// <summary>A</summary>\nclass A {}\n#endif\n";

        List<Token> tokens = lex(src);

        Token first = tokens.get(0);
        assertEquals("class", first.text);
        assertEquals(TriviaKind.DIRECTIVE, first.leadingTrivia.get(0).kind);
        assertEquals("#if DEBUG", first.leadingTrivia.get(0).text);
        assertTrue(first.leadingTrivia.stream().anyMatch(t -> t.kind == TriviaKind.DOC_COMMENT));

        Token eof = tokens.get(tokens.size() - 1);
        assertTrue(eof.leadingTrivia.stream().anyMatch(t -> t.kind == TriviaKind.DIRECTIVE && t.text.equals("#endif")));
    }

    @Test
    void combinesQualifierAndArrowOnly() {
        List<Token> tokens = lex("global::System.Func<int> f = () => 1 >= 0;");

        assertEquals(1, count(tokens, "::"));
        assertEquals(1, count(tokens, "=>"));
        // '>=' stays two tokens
        assertEquals(2, count(tokens, ">"));
    }

    @Test
    void skipsByteOrderMark() {
        List<Token> tokens = lex("\uFEFFclass A {}");

        assertEquals("class", tokens.get(0).text);
        assertEquals(1, tokens.get(0).start);
    }

    @Test
    void unterminatedStringReportsPosition() {
        SourceSyntaxException ex = assertThrows(SourceSyntaxException.class, () -> lex("class A {}\nvar s = \"abc\n"));

        assertEquals("Test.cs", ex.getSourceName());
        assertEquals(2, ex.getLine());
        assertEquals(9, ex.getColumn());
        assertTrue(ex.getMessage().startsWith("Test.cs(2,9): syntax error:"), ex.getMessage());
    }

    @Test
    void unterminatedCommentIsAnError() {
        assertThrows(SourceSyntaxException.class, () -> lex("class A { /* never closed }"));
    }
}
