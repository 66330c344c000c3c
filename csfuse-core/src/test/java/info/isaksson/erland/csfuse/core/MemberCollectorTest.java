package info.isaksson.erland.csfuse.core;

import info.isaksson.erland.csfuse.io.SourceFile;
import info.isaksson.erland.csfuse.syntax.CSharpParser;
import info.isaksson.erland.csfuse.syntax.MemberDeclaration;
import info.isaksson.erland.csfuse.syntax.Trivia;
import info.isaksson.erland.csfuse.syntax.TriviaKind;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

public class MemberCollectorTest {

    private static ParsedUnit unit(String path, String text) {
        SourceFile file = new SourceFile(Path.of(path), text);
        return new ParsedUnit(file, new CSharpParser().parse(text, path));
    }

    private static List<String> names(CollectedMembers c) {
        return c.declarations.stream().map(d -> d.name).collect(Collectors.toList());
    }

    @Test
    void flattensNestedNamespacesInDocumentOrder() {
        ParsedUnit u = unit("src/A.cs", ""
                + "using System;\n"
                + "namespace A\n"
                + "{\n"
                + "    using System.IO;\n"
                + "    class First {}\n"
                + "    namespace A.B\n"
                + "    {\n"
                + "        using System.Text;\n"
                + "        class D {}\n"
                + "    }\n"
                + "    class Last {}\n"
                + "}\n");

        CollectedMembers c = new MemberCollector(false).collect(List.of(u));

        assertEquals(List.of("First", "D", "Last"), names(c));
        assertEquals(List.of("A", "A.B"), c.namespaceNames);
        assertEquals(List.of("using System;", "using System.IO;", "using System.Text;"),
                c.usings.stream().map(x -> x.canonicalText()).collect(Collectors.toList()));
    }

    @Test
    void collectsFileScopedAndGlobalMembers() {
        ParsedUnit scoped = unit("Scoped.cs", "namespace Foo.Sub;\nusing System.Text;\nrecord C(string Name);\n");
        ParsedUnit global = unit("Program.cs", "System.Console.WriteLine(1);\nclass Program2 {}\n");

        CollectedMembers c = new MemberCollector(false).collect(List.of(scoped, global));

        assertEquals(List.of("Foo.Sub"), c.namespaceNames);
        assertEquals(3, c.declarations.size());
        assertEquals("C", c.declarations.get(0).name);
        assertNull(c.declarations.get(1).name);
        assertEquals("Program2", c.declarations.get(2).name);
        assertEquals(1, c.usings.size());
    }

    @Test
    void annotatesEachDeclarationWithItsFileName() {
        ParsedUnit u = unit("deep/dir/Widget.cs", "namespace W {\n    /// <summary>W</summary>\n    class Widget {}\n    class Gadget {}\n}\n");

        CollectedMembers c = new MemberCollector(true).collect(List.of(u));

        for (MemberDeclaration d : c.declarations) {
            Trivia first = d.leadingTrivia.get(0);
            assertEquals(TriviaKind.SINGLE_LINE_COMMENT, first.kind);
            assertEquals("// ===== From: Widget.cs =====", first.text);
        }
        // existing doc comment is kept after the provenance line
        assertTrue(c.declarations.get(0).leadingTrivia.stream().anyMatch(t -> t.kind == TriviaKind.DOC_COMMENT));
    }

    @Test
    void identicalDeclarationsFromDifferentFilesAreKept() {
        ParsedUnit a = unit("A.cs", "namespace N { class Dup {} }");
        ParsedUnit b = unit("B.cs", "namespace N { class Dup {} }");

        CollectedMembers c = new MemberCollector(true).collect(List.of(a, b));

        assertEquals(List.of("Dup", "Dup"), names(c));
        assertEquals("// ===== From: A.cs =====", c.declarations.get(0).leadingTrivia.get(0).text);
        assertEquals("// ===== From: B.cs =====", c.declarations.get(1).leadingTrivia.get(0).text);
    }

    @Test
    void emptyUnitContributesNothing() {
        CollectedMembers c = new MemberCollector(true).collect(List.of(unit("Empty.cs", "// nothing\n")));

        assertTrue(c.declarations.isEmpty());
        assertTrue(c.usings.isEmpty());
        assertTrue(c.namespaceNames.isEmpty());
    }

    @Test
    void keepsExternAliasesAndGlobalAttributes() {
        ParsedUnit u = unit("A.cs", "extern alias Old;\n[assembly: Foo]\nnamespace N { extern alias Inner; class A {} }");

        CollectedMembers c = new MemberCollector(false).collect(List.of(u));

        assertEquals(2, c.externAliases.size());
        assertEquals(1, c.attributeLists.size());
    }

    private static List<String> directiveTexts(List<Trivia> trivia) {
        return trivia.stream()
                .filter(t -> t.kind == TriviaKind.DIRECTIVE)
                .map(t -> t.text.trim())
                .collect(Collectors.toList());
    }

    @Test
    void directivesBeforeNamespaceCloseStayWithTheLastMember() {
        ParsedUnit u = unit("R.cs", ""
                + "namespace Foo\n"
                + "{\n"
                + "    class A {}\n"
                + "#if DEBUG\n"
                + "    class B {}\n"
                + "#endif\n"
                + "    #region Tail\n"
                + "    class C {}\n"
                + "    #endregion\n"
                + "}\n");

        CollectedMembers c = new MemberCollector(false).collect(List.of(u));

        assertEquals(List.of("A", "B", "C"), names(c));
        assertEquals(List.of("#if DEBUG"), directiveTexts(c.declarations.get(1).leadingTrivia));
        assertEquals(List.of("#endif", "#region Tail"), directiveTexts(c.declarations.get(2).leadingTrivia));
        assertEquals(List.of("#endregion"), directiveTexts(c.declarations.get(2).trailingTrivia));
    }

    @Test
    void directivesAroundWholeNamespaceAndAtEndOfFileAreKept() {
        ParsedUnit u = unit("R.cs", ""
                + "#if NET8_0\n"
                + "namespace Foo\n"
                + "{\n"
                + "    class A {}\n"
                + "}\n"
                + "#endif\n");

        CollectedMembers c = new MemberCollector(true).collect(List.of(u));

        MemberDeclaration a = c.declarations.get(0);
        assertEquals("// ===== From: R.cs =====", a.leadingTrivia.get(0).text);
        assertEquals(List.of("#if NET8_0"), directiveTexts(a.leadingTrivia));
        assertEquals(List.of("#endif"), directiveTexts(a.trailingTrivia));
    }

    @Test
    void directivesOnUsingsMoveToTheFirstMember() {
        ParsedUnit u = unit("R.cs", ""
                + "#if WINDOWS\n"
                + "using Microsoft.Win32;\n"
                + "#endif\n"
                + "namespace Foo;\n"
                + "class A {}\n");

        CollectedMembers c = new MemberCollector(false).collect(List.of(u));

        assertEquals(1, c.usings.size());
        assertEquals(List.of("#if WINDOWS", "#endif"), directiveTexts(c.declarations.get(0).leadingTrivia));
        assertTrue(c.declarations.get(0).trailingTrivia.isEmpty());
    }

    @Test
    void fileWithoutDeclarationsDropsItsDirectives() {
        ParsedUnit empty = unit("Empty.cs", "#region Nothing\nnamespace Foo\n{\n}\n#endregion\n");
        ParsedUnit other = unit("Other.cs", "namespace Foo { class A {} }");

        CollectedMembers c = new MemberCollector(false).collect(List.of(empty, other));

        assertEquals(1, c.declarations.size());
        assertTrue(directiveTexts(c.declarations.get(0).leadingTrivia).isEmpty());
        assertTrue(c.declarations.get(0).trailingTrivia.isEmpty());
    }

    @Test
    void defineAndUndefAreDropped() {
        ParsedUnit u = unit("R.cs", "#define TRACE_ON\n#undef LEGACY\nclass A {}\n");

        CollectedMembers c = new MemberCollector(false).collect(List.of(u));

        assertTrue(directiveTexts(c.declarations.get(0).leadingTrivia).isEmpty());
    }
}
