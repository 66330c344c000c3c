package info.isaksson.erland.csfuse.core;

import info.isaksson.erland.csfuse.syntax.CSharpParser;
import info.isaksson.erland.csfuse.syntax.UsingDirective;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

public class UsingMergerTest {

    private static List<UsingDirective> usings(String text) {
        return new CSharpParser().parse(text).usings;
    }

    private static List<String> texts(List<UsingDirective> list) {
        return list.stream().map(UsingDirective::canonicalText).collect(Collectors.toList());
    }

    @Test
    void dropsDuplicatesByCanonicalText() {
        List<UsingDirective> raw = usings(""
                + "using System;\n"
                + "using  System ;\n"
                + "using /* again */ System;\n"
                + "using Acme.Core;\n"
                + "using Acme . Core;\n"
                + "using static Acme.Core;\n");

        List<UsingDirective> merged = new UsingMerger().merge(raw);

        assertEquals(3, merged.size());
    }

    @Test
    void keepsTheFirstOccurrence() {
        List<UsingDirective> raw = usings("using  Acme.Core ; // first\nusing Acme.Core;\n");

        List<UsingDirective> merged = new UsingMerger().merge(raw);

        assertSame(raw.get(0), merged.get(0));
    }

    @Test
    void standardLibraryUsingsComeFirstThenOrdinalOrder() {
        List<UsingDirective> raw = usings(""
                + "using Zeta;\n"
                + "using System.Text;\n"
                + "using global::System.IO;\n"
                + "using Acme.Core;\n"
                + "using System;\n"
                + "using Systematic.Tools;\n"
                + "using static System.Math;\n"
                + "using Json = Newtonsoft.Json;\n"
                + "using IO = System.IO;\n");

        List<String> merged = texts(new UsingMerger().merge(raw));

        assertEquals(List.of(
                "using IO = System.IO;",
                "using System.Text;",
                "using System;",
                "using global::System.IO;",
                "using static System.Math;",
                "using Acme.Core;",
                "using Json = Newtonsoft.Json;",
                "using Systematic.Tools;",
                "using Zeta;"
        ), merged);
    }

    @Test
    void standardLibraryRootIsConfigurable() {
        List<String> merged = texts(new UsingMerger("Acme").merge(usings("using System;\nusing Acme.Core;\n")));

        assertEquals(List.of("using Acme.Core;", "using System;"), merged);
        assertThrows(IllegalArgumentException.class, () -> new UsingMerger(" "));
    }

    @Test
    void emptyInputGivesEmptyOutput() {
        assertTrue(new UsingMerger().merge(List.of()).isEmpty());
    }
}
