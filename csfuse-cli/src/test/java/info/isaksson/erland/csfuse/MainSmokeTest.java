package info.isaksson.erland.csfuse;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

public class MainSmokeTest {

    @Test
    void fusesSamplesMini(@TempDir Path tmp) throws Exception {
        Path out = tmp.resolve("out/Combined.cs");

        int code = Main.run(new String[] {
                TestRepoPaths.resolveSamplesMini().toString(),
                out.toString()
        });

        assertEquals(0, code);
        String s = Files.readString(out);
        assertTrue(s.startsWith("// ------------------------------------------------------------\n"), s);
        assertTrue(s.contains("\nnamespace Foo\n{\n"), "root namespace should be inferred: " + s);
        assertTrue(s.contains("// ===== From: Class1.cs ====="));
        assertTrue(s.contains("// ===== From: Feature.cs ====="));
        assertFalse(s.contains("namespace Foo.Sub"), "nested namespaces must be flattened");
        assertFalse(s.contains("partial class Generated"), "designer files are skipped");
        assertFalse(s.contains("[assembly:"), "obj/ is skipped");
        assertTrue(s.indexOf("    public class A") < s.indexOf("    public class B"));
        assertTrue(s.indexOf("    public class B") < s.indexOf("    public record C"));
    }

    @Test
    void writesDefaultOutputAndReportWithRoot(@TempDir Path tmp) throws Exception {
        Path in = TestRepoPaths.copySamplesMini(tmp.resolve("mini"));
        Path report = tmp.resolve("report.json");

        int code = Main.run(new String[] {
                in.toString(),
                "--root=Shop",
                "--no-headers",
                "--exclude", "Sub/**",
                "--report", report.toString()
        });

        assertEquals(0, code);
        Path out = in.resolve("Shop.cs");
        assertTrue(Files.exists(out), "default output is <input>/<root>.cs");
        String s = Files.readString(out);
        assertTrue(s.contains("\nnamespace Shop\n{\n"), s);
        assertFalse(s.contains("===== From:"));
        assertFalse(s.contains("record C"));

        String json = Files.readString(report);
        assertTrue(json.contains("\"rootNamespace\""), json);
        assertTrue(json.contains("\"Shop\""), json);

        // the previous output is not picked up as input
        assertEquals(0, Main.run(new String[] {in.toString(), "--root", "Shop", "--no-headers", "--exclude=Sub/**"}));
        assertEquals(s.substring(s.indexOf("using")), Files.readString(out).substring(s.indexOf("using")));
    }

    @Test
    void includeGeneratedAndNoRecursive(@TempDir Path tmp) throws Exception {
        Path out = tmp.resolve("All.cs");

        int code = Main.run(new String[] {
                TestRepoPaths.resolveSamplesMini().toString(), out.toString(),
                "--include-generated", "--no-recursive"
        });

        assertEquals(0, code);
        String s = Files.readString(out);
        assertTrue(s.contains("partial class Generated"));
        assertFalse(s.contains("record C"));
        assertFalse(s.contains("[assembly:"));
    }

    @Test
    void buildOutputHasItsOwnFlag(@TempDir Path tmp) throws Exception {
        Path out = tmp.resolve("All.cs");

        int code = Main.run(new String[] {
                TestRepoPaths.resolveSamplesMini().toString(), out.toString(),
                "--include-build-output"
        });

        assertEquals(0, code);
        String s = Files.readString(out);
        assertTrue(s.contains("[assembly: System.Runtime.Versioning.TargetFrameworkAttribute"), s);
        assertFalse(s.contains("partial class Generated"), "designer files are still skipped");
    }

    @Test
    void helpExitsZero() {
        assertEquals(0, Main.run(new String[] {"--help"}));
    }

    @Test
    void usageErrorsExitOne(@TempDir Path tmp) {
        assertEquals(1, Main.run(new String[] {}));
        assertEquals(1, Main.run(new String[] {tmp.toString(), "--bogus"}));
        assertEquals(1, Main.run(new String[] {tmp.toString()}), "output file or --root is required");
        assertEquals(1, Main.run(new String[] {tmp.resolve("missing").toString(), "--root=X"}));
        assertEquals(1, Main.run(new String[] {tmp.toString(), "a.cs", "b.cs"}));
        assertEquals(1, Main.run(new String[] {tmp.toString(), "--root"}));
        assertEquals(1, Main.run(new String[] {tmp.toString(), "--root="}));
        String same = tmp.resolve("out.cs").toString();
        assertEquals(1, Main.run(new String[] {tmp.toString(), same, "--report", same}), "report must not replace the output");
    }

    @Test
    void rootMustBeADottedName(@TempDir Path tmp) throws Exception {
        Path in = Files.createDirectories(tmp.resolve("in"));
        Files.writeString(in.resolve("A.cs"), "namespace Foo { class A {} }");

        assertEquals(1, Main.run(new String[] {in.toString(), "--root=../evil"}));
        assertEquals(1, Main.run(new String[] {in.toString(), "--root", "sub/Name"}));
        assertEquals(1, Main.run(new String[] {in.toString(), "--root=My..App"}));
        assertFalse(Files.exists(tmp.resolve("evil.cs")));
        try (var files = Files.list(in)) {
            assertEquals(1, files.count(), "nothing written next to the sources");
        }

        assertEquals(0, Main.run(new String[] {in.toString(), "--root= My.App_2 "}));
        assertTrue(Files.exists(in.resolve("My.App_2.cs")));
    }

    @Test
    void unwritableReportFailsBeforeTheOutputIsWritten(@TempDir Path tmp) throws Exception {
        Path in = Files.createDirectories(tmp.resolve("in"));
        Files.writeString(in.resolve("A.cs"), "namespace Foo { class A {} }");
        Path report = Files.createDirectories(tmp.resolve("report.json"));
        Path out = tmp.resolve("Out.cs");

        int code = Main.run(new String[] {in.toString(), out.toString(), "--report", report.toString()});

        assertEquals(2, code);
        assertFalse(Files.exists(out));
    }

    @Test
    void reportParentFoldersAreCreated(@TempDir Path tmp) throws Exception {
        Path in = Files.createDirectories(tmp.resolve("in"));
        Files.writeString(in.resolve("A.cs"), "namespace Foo { class A {} }");
        Path report = tmp.resolve("reports/run/report.json");

        int code = Main.run(new String[] {in.toString(), tmp.resolve("Out.cs").toString(), "--report=" + report});

        assertEquals(0, code);
        assertTrue(Files.readString(report).contains("\"filesProcessed\""));
    }

    @Test
    void syntaxErrorExitsTwoAndWritesNothing(@TempDir Path tmp) throws Exception {
        Path in = Files.createDirectories(tmp.resolve("in"));
        Files.writeString(in.resolve("Bad.cs"), "namespace Foo { class A { void M( } }");
        Path out = tmp.resolve("Out.cs");

        int code = Main.run(new String[] {in.toString(), out.toString()});

        assertEquals(2, code);
        assertFalse(Files.exists(out));
    }
}
