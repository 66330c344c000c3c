package info.isaksson.erland.csfuse;

import info.isaksson.erland.csfuse.core.FusionOptions;
import info.isaksson.erland.csfuse.core.FusionResult;
import info.isaksson.erland.csfuse.core.FusionService;
import info.isaksson.erland.csfuse.report.FusionReport;
import info.isaksson.erland.csfuse.report.FusionReportJson;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * CLI entrypoint: fuse every C# file under a folder into one file.
 */
public final class Main {

    private static final FusionService SERVICE = new FusionService();

    public static void main(String[] args) {
        System.exit(run(args));
    }

    /**
     * Testable entrypoint that returns an exit code instead of calling System.exit.
     */
    public static int run(String[] args) {
        CliArgs parsed;
        try {
            parsed = CliArgs.parse(args);
        } catch (IllegalArgumentException ex) {
            System.err.println("Error: " + ex.getMessage());
            System.err.println();
            CliArgs.printHelp();
            return 1;
        }

        if (parsed.help) {
            CliArgs.printHelp();
            return 0;
        }

        if (parsed.input == null) {
            System.err.println("Error: input directory is required.");
            System.err.println();
            CliArgs.printHelp();
            return 1;
        }

        final Path inputPath = Paths.get(parsed.input).toAbsolutePath().normalize();
        if (!Files.exists(inputPath)) {
            System.err.println("Error: input directory does not exist: " + inputPath);
            return 1;
        }
        if (!Files.isDirectory(inputPath)) {
            System.err.println("Error: input must be a directory: " + inputPath);
            return 1;
        }

        final Path outputPath;
        if (parsed.output != null) {
            outputPath = Paths.get(parsed.output).toAbsolutePath().normalize();
        } else if (parsed.root != null) {
            outputPath = inputPath.resolve(parsed.root + ".cs");
        } else {
            System.err.println("Error: output file is required unless --root is given.");
            System.err.println();
            CliArgs.printHelp();
            return 1;
        }

        Path reportOut = null;
        if (parsed.report != null) {
            reportOut = Paths.get(parsed.report).toAbsolutePath().normalize();
            if (reportOut.equals(outputPath)) {
                System.err.println("Error: report and output must be different files: " + reportOut);
                return 1;
            }
            if (Files.isDirectory(reportOut)) {
                System.err.println("Error: could not write report to: " + reportOut);
                System.err.println("Target is a directory.");
                return 2;
            }
            try {
                if (reportOut.getParent() != null) Files.createDirectories(reportOut.getParent());
            } catch (IOException e) {
                System.err.println("Error: could not write report to: " + reportOut);
                System.err.println(e.getMessage());
                return 2;
            }
        }

        final FusionResult res;
        try {
            res = SERVICE.fuse(inputPath, outputPath, toOptions(parsed));
        } catch (RuntimeException | IOException e) {
            System.err.println("Error: fusion failed.");
            System.err.println(e.getMessage());
            return 2;
        }

        if (reportOut != null) {
            try {
                FusionReportJson.write(FusionReport.from(res, inputPath), reportOut);
            } catch (IOException e) {
                System.err.println("Error: could not write report to: " + reportOut);
                System.err.println(e.getMessage());
                return 2;
            }
        }

        System.out.println(
                "csfuse\n" +
                "- Root namespace: " + res.rootNamespace + "\n" +
                "- Files processed: " + res.sourceFiles.size() + "\n" +
                "- Members emitted: " + res.membersEmitted + "\n" +
                "- Usings emitted: " + res.usingsEmitted + "\n" +
                "- Output file: " + res.outputFile +
                (reportOut != null ? "\n- Report: " + reportOut : "")
        );
        return 0;
    }

    private static FusionOptions toOptions(CliArgs parsed) {
        FusionOptions o = new FusionOptions();
        o.forcedRootNamespace = parsed.root;
        o.addFileHeaders = !parsed.noHeaders;
        o.recursive = !parsed.noRecursive;
        o.excludeGeneratedFiles = !parsed.includeGenerated;
        o.excludeBuildOutput = !parsed.includeBuildOutput;
        o.excludeGlobs = new ArrayList<>(parsed.excludes);
        return o;
    }

    /** Minimal CLI argument parsing without external dependencies. */
    static final class CliArgs {
        private static final String IDENTIFIER = "@?[\\p{L}_][\\p{L}\\p{Nd}_]*";
        private static final Pattern NAMESPACE_NAME = Pattern.compile(IDENTIFIER + "(\\." + IDENTIFIER + ")*");

        boolean help = false;
        String input;
        String output;
        String root;
        String report;

        boolean noHeaders = false;
        boolean noRecursive = false;
        boolean includeGenerated = false;
        boolean includeBuildOutput = false;
        final List<String> excludes = new ArrayList<>();

        static CliArgs parse(String[] args) {
            CliArgs out = new CliArgs();

            for (int i = 0; i < args.length; i++) {
                String a = args[i];
                if (a == null) continue;

                if (a.startsWith("--root=")) {
                    out.root = requireNamespace(a.substring("--root=".length()));
                    continue;
                }
                if (a.startsWith("--exclude=")) {
                    out.excludes.add(a.substring("--exclude=".length()));
                    continue;
                }
                if (a.startsWith("--report=")) {
                    out.report = requireName(a.substring("--report=".length()), "--report");
                    continue;
                }

                switch (a) {
                    case "--help":
                    case "-h":
                        out.help = true;
                        break;
                    case "--root":
                        out.root = requireNamespace(requireValue(args, ++i, "--root"));
                        break;
                    case "--report":
                        out.report = requireValue(args, ++i, "--report");
                        break;
                    case "--exclude":
                        out.excludes.add(requireValue(args, ++i, "--exclude"));
                        break;
                    case "--no-headers":
                        out.noHeaders = true;
                        break;
                    case "--no-recursive":
                        out.noRecursive = true;
                        break;
                    case "--include-generated":
                        out.includeGenerated = true;
                        break;
                    case "--include-build-output":
                        out.includeBuildOutput = true;
                        break;
                    default:
                        if (a.startsWith("-")) {
                            throw new IllegalArgumentException("Unknown argument: " + a);
                        }
                        if (out.input == null) {
                            out.input = a;
                        } else if (out.output == null) {
                            out.output = a;
                        } else {
                            throw new IllegalArgumentException("Unexpected extra argument: " + a);
                        }
                }
            }

            return out;
        }

        static String requireValue(String[] args, int index, String flag) {
            if (index >= args.length) {
                throw new IllegalArgumentException("Missing value for " + flag);
            }
            String v = args[index];
            if (v == null || v.isBlank() || v.startsWith("--")) {
                throw new IllegalArgumentException("Invalid value for " + flag + ": " + v);
            }
            return v;
        }

        static String requireName(String v, String flag) {
            if (v == null || v.isBlank()) {
                throw new IllegalArgumentException("Missing value for " + flag);
            }
            return v.trim();
        }

        /** The root also names the default output file, so only dotted C# identifiers are accepted. */
        static String requireNamespace(String v) {
            String name = requireName(v, "--root");
            if (!NAMESPACE_NAME.matcher(name).matches()) {
                throw new IllegalArgumentException("Invalid namespace for --root: " + name);
            }
            return name;
        }

        static void printHelp() {
            System.out.println(
                    "csfuse\n" +
                    "\n" +
                    "Usage:\n" +
                    "  java -jar csfuse.jar <inputDirectory> [outputFile] [--root=<name>] [options]\n" +
                    "\n" +
                    "Options:\n" +
                    "  --root <name>          Root namespace of the output (default: most common first\n" +
                    "                         namespace segment), a dotted C# name such as MyApp.Core.\n" +
                    "                         Also supports --root=<name>.\n" +
                    "                         Without outputFile, writes <inputDirectory>/<name>.cs\n" +
                    "  --no-headers           Do not add '// ===== From: File.cs =====' comments\n" +
                    "  --no-recursive         Only read files directly in <inputDirectory>\n" +
                    "  --include-generated    Also read *.g.cs, *.designer.cs and *.AssemblyInfo.cs\n" +
                    "  --include-build-output Also read files below bin/ and obj/ folders (any depth,\n" +
                    "                         case-insensitive); skipped by default\n" +
                    "  --exclude <glob>       Exclude paths matching glob (repeatable). Matches are evaluated\n" +
                    "                         against paths relative to <inputDirectory> using '/' separators.\n" +
                    "                         Also supports --exclude=<glob>.\n" +
                    "  --report <file.json>   Write a JSON run report (checked before the output is written)\n" +
                    "  -h, --help             Show help\n" +
                    "\n" +
                    "Exit codes: 0 success, 1 usage error, 2 fusion failure\n" +
                    "\n" +
                    "Examples:\n" +
                    "  java -jar target/csfuse.jar samples/mini out/Combined.cs\n" +
                    "  java -jar target/csfuse.jar src --root=MyApp --exclude \"Tests/**\"\n"
            );
        }
    }
}
