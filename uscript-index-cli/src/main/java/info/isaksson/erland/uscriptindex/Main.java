package info.isaksson.erland.uscriptindex;

import info.isaksson.erland.uscriptindex.analyze.CompletionCatalog;
import info.isaksson.erland.uscriptindex.core.UScriptIndexOptions;
import info.isaksson.erland.uscriptindex.core.UScriptIndexService;
import info.isaksson.erland.uscriptindex.io.ScanResult;
import info.isaksson.erland.uscriptindex.io.SourceText;
import info.isaksson.erland.uscriptindex.model.CompletionItem;
import info.isaksson.erland.uscriptindex.model.DocumentAnalysis;
import info.isaksson.erland.uscriptindex.model.HighlightSpan;
import info.isaksson.erland.uscriptindex.model.IndexJson;
import info.isaksson.erland.uscriptindex.model.OutlineEntry;
import info.isaksson.erland.uscriptindex.report.IndexReportGenerator;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Locale;

/**
 * CLI entrypoint: index a game installation, optionally write a report and analyze one document.
 */
public final class Main {

    public static void main(String[] args) {
        System.exit(run(args));
    }

    /**
     * Testable entrypoint that returns an exit code instead of calling System.exit.
     */
    public static int run(String[] args) {
        return run(args, System.out, System.err);
    }

    static int run(String[] args, PrintStream out, PrintStream err) {
        CliArgs parsed;
        try {
            parsed = CliArgs.parse(args);
        } catch (IllegalArgumentException ex) {
            err.println("Error: " + ex.getMessage());
            err.println();
            CliArgs.printHelp(err);
            return 1;
        }

        if (parsed.help) {
            CliArgs.printHelp(out);
            return 0;
        }

        if (parsed.root == null) {
            err.println("Error: --root is required.");
            err.println();
            CliArgs.printHelp(err);
            return 1;
        }

        final Path rootPath = Paths.get(parsed.root).toAbsolutePath().normalize();
        if (!Files.exists(rootPath)) {
            err.println("Error: --root does not exist: " + rootPath);
            return 1;
        }
        if (!Files.isDirectory(rootPath)) {
            err.println("Error: --root must be a directory: " + rootPath);
            return 1;
        }

        Path documentPath = null;
        if (parsed.document != null) {
            documentPath = Paths.get(parsed.document).toAbsolutePath().normalize();
            if (!Files.isRegularFile(documentPath)) {
                err.println("Error: --document must point to an existing file: " + documentPath);
                return 1;
            }
        }

        UScriptIndexService service = new UScriptIndexService(toCoreOptions(parsed));

        final ScanResult res;
        try {
            res = service.rebuild(rootPath);
        } catch (IOException e) {
            err.println("Error: could not scan game folder: " + rootPath);
            err.println(e.getMessage());
            return 2;
        }

        if (parsed.report != null) {
            Path reportOut = Paths.get(parsed.report).toAbsolutePath().normalize();
            try {
                IndexReportGenerator.writeMarkdown(reportOut, res);
            } catch (IOException e) {
                err.println("Error: could not write report to: " + reportOut);
                err.println(e.getMessage());
                return 2;
            }
        }

        if (documentPath != null) {
            final DocumentAnalysis analysis;
            try {
                analysis = service.analyze(SourceText.read(documentPath));
            } catch (IOException e) {
                err.println("Error: could not read document: " + documentPath);
                err.println(e.getMessage());
                return 2;
            }
            if (parsed.json) {
                try {
                    out.print(IndexJson.toJsonString(analysis));
                } catch (IOException e) {
                    err.println("Error: could not render analysis as JSON.");
                    err.println(e.getMessage());
                    return 2;
                }
                return 0;
            }
            printSummary(out, res, parsed);
            printAnalysis(out, documentPath, analysis);
            return 0;
        }

        if (parsed.completions) {
            List<CompletionItem> items = service.completions();
            if (parsed.json) {
                try {
                    out.print(IndexJson.toJsonString(items));
                } catch (IOException e) {
                    err.println("Error: could not render completions as JSON.");
                    err.println(e.getMessage());
                    return 2;
                }
                return 0;
            }
            printCompletions(out, items);
            return 0;
        }

        if (parsed.json) {
            try {
                out.print(IndexJson.toJsonString(res.table));
            } catch (IOException e) {
                err.println("Error: could not render index as JSON.");
                err.println(e.getMessage());
                return 2;
            }
            return 0;
        }

        printSummary(out, res, parsed);
        return 0;
    }

    private static UScriptIndexOptions toCoreOptions(CliArgs parsed) {
        UScriptIndexOptions o = new UScriptIndexOptions();
        o.classesDirName = parsed.classesDir;
        o.sourceSuffix = parsed.suffix;
        o.resetClassPerFile = parsed.resetClassPerFile;
        return o;
    }

    private static void printSummary(PrintStream out, ScanResult res, CliArgs parsed) {
        out.println(
                "uscript-index\n" +
                "- Root: " + res.root + "\n" +
                (parsed.report != null ? "- Report: " + Paths.get(parsed.report).toAbsolutePath().normalize() + "\n" : "") +
                "- Packages: " + res.packages.size() + "\n" +
                "- Source files: " + res.sourceFiles.size() + "\n" +
                "- Classes: " + res.table.size() + "\n" +
                "- Warnings: " + res.warnings.size()
        );
    }

    private static void printAnalysis(PrintStream out, Path document, DocumentAnalysis analysis) {
        out.println();
        out.println("Outline of " + document.getFileName() + ":");
        for (OutlineEntry e : analysis.outline) {
            out.println("  " + (e.line + 1) + ": " + e.kind.name().toLowerCase(Locale.ROOT) + " " + e.name);
        }
        out.println("Highlights: " + analysis.highlights.size());
        for (HighlightSpan s : analysis.highlights) {
            out.println("  " + (s.line + 1) + ":" + (s.startColumn + 1) + " +" + s.length + " " + s.category.name().toLowerCase(Locale.ROOT));
        }
    }

    private static void printCompletions(PrintStream out, List<CompletionItem> items) {
        out.println("Completions (trigger characters: " + String.join(" ", CompletionCatalog.TRIGGER_CHARACTERS) + "):");
        for (CompletionItem item : items) {
            out.println("  " + item.kind.name().toLowerCase(Locale.ROOT) + " " + item.label);
        }
    }

    /** Minimal CLI argument parsing without external dependencies. */
    static final class CliArgs {
        boolean help = false;
        String root;
        String document;
        String report;
        boolean json = false;
        boolean completions = false;

        String classesDir = "Classes";
        String suffix = ".uc";
        boolean resetClassPerFile = true;

        static CliArgs parse(String[] args) {
            CliArgs out = new CliArgs();

            for (int i = 0; i < args.length; i++) {
                String a = args[i];
                if (a == null) continue;

                switch (a) {
                    case "--help":
                    case "-h":
                        out.help = true;
                        break;
                    case "--root":
                        out.root = requireValue(args, ++i, "--root");
                        break;
                    case "--document":
                        out.document = requireValue(args, ++i, "--document");
                        break;
                    case "--report":
                        out.report = requireValue(args, ++i, "--report");
                        break;
                    case "--json":
                        out.json = true;
                        break;
                    case "--completions":
                        out.completions = true;
                        break;
                    case "--classes-dir":
                        out.classesDir = requireValue(args, ++i, "--classes-dir");
                        break;
                    case "--suffix":
                        out.suffix = requireValue(args, ++i, "--suffix");
                        break;
                    case "--reset-class-per-file":
                        out.resetClassPerFile = parseBoolean(requireValue(args, ++i, "--reset-class-per-file"), "--reset-class-per-file");
                        break;
                    default:
                        if (a.startsWith("--")) {
                            throw new IllegalArgumentException("Unknown argument: " + a);
                        }
                        // allow a bare path as shorthand for --root
                        if (out.root == null) {
                            out.root = a;
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

        static boolean parseBoolean(String v, String flag) {
            if (v == null) throw new IllegalArgumentException("Missing value for " + flag);
            String s = v.trim().toLowerCase(Locale.ROOT);
            if (s.equals("true") || s.equals("1") || s.equals("yes")) return true;
            if (s.equals("false") || s.equals("0") || s.equals("no")) return false;
            throw new IllegalArgumentException("Invalid boolean for " + flag + ": " + v);
        }

        static void printHelp(PrintStream out) {
            out.println(
                    "uscript-index\n" +
                    "\n" +
                    "Usage:\n" +
                    "  java -jar uscript-index.jar --root <game folder> [options]\n" +
                    "\n" +
                    "Options:\n" +
                    "  --root <path>          Game folder; every subfolder is a package (required)\n" +
                    "  --document <file.uc>   Analyze one source file against the index and print its\n" +
                    "                         outline and highlight spans\n" +
                    "  --report <file.md>     Write a markdown report of the index\n" +
                    "  --completions          Print the completion list (keywords, types, class names)\n" +
                    "  --json                 Print JSON instead of text (the analysis when --document\n" +
                    "                         is given, the completion list with --completions, the\n" +
                    "                         class index otherwise)\n" +
                    "  --classes-dir <name>   Class-source subfolder of each package (default: Classes)\n" +
                    "  --suffix <ext>         Source file suffix, case-sensitive (default: .uc)\n" +
                    "  --reset-class-per-file <bool>  Forget the current class at the start of each file.\n" +
                    "                         Default: true. With false, members of a file without a class\n" +
                    "                         declaration belong to the last class of the previous file.\n" +
                    "  -h, --help             Show help\n" +
                    "\n" +
                    "Examples:\n" +
                    "  java -jar uscript-index.jar --root samples/mini-game --report out/index.md\n" +
                    "  java -jar uscript-index.jar samples/mini-game --document samples/mini-game/Core/Classes/Actor.uc --json\n"
            );
        }
    }
}
