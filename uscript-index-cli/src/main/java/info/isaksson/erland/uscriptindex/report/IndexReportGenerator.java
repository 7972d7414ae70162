package info.isaksson.erland.uscriptindex.report;

import info.isaksson.erland.uscriptindex.io.ScanResult;
import info.isaksson.erland.uscriptindex.io.ScanWarning;
import info.isaksson.erland.uscriptindex.model.ClassRecord;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Human-readable markdown report of one scan: summary, classes grouped by package, skipped units.
 */
public final class IndexReportGenerator {

    private IndexReportGenerator() {}

    public static void writeMarkdown(Path reportPath, ScanResult result) throws IOException {
        Path parent = reportPath.toAbsolutePath().normalize().getParent();
        if (parent != null) Files.createDirectories(parent);
        Files.writeString(reportPath, toMarkdown(result));
    }

    public static String toMarkdown(ScanResult result) {
        StringBuilder report = new StringBuilder();
        report.append("# uscript-index report\n\n");

        report.append("## Summary\n\n");
        report.append("- Root: `").append(result.root).append("`\n");
        report.append("- Packages scanned: **").append(result.packages.size()).append("**\n");
        report.append("- Source files read: **").append(result.sourceFiles.size()).append("**\n");
        report.append("- Classes indexed: **").append(result.table.size()).append("**\n");
        report.append("- Functions: **").append(countFunctions(result)).append("**\n");
        report.append("- Variables: **").append(countVariables(result)).append("**\n");
        report.append("- Skipped (warnings): **").append(result.warnings.size()).append("**\n\n");

        report.append("## Classes\n");
        Map<String, List<ClassRecord>> byPackage = groupByPackage(result);
        if (byPackage.isEmpty()) {
            report.append("\n_(none)_\n");
        }
        for (Map.Entry<String, List<ClassRecord>> e : byPackage.entrySet()) {
            report.append("\n### ").append(e.getKey()).append("\n\n");
            report.append("| Class | Functions | Variables |\n");
            report.append("|---|---|---|\n");
            for (ClassRecord r : e.getValue()) {
                report.append("| `").append(r.name).append("` | ")
                        .append(joinOrDash(r.functions)).append(" | ")
                        .append(joinOrDash(r.variables)).append(" |\n");
            }
        }

        report.append("\n## Warnings\n\n");
        if (result.warnings.isEmpty()) {
            report.append("_(none)_\n");
        } else {
            for (ScanWarning w : result.warnings) {
                report.append("- **").append(w.code).append("** ").append(w.message())
                        .append(" (").append(w.packageName).append("): `").append(w.path).append("`\n");
            }
        }
        return report.toString();
    }

    private static Map<String, List<ClassRecord>> groupByPackage(ScanResult result) {
        Map<String, List<ClassRecord>> out = new LinkedHashMap<>();
        for (String pkg : result.packages) {
            List<ClassRecord> records = new ArrayList<>();
            for (ClassRecord r : result.table.records()) {
                if (pkg.equals(r.packageName)) records.add(r);
            }
            if (records.isEmpty()) continue;
            records.sort(Comparator.comparing(r -> r.name));
            out.put(pkg, records);
        }
        return out;
    }

    private static int countFunctions(ScanResult result) {
        int n = 0;
        for (ClassRecord r : result.table.records()) n += r.functions.size();
        return n;
    }

    private static int countVariables(ScanResult result) {
        int n = 0;
        for (ClassRecord r : result.table.records()) n += r.variables.size();
        return n;
    }

    private static String joinOrDash(List<String> values) {
        if (values.isEmpty()) return "-";
        return String.join(", ", values);
    }
}
