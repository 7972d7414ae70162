package info.isaksson.erland.uscriptindex.report;

import info.isaksson.erland.uscriptindex.io.PackageTreeScanner;
import info.isaksson.erland.uscriptindex.io.ScanResult;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

public class IndexReportGeneratorTest {

    @Test
    void rendersClassesPerPackage(@TempDir Path tmp) throws IOException {
        Path classes = Files.createDirectories(tmp.resolve("Core/Classes"));
        Files.writeString(classes.resolve("Object.uc"), "class Object;\n");
        Files.writeString(classes.resolve("Actor.uc"),
                "class Actor extends Object;\nvar int Health;\nfunction Tick()\n");

        ScanResult res = new PackageTreeScanner().scan(tmp);
        String md = IndexReportGenerator.toMarkdown(res);

        assertTrue(md.startsWith("# uscript-index report\n"), md);
        assertTrue(md.contains("- Classes indexed: **2**"), md);
        assertTrue(md.contains("- Functions: **1**"), md);
        assertTrue(md.contains("- Variables: **1**"), md);
        assertTrue(md.contains("### Core"), md);
        assertTrue(md.indexOf("| `Actor` | Tick | Health |") < md.indexOf("| `Object` | - | - |"), md);
        assertTrue(md.endsWith("## Warnings\n\n_(none)_\n"), md);
    }

    @Test
    void emptyTreeSaysNone(@TempDir Path tmp) throws IOException {
        String md = IndexReportGenerator.toMarkdown(new PackageTreeScanner().scan(tmp));
        assertTrue(md.contains("## Classes\n\n_(none)_\n"), md);
        assertTrue(md.contains("- Packages scanned: **0**"), md);
    }

    @Test
    void listsSkippedFiles(@TempDir Path tmp) throws IOException {
        Path pkg = Files.createDirectories(tmp.resolve("Broken"));
        try {
            Files.createSymbolicLink(pkg.resolve("Gone.uc"), pkg.resolve("does-not-exist.uc"));
        } catch (UnsupportedOperationException | IOException e) {
            assumeTrue(false, "symlinks not supported");
        }

        String md = IndexReportGenerator.toMarkdown(new PackageTreeScanner().scan(tmp));
        assertTrue(md.contains("- **FILE_UNREADABLE** Source file could not be read (Broken): `"), md);
        assertTrue(md.contains("Gone.uc`"), md);
    }

    @Test
    void writeMarkdownCreatesParentFolders(@TempDir Path tmp) throws IOException {
        Path out = tmp.resolve("a/b/report.md");
        IndexReportGenerator.writeMarkdown(out, new PackageTreeScanner().scan(tmp));
        assertTrue(Files.isRegularFile(out));
    }
}
