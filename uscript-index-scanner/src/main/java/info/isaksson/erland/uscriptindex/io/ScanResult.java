package info.isaksson.erland.uscriptindex.io;

import info.isaksson.erland.uscriptindex.model.SymbolTable;

import java.nio.file.Path;
import java.util.List;

/** Outcome of one package tree scan. */
public final class ScanResult {

    public final Path root;

    /** The freshly built table. Nothing else holds a reference to it yet. */
    public final SymbolTable table;

    /** Package folder names that contributed a source directory, in scan order. */
    public final List<String> packages;

    /** Source files that were read successfully, in scan order. */
    public final List<Path> sourceFiles;

    /** Skipped packages and files, deterministic order. */
    public final List<ScanWarning> warnings;

    ScanResult(Path root, SymbolTable table, List<String> packages, List<Path> sourceFiles, List<ScanWarning> warnings) {
        this.root = root;
        this.table = table;
        this.packages = List.copyOf(packages);
        this.sourceFiles = List.copyOf(sourceFiles);
        this.warnings = List.copyOf(warnings);
    }
}
