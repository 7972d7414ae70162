package info.isaksson.erland.uscriptindex.core;

import info.isaksson.erland.uscriptindex.io.ScanOptions;

/**
 * Core (host-friendly) options for indexing a game installation.
 *
 * <p>This mirrors the CLI flags in a structured form.</p>
 */
public final class UScriptIndexOptions {

    /** Class-source subfolder looked up in each package before falling back to the package folder. */
    public String classesDirName = "Classes";

    /** Source file suffix, matched case-sensitively. */
    public String sourceSuffix = ".uc";

    /**
     * Forget the current class at the start of every file. Set to {@code false} to attribute
     * class-less members to the last class of a previous file.
     */
    public boolean resetClassPerFile = true;

    ScanOptions toScanOptions() {
        ScanOptions o = new ScanOptions();
        o.classesDirName = classesDirName;
        o.sourceSuffix = sourceSuffix;
        o.resetClassPerFile = resetClassPerFile;
        return o;
    }
}
