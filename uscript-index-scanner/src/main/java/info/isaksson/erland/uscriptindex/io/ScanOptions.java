package info.isaksson.erland.uscriptindex.io;

/**
 * Package tree scanning controls.
 *
 * <p>Defaults match the layout of an Unreal Engine 1 game installation: one folder per package,
 * sources under {@code Classes}, files ending in {@code .uc}.</p>
 */
public final class ScanOptions {

    /** Preferred class-source subfolder of each package. Falls back to the package folder itself. */
    public String classesDirName = "Classes";

    /** File name suffix of source files (case-sensitive). */
    public String sourceSuffix = ".uc";

    /**
     * Whether the "current class" is forgotten at the start of each file.
     *
     * <p>When {@code false}, functions and variables in a file without a class declaration are
     * attributed to the last class seen in an earlier file of the same scan.</p>
     */
    public boolean resetClassPerFile = true;

    public static ScanOptions defaults() {
        return new ScanOptions();
    }

    ScanOptions validated() {
        if (classesDirName == null || classesDirName.isBlank()) {
            throw new IllegalArgumentException("classesDirName must not be blank");
        }
        if (sourceSuffix == null || sourceSuffix.isEmpty()) {
            throw new IllegalArgumentException("sourceSuffix must not be empty");
        }
        return this;
    }
}
