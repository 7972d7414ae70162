package info.isaksson.erland.uscriptindex.io;

import java.util.Comparator;
import java.util.Objects;

/** A package or source file that a scan skipped. The scan itself went on. */
public final class ScanWarning {

    public enum Code {
        /** The package's class-source folder could not be listed. */
        PACKAGE_UNREADABLE("Package folder could not be listed"),
        /** A source file could not be read. */
        FILE_UNREADABLE("Source file could not be read");

        private final String message;

        Code(String message) {
            this.message = message;
        }

        public String message() {
            return message;
        }
    }

    /** Report order: code, then package, then path. Independent of directory listing order. */
    public static final Comparator<ScanWarning> REPORT_ORDER = Comparator
            .comparing((ScanWarning w) -> w.code)
            .thenComparing(w -> w.packageName)
            .thenComparing(w -> w.path);

    public final Code code;

    /** Package folder name the skipped unit belongs to. */
    public final String packageName;

    /** Skipped folder or file, with forward slashes. */
    public final String path;

    ScanWarning(Code code, String packageName, String path) {
        this.code = Objects.requireNonNull(code, "code must not be null");
        this.packageName = Objects.requireNonNull(packageName, "packageName must not be null");
        this.path = Objects.requireNonNull(path, "path must not be null");
    }

    public String message() {
        return code.message();
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ScanWarning)) return false;
        ScanWarning that = (ScanWarning) o;
        return code == that.code && packageName.equals(that.packageName) && path.equals(that.path);
    }

    @Override public int hashCode() {
        return Objects.hash(code, packageName, path);
    }

    @Override public String toString() {
        return code + ": " + message() + " [" + packageName + "] " + path;
    }
}
