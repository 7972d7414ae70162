package info.isaksson.erland.uscriptindex.io;

import info.isaksson.erland.uscriptindex.classify.LineClassifier;
import info.isaksson.erland.uscriptindex.classify.PatternLineClassifier;
import info.isaksson.erland.uscriptindex.model.ClassRecord;
import info.isaksson.erland.uscriptindex.model.DeclarationMatch;
import info.isaksson.erland.uscriptindex.model.SymbolTable;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.DirectoryIteratorException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.NotDirectoryException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Builds a {@link SymbolTable} from an UnrealScript package tree.
 *
 * <p>Layout: every immediate subdirectory of the root is a package. Its sources live in
 * {@code <package>/Classes}, or directly in {@code <package>} when there is no {@code Classes}
 * folder. Only files directly inside that folder are read.</p>
 *
 * <p>Every scan fills a private working table and returns it frozen; a scan never touches a
 * table that someone else can read. Only a root that cannot be listed fails the scan. Unreadable
 * packages and files are recorded as {@link ScanWarning}s and skipped.</p>
 */
public final class PackageTreeScanner {

    private static final Logger logger = LogManager.getLogger(PackageTreeScanner.class);

    private static final Comparator<Path> BY_FILE_NAME = Comparator.comparing(p -> p.getFileName().toString());

    /** Lists the source files directly inside one package's class-source folder. */
    @FunctionalInterface
    interface SourceLister {
        List<Path> list(Path sourceDir) throws IOException;
    }

    private final LineClassifier classifier;
    private final ScanOptions options;
    private final SourceLister lister;

    public PackageTreeScanner() {
        this(PatternLineClassifier.INSTANCE, ScanOptions.defaults());
    }

    public PackageTreeScanner(LineClassifier classifier, ScanOptions options) {
        this(classifier, options, null);
    }

    PackageTreeScanner(LineClassifier classifier, ScanOptions options, SourceLister lister) {
        this.classifier = Objects.requireNonNull(classifier, "classifier must not be null");
        this.options = (options == null ? ScanOptions.defaults() : options).validated();
        this.lister = lister == null ? this::listSourceFiles : lister;
    }

    /**
     * Scan the package tree under {@code root}.
     *
     * @throws NoSuchFileException if {@code root} does not exist
     * @throws NotDirectoryException if {@code root} is not a directory
     * @throws IOException if {@code root} cannot be listed
     */
    public ScanResult scan(Path root) throws IOException {
        Objects.requireNonNull(root, "root");
        if (!Files.exists(root)) throw new NoSuchFileException(root.toString());
        if (!Files.isDirectory(root)) throw new NotDirectoryException(root.toString());

        logger.debug("Scanning game packages in {}", root);

        List<Path> packageDirs = listPackageDirs(root);
        logger.debug("Found {} package folders", packageDirs.size());

        SymbolTable.Builder table = SymbolTable.builder();
        List<ScanWarning> warnings = new ArrayList<>();
        List<String> packages = new ArrayList<>();
        List<Path> sourceFiles = new ArrayList<>();

        // Only carried between files when resetClassPerFile is false
        ClassRecord.Builder carried = null;

        for (Path packageDir : packageDirs) {
            String packageName = packageDir.getFileName().toString();

            Path sourceDir = resolveSourceDir(packageDir);

            // also covers a package folder removed after the root was listed
            List<Path> files;
            try {
                files = lister.list(sourceDir);
            } catch (IOException | DirectoryIteratorException e) {
                logger.debug("Skipping unreadable package {}: {}", packageName, e.getMessage());
                warnings.add(new ScanWarning(ScanWarning.Code.PACKAGE_UNREADABLE, packageName, normalize(sourceDir)));
                continue;
            }
            packages.add(packageName);
            logger.debug("Scanning package \"{}\" in folder \"{}\", found {} source files",
                    packageName, sourceDir, files.size());

            for (Path file : files) {
                String text;
                try {
                    text = SourceText.read(file);
                } catch (IOException e) {
                    logger.debug("Skipping unreadable file {}: {}", file, e.getMessage());
                    warnings.add(new ScanWarning(ScanWarning.Code.FILE_UNREADABLE, packageName, normalize(file)));
                    continue;
                }
                sourceFiles.add(file);

                ClassRecord.Builder start = options.resetClassPerFile ? null : carried;
                carried = indexFile(packageName, SourceText.lines(text), start, table);
            }
        }

        SymbolTable built = table.build();
        logger.info("Indexed {} classes from {} packages under {}", built.size(), packages.size(), root);
        warnings.sort(ScanWarning.REPORT_ORDER);
        return new ScanResult(root, built, packages, sourceFiles, warnings);
    }

    /**
     * Feed the lines of one file through the classifier.
     *
     * @param current class that members are attributed to before the file declares its own
     * @return the class that is current at the end of the file
     */
    ClassRecord.Builder indexFile(String packageName, List<String> lines, ClassRecord.Builder current, SymbolTable.Builder table) {
        for (String line : lines) {
            Optional<DeclarationMatch> match = classifier.classify(line);
            if (match.isEmpty()) continue;

            DeclarationMatch m = match.get();
            switch (m.kind) {
                case CLASS:
                    if (current != null) logCompleted(current);
                    current = table.startClass(packageName, m.name);
                    logger.debug("Found class {}", m.name);
                    break;
                case FUNCTION:
                    if (current != null) {
                        current.addFunction(m.name);
                        logger.trace("  Found function {} in {}", m.name, current.name());
                    }
                    break;
                case VARIABLE:
                    if (current != null) {
                        current.addVariable(m.name);
                        logger.trace("  Found variable {} in {}", m.name, current.name());
                    }
                    break;
                case STATE:
                default:
                    // states are outline-only
                    break;
            }
        }
        if (current != null) logCompleted(current);
        return current;
    }

    private Path resolveSourceDir(Path packageDir) {
        Path classes = packageDir.resolve(options.classesDirName);
        return Files.isDirectory(classes) ? classes : packageDir;
    }

    private static List<Path> listPackageDirs(Path root) throws IOException {
        List<Path> out = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(root)) {
            for (Path p : stream) {
                if (Files.isDirectory(p)) out.add(p);
            }
        } catch (DirectoryIteratorException e) {
            throw e.getCause();
        }
        out.sort(BY_FILE_NAME);
        return out;
    }

    private List<Path> listSourceFiles(Path dir) throws IOException {
        List<Path> out = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir)) {
            for (Path p : stream) {
                // broken links are kept and reported when the read fails
                if (p.getFileName().toString().endsWith(options.sourceSuffix) && !Files.isDirectory(p)) {
                    out.add(p);
                }
            }
        }
        out.sort(BY_FILE_NAME);
        return out;
    }

    private static void logCompleted(ClassRecord.Builder b) {
        logger.debug("Completed class {} with {} functions and {} variables",
                b.name(), b.functionCount(), b.variableCount());
    }

    private static String normalize(Path p) {
        return p.toString().replace('\\', '/');
    }
}
