package info.isaksson.erland.uscriptindex.core;

import info.isaksson.erland.uscriptindex.analyze.CompletionCatalog;
import info.isaksson.erland.uscriptindex.analyze.DocumentAnalyzer;
import info.isaksson.erland.uscriptindex.analyze.SemanticTokensEncoder;
import info.isaksson.erland.uscriptindex.classify.PatternLineClassifier;
import info.isaksson.erland.uscriptindex.io.PackageTreeScanner;
import info.isaksson.erland.uscriptindex.io.ScanResult;
import info.isaksson.erland.uscriptindex.model.CompletionItem;
import info.isaksson.erland.uscriptindex.model.DocumentAnalysis;
import info.isaksson.erland.uscriptindex.model.SymbolTable;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Owns the published {@link SymbolTable} of one game installation and serves document requests
 * against it.
 *
 * <p>Lifecycle of the table: empty at construction, replaced as a whole by every successful
 * {@link #rebuild(Path)}, read by any number of callers. A rebuild scans into a private table and
 * publishes it with one atomic swap, so readers see either the previous table or the new one,
 * never a partial one. A failed rebuild publishes nothing. Rebuilds are serialized: a second
 * caller waits until the running rebuild has published.</p>
 *
 * <p>Hosts and CLI wrappers should use this class instead of wiring scanner and analyzer
 * themselves.</p>
 */
public final class UScriptIndexService {

    private static final Logger logger = LogManager.getLogger(UScriptIndexService.class);

    private final PackageTreeScanner scanner;
    private final DocumentAnalyzer analyzer;

    private final AtomicReference<SymbolTable> published = new AtomicReference<>(SymbolTable.empty());
    private final ReentrantLock rebuildLock = new ReentrantLock();
    private final List<IndexListener> listeners = new CopyOnWriteArrayList<>();

    private volatile Path root;

    public UScriptIndexService() {
        this(new UScriptIndexOptions());
    }

    public UScriptIndexService(UScriptIndexOptions options) {
        this(new PackageTreeScanner(PatternLineClassifier.INSTANCE,
                        (options == null ? new UScriptIndexOptions() : options).toScanOptions()),
                new DocumentAnalyzer(PatternLineClassifier.INSTANCE));
    }

    public UScriptIndexService(PackageTreeScanner scanner, DocumentAnalyzer analyzer) {
        this.scanner = Objects.requireNonNull(scanner, "scanner must not be null");
        this.analyzer = Objects.requireNonNull(analyzer, "analyzer must not be null");
    }

    /**
     * Scan {@code gameRoot} and publish the resulting table.
     *
     * @throws IOException if {@code gameRoot} is missing, not a directory or cannot be listed; the
     *                     previously published table stays in place
     */
    public ScanResult rebuild(Path gameRoot) throws IOException {
        if (gameRoot == null) throw new IllegalArgumentException("gameRoot must not be null");
        Path normalized = gameRoot.toAbsolutePath().normalize();

        rebuildLock.lock();
        try {
            ScanResult res = scanner.scan(normalized);
            published.set(res.table);
            root = normalized;
            if (!res.warnings.isEmpty()) {
                logger.warn("Rebuild of {} skipped {} unreadable packages or files", normalized, res.warnings.size());
            }
            notifyListeners(res.table);
            return res;
        } finally {
            rebuildLock.unlock();
        }
    }

    /** Rescan the root of the last successful rebuild. */
    public ScanResult rebuild() throws IOException {
        Path current = root;
        if (current == null) throw new IllegalStateException("No game root has been indexed yet");
        return rebuild(current);
    }

    /** The currently published table. Callers should keep the returned snapshot for one request. */
    public SymbolTable symbolTable() {
        return published.get();
    }

    /** Root of the last successful rebuild. */
    public Optional<Path> root() {
        return Optional.ofNullable(root);
    }

    public DocumentAnalysis analyze(String languageId, String text) {
        return analyzer.analyze(languageId, text, published.get());
    }

    public DocumentAnalysis analyze(String text) {
        return analyzer.analyze(text, published.get());
    }

    /** Highlights of {@code text} in the relative integer encoding, see {@link SemanticTokensEncoder}. */
    public int[] semanticTokens(String languageId, String text) {
        return SemanticTokensEncoder.encode(analyze(languageId, text).highlights);
    }

    public List<CompletionItem> completions() {
        return CompletionCatalog.completions(published.get());
    }

    public void addListener(IndexListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener must not be null"));
    }

    /** Ask listeners to re-analyze their documents against the current table. */
    public void invalidate() {
        notifyListeners(published.get());
    }

    private void notifyListeners(SymbolTable table) {
        for (IndexListener l : listeners) {
            try {
                l.indexChanged(table);
            } catch (RuntimeException e) {
                logger.warn("Index listener {} failed", l, e);
            }
        }
    }
}
