package info.isaksson.erland.uscriptindex.analyze;

import info.isaksson.erland.uscriptindex.classify.LineClassifier;
import info.isaksson.erland.uscriptindex.classify.PatternLineClassifier;
import info.isaksson.erland.uscriptindex.io.SourceText;
import info.isaksson.erland.uscriptindex.model.DeclarationMatch;
import info.isaksson.erland.uscriptindex.model.DocumentAnalysis;
import info.isaksson.erland.uscriptindex.model.HighlightSpan;
import info.isaksson.erland.uscriptindex.model.OutlineEntry;
import info.isaksson.erland.uscriptindex.model.SymbolTable;
import info.isaksson.erland.uscriptindex.model.TokenCategory;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Derives outline entries and highlight spans for one open document.
 *
 * <p>Both passes classify each line independently with the {@link LineClassifier}; the highlight
 * pass additionally searches every line for known class names (from the {@link SymbolTable}) and
 * for variables declared earlier in the document. The analyzer keeps no state between calls and
 * accepts any text, including binary content, without failing.</p>
 */
public final class DocumentAnalyzer {

    private static final Logger logger = LogManager.getLogger(DocumentAnalyzer.class);

    /** Language id of documents this analyzer handles. */
    public static final String LANGUAGE_ID = "unrealscript";

    private final LineClassifier classifier;

    public DocumentAnalyzer() {
        this(PatternLineClassifier.INSTANCE);
    }

    public DocumentAnalyzer(LineClassifier classifier) {
        this.classifier = Objects.requireNonNull(classifier, "classifier must not be null");
    }

    public static boolean handles(String languageId) {
        return languageId != null && LANGUAGE_ID.equals(languageId.trim().toLowerCase(Locale.ROOT));
    }

    /** Analyze {@code text} if {@code languageId} is UnrealScript; any other language yields an empty result. */
    public DocumentAnalysis analyze(String languageId, String text, SymbolTable table) {
        if (!handles(languageId)) {
            logger.debug("Ignoring document with language id {}", languageId);
            return DocumentAnalysis.empty();
        }
        return analyze(text, table);
    }

    public DocumentAnalysis analyze(String text, SymbolTable table) {
        List<String> lines = SourceText.lines(text);
        List<OutlineEntry> outline = outline(lines);
        List<HighlightSpan> highlights = highlights(lines, table);
        logger.debug("Analyzed {} lines: {} outline entries, {} highlight spans",
                lines.size(), outline.size(), highlights.size());
        return new DocumentAnalysis(outline, highlights);
    }

    /**
     * One flat entry per class, function or state declaration, in line order. Functions are not
     * nested under their class and variables are not listed.
     */
    public List<OutlineEntry> outline(List<String> lines) {
        if (lines == null || lines.isEmpty()) return List.of();
        List<OutlineEntry> out = new ArrayList<>();
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            Optional<DeclarationMatch> match = classifier.classify(line);
            if (match.isEmpty()) continue;

            DeclarationMatch m = match.get();
            switch (m.kind) {
                case CLASS:
                case FUNCTION:
                case STATE:
                    out.add(OutlineEntry.forLine(m.name, m.kind, i, line));
                    break;
                case VARIABLE:
                default:
                    break;
            }
        }
        return out;
    }

    /**
     * Highlight spans in line order, column order within a line. Spans of different names may
     * overlap; a span is never reported twice.
     *
     * <p>Variables declared with {@code var} are remembered in two scopes: the class scope lasts
     * until the next class declaration, the function scope until the next class or function
     * declaration. Every later occurrence of a remembered variable, and of any class name in
     * {@code table}, is highlighted.</p>
     */
    public List<HighlightSpan> highlights(List<String> lines, SymbolTable table) {
        if (lines == null || lines.isEmpty()) return List.of();
        SymbolTable symbols = table == null ? SymbolTable.empty() : table;

        Set<String> classVariables = new LinkedHashSet<>();
        Set<String> functionVariables = new LinkedHashSet<>();
        List<HighlightSpan> out = new ArrayList<>();

        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i) == null ? "" : lines.get(i);
            HighlightCollector spans = new HighlightCollector(i);

            Optional<DeclarationMatch> match = classifier.classify(line);
            if (match.isPresent()) {
                DeclarationMatch m = match.get();
                switch (m.kind) {
                    case CLASS:
                        spans.declaration(m.nameColumn, m.name, TokenCategory.CLASS);
                        if (m.hasParent()) spans.declaration(m.parentColumn, m.parentName, TokenCategory.CLASS);
                        classVariables.clear();
                        functionVariables.clear();
                        break;
                    case FUNCTION:
                        spans.declaration(m.nameColumn, m.name, TokenCategory.FUNCTION);
                        functionVariables.clear();
                        break;
                    case VARIABLE:
                        spans.declaration(m.nameColumn, m.name, TokenCategory.VARIABLE);
                        classVariables.add(m.name);
                        functionVariables.add(m.name);
                        break;
                    case STATE:
                    default:
                        break;
                }
            }

            for (String className : symbols.classNames()) {
                spans.occurrences(line, className, TokenCategory.CLASS);
            }

            Set<String> variables = new LinkedHashSet<>(classVariables);
            variables.addAll(functionVariables);
            for (String variable : variables) {
                spans.occurrences(line, variable, TokenCategory.VARIABLE);
            }

            out.addAll(spans.resolve());
        }
        return out;
    }
}
