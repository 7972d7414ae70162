package info.isaksson.erland.uscriptindex.analyze;

import info.isaksson.erland.uscriptindex.model.HighlightSpan;
import info.isaksson.erland.uscriptindex.model.TokenCategory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Collects the highlight spans of one line and returns them in column order.
 *
 * <p>Every occurrence is kept, including occurrences of one name inside another (a class name
 * inside a variable name yields both spans). Only exact duplicates are collapsed, such as a
 * declaration span and the occurrence search finding the same name at the same column. Spans
 * starting at the same column are ordered longer first, then by token category.</p>
 */
final class HighlightCollector {

    private static final Comparator<HighlightSpan> LINE_ORDER = Comparator
            .comparingInt((HighlightSpan s) -> s.startColumn)
            .thenComparing(Comparator.comparingInt((HighlightSpan s) -> s.length).reversed())
            .thenComparingInt(s -> s.category.ordinal());

    private final int line;
    private final List<HighlightSpan> spans = new ArrayList<>();

    HighlightCollector(int line) {
        this.line = line;
    }

    void declaration(int startColumn, String name, TokenCategory category) {
        if (startColumn < 0 || name == null || name.isEmpty()) return;
        spans.add(new HighlightSpan(line, startColumn, name.length(), category));
    }

    /**
     * Add every occurrence of {@code name} in {@code text}, scanning left to right and resuming
     * after the end of each match. Plain substring search: {@code Pawn} also matches inside
     * {@code PlayerPawnX}.
     */
    void occurrences(String text, String name, TokenCategory category) {
        if (text == null || name == null || name.isEmpty()) return;
        int idx = text.indexOf(name);
        while (idx >= 0) {
            spans.add(new HighlightSpan(line, idx, name.length(), category));
            idx = text.indexOf(name, idx + name.length());
        }
    }

    List<HighlightSpan> resolve() {
        if (spans.isEmpty()) return List.of();
        List<HighlightSpan> sorted = new ArrayList<>(spans);
        sorted.sort(LINE_ORDER);

        // equal spans are adjacent after sorting
        List<HighlightSpan> out = new ArrayList<>();
        HighlightSpan previous = null;
        for (HighlightSpan s : sorted) {
            if (s.equals(previous)) continue;
            out.add(s);
            previous = s;
        }
        return out;
    }
}
