package info.isaksson.erland.uscriptindex.analyze;

import info.isaksson.erland.uscriptindex.model.HighlightSpan;
import info.isaksson.erland.uscriptindex.model.TokenCategory;

import java.util.ArrayList;
import java.util.List;

/**
 * Encodes highlight spans into the relative integer stream used by editor semantic token APIs.
 *
 * <p>Each span becomes five integers: line delta, start delta (relative to the previous span on
 * the same line, absolute otherwise), length, token type index from {@link TokenCategory#legend()}
 * and a modifier bitset, always 0.</p>
 */
public final class SemanticTokensEncoder {

    private SemanticTokensEncoder() {}

    public static List<String> tokenTypes() {
        return TokenCategory.legend();
    }

    public static int[] encode(List<HighlightSpan> spans) {
        if (spans == null || spans.isEmpty()) return new int[0];
        List<HighlightSpan> sorted = new ArrayList<>(spans);
        sorted.sort(HighlightSpan.DOCUMENT_ORDER);

        int[] data = new int[sorted.size() * 5];
        int prevLine = 0;
        int prevColumn = 0;
        int i = 0;
        for (HighlightSpan s : sorted) {
            int deltaLine = s.line - prevLine;
            int deltaColumn = deltaLine == 0 ? s.startColumn - prevColumn : s.startColumn;

            data[i++] = deltaLine;
            data[i++] = deltaColumn;
            data[i++] = s.length;
            data[i++] = s.category.legendIndex();
            data[i++] = 0;

            prevLine = s.line;
            prevColumn = s.startColumn;
        }
        return data;
    }
}
