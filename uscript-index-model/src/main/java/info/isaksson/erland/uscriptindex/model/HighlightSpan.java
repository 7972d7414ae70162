package info.isaksson.erland.uscriptindex.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Comparator;
import java.util.Objects;

@JsonPropertyOrder({"line","startColumn","length","category"})
public final class HighlightSpan {

    /** Document order: line, then start column. */
    public static final Comparator<HighlightSpan> DOCUMENT_ORDER = Comparator
            .comparingInt((HighlightSpan s) -> s.line)
            .thenComparingInt(s -> s.startColumn);

    public final int line;
    public final int startColumn;
    public final int length;
    public final TokenCategory category;

    @JsonCreator
    public HighlightSpan(
            @JsonProperty("line") int line,
            @JsonProperty("startColumn") int startColumn,
            @JsonProperty("length") int length,
            @JsonProperty("category") TokenCategory category
    ) {
        if (line < 0) throw new IllegalArgumentException("line must be >= 0: " + line);
        if (startColumn < 0) throw new IllegalArgumentException("startColumn must be >= 0: " + startColumn);
        if (length <= 0) throw new IllegalArgumentException("length must be > 0: " + length);
        this.line = line;
        this.startColumn = startColumn;
        this.length = length;
        this.category = Objects.requireNonNull(category, "category must not be null");
    }

    /** Exclusive end column. */
    public int endColumn() {
        return startColumn + length;
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof HighlightSpan)) return false;
        HighlightSpan that = (HighlightSpan) o;
        return line == that.line &&
                startColumn == that.startColumn &&
                length == that.length &&
                category == that.category;
    }

    @Override public int hashCode() {
        return Objects.hash(line, startColumn, length, category);
    }

    @Override public String toString() {
        return category + "@" + line + ":" + startColumn + "+" + length;
    }
}
