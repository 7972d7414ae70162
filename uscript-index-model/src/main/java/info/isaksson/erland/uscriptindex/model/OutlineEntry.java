package info.isaksson.erland.uscriptindex.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/**
 * Flat outline entry for one declaration line. The range always covers the whole line.
 */
@JsonPropertyOrder({"name","kind","line","startColumn","endColumn"})
public final class OutlineEntry {
    public final String name;
    public final DeclarationKind kind;
    public final int line;
    public final int startColumn;
    public final int endColumn;

    @JsonCreator
    public OutlineEntry(
            @JsonProperty("name") String name,
            @JsonProperty("kind") DeclarationKind kind,
            @JsonProperty("line") int line,
            @JsonProperty("startColumn") int startColumn,
            @JsonProperty("endColumn") int endColumn
    ) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
        this.line = line;
        this.startColumn = startColumn;
        this.endColumn = endColumn;
    }

    /** Entry spanning the full text of {@code lineText}. */
    public static OutlineEntry forLine(String name, DeclarationKind kind, int line, String lineText) {
        return new OutlineEntry(name, kind, line, 0, lineText == null ? 0 : lineText.length());
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof OutlineEntry)) return false;
        OutlineEntry that = (OutlineEntry) o;
        return line == that.line &&
                startColumn == that.startColumn &&
                endColumn == that.endColumn &&
                Objects.equals(name, that.name) &&
                kind == that.kind;
    }

    @Override public int hashCode() {
        return Objects.hash(name, kind, line, startColumn, endColumn);
    }

    @Override public String toString() {
        return kind + " " + name + " [" + line + ":" + startColumn + "-" + endColumn + "]";
    }
}
