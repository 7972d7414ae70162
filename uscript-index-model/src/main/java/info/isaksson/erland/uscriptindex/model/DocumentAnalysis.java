package info.isaksson.erland.uscriptindex.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;
import java.util.Objects;

/** Outline and highlight results for one document, both in document order. */
@JsonPropertyOrder({"outline","highlights"})
public final class DocumentAnalysis {

    private static final DocumentAnalysis EMPTY = new DocumentAnalysis(List.of(), List.of());

    public final List<OutlineEntry> outline;
    public final List<HighlightSpan> highlights;

    @JsonCreator
    public DocumentAnalysis(
            @JsonProperty("outline") List<OutlineEntry> outline,
            @JsonProperty("highlights") List<HighlightSpan> highlights
    ) {
        this.outline = outline == null ? List.of() : List.copyOf(outline);
        this.highlights = highlights == null ? List.of() : List.copyOf(highlights);
    }

    public static DocumentAnalysis empty() {
        return EMPTY;
    }

    @JsonIgnore
    public boolean isEmpty() {
        return outline.isEmpty() && highlights.isEmpty();
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DocumentAnalysis)) return false;
        DocumentAnalysis that = (DocumentAnalysis) o;
        return Objects.equals(outline, that.outline) &&
                Objects.equals(highlights, that.highlights);
    }

    @Override public int hashCode() {
        return Objects.hash(outline, highlights);
    }
}
