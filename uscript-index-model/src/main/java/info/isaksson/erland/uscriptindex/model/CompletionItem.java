package info.isaksson.erland.uscriptindex.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

@JsonPropertyOrder({"label","kind"})
public final class CompletionItem {
    public final String label;
    public final CompletionKind kind;

    @JsonCreator
    public CompletionItem(
            @JsonProperty("label") String label,
            @JsonProperty("kind") CompletionKind kind
    ) {
        this.label = Objects.requireNonNull(label, "label must not be null");
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CompletionItem)) return false;
        CompletionItem that = (CompletionItem) o;
        return Objects.equals(label, that.label) && kind == that.kind;
    }

    @Override public int hashCode() {
        return Objects.hash(label, kind);
    }

    @Override public String toString() {
        return kind + ":" + label;
    }
}
