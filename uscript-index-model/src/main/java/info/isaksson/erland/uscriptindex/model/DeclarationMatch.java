package info.isaksson.erland.uscriptindex.model;

import java.util.Objects;

/**
 * Result of classifying one source line as a declaration.
 *
 * <p>Only class declarations carry a parent; {@link #parentName} is {@code null} otherwise.
 * Columns are 0-based offsets into the classified line.</p>
 */
public final class DeclarationMatch {
    public final DeclarationKind kind;
    public final String name;
    public final int nameColumn;
    public final String parentName;
    public final int parentColumn;

    public DeclarationMatch(DeclarationKind kind, String name, int nameColumn, String parentName, int parentColumn) {
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.nameColumn = nameColumn;
        this.parentName = parentName;
        this.parentColumn = parentName == null ? -1 : parentColumn;
    }

    public static DeclarationMatch of(DeclarationKind kind, String name, int nameColumn) {
        return new DeclarationMatch(kind, name, nameColumn, null, -1);
    }

    public boolean hasParent() {
        return parentName != null;
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DeclarationMatch)) return false;
        DeclarationMatch that = (DeclarationMatch) o;
        return nameColumn == that.nameColumn &&
                parentColumn == that.parentColumn &&
                kind == that.kind &&
                Objects.equals(name, that.name) &&
                Objects.equals(parentName, that.parentName);
    }

    @Override public int hashCode() {
        return Objects.hash(kind, name, nameColumn, parentName, parentColumn);
    }

    @Override public String toString() {
        return kind + " " + name + "@" + nameColumn + (parentName == null ? "" : " : " + parentName + "@" + parentColumn);
    }
}
