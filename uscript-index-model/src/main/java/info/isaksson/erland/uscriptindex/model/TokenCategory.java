package info.isaksson.erland.uscriptindex.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * Highlight categories. The ordinal is the token type index of the semantic token legend,
 * so the declaration order must not change.
 */
public enum TokenCategory {
    CLASS,
    FUNCTION,
    VARIABLE,
    /** Reserved in the legend; nothing emits it yet. */
    PARAMETER;

    /** Index of this category in {@link #legend()}. */
    public int legendIndex() {
        return ordinal();
    }

    /** Legend token names in index order: {@code class, function, variable, parameter}. */
    public static List<String> legend() {
        List<String> out = new ArrayList<>();
        for (TokenCategory c : values()) {
            out.add(c.name().toLowerCase(Locale.ROOT));
        }
        return Collections.unmodifiableList(out);
    }
}
