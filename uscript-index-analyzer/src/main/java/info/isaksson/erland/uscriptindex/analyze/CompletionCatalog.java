package info.isaksson.erland.uscriptindex.analyze;

import info.isaksson.erland.uscriptindex.model.CompletionItem;
import info.isaksson.erland.uscriptindex.model.CompletionKind;
import info.isaksson.erland.uscriptindex.model.SymbolTable;

import java.util.ArrayList;
import java.util.List;

/** Completion vocabulary: UnrealScript keywords, built-in types and every indexed class name. */
public final class CompletionCatalog {

    public static final List<String> KEYWORDS = List.of(
            "class", "extends", "function", "event", "state", "defaultproperties",
            "if", "else", "while", "for", "foreach", "switch", "case", "return", "break", "continue", "until");

    public static final List<String> TYPES = List.of(
            "int", "float", "bool", "byte", "string", "name", "vector", "rotator", "array", "struct", "class");

    /** Characters after which a host should offer completions. */
    public static final List<String> TRIGGER_CHARACTERS = List.of(".");

    private CompletionCatalog() {}

    /** Keywords, then types, then class names in table order. No context filtering. */
    public static List<CompletionItem> completions(SymbolTable table) {
        List<CompletionItem> out = new ArrayList<>();
        for (String kw : KEYWORDS) out.add(new CompletionItem(kw, CompletionKind.KEYWORD));
        for (String t : TYPES) out.add(new CompletionItem(t, CompletionKind.TYPE));
        if (table != null) {
            for (String name : table.classNames()) out.add(new CompletionItem(name, CompletionKind.CLASS));
        }
        return out;
    }
}
