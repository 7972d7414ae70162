package info.isaksson.erland.uscriptindex.classify;

import info.isaksson.erland.uscriptindex.model.DeclarationKind;
import info.isaksson.erland.uscriptindex.model.DeclarationMatch;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Line-level pattern classifier for UnrealScript declarations.
 *
 * <p>This is an approximation of the grammar, not a parser: every pattern is anchored at the start
 * of the line (leading whitespace allowed) and matched case-insensitively. Comments, string
 * literals, multi-line declarations and {@code defaultproperties} blocks are not recognized, so a
 * commented-out declaration is still reported. Patterns are tried in the order class, function,
 * var, state and the first match wins.</p>
 */
public final class PatternLineClassifier implements LineClassifier {

    /** Shared instance; the classifier holds no state. */
    public static final PatternLineClassifier INSTANCE = new PatternLineClassifier();

    static final Pattern CLASS = Pattern.compile(
            "^\\s*class\\s+(\\w+)(?:\\s+(extends|based\\s+on)\\s+(\\w+))?", Pattern.CASE_INSENSITIVE);
    static final Pattern FUNCTION = Pattern.compile("^\\s*function\\s+(\\w+)", Pattern.CASE_INSENSITIVE);
    // var <type> <name>: only the last identifier is kept
    static final Pattern VARIABLE = Pattern.compile("^\\s*var\\s+\\w+\\s+(\\w+)", Pattern.CASE_INSENSITIVE);
    static final Pattern STATE = Pattern.compile("^\\s*state\\s+(\\w+)", Pattern.CASE_INSENSITIVE);

    @Override
    public Optional<DeclarationMatch> classify(String line) {
        if (line == null || line.isEmpty()) return Optional.empty();

        Matcher m = CLASS.matcher(line);
        if (m.find()) {
            String parent = m.group(3);
            return Optional.of(new DeclarationMatch(
                    DeclarationKind.CLASS,
                    m.group(1),
                    m.start(1),
                    parent,
                    parent == null ? -1 : m.start(3)));
        }

        m = FUNCTION.matcher(line);
        if (m.find()) {
            return Optional.of(DeclarationMatch.of(DeclarationKind.FUNCTION, m.group(1), m.start(1)));
        }

        m = VARIABLE.matcher(line);
        if (m.find()) {
            return Optional.of(DeclarationMatch.of(DeclarationKind.VARIABLE, m.group(1), m.start(1)));
        }

        m = STATE.matcher(line);
        if (m.find()) {
            return Optional.of(DeclarationMatch.of(DeclarationKind.STATE, m.group(1), m.start(1)));
        }

        return Optional.empty();
    }
}
