package info.isaksson.erland.uscriptindex.classify;

import info.isaksson.erland.uscriptindex.model.DeclarationKind;
import info.isaksson.erland.uscriptindex.model.DeclarationMatch;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

public class PatternLineClassifierTest {

    private final LineClassifier classifier = PatternLineClassifier.INSTANCE;

    private DeclarationMatch classifyPresent(String line) {
        Optional<DeclarationMatch> m = classifier.classify(line);
        assertTrue(m.isPresent(), "expected a declaration for: " + line);
        return m.get();
    }

    @Test
    void classKeywordIsCaseInsensitiveAndIgnoresLeadingWhitespace() {
        for (String line : new String[] {"class Actor;", "Class Actor;", "CLASS Actor;", "\t  class Actor;"}) {
            DeclarationMatch m = classifyPresent(line);
            assertEquals(DeclarationKind.CLASS, m.kind);
            assertEquals("Actor", m.name);
            assertEquals(line.indexOf("Actor"), m.nameColumn);
            assertFalse(m.hasParent());
        }
    }

    @Test
    void classCapturesParentForExtendsAndBasedOn() {
        DeclarationMatch ext = classifyPresent("class Pawn extends Actor;");
        assertEquals("Pawn", ext.name);
        assertEquals(6, ext.nameColumn);
        assertEquals("Actor", ext.parentName);
        assertEquals(19, ext.parentColumn);

        DeclarationMatch based = classifyPresent("  class Fallback based  on Actor");
        assertEquals("Fallback", based.name);
        assertEquals("Actor", based.parentName);
        assertEquals("  class Fallback based  on Actor".lastIndexOf("Actor"), based.parentColumn);
    }

    @Test
    void parentColumnIsTheGroupOffsetEvenWhenNamesRepeat() {
        DeclarationMatch m = classifyPresent("class Actor extends Actor;");
        assertEquals(6, m.nameColumn);
        assertEquals(20, m.parentColumn);
    }

    @Test
    void functionVariableAndStateDeclarations() {
        DeclarationMatch f = classifyPresent("function Tick(float Delta);");
        assertEquals(DeclarationKind.FUNCTION, f.kind);
        assertEquals("Tick", f.name);
        assertEquals(9, f.nameColumn);

        DeclarationMatch v = classifyPresent("var int Health;");
        assertEquals(DeclarationKind.VARIABLE, v.kind);
        assertEquals("Health", v.name);
        assertEquals(8, v.nameColumn);

        DeclarationMatch s = classifyPresent("  State Dying");
        assertEquals(DeclarationKind.STATE, s.kind);
        assertEquals("Dying", s.name);
        assertEquals(8, s.nameColumn);
    }

    @Test
    void variableKeepsOnlyTheIdentifierAfterTheFirstToken() {
        // modifiers are not understood: the token after the first word is taken as the name
        assertEquals("const", classifyPresent("var native const int X;").name);
        assertEquals("Health", classifyPresent("var int Health, Armor;").name);
    }

    @Test
    void nonDeclarationsYieldNoMatch() {
        assertTrue(classifier.classify("// comment").isEmpty());
        assertTrue(classifier.classify("if (x > 0)").isEmpty());
        assertTrue(classifier.classify("").isEmpty());
        assertTrue(classifier.classify(null).isEmpty());
        assertTrue(classifier.classify("classic Actor;").isEmpty());
        assertTrue(classifier.classify("native final function bool IsA(name N);").isEmpty());
        assertTrue(classifier.classify("var(Display) int Skin;").isEmpty());
        assertTrue(classifier.classify("simulated function PostBeginPlay()").isEmpty());
    }

    @Test
    void commentedOutDeclarationIsStillReportedWhenLeadingKeywordMatches() {
        // only lines beginning with the keyword are considered, a '//' prefix hides them
        assertTrue(classifier.classify("//function Hidden();").isEmpty());
        // but nothing tracks block comments
        assertEquals("Hidden", classifyPresent("   function Hidden();  */").name);
    }

    @Test
    void firstMatchingPatternWins() {
        DeclarationMatch m = classifyPresent("class function extends state");
        assertEquals(DeclarationKind.CLASS, m.kind);
        assertEquals("function", m.name);
        assertEquals("state", m.parentName);
    }
}
