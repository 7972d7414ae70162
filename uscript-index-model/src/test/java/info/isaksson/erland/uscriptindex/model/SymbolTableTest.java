package info.isaksson.erland.uscriptindex.model;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class SymbolTableTest {

    @Test
    void emptyTableHasNoClasses() {
        SymbolTable t = SymbolTable.empty();
        assertTrue(t.isEmpty());
        assertEquals(0, t.size());
        assertTrue(t.get("Actor").isEmpty());
        assertFalse(t.contains(null));
        assertSame(t, SymbolTable.builder().build());
    }

    @Test
    void lastDeclarationWinsButFirstPositionIsKept() {
        SymbolTable.Builder b = SymbolTable.builder();
        b.startClass("Core", "Actor").addFunction("Tick");
        b.startClass("Core", "Object");
        b.startClass("Engine", "Actor").addVariable("Health").addVariable("Health");

        SymbolTable t = b.build();
        assertEquals(List.of("Actor", "Object"), List.copyOf(t.classNames()));

        ClassRecord actor = t.get("Actor").orElseThrow();
        assertEquals("Engine", actor.packageName);
        assertEquals(List.of(), actor.functions);
        assertEquals(List.of("Health", "Health"), actor.variables);
    }

    @Test
    void builtTableIsImmutable() {
        SymbolTable.Builder b = SymbolTable.builder();
        ClassRecord.Builder actor = b.startClass("Core", "Actor").addFunction("Tick");
        SymbolTable t = b.build();

        actor.addFunction("Later");
        assertEquals(List.of("Tick"), t.get("Actor").orElseThrow().functions);

        assertThrows(UnsupportedOperationException.class, () -> t.classNames().remove("Actor"));
        assertThrows(UnsupportedOperationException.class, () -> t.get("Actor").orElseThrow().functions.add("X"));
    }

    @Test
    void valueEquality() {
        SymbolTable.Builder a = SymbolTable.builder();
        a.startClass("Core", "Actor").addFunction("Tick");
        SymbolTable.Builder b = SymbolTable.builder();
        b.startClass("Core", "Actor").addFunction("Tick");

        assertEquals(a.build(), b.build());
        assertEquals(a.build().hashCode(), b.build().hashCode());
    }
}
