package info.isaksson.erland.uscriptindex.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class IndexJsonTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Test
    void tableJsonIsSortedByClassName() throws Exception {
        SymbolTable.Builder b = SymbolTable.builder();
        b.startClass("Engine", "Pawn").addFunction("Died").addVariable("GroundSpeed");
        b.startClass("Core", "Actor").addFunction("Tick");

        String json = IndexJson.toJsonString(b.build());
        assertTrue(json.endsWith("\n"));

        JsonNode root = MAPPER.readTree(json);
        assertEquals(2, root.get("classCount").asInt());
        JsonNode classes = root.get("classes");
        assertEquals("Actor", classes.get(0).get("name").asText());
        assertEquals("Pawn", classes.get(1).get("name").asText());
        assertEquals("Engine", classes.get(1).get("packageName").asText());
        assertEquals("GroundSpeed", classes.get(1).get("variables").get(0).asText());
    }

    @Test
    void renderingIsDeterministic() throws Exception {
        SymbolTable.Builder a = SymbolTable.builder();
        a.startClass("Core", "Object");
        a.startClass("Core", "Actor");
        SymbolTable.Builder b = SymbolTable.builder();
        b.startClass("Core", "Actor");
        b.startClass("Core", "Object");

        assertEquals(IndexJson.toJsonString(a.build()), IndexJson.toJsonString(b.build()));
    }

    @Test
    void analysisJsonHasOutlineAndHighlightsOnly() throws Exception {
        DocumentAnalysis analysis = new DocumentAnalysis(
                List.of(OutlineEntry.forLine("Actor", DeclarationKind.CLASS, 0, "class Actor;")),
                List.of(new HighlightSpan(0, 6, 5, TokenCategory.CLASS)));

        JsonNode root = MAPPER.readTree(IndexJson.toJsonString(analysis));
        assertEquals(2, root.size());
        JsonNode entry = root.get("outline").get(0);
        assertEquals("CLASS", entry.get("kind").asText());
        assertEquals(12, entry.get("endColumn").asInt());
        JsonNode span = root.get("highlights").get(0);
        assertEquals(6, span.get("startColumn").asInt());
        assertEquals("CLASS", span.get("category").asText());
    }

    @Test
    void completionItemsRenderAsArray() throws Exception {
        JsonNode root = MAPPER.readTree(IndexJson.toJsonString(List.of(
                new CompletionItem("class", CompletionKind.KEYWORD),
                new CompletionItem("Actor", CompletionKind.CLASS))));
        assertTrue(root.isArray());
        assertEquals("Actor", root.get(1).get("label").asText());
    }

    @Test
    void rejectsNull() {
        assertThrows(IllegalArgumentException.class, () -> IndexJson.toJsonString((SymbolTable) null));
    }
}
