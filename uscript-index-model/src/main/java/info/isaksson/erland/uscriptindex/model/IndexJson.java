package info.isaksson.erland.uscriptindex.model;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.util.DefaultIndenter;
import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * JSON rendering of index snapshots and document analyses for command line output.
 *
 * <p>Rendering is deterministic: records are sorted by class name and map keys are ordered.</p>
 */
public final class IndexJson {

    private static final ObjectMapper MAPPER = createMapper();
    private static final DefaultPrettyPrinter PRETTY = createPrettyPrinter();

    private IndexJson() {}

    public static String toJsonString(DocumentAnalysis analysis) throws JsonProcessingException {
        if (analysis == null) throw new IllegalArgumentException("analysis is null");
        return MAPPER.writer(PRETTY).writeValueAsString(analysis) + "\n";
    }

    public static String toJsonString(SymbolTable table) throws JsonProcessingException {
        if (table == null) throw new IllegalArgumentException("table is null");
        List<ClassRecord> records = new ArrayList<>(table.records());
        records.sort(Comparator.comparing((ClassRecord r) -> r.name).thenComparing(r -> String.valueOf(r.packageName)));

        Map<String, Object> root = new LinkedHashMap<>();
        root.put("classCount", records.size());
        root.put("classes", records);
        return MAPPER.writer(PRETTY).writeValueAsString(root) + "\n";
    }

    public static String toJsonString(List<CompletionItem> items) throws JsonProcessingException {
        if (items == null) throw new IllegalArgumentException("items is null");
        return MAPPER.writer(PRETTY).writeValueAsString(items) + "\n";
    }

    private static ObjectMapper createMapper() {
        ObjectMapper om = new ObjectMapper();
        om.enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);
        om.getFactory().disable(JsonGenerator.Feature.AUTO_CLOSE_TARGET);
        return om;
    }

    private static DefaultPrettyPrinter createPrettyPrinter() {
        DefaultPrettyPrinter pp = new DefaultPrettyPrinter();
        DefaultIndenter indenter = new DefaultIndenter("  ", "\n");
        pp.indentObjectsWith(indenter);
        pp.indentArraysWith(indenter);
        return pp;
    }
}
