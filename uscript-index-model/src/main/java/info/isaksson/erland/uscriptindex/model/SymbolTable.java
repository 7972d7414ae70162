package info.isaksson.erland.uscriptindex.model;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable snapshot of every class discovered by one package tree scan, keyed by class name.
 *
 * <p>Keys keep the order in which class names were first seen. When a name is declared more than
 * once the last declaration's record is the one stored.</p>
 */
public final class SymbolTable {

    private static final SymbolTable EMPTY = new SymbolTable(Map.of());

    private final Map<String, ClassRecord> classes;

    private SymbolTable(Map<String, ClassRecord> classes) {
        this.classes = classes;
    }

    public static SymbolTable empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Optional<ClassRecord> get(String className) {
        if (className == null) return Optional.empty();
        return Optional.ofNullable(classes.get(className));
    }

    public boolean contains(String className) {
        return className != null && classes.containsKey(className);
    }

    /** Class names in table order. */
    public Set<String> classNames() {
        return classes.keySet();
    }

    public Collection<ClassRecord> records() {
        return classes.values();
    }

    public int size() {
        return classes.size();
    }

    public boolean isEmpty() {
        return classes.isEmpty();
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SymbolTable)) return false;
        SymbolTable that = (SymbolTable) o;
        return classes.equals(that.classes);
    }

    @Override public int hashCode() {
        return classes.hashCode();
    }

    @Override public String toString() {
        return "SymbolTable" + classes.keySet();
    }

    /**
     * Working table for a scan in progress. Records stay mutable until {@link #build()} freezes
     * them into a new {@link SymbolTable}; the builder is not meant to be shared between threads.
     */
    public static final class Builder {
        private final Map<String, ClassRecord.Builder> classes = new LinkedHashMap<>();

        private Builder() {}

        /** Start a new record, replacing any earlier record with the same name. */
        public ClassRecord.Builder startClass(String packageName, String className) {
            Objects.requireNonNull(className, "className must not be null");
            ClassRecord.Builder b = ClassRecord.builder(packageName, className);
            classes.put(className, b);
            return b;
        }

        public SymbolTable build() {
            if (classes.isEmpty()) return EMPTY;
            Map<String, ClassRecord> frozen = new LinkedHashMap<>();
            for (Map.Entry<String, ClassRecord.Builder> e : classes.entrySet()) {
                frozen.put(e.getKey(), e.getValue().build());
            }
            return new SymbolTable(Collections.unmodifiableMap(frozen));
        }
    }
}
