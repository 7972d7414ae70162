package info.isaksson.erland.uscriptindex.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * One indexed UnrealScript class: its owning package and its members in file declaration order.
 *
 * <p>Instances are immutable. A scan accumulates members through a {@link Builder} and freezes the
 * record when the scan completes. Duplicate member names are kept.</p>
 */
@JsonPropertyOrder({"packageName","name","functions","variables"})
public final class ClassRecord {
    public final String packageName;
    public final String name;
    public final List<String> functions;
    public final List<String> variables;

    @JsonCreator
    public ClassRecord(
            @JsonProperty("packageName") String packageName,
            @JsonProperty("name") String name,
            @JsonProperty("functions") List<String> functions,
            @JsonProperty("variables") List<String> variables
    ) {
        this.packageName = packageName;
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.functions = functions == null ? List.of() : List.copyOf(functions);
        this.variables = variables == null ? List.of() : List.copyOf(variables);
    }

    public static Builder builder(String packageName, String name) {
        return new Builder(packageName, name);
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ClassRecord)) return false;
        ClassRecord that = (ClassRecord) o;
        return Objects.equals(packageName, that.packageName) &&
                Objects.equals(name, that.name) &&
                Objects.equals(functions, that.functions) &&
                Objects.equals(variables, that.variables);
    }

    @Override public int hashCode() {
        return Objects.hash(packageName, name, functions, variables);
    }

    @Override public String toString() {
        return packageName + "." + name + " functions=" + functions + " variables=" + variables;
    }

    /** Mutable accumulator used while a single file is being scanned. */
    public static final class Builder {
        private final String packageName;
        private final String name;
        private final List<String> functions = new ArrayList<>();
        private final List<String> variables = new ArrayList<>();

        private Builder(String packageName, String name) {
            this.packageName = packageName;
            this.name = Objects.requireNonNull(name, "name must not be null");
        }

        public String name() {
            return name;
        }

        public Builder addFunction(String function) {
            functions.add(Objects.requireNonNull(function, "function must not be null"));
            return this;
        }

        public Builder addVariable(String variable) {
            variables.add(Objects.requireNonNull(variable, "variable must not be null"));
            return this;
        }

        public int functionCount() {
            return functions.size();
        }

        public int variableCount() {
            return variables.size();
        }

        public ClassRecord build() {
            return new ClassRecord(packageName, name, functions, variables);
        }
    }
}
