package com.leanplan.logical;

import com.leanplan.exception.ConstructionException;
import com.leanplan.types.StructField;
import com.leanplan.types.StructType;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Node gathering several named reductions into one record.
 *
 * <pre>
 *   Summary.of(Map.of("total", t.column("amount").sum()))   // summary(total=sum(t['amount']))
 * </pre>
 *
 * <p>Each value must be dimensionless and produce exactly one field; the output record has
 * one field per name, typed by its value, in insertion order. Values may reduce different
 * tables.
 */
public final class Summary extends LogicalPlan {

    private final List<String> names;

    /**
     * Creates a summary from parallel name and value lists.
     *
     * @param names the output field names
     * @param values the reducing expressions, one per name
     */
    public Summary(List<String> names, List<LogicalPlan> values) {
        super(values);
        this.names = List.copyOf(Objects.requireNonNull(names, "names must not be null"));
        if (this.names.size() != values.size()) {
            throw new ConstructionException(ConstructionException.Reason.INVALID_ARGUMENT,
                "names and values must have the same size");
        }
        if (this.names.stream().distinct().count() != this.names.size()) {
            throw new ConstructionException(ConstructionException.Reason.DUPLICATE_COLUMN,
                "Summary names must be unique: " + this.names);
        }
        for (int i = 0; i < values.size(); i++) {
            LogicalPlan value = values.get(i);
            if (value.isTabular()) {
                throw new ConstructionException(ConstructionException.Reason.NON_REDUCING_APPLY,
                    "Summary value '" + this.names.get(i) + "' must reduce: " + value, value);
            }
            if (value.schema().size() != 1) {
                throw new ConstructionException(ConstructionException.Reason.INVALID_ARGUMENT,
                    "Summary value '" + this.names.get(i) + "' must produce a single field: " + value, value);
            }
        }
    }

    /**
     * Creates a summary from a name to value mapping, keeping the map's iteration order.
     *
     * @param entries name to reducing expression
     * @return the summary
     */
    public static Summary of(Map<String, ? extends LogicalPlan> entries) {
        return new Summary(new ArrayList<>(entries.keySet()), new ArrayList<>(entries.values()));
    }

    public List<String> names() {
        return names;
    }

    public List<LogicalPlan> values() {
        return children;
    }

    /**
     * Returns the entries as an ordered map.
     *
     * @return an unmodifiable name to value map
     */
    public Map<String, LogicalPlan> entries() {
        Map<String, LogicalPlan> entries = new LinkedHashMap<>();
        for (int i = 0; i < names.size(); i++) {
            entries.put(names.get(i), children.get(i));
        }
        return Collections.unmodifiableMap(entries);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.SUMMARY;
    }

    @Override
    public StructType schema() {
        List<StructField> fields = new ArrayList<>(names.size());
        for (int i = 0; i < names.size(); i++) {
            fields.add(new StructField(names.get(i), children.get(i).dataType()));
        }
        return new StructType(fields);
    }

    @Override
    public List<String> columns() {
        return names;
    }

    @Override
    public boolean isTabular() {
        return false;
    }

    @Override
    public LogicalPlan withNewChildren(List<LogicalPlan> newChildren) {
        checkArity(this, newChildren, names.size());
        return new Summary(names, newChildren);
    }

    @Override
    public String toString() {
        List<String> parts = new ArrayList<>(names.size());
        for (int i = 0; i < names.size(); i++) {
            parts.add(names.get(i) + "=" + children.get(i));
        }
        return parts.stream().collect(Collectors.joining(", ", "summary(", ")"));
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Summary)) return false;
        Summary that = (Summary) obj;
        return names.equals(that.names) && children.equals(that.children);
    }

    @Override
    public int hashCode() {
        return Objects.hash(NodeKind.SUMMARY, names, children);
    }
}
