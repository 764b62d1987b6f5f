package com.leanplan.logical;

import com.leanplan.exception.ConstructionException;
import com.leanplan.types.Shape;
import com.leanplan.types.StructField;
import com.leanplan.types.StructType;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Node renaming some of its child's columns, keeping their order.
 *
 * <pre>
 *   t.relabel(Map.of("amount", "balance"))     // t.relabel({'amount': 'balance'})
 * </pre>
 *
 * <p>Every old name must be one of the child's columns and the renamed record must still
 * have unique names. The labels are kept sorted by old name so that equal mappings compare
 * and print the same regardless of how the caller's map iterates.
 */
public final class ReLabel extends LogicalPlan {

    private final SortedMap<String, String> labels;

    /**
     * Creates a relabel node.
     *
     * @param child the input
     * @param labels old column name to new column name
     */
    public ReLabel(LogicalPlan child, Map<String, String> labels) {
        super(child);
        this.labels = Collections.unmodifiableSortedMap(
            new TreeMap<>(Objects.requireNonNull(labels, "labels must not be null")));
        for (String oldName : this.labels.keySet()) {
            requireColumn(child, oldName);
        }
        Set<String> seen = new HashSet<>();
        for (String name : renamed(child.columns())) {
            if (!seen.add(name)) {
                throw new ConstructionException(ConstructionException.Reason.DUPLICATE_COLUMN,
                    "Relabeling " + this.labels + " produces column '" + name + "' twice", child);
            }
        }
    }

    public LogicalPlan child() {
        return children.get(0);
    }

    /**
     * Returns the rename mapping, sorted by old name.
     *
     * @return old name to new name
     */
    public SortedMap<String, String> labels() {
        return labels;
    }

    /**
     * Maps an output column name back to the child's name for it.
     *
     * @param outputName a column of this node
     * @return the child's column name
     */
    public String originalName(String outputName) {
        for (Map.Entry<String, String> entry : labels.entrySet()) {
            if (entry.getValue().equals(outputName)) {
                return entry.getKey();
            }
        }
        return outputName;
    }

    private List<String> renamed(List<String> names) {
        List<String> result = new ArrayList<>(names.size());
        for (String name : names) {
            result.add(labels.getOrDefault(name, name));
        }
        return result;
    }

    @Override
    public NodeKind kind() {
        return NodeKind.RELABEL;
    }

    @Override
    public StructType schema() {
        List<StructField> fields = new ArrayList<>();
        for (StructField field : child().schema().fields()) {
            fields.add(field.withName(labels.getOrDefault(field.name(), field.name())));
        }
        return new StructType(fields);
    }

    @Override
    public boolean isTabular() {
        return child().isTabular();
    }

    @Override
    public Shape shape() {
        return child().shape().withMeasure(schema());
    }

    @Override
    public LogicalPlan withNewChildren(List<LogicalPlan> newChildren) {
        checkArity(this, newChildren, 1);
        return new ReLabel(newChildren.get(0), labels);
    }

    @Override
    public String toString() {
        return labels.entrySet().stream()
            .map(e -> quote(e.getKey()) + ": " + quote(e.getValue()))
            .collect(Collectors.joining(", ", child() + ".relabel({", "})"));
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof ReLabel)) return false;
        ReLabel that = (ReLabel) obj;
        return labels.equals(that.labels) && child().equals(that.child());
    }

    @Override
    public int hashCode() {
        return Objects.hash(NodeKind.RELABEL, labels, child());
    }
}
