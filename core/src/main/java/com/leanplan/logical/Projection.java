package com.leanplan.logical;

import com.leanplan.exception.ConstructionException;
import com.leanplan.types.Shape;
import com.leanplan.types.StructType;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Node selecting an ordered subset of its child's columns.
 *
 * <p>Example: {@code t[['name', 'amount']]} keeps two columns, name first.
 *
 * <p>The column list must be non-empty, free of duplicates and drawn from the child's
 * columns; all three are checked at construction.
 */
public final class Projection extends LogicalPlan {

    private final List<String> projectedColumns;

    /**
     * Creates a projection node.
     *
     * @param child the child node
     * @param columns the columns to keep, in output order
     */
    public Projection(LogicalPlan child, List<String> columns) {
        super(child);
        this.projectedColumns = List.copyOf(Objects.requireNonNull(columns, "columns must not be null"));

        if (projectedColumns.isEmpty()) {
            throw new ConstructionException(ConstructionException.Reason.INVALID_ARGUMENT,
                "projection must keep at least one column", child);
        }
        Set<String> seen = new HashSet<>();
        for (String column : projectedColumns) {
            if (!seen.add(column)) {
                throw new ConstructionException(ConstructionException.Reason.DUPLICATE_COLUMN,
                    "Column '" + column + "' projected twice", child);
            }
            requireColumn(child, column);
        }
    }

    public LogicalPlan child() {
        return children.get(0);
    }

    /**
     * Returns the projected column names in output order.
     *
     * @return an unmodifiable list of names
     */
    public List<String> projectedColumns() {
        return projectedColumns;
    }

    @Override
    public NodeKind kind() {
        return NodeKind.PROJECTION;
    }

    @Override
    public StructType schema() {
        return child().schema().restrict(projectedColumns);
    }

    @Override
    public List<String> columns() {
        return projectedColumns;
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
        return new Projection(newChildren.get(0), projectedColumns);
    }

    @Override
    public String toString() {
        return projectedColumns.stream()
            .map(LogicalPlan::quote)
            .collect(Collectors.joining(", ", child() + "[[", "]]"));
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Projection)) return false;
        Projection that = (Projection) obj;
        return projectedColumns.equals(that.projectedColumns) && child().equals(that.child());
    }

    @Override
    public int hashCode() {
        return Objects.hash(NodeKind.PROJECTION, projectedColumns, child());
    }
}
