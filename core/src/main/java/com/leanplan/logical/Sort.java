package com.leanplan.logical;

import com.leanplan.exception.ConstructionException;
import com.leanplan.types.Shape;
import com.leanplan.types.StructType;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Node ordering the rows of its child.
 *
 * <p>The key is either a list of the child's column names or a single-column expression
 * over the child ({@code t.sort(t.column("amount").negate(), true)}). In the second form
 * the key expression is held as a second child. The schema is the child's.
 */
public final class Sort extends LogicalPlan {

    private final List<String> keyColumns;
    private final boolean ascending;

    private Sort(List<LogicalPlan> children, List<String> keyColumns, boolean ascending) {
        super(children);
        this.keyColumns = keyColumns;
        this.ascending = ascending;
    }

    /**
     * Sorts by one or more columns of the child.
     *
     * @param child the table to sort
     * @param keys the key column names, most significant first
     * @param ascending sort direction
     * @return the sort node
     */
    public static Sort byColumns(LogicalPlan child, List<String> keys, boolean ascending) {
        Objects.requireNonNull(child, "child must not be null");
        List<String> copy = List.copyOf(Objects.requireNonNull(keys, "keys must not be null"));
        if (copy.isEmpty()) {
            throw new ConstructionException(ConstructionException.Reason.INVALID_ARGUMENT,
                "sort needs at least one key column", child);
        }
        for (String key : copy) {
            requireColumn(child, key);
        }
        return new Sort(Collections.singletonList(child), copy, ascending);
    }

    /**
     * Sorts by the values of a single-column expression over the child.
     *
     * @param child the table to sort
     * @param key the key expression
     * @param ascending sort direction
     * @return the sort node
     */
    public static Sort byExpression(LogicalPlan child, LogicalPlan key, boolean ascending) {
        Objects.requireNonNull(child, "child must not be null");
        Objects.requireNonNull(key, "key must not be null");
        if (key.schema().size() != 1 || !key.isTabular()) {
            throw new ConstructionException(ConstructionException.Reason.INVALID_ARGUMENT,
                "sort key must be a single-column, row-producing expression: " + key, key);
        }
        return new Sort(Arrays.asList(child, key), List.of(), ascending);
    }

    public LogicalPlan child() {
        return children.get(0);
    }

    /**
     * Returns the key expression, or null when sorting by column names.
     *
     * @return the key expression or null
     */
    public LogicalPlan keyExpression() {
        return children.size() > 1 ? children.get(1) : null;
    }

    /**
     * Returns the key column names; empty when sorting by an expression.
     *
     * @return the key columns
     */
    public List<String> keyColumns() {
        return keyColumns;
    }

    public boolean isAscending() {
        return ascending;
    }

    @Override
    public NodeKind kind() {
        return NodeKind.SORT;
    }

    @Override
    public StructType schema() {
        return child().schema();
    }

    @Override
    public boolean isTabular() {
        return child().isTabular();
    }

    @Override
    public Shape shape() {
        return child().shape();
    }

    @Override
    public LogicalPlan withNewChildren(List<LogicalPlan> newChildren) {
        if (keyExpression() == null) {
            checkArity(this, newChildren, 1);
            return byColumns(newChildren.get(0), keyColumns, ascending);
        }
        checkArity(this, newChildren, 2);
        return byExpression(newChildren.get(0), newChildren.get(1), ascending);
    }

    @Override
    public String toString() {
        String key;
        if (keyExpression() != null) {
            key = keyExpression().toString();
        } else if (keyColumns.size() == 1) {
            key = quote(keyColumns.get(0));
        } else {
            key = keyColumns.stream().map(LogicalPlan::quote).collect(Collectors.joining(", ", "[", "]"));
        }
        return child() + ".sort(" + key + ", ascending=" + ascending + ")";
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Sort)) return false;
        Sort that = (Sort) obj;
        return ascending == that.ascending
            && keyColumns.equals(that.keyColumns)
            && children.equals(that.children);
    }

    @Override
    public int hashCode() {
        return Objects.hash(NodeKind.SORT, keyColumns, ascending, children);
    }
}
