package com.leanplan.logical;

import com.leanplan.exception.ConstructionException;
import com.leanplan.schema.SchemaInferenceException;
import com.leanplan.types.DataType;
import com.leanplan.types.SchemaParser;
import com.leanplan.types.Shape;
import com.leanplan.types.StructType;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;

/**
 * Base class for all expression nodes.
 *
 * <p>A node holds references to its child nodes plus kind-specific fields and exposes a
 * computed {@link #schema()} (the record type of one output row) and {@link #columns()}
 * (the schema's field names, in order). Nodes are immutable: rewrites build new nodes and
 * never edit existing ones, so trees can be shared freely between threads.
 *
 * <p>The schema is a pure function of the node's own fields and its children's schemas and
 * is recomputed on every call. Equality is structural: two nodes are equal iff they have
 * the same kind, the same fields and equal children.
 *
 * <p>Trees are built bottom-up from {@link TableSymbol} leaves:
 * <pre>
 *   TableSymbol t = new TableSymbol("t", "{name: string, amount: int32, id: int32}");
 *   LogicalPlan deadbeats = t.select(t.column("amount").lessThan(0)).column("name");
 * </pre>
 */
public abstract sealed class LogicalPlan
    permits TableSymbol, Projection, Column, Selection, ColumnWise, Reduction, Summary, By,
            Sort, Distinct, Head, Label, ReLabel, RowMap, Apply, Join {

    /** Child nodes in the expression tree */
    protected final List<LogicalPlan> children;

    /**
     * Creates a leaf node.
     */
    protected LogicalPlan() {
        this.children = Collections.emptyList();
    }

    /**
     * Creates a node with a single child.
     *
     * @param child the child node
     */
    protected LogicalPlan(LogicalPlan child) {
        this.children = Collections.singletonList(Objects.requireNonNull(child, "child must not be null"));
    }

    /**
     * Creates a node with multiple children.
     *
     * @param children the child nodes
     */
    protected LogicalPlan(List<LogicalPlan> children) {
        List<LogicalPlan> copy = new ArrayList<>(children.size());
        for (LogicalPlan child : children) {
            copy.add(Objects.requireNonNull(child, "child must not be null"));
        }
        this.children = Collections.unmodifiableList(copy);
    }

    /**
     * Returns the kind of this node.
     *
     * @return the node kind
     */
    public abstract NodeKind kind();

    /**
     * Computes the record type of one output row of this node.
     *
     * @return the schema
     * @throws SchemaInferenceException if the node lacks declared type information
     */
    public abstract StructType schema();

    /**
     * Rebuilds this node over new children, keeping every other field.
     *
     * <p>The new children must be given in the order of {@link #children()}. The node's
     * constructor runs again, so invariants are re-checked against the new children.
     *
     * @param newChildren the replacement children
     * @return the rebuilt node
     */
    public abstract LogicalPlan withNewChildren(List<LogicalPlan> newChildren);

    /**
     * Returns the child nodes of this node.
     *
     * @return an unmodifiable list of children
     */
    public List<LogicalPlan> children() {
        return children;
    }

    /**
     * Returns the field names of this node's schema, in schema order.
     *
     * @return the column names
     */
    public List<String> columns() {
        return schema().fieldNames();
    }

    /**
     * Returns whether this node produces rows, i.e. whether its shape carries a dimension.
     *
     * <p>Reductions and summaries collapse the row dimension and return false.
     *
     * @return true for row-producing nodes
     */
    public boolean isTabular() {
        return true;
    }

    /**
     * Returns the full shape of this node: its dimension over its schema.
     *
     * @return the shape
     */
    public Shape shape() {
        return isTabular() ? Shape.table(schema()) : Shape.scalar(schema());
    }

    /**
     * Returns the element type of a single-column node.
     *
     * @return the element type of the only field
     * @throws SchemaInferenceException if the node has more than one column
     */
    public DataType dataType() {
        StructType schema = schema();
        if (schema.size() != 1) {
            throw new SchemaInferenceException(
                "dataType is not defined for a multi-column expression; use schema() instead: " + schema, this);
        }
        return schema.fieldAt(0).dataType();
    }

    /**
     * Returns whether the given node is structurally identical to this one.
     *
     * @param other the node to compare
     * @return true if both nodes have the same kind, fields and children
     */
    public boolean isIdentical(LogicalPlan other) {
        return equals(other);
    }

    /**
     * Returns this node and all of its descendants in pre-order, each distinct node once.
     *
     * @return the subterms
     */
    public List<LogicalPlan> subterms() {
        Set<LogicalPlan> seen = new LinkedHashSet<>();
        collectSubterms(this, seen);
        return new ArrayList<>(seen);
    }

    private static void collectSubterms(LogicalPlan plan, Set<LogicalPlan> seen) {
        if (!seen.add(plan)) {
            return;
        }
        for (LogicalPlan child : plan.children) {
            collectSubterms(child, seen);
        }
    }

    /**
     * Returns the number of nodes in this tree, counting shared subtrees each time they occur.
     *
     * @return the tree size
     */
    public int treeSize() {
        int size = 1;
        for (LogicalPlan child : children) {
            size += child.treeSize();
        }
        return size;
    }

    /**
     * Replaces every occurrence of {@code from} in this tree with {@code to}.
     *
     * <p>Every path leading to a replaced occurrence is rebuilt; untouched subtrees are
     * reused as they are.
     *
     * @param from the subtree to replace (matched structurally)
     * @param to the replacement
     * @return the rewritten tree, or this node if {@code from} does not occur
     */
    public LogicalPlan substitute(LogicalPlan from, LogicalPlan to) {
        if (equals(from)) {
            return to;
        }
        if (children.isEmpty()) {
            return this;
        }
        List<LogicalPlan> replaced = new ArrayList<>(children.size());
        boolean changed = false;
        for (LogicalPlan child : children) {
            LogicalPlan newChild = child.substitute(from, to);
            changed |= newChild != child;
            replaced.add(newChild);
        }
        return changed ? withNewChildren(replaced) : this;
    }

    /**
     * Checks that a rebuild received the expected number of children.
     */
    protected static void checkArity(LogicalPlan plan, List<LogicalPlan> newChildren, int expected) {
        if (newChildren.size() != expected) {
            throw new IllegalArgumentException(String.format(
                "%s expects %d children, got %d", plan.kind(), expected, newChildren.size()));
        }
    }

    // ==================== Construction API ====================

    /**
     * Selects one column: {@code t['amount']}.
     *
     * @param name the column name
     * @return the column node
     */
    public Column column(String name) {
        return new Column(this, name);
    }

    /**
     * Selects several columns, in the given order: {@code t[['name', 'amount']]}.
     *
     * @param names the column names
     * @return the projection
     */
    public Projection project(String... names) {
        return new Projection(this, Arrays.asList(names));
    }

    /**
     * Projects onto a list of columns.
     *
     * @param names the column names
     * @return the projection
     */
    public Projection project(List<String> names) {
        return new Projection(this, names);
    }

    /**
     * Keeps the rows matching a boolean predicate: {@code t[t['amount'] < 0]}.
     *
     * @param predicate a boolean single-column expression over this table
     * @return the selection
     */
    public Selection select(LogicalPlan predicate) {
        return new Selection(this, predicate);
    }

    /**
     * Sorts ascending by the first column.
     *
     * @return the sort node
     */
    public Sort sort() {
        return sort(columns().get(0), true);
    }

    public Sort sort(String key) {
        return sort(key, true);
    }

    public Sort sort(String key, boolean ascending) {
        return Sort.byColumns(this, List.of(key), ascending);
    }

    public Sort sort(List<String> keys, boolean ascending) {
        return Sort.byColumns(this, keys, ascending);
    }

    /**
     * Sorts by the values of an expression over this table: {@code t.sort(-t['amount'])}.
     *
     * @param key the key expression
     * @param ascending sort direction
     * @return the sort node
     */
    public Sort sort(LogicalPlan key, boolean ascending) {
        return Sort.byExpression(this, key, ascending);
    }

    /**
     * Keeps the first ten rows.
     *
     * @return the head node
     */
    public Head head() {
        return new Head(this, Head.DEFAULT_ROWS);
    }

    public Head head(long n) {
        return new Head(this, n);
    }

    public Distinct distinct() {
        return new Distinct(this);
    }

    /**
     * Names the single output column of this expression.
     *
     * @param label the new column name
     * @return the label node
     */
    public Label label(String label) {
        return new Label(this, label);
    }

    /**
     * Renames columns.
     *
     * @param labels old name to new name
     * @return the relabel node
     */
    public ReLabel relabel(Map<String, String> labels) {
        return new ReLabel(this, labels);
    }

    /**
     * Maps a function over the rows of this table, without a declared result schema.
     *
     * @param func the row function
     * @return the map node
     */
    public RowMap map(Function<Object, Object> func) {
        return new RowMap(this, func, null);
    }

    public RowMap map(Function<Object, Object> func, StructType schema) {
        return new RowMap(this, func, schema);
    }

    public RowMap map(Function<Object, Object> func, String schema) {
        return new RowMap(this, func, SchemaParser.parse(schema));
    }

    /**
     * Applies a function to this whole table, without a declared result shape.
     *
     * @param func the function
     * @return the apply node
     */
    public Apply apply(Function<Object, Object> func) {
        return new Apply(this, func, null);
    }

    public Apply apply(Function<Object, Object> func, Shape shape) {
        return new Apply(this, func, shape);
    }

    public Apply apply(Function<Object, Object> func, String shape) {
        return new Apply(this, func, SchemaParser.parseShape(shape));
    }

    /**
     * Joins with another table on a column present under the same name on both sides.
     *
     * @param right the right table
     * @param on the key column
     * @return the join
     */
    public Join join(LogicalPlan right, String on) {
        return new Join(this, right, on, on);
    }

    public Join join(LogicalPlan right, String onLeft, String onRight) {
        return new Join(this, right, onLeft, onRight);
    }

    /**
     * Groups this table by {@code grouper} and reduces every group with {@code apply}.
     *
     * @param grouper the grouping expression over this table
     * @param apply the reducing expression over this table
     * @return the group-by node
     */
    public By by(LogicalPlan grouper, LogicalPlan apply) {
        return new By(this, grouper, apply);
    }

    /**
     * Checks a column name against an input's schema.
     */
    static void requireColumn(LogicalPlan input, String name) {
        if (!input.schema().contains(name)) {
            throw new ConstructionException(ConstructionException.Reason.UNKNOWN_COLUMN,
                "Mismatched column: '" + name + "' is not one of " + input.columns(), input);
        }
    }

    /**
     * Quotes a name the way it prints inside an index expression.
     */
    static String quote(String name) {
        return "'" + name + "'";
    }

    /**
     * Returns a string in the indexing notation, e.g. {@code t[['a', 'b']]['a']}.
     *
     * @return a string representation
     */
    @Override
    public abstract String toString();

    @Override
    public abstract boolean equals(Object obj);

    @Override
    public abstract int hashCode();
}
