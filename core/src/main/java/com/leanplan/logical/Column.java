package com.leanplan.logical;

import com.leanplan.types.Shape;
import com.leanplan.types.StructType;
import java.util.List;
import java.util.Objects;

/**
 * Node selecting a single column: {@code t['amount']}.
 *
 * <p>Columns take part in scalar arithmetic and comparisons through {@link ColumnSyntax};
 * combining them produces a {@link ColumnWise} node.
 */
public final class Column extends LogicalPlan implements ColumnSyntax {

    private final String name;

    /**
     * Creates a column node.
     *
     * @param child the table the column belongs to
     * @param name the column name, which must be one of the child's columns
     */
    public Column(LogicalPlan child, String name) {
        super(child);
        this.name = Objects.requireNonNull(name, "name must not be null");
        requireColumn(child, name);
    }

    public LogicalPlan child() {
        return children.get(0);
    }

    public String name() {
        return name;
    }

    @Override
    public NodeKind kind() {
        return NodeKind.COLUMN;
    }

    @Override
    public StructType schema() {
        return child().schema().restrict(List.of(name));
    }

    @Override
    public List<String> columns() {
        return List.of(name);
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
        return new Column(newChildren.get(0), name);
    }

    @Override
    public String toString() {
        return child() + "[" + quote(name) + "]";
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Column)) return false;
        Column that = (Column) obj;
        return name.equals(that.name) && child().equals(that.child());
    }

    @Override
    public int hashCode() {
        return Objects.hash(NodeKind.COLUMN, name, child());
    }
}
