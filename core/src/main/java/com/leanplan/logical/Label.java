package com.leanplan.logical;

import com.leanplan.schema.SchemaInferenceException;
import com.leanplan.types.Shape;
import com.leanplan.types.StructType;
import java.util.List;
import java.util.Objects;

/**
 * Node naming the single output column of its child.
 *
 * <pre>
 *   t.column("amount").add(1).label("bumped")     // (t['amount'] + 1).label('bumped')
 *   t.column("amount").label("x").sum()           // sum(t['amount'].label('x'))
 * </pre>
 *
 * <p>The child must produce exactly one field. This is checked when the schema is computed,
 * since the child's schema may not be known at construction (an undeclared {@link RowMap}).
 */
public final class Label extends LogicalPlan implements ColumnSyntax {

    private final String label;

    public Label(LogicalPlan child, String label) {
        super(child);
        this.label = Objects.requireNonNull(label, "label must not be null");
    }

    public LogicalPlan child() {
        return children.get(0);
    }

    public String label() {
        return label;
    }

    @Override
    public NodeKind kind() {
        return NodeKind.LABEL;
    }

    @Override
    public StructType schema() {
        StructType childSchema = child().schema();
        if (childSchema.size() != 1) {
            throw new SchemaInferenceException(
                "Cannot label an expression with " + childSchema.size() + " columns: " + child(), this);
        }
        return StructType.of(label, childSchema.fieldAt(0).dataType());
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
        return new Label(newChildren.get(0), label);
    }

    @Override
    public String toString() {
        return child() + ".label(" + quote(label) + ")";
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Label)) return false;
        Label that = (Label) obj;
        return label.equals(that.label) && child().equals(that.child());
    }

    @Override
    public int hashCode() {
        return Objects.hash(NodeKind.LABEL, label, child());
    }
}
