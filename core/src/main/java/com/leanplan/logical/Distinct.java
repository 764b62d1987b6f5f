package com.leanplan.logical;

import com.leanplan.types.Shape;
import com.leanplan.types.StructType;
import java.util.List;
import java.util.Objects;

/**
 * Node removing duplicate rows from its child. The schema is the child's.
 */
public final class Distinct extends LogicalPlan {

    public Distinct(LogicalPlan child) {
        super(child);
    }

    public LogicalPlan child() {
        return children.get(0);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.DISTINCT;
    }

    @Override
    public StructType schema() {
        return child().schema();
    }

    @Override
    public Shape shape() {
        return Shape.table(schema());
    }

    @Override
    public LogicalPlan withNewChildren(List<LogicalPlan> newChildren) {
        checkArity(this, newChildren, 1);
        return new Distinct(newChildren.get(0));
    }

    @Override
    public String toString() {
        return "distinct(" + child() + ")";
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Distinct)) return false;
        return child().equals(((Distinct) obj).child());
    }

    @Override
    public int hashCode() {
        return Objects.hash(NodeKind.DISTINCT, child());
    }
}
