package com.leanplan.logical;

import com.leanplan.exception.ConstructionException;
import com.leanplan.types.Dimension;
import com.leanplan.types.Shape;
import com.leanplan.types.StructType;
import java.util.List;
import java.util.Objects;

/**
 * Node keeping the first {@code n} rows of its child.
 *
 * <p>The schema is the child's; the shape has a fixed leading dimension of {@code n}, e.g.
 * {@code 10 * {name: string, amount: int32}}.
 */
public final class Head extends LogicalPlan {

    /** Row count used by {@link LogicalPlan#head()}. */
    public static final long DEFAULT_ROWS = 10;

    private final long n;

    /**
     * Creates a head node.
     *
     * @param child the table
     * @param n the number of rows to keep, non-negative
     */
    public Head(LogicalPlan child, long n) {
        super(child);
        if (n < 0) {
            throw new ConstructionException(ConstructionException.Reason.INVALID_ARGUMENT,
                "head row count must be non-negative, got " + n, child);
        }
        this.n = n;
    }

    public LogicalPlan child() {
        return children.get(0);
    }

    public long n() {
        return n;
    }

    @Override
    public NodeKind kind() {
        return NodeKind.HEAD;
    }

    @Override
    public StructType schema() {
        return child().schema();
    }

    @Override
    public Shape shape() {
        return new Shape(Dimension.fixed(n), schema());
    }

    @Override
    public LogicalPlan withNewChildren(List<LogicalPlan> newChildren) {
        checkArity(this, newChildren, 1);
        return new Head(newChildren.get(0), n);
    }

    @Override
    public String toString() {
        return child() + ".head(" + n + ")";
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Head)) return false;
        Head that = (Head) obj;
        return n == that.n && child().equals(that.child());
    }

    @Override
    public int hashCode() {
        return Objects.hash(NodeKind.HEAD, n, child());
    }
}
