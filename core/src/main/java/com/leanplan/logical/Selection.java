package com.leanplan.logical;

import com.leanplan.exception.ConstructionException;
import com.leanplan.types.BooleanType;
import com.leanplan.types.DataType;
import com.leanplan.types.StructType;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Node keeping the rows of its child for which a predicate holds.
 *
 * <pre>
 *   accounts.select(accounts.column("amount").lessThan(0))   // accounts[accounts['amount'] &lt; 0]
 * </pre>
 *
 * <p>The predicate must have boolean element type; anything else is rejected at
 * construction. The schema is the child's.
 */
public final class Selection extends LogicalPlan {

    /**
     * Creates a selection node.
     *
     * @param child the table to filter
     * @param predicate a boolean, single-column expression over the child's columns
     */
    public Selection(LogicalPlan child, LogicalPlan predicate) {
        super(Arrays.asList(child, predicate));
        DataType predicateType = predicate.dataType();
        if (!(predicateType instanceof BooleanType)) {
            throw new ConstructionException(ConstructionException.Reason.NON_BOOLEAN_PREDICATE,
                "Must select over a boolean predicate. Got: " + child + "[" + predicate
                    + "] of type " + predicateType, predicate);
        }
    }

    public LogicalPlan child() {
        return children.get(0);
    }

    public LogicalPlan predicate() {
        return children.get(1);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.SELECTION;
    }

    @Override
    public StructType schema() {
        return child().schema();
    }

    @Override
    public LogicalPlan withNewChildren(List<LogicalPlan> newChildren) {
        checkArity(this, newChildren, 2);
        return new Selection(newChildren.get(0), newChildren.get(1));
    }

    @Override
    public String toString() {
        return child() + "[" + predicate() + "]";
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Selection)) return false;
        return children.equals(((Selection) obj).children);
    }

    @Override
    public int hashCode() {
        return Objects.hash(NodeKind.SELECTION, children);
    }
}
