package com.leanplan.logical;

import com.leanplan.exception.ConstructionException;
import com.leanplan.types.StructField;
import com.leanplan.types.StructType;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Split-apply-combine node: groups the rows of a parent table by a grouper expression and
 * reduces every group with an apply expression.
 *
 * <pre>
 *   TableSymbol t = new TableSymbol("t", "{name: string, amount: int32, id: int32}");
 *   t.by(t.column("name"), t.column("amount").sum());     // by(t['name'], sum(t['amount']))
 * </pre>
 *
 * <p>Both grouper and apply are expressions over the parent. The apply must collapse the
 * row dimension; a row-producing apply is rejected at construction. The output record is
 * the grouper's fields followed by the apply's fields, with names already present on the
 * grouper side dropped from the apply side.
 */
public final class By extends LogicalPlan {

    /**
     * Creates a group-by node.
     *
     * @param parent the table being grouped
     * @param grouper the grouping expression, built over {@code parent}
     * @param apply the per-group reduction, built over {@code parent}
     */
    public By(LogicalPlan parent, LogicalPlan grouper, LogicalPlan apply) {
        super(Arrays.asList(parent, grouper, apply));
        if (apply.isTabular()) {
            throw new ConstructionException(ConstructionException.Reason.NON_REDUCING_APPLY,
                "Expected a reduction for the apply of a group-by, got: " + apply, apply);
        }
        if (!grouper.subterms().contains(parent)) {
            throw new ConstructionException(ConstructionException.Reason.INVALID_ARGUMENT,
                "Grouper " + grouper + " is not built over " + parent, parent);
        }
        if (!apply.subterms().contains(parent)) {
            throw new ConstructionException(ConstructionException.Reason.INVALID_ARGUMENT,
                "Apply " + apply + " is not built over " + parent, parent);
        }
    }

    /**
     * Creates a group-by node whose parent is the largest table shared by grouper and apply.
     *
     * @param grouper the grouping expression
     * @param apply the per-group reduction
     * @return the group-by node
     */
    public static By of(LogicalPlan grouper, LogicalPlan apply) {
        return new By(CommonSubexpression.find(grouper, apply), grouper, apply);
    }

    public LogicalPlan parent() {
        return children.get(0);
    }

    public LogicalPlan grouper() {
        return children.get(1);
    }

    public LogicalPlan apply() {
        return children.get(2);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.BY;
    }

    @Override
    public StructType schema() {
        Map<String, StructField> merged = new LinkedHashMap<>();
        for (StructField field : grouper().schema().fields()) {
            merged.putIfAbsent(field.name(), field);
        }
        for (StructField field : apply().schema().fields()) {
            merged.putIfAbsent(field.name(), field);
        }
        return new StructType(new ArrayList<>(merged.values()));
    }

    @Override
    public LogicalPlan withNewChildren(List<LogicalPlan> newChildren) {
        checkArity(this, newChildren, 3);
        return new By(newChildren.get(0), newChildren.get(1), newChildren.get(2));
    }

    @Override
    public String toString() {
        return "by(" + grouper() + ", " + apply() + ")";
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof By)) return false;
        return children.equals(((By) obj).children);
    }

    @Override
    public int hashCode() {
        return Objects.hash(NodeKind.BY, children);
    }
}
