package com.leanplan.logical;

import com.leanplan.exception.ConstructionException;
import com.leanplan.types.DataType;
import com.leanplan.types.StructField;
import com.leanplan.types.StructType;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Inner equi-join of two tables on one key column per side.
 *
 * <pre>
 *   accounts.join(cities, "city")    // join(accounts, cities, 'city')
 * </pre>
 *
 * <p>The output has the left fields, then the right fields without the right key. Both
 * keys must have the same element type, and the merged record must not repeat a name.
 */
public final class Join extends LogicalPlan {

    private final String onLeft;
    private final String onRight;

    /**
     * Creates a join node.
     *
     * @param left the left table
     * @param right the right table
     * @param onLeft the key column of the left table
     * @param onRight the key column of the right table
     */
    public Join(LogicalPlan left, LogicalPlan right, String onLeft, String onRight) {
        super(Arrays.asList(left, right));
        this.onLeft = Objects.requireNonNull(onLeft, "onLeft must not be null");
        this.onRight = Objects.requireNonNull(onRight, "onRight must not be null");

        requireColumn(left, onLeft);
        requireColumn(right, onRight);
        DataType leftType = left.schema().fieldByName(onLeft).dataType();
        DataType rightType = right.schema().fieldByName(onRight).dataType();
        if (!leftType.equals(rightType)) {
            throw new ConstructionException(ConstructionException.Reason.JOIN_KEY_TYPE_MISMATCH,
                String.format("Schemas of joining columns do not match: %s.%s is %s, %s.%s is %s",
                    left, onLeft, leftType, right, onRight, rightType), left);
        }

        Set<String> seen = new HashSet<>();
        for (StructField field : mergedFields(left.schema(), right.schema())) {
            if (!seen.add(field.name())) {
                throw new ConstructionException(ConstructionException.Reason.DUPLICATE_COLUMN,
                    "Joined record would contain column '" + field.name() + "' twice", right);
            }
        }
    }

    public LogicalPlan left() {
        return children.get(0);
    }

    public LogicalPlan right() {
        return children.get(1);
    }

    public String onLeft() {
        return onLeft;
    }

    public String onRight() {
        return onRight;
    }

    private List<StructField> mergedFields(StructType leftSchema, StructType rightSchema) {
        List<StructField> fields = new ArrayList<>(leftSchema.fields());
        for (StructField field : rightSchema.fields()) {
            if (!field.name().equals(onRight)) {
                fields.add(field);
            }
        }
        return fields;
    }

    @Override
    public NodeKind kind() {
        return NodeKind.JOIN;
    }

    @Override
    public StructType schema() {
        return new StructType(mergedFields(left().schema(), right().schema()));
    }

    @Override
    public LogicalPlan withNewChildren(List<LogicalPlan> newChildren) {
        checkArity(this, newChildren, 2);
        return new Join(newChildren.get(0), newChildren.get(1), onLeft, onRight);
    }

    @Override
    public String toString() {
        String keys = onLeft.equals(onRight) ? quote(onLeft) : quote(onLeft) + ", " + quote(onRight);
        return "join(" + left() + ", " + right() + ", " + keys + ")";
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Join)) return false;
        Join that = (Join) obj;
        return onLeft.equals(that.onLeft) && onRight.equals(that.onRight) && children.equals(that.children);
    }

    @Override
    public int hashCode() {
        return Objects.hash(NodeKind.JOIN, onLeft, onRight, children);
    }
}
