package com.leanplan.logical;

import com.leanplan.exception.ConstructionException;
import com.leanplan.types.BooleanType;
import com.leanplan.types.DataType;
import com.leanplan.types.DoubleType;
import com.leanplan.types.LongType;
import com.leanplan.types.StructField;
import com.leanplan.types.StructType;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Node collapsing the rows of its child to a single value per column.
 *
 * <pre>
 *   t.column("amount").sum()      // sum(t['amount'])
 * </pre>
 *
 * <p>The result keeps the child's field names and is dimensionless. Result types:
 * <ul>
 *   <li>sum, min, max: the column's type</li>
 *   <li>mean, var, std: float64</li>
 *   <li>count, nunique: int64</li>
 *   <li>any, all: bool</li>
 * </ul>
 */
public final class Reduction extends LogicalPlan {

    /**
     * Supported reductions.
     */
    public enum Kind {
        ANY("any"),
        ALL("all"),
        SUM("sum"),
        MAX("max"),
        MIN("min"),
        MEAN("mean"),
        VAR("var"),
        STD("std"),
        COUNT("count"),
        NUNIQUE("nunique");

        private final String symbol;

        Kind(String symbol) {
            this.symbol = symbol;
        }

        public String symbol() {
            return symbol;
        }

        /**
         * Returns the type a column of {@code input} type reduces to.
         *
         * @param input the column type
         * @return the result type
         */
        public DataType resultType(DataType input) {
            switch (this) {
                case ANY:
                case ALL:
                    return BooleanType.get();
                case MEAN:
                case VAR:
                case STD:
                    return DoubleType.get();
                case COUNT:
                case NUNIQUE:
                    return LongType.get();
                default:
                    return input;
            }
        }
    }

    private final Kind reductionKind;

    /**
     * Creates a reduction node.
     *
     * @param reductionKind which reduction to apply
     * @param child the row-producing expression to reduce
     */
    public Reduction(Kind reductionKind, LogicalPlan child) {
        super(child);
        this.reductionKind = Objects.requireNonNull(reductionKind, "reductionKind must not be null");
        if (!child.isTabular()) {
            throw new ConstructionException(ConstructionException.Reason.INVALID_ARGUMENT,
                "Cannot reduce an expression that has no row dimension: " + child, child);
        }
    }

    public LogicalPlan child() {
        return children.get(0);
    }

    public Kind reductionKind() {
        return reductionKind;
    }

    @Override
    public NodeKind kind() {
        return NodeKind.REDUCTION;
    }

    @Override
    public StructType schema() {
        List<StructField> fields = new ArrayList<>();
        for (StructField field : child().schema().fields()) {
            fields.add(field.withDataType(reductionKind.resultType(field.dataType())));
        }
        return new StructType(fields);
    }

    @Override
    public boolean isTabular() {
        return false;
    }

    @Override
    public LogicalPlan withNewChildren(List<LogicalPlan> newChildren) {
        checkArity(this, newChildren, 1);
        return new Reduction(reductionKind, newChildren.get(0));
    }

    @Override
    public String toString() {
        return reductionKind.symbol() + "(" + child() + ")";
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Reduction)) return false;
        Reduction that = (Reduction) obj;
        return reductionKind == that.reductionKind && child().equals(that.child());
    }

    @Override
    public int hashCode() {
        return Objects.hash(NodeKind.REDUCTION, reductionKind, child());
    }
}
