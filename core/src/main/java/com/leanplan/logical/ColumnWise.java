package com.leanplan.logical;

import com.leanplan.exception.ConstructionException;
import com.leanplan.expression.Expression;
import com.leanplan.expression.ExpressionUtils;
import com.leanplan.expression.ScalarSymbol;
import com.leanplan.types.StructType;
import java.util.List;
import java.util.Objects;

/**
 * Broadcast node: a scalar expression evaluated once per row of a single source table.
 *
 * <p>Inside the scalar expression every column of the source table is represented by a
 * {@link ScalarSymbol} placeholder named after it. {@code t['a'] + t['b'] * 2} is held as
 * {@code ColumnWise(t, a + b * 2)}.
 *
 * <p>The output is a single column named after the first placeholder in the expression
 * (reading left to right) and typed by the expression's result type.
 *
 * <p>The source may also be a single-field {@link Reduction} or {@link Label}, whose one field
 * is the only placeholder: {@code sum(t['a']) + 1} is {@code ColumnWise(sum(t['a']), a + 1)}.
 * Over a reduction the node is a scalar, not a table.
 *
 * <p>Instances are normally built by {@link ColumnFunctions}, which checks that every
 * operand traces back to the same source.
 */
public final class ColumnWise extends LogicalPlan implements ColumnSyntax {

    private final Expression expression;

    /**
     * Creates a broadcast node.
     *
     * @param child the source table
     * @param expression the scalar expression over column placeholders of {@code child}
     */
    public ColumnWise(LogicalPlan child, Expression expression) {
        super(child);
        this.expression = Objects.requireNonNull(expression, "expression must not be null");

        List<ScalarSymbol> symbols = ExpressionUtils.collectSymbols(expression);
        if (symbols.isEmpty()) {
            throw new ConstructionException(ConstructionException.Reason.INVALID_ARGUMENT,
                "columnwise expression references no column: " + expression, child);
        }
        for (ScalarSymbol symbol : symbols) {
            requireColumn(child, symbol.name());
        }
    }

    public LogicalPlan child() {
        return children.get(0);
    }

    /**
     * Returns the scalar expression over column placeholders.
     *
     * @return the expression
     */
    public Expression expression() {
        return expression;
    }

    /**
     * Returns the names of all source columns the expression reads, sorted, without duplicates.
     *
     * @return the active column names
     */
    public List<String> activeColumns() {
        return ExpressionUtils.activeColumns(expression);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.COLUMN_WISE;
    }

    @Override
    public StructType schema() {
        String name = ExpressionUtils.collectSymbols(expression).get(0).name();
        return StructType.of(name, expression.dataType());
    }

    @Override
    public boolean isTabular() {
        return child().isTabular();
    }

    @Override
    public LogicalPlan withNewChildren(List<LogicalPlan> newChildren) {
        checkArity(this, newChildren, 1);
        return new ColumnWise(newChildren.get(0), expression);
    }

    @Override
    public String toString() {
        String table = child().toString();
        if (child() instanceof Reduction || child() instanceof Label) {
            return expression.render(column -> table);
        }
        return expression.render(column -> table + "[" + quote(column) + "]");
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof ColumnWise)) return false;
        ColumnWise that = (ColumnWise) obj;
        return expression.equals(that.expression) && child().equals(that.child());
    }

    @Override
    public int hashCode() {
        return Objects.hash(NodeKind.COLUMN_WISE, expression, child());
    }
}
