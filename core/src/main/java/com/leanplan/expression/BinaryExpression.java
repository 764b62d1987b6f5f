package com.leanplan.expression;

import com.leanplan.types.BooleanType;
import com.leanplan.types.DataType;
import com.leanplan.types.DoubleType;
import com.leanplan.types.IntegerType;
import com.leanplan.types.LongType;
import com.leanplan.types.TypeCoercion;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/**
 * Expression representing a binary operation (operation with two operands).
 *
 * <p>Binary expressions include:
 * <ul>
 *   <li>Arithmetic: a + b, a - b, a * b, a / b, a % b, a ** b</li>
 *   <li>Comparison: a &gt; b, a &gt;= b, a &lt; b, a &lt;= b, a == b, a != b</li>
 *   <li>Logical: a &amp; b, a | b</li>
 * </ul>
 */
public final class BinaryExpression implements Expression {

    /**
     * Binary operators.
     */
    public enum Operator {
        ADD("+", "addition"),
        SUBTRACT("-", "subtraction"),
        MULTIPLY("*", "multiplication"),
        DIVIDE("/", "division"),
        MODULO("%", "modulo"),
        POWER("**", "exponentiation"),

        EQUAL("==", "equal"),
        NOT_EQUAL("!=", "not equal"),
        LESS_THAN("<", "less than"),
        LESS_THAN_OR_EQUAL("<=", "less than or equal"),
        GREATER_THAN(">", "greater than"),
        GREATER_THAN_OR_EQUAL(">=", "greater than or equal"),

        AND("&", "logical AND"),
        OR("|", "logical OR");

        private final String symbol;
        private final String description;

        Operator(String symbol, String description) {
            this.symbol = symbol;
            this.description = description;
        }

        public String symbol() {
            return symbol;
        }

        public String description() {
            return description;
        }

        public boolean isArithmetic() {
            return this == ADD || this == SUBTRACT || this == MULTIPLY ||
                   this == DIVIDE || this == MODULO || this == POWER;
        }

        public boolean isComparison() {
            return this == EQUAL || this == NOT_EQUAL || this == LESS_THAN ||
                   this == LESS_THAN_OR_EQUAL || this == GREATER_THAN ||
                   this == GREATER_THAN_OR_EQUAL;
        }

        public boolean isLogical() {
            return this == AND || this == OR;
        }
    }

    private final Expression left;
    private final Operator operator;
    private final Expression right;

    /**
     * Creates a binary expression.
     *
     * @param left the left operand
     * @param operator the operator
     * @param right the right operand
     */
    public BinaryExpression(Expression left, Operator operator, Expression right) {
        this.left = Objects.requireNonNull(left, "left must not be null");
        this.operator = Objects.requireNonNull(operator, "operator must not be null");
        this.right = Objects.requireNonNull(right, "right must not be null");
    }

    public Expression left() {
        return left;
    }

    public Operator operator() {
        return operator;
    }

    public Expression right() {
        return right;
    }

    @Override
    public DataType dataType() {
        if (operator.isComparison() || operator.isLogical()) {
            return BooleanType.get();
        }
        // True division: integral / integral is float64
        if (operator == Operator.DIVIDE && left.dataType().isNumeric() && right.dataType().isNumeric()) {
            DataType promoted = TypeCoercion.promoteNumericTypes(left.dataType(), right.dataType());
            return promoted instanceof IntegerType || promoted instanceof LongType
                ? DoubleType.get() : promoted;
        }
        return TypeCoercion.promoteNumericTypes(left.dataType(), right.dataType());
    }

    @Override
    public List<Expression> children() {
        return List.of(left, right);
    }

    @Override
    public String render(Function<String, String> columnRenderer) {
        return operand(left, columnRenderer) + " " + operator.symbol() + " " + operand(right, columnRenderer);
    }

    private static String operand(Expression expr, Function<String, String> columnRenderer) {
        String rendered = expr.render(columnRenderer);
        return expr instanceof BinaryExpression ? "(" + rendered + ")" : rendered;
    }

    @Override
    public String toString() {
        return render(Function.identity());
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof BinaryExpression)) return false;
        BinaryExpression that = (BinaryExpression) obj;
        return operator == that.operator && left.equals(that.left) && right.equals(that.right);
    }

    @Override
    public int hashCode() {
        return Objects.hash(left, operator, right);
    }
}
