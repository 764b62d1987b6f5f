package com.leanplan.expression;

import com.leanplan.types.BooleanType;
import com.leanplan.types.DataType;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/**
 * Expression representing a unary operation: arithmetic negation ({@code -a}) or logical
 * negation ({@code ~a}).
 */
public final class UnaryExpression implements Expression {

    /**
     * Unary operators.
     */
    public enum Operator {
        NEGATE("-"),
        NOT("~");

        private final String symbol;

        Operator(String symbol) {
            this.symbol = symbol;
        }

        public String symbol() {
            return symbol;
        }
    }

    private final Operator operator;
    private final Expression operand;

    public UnaryExpression(Operator operator, Expression operand) {
        this.operator = Objects.requireNonNull(operator, "operator must not be null");
        this.operand = Objects.requireNonNull(operand, "operand must not be null");
    }

    public Operator operator() {
        return operator;
    }

    public Expression operand() {
        return operand;
    }

    @Override
    public DataType dataType() {
        return operator == Operator.NOT ? BooleanType.get() : operand.dataType();
    }

    @Override
    public List<Expression> children() {
        return List.of(operand);
    }

    @Override
    public String render(Function<String, String> columnRenderer) {
        String inner = operand.render(columnRenderer);
        if (operand instanceof BinaryExpression) {
            inner = "(" + inner + ")";
        }
        return operator.symbol() + inner;
    }

    @Override
    public String toString() {
        return render(Function.identity());
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof UnaryExpression)) return false;
        UnaryExpression that = (UnaryExpression) obj;
        return operator == that.operator && operand.equals(that.operand);
    }

    @Override
    public int hashCode() {
        return Objects.hash(operator, operand);
    }
}
