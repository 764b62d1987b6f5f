package com.leanplan.logical;

import com.leanplan.exception.ConstructionException;
import com.leanplan.expression.BinaryExpression;
import com.leanplan.expression.Expression;
import com.leanplan.expression.FunctionCall;
import com.leanplan.expression.Literal;
import com.leanplan.expression.ScalarSymbol;
import com.leanplan.expression.UnaryExpression;
import com.leanplan.types.DoubleType;
import com.leanplan.types.StructField;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Combinators fusing column-like operands into a single {@link ColumnWise} node.
 *
 * <p>Operands may be:
 * <ul>
 *   <li>a {@link Column}: replaced by a placeholder named after the column, its table
 *       becomes a source</li>
 *   <li>a {@link ColumnWise}: its scalar expression is inlined, its table becomes a source</li>
 *   <li>a single-field {@link Reduction} or {@link Label}: replaced by a placeholder named
 *       after its field, the node itself becomes the source</li>
 *   <li>a scalar {@link Expression} or a plain Java value (5, 2.5, "Alice", true): passed
 *       through as a literal, contributing no source</li>
 * </ul>
 *
 * <p>All sources must be the same table (compared structurally). Mixing two tables raises
 * {@link ConstructionException.Reason#MISMATCHED_SOURCE_TABLE}: one broadcast cannot span
 * two unrelated row streams.
 *
 * <pre>
 *   ColumnWise total = ColumnFunctions.multiply(t.column("price"), t.column("quantity"));
 *   ColumnWise expensive = ColumnFunctions.greaterThan(total, 100);
 * </pre>
 */
public final class ColumnFunctions {

    private ColumnFunctions() {
        // Utility class - prevent instantiation
    }

    /**
     * Fuses the given operands under a scalar operator.
     *
     * @param op builds the scalar expression from the operands' scalar forms, in order
     * @param inputs the operands
     * @return the fused broadcast node
     * @throws ConstructionException if the operands reference more than one table, none at
     *         all, or an operand is not column-like
     */
    public static ColumnWise columnwise(Function<List<Expression>, Expression> op, Object... inputs) {
        List<Expression> scalarInputs = new ArrayList<>(inputs.length);
        Set<LogicalPlan> sources = new LinkedHashSet<>();

        for (Object input : inputs) {
            if (input instanceof ColumnWise) {
                ColumnWise columnWise = (ColumnWise) input;
                scalarInputs.add(columnWise.expression());
                sources.add(columnWise.child());
            } else if (input instanceof Column) {
                Column column = (Column) input;
                scalarInputs.add(new ScalarSymbol(column.name(), column.dataType()));
                sources.add(column.child());
            } else if (input instanceof Reduction || input instanceof Label) {
                LogicalPlan value = (LogicalPlan) input;
                if (value.schema().size() != 1) {
                    throw new ConstructionException(ConstructionException.Reason.INVALID_ARGUMENT,
                        "Expected a single-field expression, got: " + value, value);
                }
                StructField field = value.schema().fieldAt(0);
                scalarInputs.add(new ScalarSymbol(field.name(), field.dataType()));
                sources.add(value);
            } else if (input instanceof LogicalPlan) {
                throw new ConstructionException(ConstructionException.Reason.INVALID_ARGUMENT,
                    "Expected a column, columnwise, label or reduction expression, got: " + input, (LogicalPlan) input);
            } else if (input instanceof Expression) {
                scalarInputs.add((Expression) input);
            } else {
                scalarInputs.add(toLiteral(input));
            }
        }

        if (sources.size() > 1) {
            throw new ConstructionException(ConstructionException.Reason.MISMATCHED_SOURCE_TABLE,
                "All inputs must be from the same table. Saw the following tables: "
                    + sources.stream().map(LogicalPlan::toString).collect(Collectors.joining(", ")));
        }
        if (sources.isEmpty()) {
            throw new ConstructionException(ConstructionException.Reason.INVALID_ARGUMENT,
                "At least one input must be a column of a table");
        }

        return new ColumnWise(sources.iterator().next(), op.apply(scalarInputs));
    }

    private static Literal toLiteral(Object value) {
        try {
            return Literal.fromValue(value);
        } catch (IllegalArgumentException e) {
            throw new ConstructionException(ConstructionException.Reason.INVALID_ARGUMENT, e.getMessage());
        }
    }

    private static ColumnWise binary(BinaryExpression.Operator operator, Object left, Object right) {
        return columnwise(args -> new BinaryExpression(args.get(0), operator, args.get(1)), left, right);
    }

    private static ColumnWise unary(UnaryExpression.Operator operator, Object operand) {
        return columnwise(args -> new UnaryExpression(operator, args.get(0)), operand);
    }

    private static ColumnWise math(String function, Object operand) {
        return columnwise(args -> new FunctionCall(function, args, DoubleType.get()), operand);
    }

    // ==================== Arithmetic ====================

    public static ColumnWise add(Object left, Object right) {
        return binary(BinaryExpression.Operator.ADD, left, right);
    }

    public static ColumnWise subtract(Object left, Object right) {
        return binary(BinaryExpression.Operator.SUBTRACT, left, right);
    }

    public static ColumnWise multiply(Object left, Object right) {
        return binary(BinaryExpression.Operator.MULTIPLY, left, right);
    }

    public static ColumnWise divide(Object left, Object right) {
        return binary(BinaryExpression.Operator.DIVIDE, left, right);
    }

    public static ColumnWise modulo(Object left, Object right) {
        return binary(BinaryExpression.Operator.MODULO, left, right);
    }

    public static ColumnWise power(Object left, Object right) {
        return binary(BinaryExpression.Operator.POWER, left, right);
    }

    public static ColumnWise negate(Object operand) {
        return unary(UnaryExpression.Operator.NEGATE, operand);
    }

    // ==================== Comparison ====================

    public static ColumnWise equal(Object left, Object right) {
        return binary(BinaryExpression.Operator.EQUAL, left, right);
    }

    public static ColumnWise notEqual(Object left, Object right) {
        return binary(BinaryExpression.Operator.NOT_EQUAL, left, right);
    }

    public static ColumnWise lessThan(Object left, Object right) {
        return binary(BinaryExpression.Operator.LESS_THAN, left, right);
    }

    public static ColumnWise lessThanOrEqual(Object left, Object right) {
        return binary(BinaryExpression.Operator.LESS_THAN_OR_EQUAL, left, right);
    }

    public static ColumnWise greaterThan(Object left, Object right) {
        return binary(BinaryExpression.Operator.GREATER_THAN, left, right);
    }

    public static ColumnWise greaterThanOrEqual(Object left, Object right) {
        return binary(BinaryExpression.Operator.GREATER_THAN_OR_EQUAL, left, right);
    }

    // ==================== Boolean ====================

    public static ColumnWise and(Object left, Object right) {
        return binary(BinaryExpression.Operator.AND, left, right);
    }

    public static ColumnWise or(Object left, Object right) {
        return binary(BinaryExpression.Operator.OR, left, right);
    }

    public static ColumnWise not(Object operand) {
        return unary(UnaryExpression.Operator.NOT, operand);
    }

    // ==================== Math ====================

    public static ColumnWise sin(Object operand) {
        return math("sin", operand);
    }

    public static ColumnWise cos(Object operand) {
        return math("cos", operand);
    }

    public static ColumnWise tan(Object operand) {
        return math("tan", operand);
    }

    public static ColumnWise exp(Object operand) {
        return math("exp", operand);
    }

    public static ColumnWise log(Object operand) {
        return math("log", operand);
    }
}
