package com.leanplan.expression;

import com.leanplan.types.DataType;
import java.util.List;
import java.util.function.Function;

/**
 * Base interface for scalar expressions evaluated once per row.
 *
 * <p>Scalar expressions live inside a {@link com.leanplan.logical.ColumnWise} node, where
 * every table column is stood in for by a {@link ScalarSymbol} placeholder. They include:
 * <ul>
 *   <li>Column placeholders ({@link ScalarSymbol})</li>
 *   <li>Literals (constants)</li>
 *   <li>Arithmetic and comparison operations (a + b, a &gt; b)</li>
 *   <li>Boolean and unary operations (a AND b, NOT a, -a)</li>
 *   <li>Scalar function calls (sin(a), log(a))</li>
 * </ul>
 *
 * <p>Expressions are immutable and compare structurally.
 */
public interface Expression {

    /**
     * Returns the element type of the value produced by this expression.
     *
     * @return the data type
     */
    DataType dataType();

    /**
     * Returns the direct sub-expressions of this expression.
     *
     * @return an unmodifiable list of children, empty for leaves
     */
    List<Expression> children();

    /**
     * Renders this expression, letting the caller decide how column placeholders print.
     *
     * @param columnRenderer maps a placeholder name to its printed form
     * @return the rendered expression
     */
    String render(Function<String, String> columnRenderer);
}
