package com.leanplan.expression;

import com.leanplan.test.TestBase;
import com.leanplan.test.TestCategories;
import com.leanplan.types.BooleanType;
import com.leanplan.types.DoubleType;
import com.leanplan.types.IntegerType;
import com.leanplan.types.LongType;
import com.leanplan.types.StringType;

import java.util.List;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for scalar expressions used inside broadcasts.
 */
@TestCategories.Tier1
@TestCategories.Unit
@TestCategories.Expression
@DisplayName("Scalar Expression Tests")
public class ExpressionTest extends TestBase {

    private final ScalarSymbol a = new ScalarSymbol("a", IntegerType.get());
    private final ScalarSymbol b = new ScalarSymbol("b", LongType.get());

    @Nested
    @DisplayName("Result Types")
    class ResultTypes {

        @Test
        @DisplayName("Arithmetic promotes operand types")
        void testArithmeticPromotion() {
            assertThat(new BinaryExpression(a, BinaryExpression.Operator.ADD, b).dataType())
                .isEqualTo(LongType.get());
            assertThat(new BinaryExpression(a, BinaryExpression.Operator.MULTIPLY, Literal.of(2.5)).dataType())
                .isEqualTo(DoubleType.get());
        }

        @Test
        @DisplayName("Division of integers is float64")
        void testTrueDivision() {
            assertThat(new BinaryExpression(a, BinaryExpression.Operator.DIVIDE, Literal.of(2)).dataType())
                .isEqualTo(DoubleType.get());
        }

        @Test
        @DisplayName("Comparisons and boolean operators are bool")
        void testBooleanResults() {
            BinaryExpression gt = new BinaryExpression(a, BinaryExpression.Operator.GREATER_THAN, Literal.of(0));
            BinaryExpression both = new BinaryExpression(gt, BinaryExpression.Operator.AND, Literal.of(true));

            assertThat(gt.dataType()).isEqualTo(BooleanType.get());
            assertThat(both.dataType()).isEqualTo(BooleanType.get());
            assertThat(new UnaryExpression(UnaryExpression.Operator.NOT, gt).dataType())
                .isEqualTo(BooleanType.get());
        }

        @Test
        @DisplayName("Negation keeps the operand type")
        void testNegate() {
            assertThat(new UnaryExpression(UnaryExpression.Operator.NEGATE, b).dataType())
                .isEqualTo(LongType.get());
        }

        @Test
        @DisplayName("Literals infer their type from the Java value")
        void testLiteralTypes() {
            assertThat(Literal.fromValue(1).dataType()).isEqualTo(IntegerType.get());
            assertThat(Literal.fromValue(1L).dataType()).isEqualTo(LongType.get());
            assertThat(Literal.fromValue(1.5f).dataType()).isEqualTo(DoubleType.get());
            assertThat(Literal.fromValue("x").dataType()).isEqualTo(StringType.get());
            assertThat(Literal.fromValue(true).dataType()).isEqualTo(BooleanType.get());
            assertThatThrownBy(() -> Literal.fromValue(new Object()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Unsupported literal value");
        }
    }

    @Nested
    @DisplayName("Rendering")
    class Rendering {

        @Test
        @DisplayName("Nested binary operands are parenthesized")
        void testParentheses() {
            Expression expr = new BinaryExpression(
                a, BinaryExpression.Operator.ADD,
                new BinaryExpression(b, BinaryExpression.Operator.MULTIPLY, Literal.of(2)));

            assertThat(expr.toString()).isEqualTo("a + (b * 2)");
            assertThat(expr.render(name -> "t['" + name + "']")).isEqualTo("t['a'] + (t['b'] * 2)");
        }

        @Test
        @DisplayName("String literals are quoted")
        void testStringLiteral() {
            assertThat(Literal.of("Alice").toString()).isEqualTo("'Alice'");
        }

        @Test
        @DisplayName("Functions render as calls")
        void testFunctionCall() {
            Expression expr = new FunctionCall("sin", List.of(a), DoubleType.get());

            assertThat(expr.toString()).isEqualTo("sin(a)");
        }
    }

    @Nested
    @DisplayName("Active Columns")
    class ActiveColumns {

        @Test
        @DisplayName("Placeholders are collected in reading order with duplicates")
        void testCollectSymbols() {
            Expression expr = new BinaryExpression(
                new BinaryExpression(b, BinaryExpression.Operator.ADD, a),
                BinaryExpression.Operator.MULTIPLY, b);

            assertThat(ExpressionUtils.collectSymbols(expr))
                .extracting(ScalarSymbol::name)
                .containsExactly("b", "a", "b");
        }

        @Test
        @DisplayName("Active columns are sorted and unique")
        void testActiveColumns() {
            Expression expr = new BinaryExpression(
                new BinaryExpression(b, BinaryExpression.Operator.ADD, a),
                BinaryExpression.Operator.MULTIPLY, b);

            assertThat(ExpressionUtils.activeColumns(expr)).containsExactly("a", "b");
        }
    }
}
