package com.leanplan.logical;

import com.leanplan.exception.ConstructionException;
import com.leanplan.test.PlanFixtures;
import com.leanplan.test.TestBase;
import com.leanplan.test.TestCategories;
import com.leanplan.types.BooleanType;
import com.leanplan.types.DoubleType;
import com.leanplan.types.IntegerType;

import java.util.function.BiFunction;
import java.util.stream.Stream;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for columnwise fusion.
 */
@TestCategories.Tier1
@TestCategories.Unit
@TestCategories.Expression
@DisplayName("Columnwise Fusion Tests")
public class ColumnFunctionsTest extends TestBase {

    private TableSymbol t;

    @Override
    protected void doSetUp() {
        t = PlanFixtures.abcd();
    }

    static Stream<Arguments> operators() {
        return Stream.of(
            Arguments.of("add", (BiFunction<Object, Object, ColumnWise>) ColumnFunctions::add),
            Arguments.of("subtract", (BiFunction<Object, Object, ColumnWise>) ColumnFunctions::subtract),
            Arguments.of("divide", (BiFunction<Object, Object, ColumnWise>) ColumnFunctions::divide),
            Arguments.of("power", (BiFunction<Object, Object, ColumnWise>) ColumnFunctions::power),
            Arguments.of("equal", (BiFunction<Object, Object, ColumnWise>) ColumnFunctions::equal),
            Arguments.of("lessThan", (BiFunction<Object, Object, ColumnWise>) ColumnFunctions::lessThan),
            Arguments.of("and", (BiFunction<Object, Object, ColumnWise>) ColumnFunctions::and));
    }

    @Nested
    @DisplayName("Fusion")
    class Fusion {

        @Test
        @DisplayName("Two columns of one table fuse into one broadcast")
        void testFuseColumns() {
            ColumnWise sum = t.column("a").add(t.column("b"));

            assertThat(sum.child()).isEqualTo(t);
            assertThat(sum.activeColumns()).containsExactly("a", "b");
            assertThat(sum.columns()).containsExactly("a");
            assertThat(sum.dataType()).isEqualTo(IntegerType.get());
            assertThat(sum.toString()).isEqualTo("t['a'] + t['b']");
        }

        @Test
        @DisplayName("Nested broadcasts are inlined")
        void testNestedBroadcast() {
            ColumnWise expr = t.column("a").add(1).multiply(t.column("b"));

            assertThat(expr.child()).isEqualTo(t);
            assertThat(expr.children()).hasSize(1);
            assertThat(expr.toString()).isEqualTo("(t['a'] + 1) * t['b']");
        }

        @Test
        @DisplayName("Output field is named after the first column read")
        void testLiteralFirst() {
            ColumnWise expr = ColumnFunctions.subtract(10, t.column("c"));

            assertThat(expr.toString()).isEqualTo("10 - t['c']");
            assertThat(expr.columns()).containsExactly("c");
        }

        @Test
        @DisplayName("Repeated columns are reported once")
        void testRepeatedColumn() {
            ColumnWise expr = t.column("b").multiply(t.column("b")).add(t.column("a"));

            assertThat(expr.activeColumns()).containsExactly("a", "b");
            assertThat(expr.columns()).containsExactly("b");
        }

        @Test
        @DisplayName("Comparisons are boolean and usable as predicates")
        void testComparison() {
            ColumnWise predicate = t.column("a").greaterThan(0).and(t.column("b").lessThanOrEqual(5));

            assertThat(predicate.dataType()).isEqualTo(BooleanType.get());
            assertThat(t.select(predicate).columns()).containsExactly("a", "b", "c", "d");
            assertThat(predicate.not().toString()).isEqualTo("~((t['a'] > 0) & (t['b'] <= 5))");
        }

        @Test
        @DisplayName("Math functions are float64")
        void testMathFunctions() {
            ColumnWise sin = ColumnFunctions.sin(t.column("a"));

            assertThat(sin.dataType()).isEqualTo(DoubleType.get());
            assertThat(sin.toString()).isEqualTo("sin(t['a'])");
            assertThat(ColumnFunctions.log(ColumnFunctions.exp(t.column("a"))).toString())
                .isEqualTo("log(exp(t['a']))");
        }

        @Test
        @DisplayName("Columns of a derived table fuse over that table")
        void testDerivedSource() {
            Selection positive = t.select(t.column("a").greaterThan(0));
            ColumnWise expr = positive.column("b").subtract(positive.column("c"));

            assertThat(expr.child()).isEqualTo(positive);
        }
    }

    @Nested
    @DisplayName("Same-Origin Invariant")
    class SameOrigin {

        @ParameterizedTest(name = "{0}")
        @MethodSource("com.leanplan.logical.ColumnFunctionsTest#operators")
        @DisplayName("Columns of two tables never fuse")
        void testMismatchedSourceTable(String name, BiFunction<Object, Object, ColumnWise> op) {
            TableSymbol accounts = PlanFixtures.accounts();
            TableSymbol cities = PlanFixtures.cities();

            assertThatThrownBy(() -> op.apply(accounts.column("id"), cities.column("id")))
                .isInstanceOf(ConstructionException.class)
                .hasMessageContaining("same table")
                .satisfies(e -> assertThat(((ConstructionException) e).reason())
                    .isEqualTo(ConstructionException.Reason.MISMATCHED_SOURCE_TABLE));
        }

        @Test
        @DisplayName("A broadcast cannot absorb a column of another table")
        void testMismatchThroughBroadcast() {
            TableSymbol accounts = PlanFixtures.accounts();
            ColumnWise local = t.column("a").add(1);

            assertThatThrownBy(() -> local.multiply(accounts.column("amount")))
                .isInstanceOf(ConstructionException.class)
                .satisfies(e -> assertThat(((ConstructionException) e).reason())
                    .isEqualTo(ConstructionException.Reason.MISMATCHED_SOURCE_TABLE));
        }

        @Test
        @DisplayName("A projection of a table is a different source")
        void testProjectionIsAnotherSource() {
            Projection ab = t.project("a", "b");

            assertThatThrownBy(() -> t.column("a").add(ab.column("b")))
                .isInstanceOf(ConstructionException.class)
                .hasMessageContaining("t[['a', 'b']]");
        }
    }

    @Nested
    @DisplayName("Reductions and Labels")
    class ReductionsAndLabels {

        @Test
        @DisplayName("A reduction fuses as a scalar operand")
        void testReductionOperand() {
            Reduction total = t.column("a").sum();

            ColumnWise bumped = ColumnFunctions.add(total, 1);

            assertThat(bumped.child()).isEqualTo(total);
            assertThat(bumped.isTabular()).isFalse();
            assertThat(bumped.columns()).containsExactly("a");
            assertThat(bumped.dataType()).isEqualTo(IntegerType.get());
            assertThat(bumped.toString()).isEqualTo("sum(t['a']) + 1");
        }

        @Test
        @DisplayName("Scalar arithmetic over one reduction keeps fusing")
        void testChainedScalar() {
            ColumnWise scaled = ColumnFunctions.divide(ColumnFunctions.add(t.column("b").mean(), 1), 2);

            assertThat(scaled.child()).isEqualTo(t.column("b").mean());
            assertThat(scaled.dataType()).isEqualTo(DoubleType.get());
            assertThat(scaled.toString()).isEqualTo("(mean(t['b']) + 1) / 2");
        }

        @Test
        @DisplayName("A reduction and a column do not share a source")
        void testReductionWithColumn() {
            assertThatThrownBy(() -> ColumnFunctions.add(t.column("a").sum(), t.column("a")))
                .isInstanceOf(ConstructionException.class)
                .satisfies(e -> assertThat(((ConstructionException) e).reason())
                    .isEqualTo(ConstructionException.Reason.MISMATCHED_SOURCE_TABLE));
        }

        @Test
        @DisplayName("Labels carry the column syntax")
        void testLabelSyntax() {
            Label x = t.column("a").label("x");

            assertThat(x.sum().toString()).isEqualTo("sum(t['a'].label('x'))");
            assertThat(x.sum().columns()).containsExactly("x");

            ColumnWise shifted = x.add(1);
            assertThat(shifted.child()).isEqualTo(x);
            assertThat(shifted.columns()).containsExactly("x");
            assertThat(shifted.isTabular()).isTrue();
            assertThat(shifted.toString()).isEqualTo("t['a'].label('x') + 1");
        }
    }

    @Nested
    @DisplayName("Invalid Operands")
    class InvalidOperands {

        @Test
        @DisplayName("Literals alone have no source table")
        void testOnlyLiterals() {
            assertThatThrownBy(() -> ColumnFunctions.add(1, 2))
                .isInstanceOf(ConstructionException.class)
                .hasMessageContaining("At least one input");
        }

        @Test
        @DisplayName("A whole table is not a column operand")
        void testTableOperand() {
            assertThatThrownBy(() -> ColumnFunctions.add(t, 1))
                .isInstanceOf(ConstructionException.class)
                .satisfies(e -> assertThat(((ConstructionException) e).reason())
                    .isEqualTo(ConstructionException.Reason.INVALID_ARGUMENT));
        }

        @Test
        @DisplayName("Unsupported literal values are rejected")
        void testUnsupportedLiteral() {
            assertThatThrownBy(() -> t.column("a").add(new Object()))
                .isInstanceOf(ConstructionException.class)
                .hasMessageContaining("Unsupported literal value");
        }

        @Test
        @DisplayName("Broadcast placeholders must be columns of the child")
        void testUnknownPlaceholder() {
            assertThatThrownBy(() -> new ColumnWise(t,
                new com.leanplan.expression.ScalarSymbol("z", IntegerType.get())))
                .isInstanceOf(ConstructionException.class)
                .satisfies(e -> assertThat(((ConstructionException) e).reason())
                    .isEqualTo(ConstructionException.Reason.UNKNOWN_COLUMN));
        }
    }
}
