package com.leanplan.logical;

import com.leanplan.test.PlanFixtures;
import com.leanplan.test.TestBase;
import com.leanplan.test.TestCategories;

import java.util.List;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for structural identity and tree rewriting helpers on {@link LogicalPlan}.
 */
@TestCategories.Tier1
@TestCategories.Unit
@DisplayName("LogicalPlan Tree Tests")
public class LogicalPlanTest extends TestBase {

    private TableSymbol t;
    private LogicalPlan expr;

    @Override
    protected void doSetUp() {
        t = PlanFixtures.abcd();
        expr = t.select(t.column("a").greaterThan(0)).column("b");
    }

    @Nested
    @DisplayName("Identity")
    class Identity {

        @Test
        @DisplayName("Separately built trees are equal")
        void testStructuralEquality() {
            TableSymbol other = PlanFixtures.abcd();
            LogicalPlan rebuilt = other.select(other.column("a").greaterThan(0)).column("b");

            assertThat(rebuilt).isEqualTo(expr);
            assertThat(rebuilt.hashCode()).isEqualTo(expr.hashCode());
            assertThat(rebuilt.isIdentical(expr)).isTrue();
        }

        @Test
        @DisplayName("Different fields make different nodes")
        void testInequality() {
            assertThat(t.column("a")).isNotEqualTo(t.column("b"));
            assertThat(t.sort("a", true)).isNotEqualTo(t.sort("a", false));
            assertThat(t.head(5)).isNotEqualTo(t.head(6));
            assertThat(new TableSymbol("t", "{a: int32}")).isNotEqualTo(new TableSymbol("t", "{a: int64}"));
        }

        @Test
        @DisplayName("Each node reports its kind")
        void testKinds() {
            assertThat(expr.kind()).isEqualTo(NodeKind.COLUMN);
            assertThat(expr.children().get(0).kind()).isEqualTo(NodeKind.SELECTION);
            assertThat(t.kind()).isEqualTo(NodeKind.SYMBOL);
        }
    }

    @Nested
    @DisplayName("Traversal")
    class Traversal {

        @Test
        @DisplayName("Subterms are distinct and in pre-order")
        void testSubterms() {
            List<LogicalPlan> subterms = expr.subterms();

            assertThat(subterms).hasSize(4);
            assertThat(subterms.get(0)).isSameAs(expr);
            assertThat(subterms.get(1).kind()).isEqualTo(NodeKind.SELECTION);
            assertThat(subterms.get(2)).isEqualTo(t);
            assertThat(subterms.get(3).kind()).isEqualTo(NodeKind.COLUMN_WISE);
        }

        @Test
        @DisplayName("Tree size counts shared subtrees each time")
        void testTreeSize() {
            assertThat(expr.treeSize()).isEqualTo(5);
        }
    }

    @Nested
    @DisplayName("Rewriting")
    class Rewriting {

        @Test
        @DisplayName("Substitute rebuilds every path to the replaced node")
        void testSubstitute() {
            LogicalPlan rewritten = expr.substitute(t, t.project("a", "b"));

            assertThat(rewritten.toString()).isEqualTo("t[['a', 'b']][t[['a', 'b']]['a'] > 0]['b']");
            assertThat(expr.toString()).isEqualTo("t[t['a'] > 0]['b']");
        }

        @Test
        @DisplayName("Substitute without a match returns the same instance")
        void testSubstituteNoMatch() {
            TableSymbol other = new TableSymbol("s", "{a: int32}");

            assertThat(expr.substitute(other, other.project("a"))).isSameAs(expr);
        }

        @Test
        @DisplayName("withNewChildren re-runs construction checks")
        void testWithNewChildrenRechecks() {
            Column b = t.column("b");

            assertThatThrownBy(() -> b.withNewChildren(List.of(t.project("a"))))
                .isInstanceOf(com.leanplan.exception.ConstructionException.class)
                .hasMessageContaining("'b'");
        }

        @Test
        @DisplayName("withNewChildren rejects the wrong number of children")
        void testWithNewChildrenArity() {
            assertThatThrownBy(() -> t.column("b").withNewChildren(List.of(t, t)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("expects 1 children");
        }
    }
}
