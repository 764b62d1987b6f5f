package com.leanplan.logical;

import com.leanplan.optimizer.OptimizationException;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Locates the shared origin of two expressions built from one table.
 *
 * <p>A group-by's grouper and apply are rewritten independently by the optimizer but still
 * descend from one source. The shared origin is the largest row-producing subtree that
 * occurs, structurally identical, in both expressions.
 */
public final class CommonSubexpression {

    private CommonSubexpression() {
    }

    /**
     * Finds the largest row-producing subtree common to both expressions.
     *
     * <p>Ties are broken by pre-order position in {@code b}.
     *
     * @param a the first expression
     * @param b the second expression
     * @return the common subtree
     * @throws OptimizationException if the expressions share no row-producing subtree
     */
    public static LogicalPlan find(LogicalPlan a, LogicalPlan b) {
        Set<LogicalPlan> inA = new HashSet<>(a.subterms());
        List<LogicalPlan> inB = b.subterms();

        LogicalPlan best = null;
        int bestSize = -1;
        for (LogicalPlan candidate : inB) {
            if (!inA.contains(candidate) || !candidate.isTabular()) {
                continue;
            }
            int size = candidate.treeSize();
            if (size > bestSize) {
                best = candidate;
                bestSize = size;
            }
        }
        if (best == null) {
            throw new OptimizationException(OptimizationException.Reason.NO_COMMON_ANCESTOR,
                "No common subexpression between " + a + " and " + b, b);
        }
        return best;
    }
}
