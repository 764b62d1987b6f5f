package com.leanplan.optimizer;

import com.leanplan.logical.LogicalPlan;

/**
 * Interface for tree rewrite rules.
 *
 * <p>A rule transforms an expression tree into an equivalent tree with the same output
 * schema. Rules never modify the input; they return a new tree, or the input itself when
 * nothing applies.
 */
public interface OptimizationRule {

    /**
     * Applies this rule to a tree.
     *
     * <p>Applying a rule to its own output should not change the output schema.
     *
     * @param plan the input tree
     * @return the rewritten tree (or the input if the rule does not apply)
     */
    LogicalPlan apply(LogicalPlan plan);

    /**
     * Returns the name of this rule, used for logging.
     *
     * @return the rule name
     */
    default String name() {
        return getClass().getSimpleName();
    }
}
