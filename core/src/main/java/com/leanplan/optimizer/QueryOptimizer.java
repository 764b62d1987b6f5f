package com.leanplan.optimizer;

import com.leanplan.logical.LogicalPlan;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Applies rewrite rules to expression trees.
 *
 * <p>Each rule runs once, in order. With {@link OptimizerConfig#verifySchema()} set, every
 * rule's output is checked to have the same schema as its input.
 *
 * <p>Example usage:
 * <pre>
 *   QueryOptimizer optimizer = new QueryOptimizer();
 *   LogicalPlan optimized = optimizer.optimize(plan);
 * </pre>
 *
 * <p>The default rule set is {@link LeanProjection}.
 */
public class QueryOptimizer {

    private static final Logger logger = LoggerFactory.getLogger(QueryOptimizer.class);

    private final List<OptimizationRule> rules;
    private final OptimizerConfig config;

    /**
     * Creates an optimizer with the default rules, configured from system properties.
     */
    public QueryOptimizer() {
        this(createDefaultRules(), OptimizerConfig.fromSystemProperties());
    }

    /**
     * Creates an optimizer with the default rules.
     *
     * @param config the configuration
     */
    public QueryOptimizer(OptimizerConfig config) {
        this(createDefaultRules(), config);
    }

    /**
     * Creates an optimizer with custom rules.
     *
     * @param rules the rules to apply, in order
     * @param config the configuration
     */
    public QueryOptimizer(List<OptimizationRule> rules, OptimizerConfig config) {
        this.rules = new ArrayList<>(rules);
        this.config = config;
    }

    /**
     * Optimizes a tree by applying every rule once.
     *
     * @param plan the input tree
     * @return the optimized tree
     * @throws OptimizationException if a rule fails or, with schema verification on,
     *         changes the output schema
     */
    public LogicalPlan optimize(LogicalPlan plan) {
        if (plan == null) {
            return null;
        }
        logPlan("Optimizing {}", plan);

        LogicalPlan currentPlan = plan;
        for (OptimizationRule rule : rules) {
            LogicalPlan rewritten = rule.apply(currentPlan);
            if (config.verifySchema() && !rewritten.schema().equals(currentPlan.schema())) {
                throw new OptimizationException(OptimizationException.Reason.SCHEMA_CHANGED,
                    String.format("Rule %s changed the schema from %s to %s",
                        rule.name(), currentPlan.schema(), rewritten.schema()),
                    currentPlan);
            }
            logger.debug("{}: {} -> {}", rule.name(), currentPlan, rewritten);
            currentPlan = rewritten;
        }

        logPlan("Optimized plan {}", currentPlan);
        return currentPlan;
    }

    private void logPlan(String message, LogicalPlan plan) {
        if (config.logPlans()) {
            logger.info(message, plan);
        } else {
            logger.debug(message, plan);
        }
    }

    /**
     * Creates the default set of rules.
     *
     * @return the default rules
     */
    private static List<OptimizationRule> createDefaultRules() {
        return Collections.singletonList(new LeanProjection());
    }

    /**
     * Returns the rules, in application order.
     *
     * @return the rules
     */
    public List<OptimizationRule> rules() {
        return new ArrayList<>(rules);
    }

    public OptimizerConfig config() {
        return config;
    }
}
