package com.leanplan.optimizer;

import com.leanplan.logical.LogicalPlan;

/**
 * Exception thrown when the optimizer cannot rewrite a tree.
 *
 * <p>These are caller or internal-consistency errors, never part of ordinary control flow:
 * a field that is simply not requested is not an error.
 */
public class OptimizationException extends RuntimeException {

    /**
     * Why the rewrite failed.
     */
    public enum Reason {
        /** A requested field is not a column of the node it was requested from. */
        UNKNOWN_FIELD,
        /** Two expressions expected to share an origin share none. */
        NO_COMMON_ANCESTOR,
        /** A shared origin lacks fields that its descendants need. */
        INCONSISTENT_ANCESTOR,
        /** The rewritten tree has a different schema from the input. */
        SCHEMA_CHANGED
    }

    private final Reason reason;
    private final transient LogicalPlan plan;

    public OptimizationException(Reason reason, String message, LogicalPlan plan) {
        super(message);
        this.reason = reason;
        this.plan = plan;
    }

    public OptimizationException(Reason reason, String message) {
        this(reason, message, null);
    }

    public Reason reason() {
        return reason;
    }

    /**
     * Returns the node being rewritten when the error occurred.
     *
     * @return the node, or null if not available
     */
    public LogicalPlan getPlan() {
        return plan;
    }
}
