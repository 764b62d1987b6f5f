package com.leanplan.schema;

import com.leanplan.logical.LogicalPlan;

/**
 * Exception thrown when the schema or shape of a node cannot be inferred.
 *
 * <p>This is raised at query time, not construction time: a {@code Map} or {@code Apply}
 * without a declared type is legal to build, but asking for its schema fails.
 */
public class SchemaInferenceException extends RuntimeException {

    private final transient LogicalPlan plan;

    public SchemaInferenceException(String message, LogicalPlan plan) {
        super(message + " (node kind: " + (plan != null ? plan.kind() : "unknown") + ")");
        this.plan = plan;
    }

    public SchemaInferenceException(String message) {
        this(message, null);
    }

    /**
     * Returns the node whose schema was queried.
     *
     * @return the node, or null if not available
     */
    public LogicalPlan getPlan() {
        return plan;
    }
}
