package com.leanplan.exception;

import com.leanplan.logical.LogicalPlan;

/**
 * Exception thrown when an expression node cannot be built because one of its invariants
 * does not hold.
 *
 * <p>Construction errors are fatal at build time and never retried. The {@link Reason}
 * lets callers tell them apart without parsing messages:
 * <pre>
 *   try {
 *       ColumnFunctions.add(accounts.column("amount"), cities.column("population"));
 *   } catch (ConstructionException e) {
 *       if (e.reason() == ConstructionException.Reason.MISMATCHED_SOURCE_TABLE) { ... }
 *   }
 * </pre>
 */
public class ConstructionException extends RuntimeException {

    /**
     * The invariant that was violated.
     */
    public enum Reason {
        /** A selection predicate does not have boolean element type. */
        NON_BOOLEAN_PREDICATE,
        /** A referenced column is not part of the input's schema. */
        UNKNOWN_COLUMN,
        /** A column name would appear twice in one record. */
        DUPLICATE_COLUMN,
        /** A group-by apply expression keeps its row dimension. */
        NON_REDUCING_APPLY,
        /** Join key columns have different element types. */
        JOIN_KEY_TYPE_MISMATCH,
        /** Columnwise inputs come from more than one source table. */
        MISMATCHED_SOURCE_TABLE,
        /** Any other malformed argument. */
        INVALID_ARGUMENT
    }

    private final Reason reason;
    private final transient LogicalPlan input;

    /**
     * Creates a construction exception.
     *
     * @param reason the violated invariant
     * @param message the error message
     * @param input the input node the failing constructor was given (may be null)
     */
    public ConstructionException(Reason reason, String message, LogicalPlan input) {
        super(message);
        this.reason = reason;
        this.input = input;
    }

    public ConstructionException(Reason reason, String message) {
        this(reason, message, null);
    }

    public Reason reason() {
        return reason;
    }

    /**
     * Returns the input node the failing constructor was given.
     *
     * @return the input node, or null if not available
     */
    public LogicalPlan getInput() {
        return input;
    }
}
