package com.leanplan.logical;

/**
 * The closed set of expression node kinds.
 *
 * <p>Every {@link LogicalPlan} subclass reports exactly one kind. Rewrite rules switch over
 * this enumeration with switch expressions, so a kind added here without a matching rule
 * fails to compile.
 */
public enum NodeKind {
    SYMBOL,
    PROJECTION,
    COLUMN,
    SELECTION,
    COLUMN_WISE,
    REDUCTION,
    SUMMARY,
    BY,
    SORT,
    DISTINCT,
    HEAD,
    LABEL,
    RELABEL,
    MAP,
    APPLY,
    JOIN
}
