package com.leanplan.optimizer;

import com.leanplan.logical.LogicalPlan;
import java.util.Collections;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Outcome of leaning one subtree: the rewritten subtree plus the source columns it needs.
 *
 * @param plan the rewritten subtree
 * @param fields the fields the rewritten subtree draws from its source tables
 */
public record LeanResult(LogicalPlan plan, SortedSet<String> fields) {

    public LeanResult {
        fields = Collections.unmodifiableSortedSet(new TreeSet<>(fields));
    }
}
