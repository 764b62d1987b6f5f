package com.leanplan.optimizer;

import com.leanplan.logical.Apply;
import com.leanplan.logical.By;
import com.leanplan.logical.Column;
import com.leanplan.logical.ColumnWise;
import com.leanplan.logical.CommonSubexpression;
import com.leanplan.logical.Distinct;
import com.leanplan.logical.Head;
import com.leanplan.logical.Join;
import com.leanplan.logical.Label;
import com.leanplan.logical.LogicalPlan;
import com.leanplan.logical.NodeKind;
import com.leanplan.logical.Projection;
import com.leanplan.logical.ReLabel;
import com.leanplan.logical.Reduction;
import com.leanplan.logical.RowMap;
import com.leanplan.logical.Selection;
import com.leanplan.logical.Sort;
import com.leanplan.logical.Summary;
import com.leanplan.logical.TableSymbol;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Rewrite rule that keeps every table as thin as possible.
 *
 * <p>Every {@link TableSymbol} leaf is wrapped in a {@link Projection} onto exactly the
 * columns consumed above it, and every node over a pruned child is rebuilt over it:
 * <pre>
 *   t = Symbol('t', 'var * {a: int32, b: int32, c: int32, d: int32}')
 *   t[t['a'] &gt; 0]['b']
 *     -&gt; t[['a', 'b']][t[['a', 'b']]['a'] &gt; 0]['b']
 * </pre>
 *
 * <p>The rewrite is a single recursive pass. Each call receives the fields needed above a
 * node, narrows that request for the node's children and reports back the source fields the
 * rewritten node needs. An empty request stands for all of a node's columns. Requesting a
 * field that is not one of a node's columns is an error.
 *
 * <p>Rules are selected by an exhaustive switch over {@link NodeKind}, so a new node kind
 * does not compile until it has a rule here.
 */
public class LeanProjection implements OptimizationRule {

    private static final Logger logger = LoggerFactory.getLogger(LeanProjection.class);

    /**
     * Leans a tree for a consumer of all its columns.
     *
     * @param plan the tree
     * @return the rewritten tree, with the same schema
     */
    @Override
    public LogicalPlan apply(LogicalPlan plan) {
        return optimize(plan, plan.columns());
    }

    /**
     * Leans a tree for a consumer of the given columns.
     *
     * <p>The result's columns are the requested ones, in the tree's original column order.
     *
     * @param plan the tree
     * @param requested the root columns the consumer needs
     * @return the rewritten tree
     * @throws OptimizationException if a requested column is not a column of {@code plan}
     */
    public LogicalPlan optimize(LogicalPlan plan, Collection<String> requested) {
        logger.debug("Leaning {} for {}", plan, requested);
        LogicalPlan leaned = lean(plan, new TreeSet<>(requested)).plan();

        List<String> target = requested.isEmpty()
            ? plan.columns()
            : plan.columns().stream().filter(requested::contains).collect(Collectors.toList());
        LogicalPlan result = restoreOrder(leaned, target);
        logger.debug("Leaned to {}", result);
        return result;
    }

    /**
     * Leans one subtree.
     *
     * @param plan the subtree
     * @param requested the fields needed above it; empty for all of its columns
     * @return the rewritten subtree and the source fields it needs
     */
    public LeanResult lean(LogicalPlan plan, SortedSet<String> requested) {
        NodeKind kind = plan.kind();
        SortedSet<String> fields = requested;
        if (ignoresRequest(kind)) {
            fields = Collections.emptySortedSet();
        } else if (requested.isEmpty()) {
            fields = new TreeSet<>(plan.columns());
        } else if (!plan.schema().containsAll(requested)) {
            List<String> unknown = requested.stream()
                .filter(name -> !plan.schema().contains(name))
                .collect(Collectors.toList());
            throw new OptimizationException(OptimizationException.Reason.UNKNOWN_FIELD,
                "Fields " + unknown + " are not columns of " + plan + ": " + plan.columns(), plan);
        }
        logger.debug("lean {} {}", kind, fields);

        return switch (kind) {
            case SYMBOL -> leanSymbol((TableSymbol) plan, fields);
            case PROJECTION -> leanProjection((Projection) plan, fields);
            case COLUMN -> leanColumn((Column) plan, fields);
            case COLUMN_WISE -> leanColumnWise((ColumnWise) plan, fields);
            case SELECTION -> leanSelection((Selection) plan, fields);
            case REDUCTION -> leanReduction((Reduction) plan);
            case SUMMARY -> leanSummary((Summary) plan, fields);
            case BY -> leanBy((By) plan, fields);
            case SORT -> leanSort((Sort) plan, fields);
            case DISTINCT -> leanDistinct((Distinct) plan);
            case HEAD -> leanHead((Head) plan, fields);
            case LABEL -> leanLabel((Label) plan);
            case RELABEL -> leanReLabel((ReLabel) plan, fields);
            case MAP -> leanWholeChild(plan, ((RowMap) plan).child());
            case APPLY -> leanWholeChild(plan, ((Apply) plan).child());
            case JOIN -> leanJoin((Join) plan, fields);
        };
    }

    private static boolean ignoresRequest(NodeKind kind) {
        return kind == NodeKind.REDUCTION || kind == NodeKind.MAP || kind == NodeKind.APPLY;
    }

    private LeanResult leanSymbol(TableSymbol symbol, SortedSet<String> fields) {
        return new LeanResult(new Projection(symbol, new ArrayList<>(fields)), fields);
    }

    private LeanResult leanProjection(Projection projection, SortedSet<String> fields) {
        LogicalPlan child = lean(projection.child(), fields).plan();
        List<String> keep = projection.projectedColumns().stream()
            .filter(fields::contains)
            .collect(Collectors.toList());
        if (child.columns().equals(keep)) {
            return new LeanResult(child, fields);
        }
        return new LeanResult(new Projection(child, keep), fields);
    }

    private LeanResult leanColumn(Column column, SortedSet<String> fields) {
        SortedSet<String> needed = union(fields, List.of(column.name()));
        LogicalPlan child = lean(column.child(), needed).plan();
        return new LeanResult(new Column(child, column.name()), needed);
    }

    private LeanResult leanColumnWise(ColumnWise columnWise, SortedSet<String> fields) {
        SortedSet<String> needed = union(fields, columnWise.activeColumns());
        LogicalPlan child = lean(columnWise.child(), needed).plan();
        return new LeanResult(columnWise.withNewChildren(List.of(child)), needed);
    }

    private LeanResult leanSelection(Selection selection, SortedSet<String> fields) {
        SortedSet<String> predicateFields = lean(selection.predicate(), Collections.emptySortedSet()).fields();
        SortedSet<String> needed = union(fields, predicateFields);
        LogicalPlan child = lean(selection.child(), needed).plan();
        return new LeanResult(selection.substitute(selection.child(), child), needed);
    }

    private LeanResult leanReduction(Reduction reduction) {
        LeanResult child = lean(reduction.child(), Collections.emptySortedSet());
        return new LeanResult(reduction.withNewChildren(List.of(child.plan())), child.fields());
    }

    private LeanResult leanSummary(Summary summary, SortedSet<String> fields) {
        List<String> names = new ArrayList<>();
        List<LogicalPlan> values = new ArrayList<>();
        SortedSet<String> needed = new TreeSet<>();
        for (Map.Entry<String, LogicalPlan> entry : summary.entries().entrySet()) {
            if (!fields.contains(entry.getKey())) {
                logger.debug("Dropping unused summary entry '{}'", entry.getKey());
                continue;
            }
            LeanResult value = lean(entry.getValue(), Collections.emptySortedSet());
            names.add(entry.getKey());
            values.add(value.plan());
            needed.addAll(value.fields());
        }
        return new LeanResult(new Summary(names, values), needed);
    }

    private LeanResult leanBy(By by, SortedSet<String> fields) {
        LeanResult grouper = lean(by.grouper(), intersection(fields, by.grouper().columns()));
        LeanResult apply = lean(by.apply(), intersection(fields, by.apply().columns()));
        SortedSet<String> needed = union(grouper.fields(), apply.fields());

        LogicalPlan ancestor = CommonSubexpression.find(grouper.plan(), apply.plan());
        if (!ancestor.schema().containsAll(needed)) {
            throw new OptimizationException(OptimizationException.Reason.INCONSISTENT_ANCESTOR,
                "Common ancestor " + ancestor + " lacks fields " + needed + " needed by " + by, by);
        }
        SortedSet<String> read = columnsReadFrom(ancestor, grouper.plan(), apply.plan());
        if (read.size() >= ancestor.columns().size()) {
            return new LeanResult(new By(ancestor, grouper.plan(), apply.plan()), needed);
        }

        logger.debug("Re-leaning shared ancestor {} to {}", ancestor, read);
        LogicalPlan parent = lean(ancestor, read).plan();
        LogicalPlan newGrouper = grouper.plan().substitute(ancestor, parent);
        LogicalPlan newApply = apply.plan().substitute(ancestor, parent);
        return new LeanResult(new By(parent, newGrouper, newApply), needed);
    }

    /**
     * Collects the columns of {@code ancestor} read by the nodes directly above it in the given
     * trees. A side that is the ancestor itself, or a consumer other than a projection, column
     * or broadcast, reads all of it.
     */
    private static SortedSet<String> columnsReadFrom(LogicalPlan ancestor, LogicalPlan... sides) {
        SortedSet<String> read = new TreeSet<>();
        for (LogicalPlan side : sides) {
            if (side.equals(ancestor)) {
                read.addAll(ancestor.columns());
                continue;
            }
            for (LogicalPlan node : side.subterms()) {
                if (!node.children().contains(ancestor)) {
                    continue;
                }
                switch (node.kind()) {
                    case PROJECTION -> read.addAll(node.columns());
                    case COLUMN -> read.add(((Column) node).name());
                    case COLUMN_WISE -> read.addAll(((ColumnWise) node).activeColumns());
                    default -> read.addAll(ancestor.columns());
                }
            }
        }
        return read;
    }

    private LeanResult leanSort(Sort sort, SortedSet<String> fields) {
        if (sort.keyExpression() == null) {
            SortedSet<String> needed = union(fields, sort.keyColumns());
            LogicalPlan child = lean(sort.child(), needed).plan();
            return new LeanResult(Sort.byColumns(child, sort.keyColumns(), sort.isAscending()), needed);
        }
        SortedSet<String> keyFields = lean(sort.keyExpression(), Collections.emptySortedSet()).fields();
        SortedSet<String> needed = union(fields, keyFields);
        LogicalPlan child = lean(sort.child(), needed).plan();
        return new LeanResult(sort.substitute(sort.child(), child), needed);
    }

    private LeanResult leanDistinct(Distinct distinct) {
        return leanWholeChild(distinct, distinct.child());
    }

    private LeanResult leanHead(Head head, SortedSet<String> fields) {
        LeanResult child = lean(head.child(), fields);
        return new LeanResult(new Head(child.plan(), head.n()), child.fields());
    }

    private LeanResult leanLabel(Label label) {
        LeanResult child = lean(label.child(), Collections.emptySortedSet());
        return new LeanResult(new Label(child.plan(), label.label()), child.fields());
    }

    private LeanResult leanReLabel(ReLabel relabel, SortedSet<String> fields) {
        SortedSet<String> childFields = new TreeSet<>();
        for (String field : fields) {
            childFields.add(relabel.originalName(field));
        }
        LeanResult child = lean(relabel.child(), childFields);

        Map<String, String> labels = new TreeMap<>();
        for (Map.Entry<String, String> entry : relabel.labels().entrySet()) {
            if (child.plan().columns().contains(entry.getKey())) {
                labels.put(entry.getKey(), entry.getValue());
            }
        }
        return new LeanResult(new ReLabel(child.plan(), labels), child.fields());
    }

    private LeanResult leanJoin(Join join, SortedSet<String> fields) {
        SortedSet<String> leftFields = intersection(fields, join.left().columns());
        leftFields.add(join.onLeft());
        SortedSet<String> rightFields = new TreeSet<>();
        for (String field : join.right().columns()) {
            if (fields.contains(field) && !field.equals(join.onRight())) {
                rightFields.add(field);
            }
        }
        rightFields.add(join.onRight());

        LeanResult left = lean(join.left(), leftFields);
        LeanResult right = lean(join.right(), rightFields);
        return new LeanResult(
            new Join(left.plan(), right.plan(), join.onLeft(), join.onRight()),
            union(left.fields(), right.fields()));
    }

    /**
     * Rule for nodes that see whole rows of their child (distinct, map, apply): the child
     * keeps every column, in its original order.
     */
    private LeanResult leanWholeChild(LogicalPlan plan, LogicalPlan child) {
        LeanResult leaned = lean(child, new TreeSet<>(child.columns()));
        LogicalPlan newChild = restoreOrder(leaned.plan(), child.columns());
        return new LeanResult(plan.withNewChildren(List.of(newChild)), leaned.fields());
    }

    private static LogicalPlan restoreOrder(LogicalPlan plan, List<String> order) {
        if (plan.columns().equals(order)) {
            return plan;
        }
        return new Projection(plan, order);
    }

    private static SortedSet<String> union(Collection<String> a, Collection<String> b) {
        SortedSet<String> result = new TreeSet<>(a);
        result.addAll(b);
        return result;
    }

    private static SortedSet<String> intersection(Collection<String> a, Collection<String> b) {
        SortedSet<String> result = new TreeSet<>(a);
        result.retainAll(b);
        return result;
    }
}
