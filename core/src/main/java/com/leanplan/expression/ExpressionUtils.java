package com.leanplan.expression;

import java.util.ArrayList;
import java.util.List;
import java.util.TreeSet;

/**
 * Traversal helpers for scalar expressions.
 */
public final class ExpressionUtils {

    private ExpressionUtils() {
        // Utility class - prevent instantiation
    }

    /**
     * Collects every column placeholder in left-to-right (pre-order) order, duplicates kept.
     *
     * @param expr the expression to walk
     * @return the placeholders in encounter order
     */
    public static List<ScalarSymbol> collectSymbols(Expression expr) {
        List<ScalarSymbol> symbols = new ArrayList<>();
        collect(expr, symbols);
        return symbols;
    }

    private static void collect(Expression expr, List<ScalarSymbol> out) {
        if (expr instanceof ScalarSymbol) {
            out.add((ScalarSymbol) expr);
            return;
        }
        for (Expression child : expr.children()) {
            collect(child, out);
        }
    }

    /**
     * Returns the names of all column placeholders, sorted and de-duplicated.
     *
     * @param expr the expression to walk
     * @return the active column names
     */
    public static List<String> activeColumns(Expression expr) {
        TreeSet<String> names = new TreeSet<>();
        for (ScalarSymbol symbol : collectSymbols(expr)) {
            names.add(symbol.name());
        }
        return new ArrayList<>(names);
    }
}
