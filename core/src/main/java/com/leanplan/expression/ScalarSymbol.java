package com.leanplan.expression;

import com.leanplan.types.DataType;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/**
 * Placeholder standing in for one source-table column inside a scalar expression.
 *
 * <p>Columnwise fusion replaces every {@link com.leanplan.logical.Column} operand with a
 * placeholder named after the column, so the scalar expression itself never references a
 * table. The set of placeholder names in an expression is its set of active columns.
 */
public final class ScalarSymbol implements Expression {

    private final String name;
    private final DataType dataType;

    /**
     * Creates a column placeholder.
     *
     * @param name the column name
     * @param dataType the column's element type
     */
    public ScalarSymbol(String name, DataType dataType) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.dataType = Objects.requireNonNull(dataType, "dataType must not be null");
    }

    public String name() {
        return name;
    }

    @Override
    public DataType dataType() {
        return dataType;
    }

    @Override
    public List<Expression> children() {
        return Collections.emptyList();
    }

    @Override
    public String render(Function<String, String> columnRenderer) {
        return columnRenderer.apply(name);
    }

    @Override
    public String toString() {
        return name;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof ScalarSymbol)) return false;
        ScalarSymbol that = (ScalarSymbol) obj;
        return name.equals(that.name) && dataType.equals(that.dataType);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, dataType);
    }
}
