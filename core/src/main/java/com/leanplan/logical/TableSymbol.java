package com.leanplan.logical;

import com.leanplan.types.SchemaParser;
import com.leanplan.types.StructType;
import java.util.List;
import java.util.Objects;

/**
 * A named table with a declared schema. This is the leaf of every expression tree.
 *
 * <pre>
 *   TableSymbol accounts = new TableSymbol("accounts", "{name: string, amount: int32, id: int32}");
 * </pre>
 *
 * <p>An execution backend binds a concrete data source to each symbol by name.
 */
public final class TableSymbol extends LogicalPlan {

    private final String name;
    private final StructType declaredSchema;

    /**
     * Creates a table symbol.
     *
     * @param name the table name
     * @param schema the record type of one row
     */
    public TableSymbol(String name, StructType schema) {
        super();
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.declaredSchema = Objects.requireNonNull(schema, "schema must not be null");
    }

    /**
     * Creates a table symbol from a schema string such as {@code {a: int32, b: string}}.
     *
     * @param name the table name
     * @param schema the schema string
     */
    public TableSymbol(String name, String schema) {
        this(name, SchemaParser.parse(schema));
    }

    public String name() {
        return name;
    }

    @Override
    public NodeKind kind() {
        return NodeKind.SYMBOL;
    }

    @Override
    public StructType schema() {
        return declaredSchema;
    }

    @Override
    public LogicalPlan withNewChildren(List<LogicalPlan> newChildren) {
        checkArity(this, newChildren, 0);
        return this;
    }

    @Override
    public String toString() {
        return name;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof TableSymbol)) return false;
        TableSymbol that = (TableSymbol) obj;
        return name.equals(that.name) && declaredSchema.equals(that.declaredSchema);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, declaredSchema);
    }
}
