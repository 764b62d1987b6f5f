package com.leanplan.logical;

import com.leanplan.schema.SchemaInferenceException;
import com.leanplan.types.StructType;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/**
 * Node applying a user function to every row of its child.
 *
 * <p>The function is opaque to this layer, so the output record type cannot be inferred and
 * must be declared. A node without a declared schema can be built, but asking for its schema
 * raises a {@link SchemaInferenceException}.
 */
public final class RowMap extends LogicalPlan {

    private final Function<Object, Object> func;
    private final StructType declaredSchema;

    /**
     * Creates a map node.
     *
     * @param child the input table
     * @param func the row function
     * @param declaredSchema the output record type, or null if unknown
     */
    public RowMap(LogicalPlan child, Function<Object, Object> func, StructType declaredSchema) {
        super(child);
        this.func = Objects.requireNonNull(func, "func must not be null");
        this.declaredSchema = declaredSchema;
    }

    public LogicalPlan child() {
        return children.get(0);
    }

    public Function<Object, Object> func() {
        return func;
    }

    /**
     * Returns the declared output record type.
     *
     * @return the declared schema, or null
     */
    public StructType declaredSchema() {
        return declaredSchema;
    }

    @Override
    public NodeKind kind() {
        return NodeKind.MAP;
    }

    @Override
    public StructType schema() {
        if (declaredSchema == null) {
            throw new SchemaInferenceException(
                "Schema of a map cannot be inferred; declare it with map(func, schema): " + this, this);
        }
        return declaredSchema;
    }

    @Override
    public LogicalPlan withNewChildren(List<LogicalPlan> newChildren) {
        checkArity(this, newChildren, 1);
        return new RowMap(newChildren.get(0), func, declaredSchema);
    }

    @Override
    public String toString() {
        return child() + ".map(" + func + ")";
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof RowMap)) return false;
        RowMap that = (RowMap) obj;
        return func.equals(that.func)
            && Objects.equals(declaredSchema, that.declaredSchema)
            && child().equals(that.child());
    }

    @Override
    public int hashCode() {
        return Objects.hash(NodeKind.MAP, func, declaredSchema, child());
    }
}
