package com.leanplan.logical;

import com.leanplan.schema.SchemaInferenceException;
import com.leanplan.types.Shape;
import com.leanplan.types.StructType;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/**
 * Node applying a user function to its child as a whole.
 *
 * <p>Like {@link RowMap} the result type is opaque and must be declared, here as a full
 * {@link Shape}. A declared dimensionless shape makes the node a reduction: it has a shape
 * but no row schema.
 */
public final class Apply extends LogicalPlan {

    private final Function<Object, Object> func;
    private final Shape declaredShape;

    /**
     * Creates an apply node.
     *
     * @param child the input
     * @param func the function
     * @param declaredShape the result shape, or null if unknown
     */
    public Apply(LogicalPlan child, Function<Object, Object> func, Shape declaredShape) {
        super(child);
        this.func = Objects.requireNonNull(func, "func must not be null");
        this.declaredShape = declaredShape;
    }

    public LogicalPlan child() {
        return children.get(0);
    }

    public Function<Object, Object> func() {
        return func;
    }

    /**
     * Returns the declared result shape.
     *
     * @return the declared shape, or null
     */
    public Shape declaredShape() {
        return declaredShape;
    }

    @Override
    public NodeKind kind() {
        return NodeKind.APPLY;
    }

    @Override
    public StructType schema() {
        if (declaredShape == null) {
            throw new SchemaInferenceException(
                "Schema of an apply cannot be inferred; declare it with apply(func, shape): " + this, this);
        }
        if (!declaredShape.isTabular()) {
            throw new SchemaInferenceException(
                "Declared shape " + declaredShape + " has no row dimension, so there is no row schema", this);
        }
        return declaredShape.schema();
    }

    @Override
    public boolean isTabular() {
        return declaredShape == null || declaredShape.isTabular();
    }

    @Override
    public Shape shape() {
        if (declaredShape == null) {
            throw new SchemaInferenceException(
                "Shape of an apply cannot be inferred; declare it with apply(func, shape): " + this, this);
        }
        return declaredShape;
    }

    @Override
    public LogicalPlan withNewChildren(List<LogicalPlan> newChildren) {
        checkArity(this, newChildren, 1);
        return new Apply(newChildren.get(0), func, declaredShape);
    }

    @Override
    public String toString() {
        return child() + ".apply(" + func + ")";
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Apply)) return false;
        Apply that = (Apply) obj;
        return func.equals(that.func)
            && Objects.equals(declaredShape, that.declaredShape)
            && child().equals(that.child());
    }

    @Override
    public int hashCode() {
        return Objects.hash(NodeKind.APPLY, func, declaredShape, child());
    }
}
