package com.leanplan.types;

import java.util.Objects;

/**
 * The full type of an expression: an optional leading {@link Dimension} over a measure.
 *
 * <p>Tables have shape {@code var * {a: int32, ...}}; a {@code head(10)} has shape
 * {@code 10 * {...}}; reductions are dimensionless ({@code {a: int32}} or plain
 * {@code int32}).
 */
public final class Shape {

    private final Dimension dimension;
    private final DataType measure;

    /**
     * Creates a shape.
     *
     * @param dimension the leading dimension, or null for a dimensionless shape
     * @param measure the measure (record or element type)
     */
    public Shape(Dimension dimension, DataType measure) {
        this.dimension = dimension;
        this.measure = Objects.requireNonNull(measure, "measure must not be null");
    }

    public static Shape table(StructType schema) {
        return new Shape(Dimension.VAR, schema);
    }

    public static Shape scalar(DataType measure) {
        return new Shape(null, measure);
    }

    /**
     * Returns the leading dimension.
     *
     * @return the dimension, or null when this shape is dimensionless
     */
    public Dimension dimension() {
        return dimension;
    }

    public DataType measure() {
        return measure;
    }

    /**
     * Returns whether this shape carries a leading (row) dimension.
     *
     * @return true for row-producing shapes
     */
    public boolean isTabular() {
        return dimension != null;
    }

    /**
     * Drops the leading dimension.
     *
     * @return the dimensionless shape over the same measure
     */
    public Shape subarray() {
        return new Shape(null, measure);
    }

    /**
     * Returns this shape with a different measure and the same dimension.
     *
     * @param newMeasure the measure
     * @return the new shape
     */
    public Shape withMeasure(DataType newMeasure) {
        return new Shape(dimension, newMeasure);
    }

    /**
     * Returns the measure as a record. A plain element type is wrapped in a single field
     * named {@code "0"}.
     *
     * @return the record type of one row
     */
    public StructType schema() {
        if (measure instanceof StructType) {
            return (StructType) measure;
        }
        return StructType.of("0", measure);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Shape)) return false;
        Shape that = (Shape) o;
        return Objects.equals(dimension, that.dimension) && measure.equals(that.measure);
    }

    @Override
    public int hashCode() {
        return Objects.hash(dimension, measure);
    }

    @Override
    public String toString() {
        return dimension == null ? measure.toString() : dimension + " * " + measure;
    }
}
