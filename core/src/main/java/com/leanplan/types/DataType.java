package com.leanplan.types;

import java.util.List;

/**
 * Sealed interface for all element types in the leanplan type system.
 *
 * <p>An element type describes the values held by one field of a record. Record types
 * themselves are {@link StructType}s, and a node's full shape (dimension plus record) is
 * a {@link Shape}.
 *
 * <p>Element types include:
 * <ul>
 *   <li>Boolean: BooleanType</li>
 *   <li>Numeric: IntegerType, LongType, FloatType, DoubleType, DecimalType</li>
 *   <li>Text and temporal: StringType, DateType, TimestampType</li>
 *   <li>Records: StructType</li>
 * </ul>
 */
public sealed interface DataType
    permits BooleanType, IntegerType, LongType, FloatType, DoubleType, DecimalType,
            StringType, DateType, TimestampType, StructType {

    /**
     * Returns the canonical name of this type, as accepted by {@link SchemaParser}.
     *
     * @return the type name
     */
    String typeName();

    /**
     * Returns every name {@link SchemaParser} accepts for this type, canonical name first.
     *
     * @return the accepted names, lowercase
     */
    default List<String> aliases() {
        return List.of(typeName());
    }

    /**
     * Returns whether arithmetic operators apply to values of this type.
     *
     * @return true for numeric types
     */
    default boolean isNumeric() {
        return false;
    }
}
