package com.leanplan.types;

import java.util.Objects;

/**
 * A named, typed field of a {@link StructType}.
 */
public record StructField(String name, DataType dataType) {

    /**
     * Creates a struct field.
     *
     * @param name the field name
     * @param dataType the field element type
     */
    public StructField {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(dataType, "dataType must not be null");
    }

    /**
     * Returns a copy of this field carrying a different name.
     *
     * @param newName the new field name
     * @return the renamed field
     */
    public StructField withName(String newName) {
        return new StructField(newName, dataType);
    }

    /**
     * Returns a copy of this field carrying a different element type.
     *
     * @param newType the new element type
     * @return the retyped field
     */
    public StructField withDataType(DataType newType) {
        return new StructField(name, newType);
    }

    @Override
    public String toString() {
        return name + ": " + dataType;
    }
}
