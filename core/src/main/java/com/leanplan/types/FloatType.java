package com.leanplan.types;

import java.util.List;

/**
 * Element type for single-precision floats ({@code float32}).
 */
public final class FloatType implements DataType {

    private static final FloatType INSTANCE = new FloatType();
    private static final List<String> ALIASES = List.of("float32", "float", "real");

    private FloatType() {}

    public static FloatType get() {
        return INSTANCE;
    }

    @Override
    public String typeName() {
        return "float32";
    }

    @Override
    public List<String> aliases() {
        return ALIASES;
    }

    @Override
    public boolean isNumeric() {
        return true;
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof FloatType;
    }

    @Override
    public int hashCode() {
        return typeName().hashCode();
    }

    @Override
    public String toString() {
        return typeName();
    }
}
