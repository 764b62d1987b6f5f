package com.leanplan.types;

import java.util.List;

/**
 * Element type for 32-bit signed integers ({@code int32}).
 */
public final class IntegerType implements DataType {

    private static final IntegerType INSTANCE = new IntegerType();
    private static final List<String> ALIASES = List.of("int32", "int", "integer");

    private IntegerType() {}

    public static IntegerType get() {
        return INSTANCE;
    }

    @Override
    public String typeName() {
        return "int32";
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
        return obj instanceof IntegerType;
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
