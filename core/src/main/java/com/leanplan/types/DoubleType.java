package com.leanplan.types;

import java.util.List;

/**
 * Element type for double-precision floats ({@code float64}). Scalar math functions,
 * {@code mean}, {@code var} and {@code std} produce it.
 */
public final class DoubleType implements DataType {

    private static final DoubleType INSTANCE = new DoubleType();
    private static final List<String> ALIASES = List.of("float64", "double");

    private DoubleType() {}

    public static DoubleType get() {
        return INSTANCE;
    }

    @Override
    public String typeName() {
        return "float64";
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
        return obj instanceof DoubleType;
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
