package com.leanplan.types;

import java.util.List;

/**
 * Element type for 64-bit signed integers ({@code int64}); {@code count} and
 * {@code nunique} reduce to it.
 */
public final class LongType implements DataType {

    private static final LongType INSTANCE = new LongType();
    private static final List<String> ALIASES = List.of("int64", "long", "bigint");

    private LongType() {}

    public static LongType get() {
        return INSTANCE;
    }

    @Override
    public String typeName() {
        return "int64";
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
        return obj instanceof LongType;
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
