package com.leanplan.types;

import java.util.List;

/**
 * Element type for points in time ({@code datetime}).
 */
public final class TimestampType implements DataType {

    private static final TimestampType INSTANCE = new TimestampType();
    private static final List<String> ALIASES = List.of("datetime", "timestamp");

    private TimestampType() {}

    public static TimestampType get() {
        return INSTANCE;
    }

    @Override
    public String typeName() {
        return "datetime";
    }

    @Override
    public List<String> aliases() {
        return ALIASES;
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof TimestampType;
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
