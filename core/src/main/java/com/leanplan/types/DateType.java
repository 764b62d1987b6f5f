package com.leanplan.types;

import java.util.List;

/**
 * Element type for calendar days ({@code date}).
 */
public final class DateType implements DataType {

    private static final DateType INSTANCE = new DateType();
    private static final List<String> ALIASES = List.of("date");

    private DateType() {}

    public static DateType get() {
        return INSTANCE;
    }

    @Override
    public String typeName() {
        return "date";
    }

    @Override
    public List<String> aliases() {
        return ALIASES;
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof DateType;
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
