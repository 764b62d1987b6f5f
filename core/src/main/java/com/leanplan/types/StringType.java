package com.leanplan.types;

import java.util.List;

/**
 * Element type for text columns ({@code string}).
 *
 * <p>Only equality and ordering comparisons apply; arithmetic on text is rejected by
 * {@link TypeCoercion}.
 */
public final class StringType implements DataType {

    private static final StringType INSTANCE = new StringType();
    private static final List<String> ALIASES = List.of("string", "varchar", "text");

    private StringType() {}

    public static StringType get() {
        return INSTANCE;
    }

    @Override
    public String typeName() {
        return "string";
    }

    @Override
    public List<String> aliases() {
        return ALIASES;
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof StringType;
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
