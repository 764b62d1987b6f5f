package com.leanplan.types;

import java.util.List;

/**
 * Element type of predicates and boolean columns ({@code bool}).
 *
 * <p>Selections require their predicate to have this type, and the {@code any}/{@code all}
 * reductions produce it.
 */
public final class BooleanType implements DataType {

    private static final BooleanType INSTANCE = new BooleanType();
    private static final List<String> ALIASES = List.of("bool", "boolean");

    private BooleanType() {}

    public static BooleanType get() {
        return INSTANCE;
    }

    @Override
    public String typeName() {
        return "bool";
    }

    @Override
    public List<String> aliases() {
        return ALIASES;
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof BooleanType;
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
