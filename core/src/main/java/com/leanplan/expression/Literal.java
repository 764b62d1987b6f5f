package com.leanplan.expression;

import com.leanplan.types.BooleanType;
import com.leanplan.types.DataType;
import com.leanplan.types.DoubleType;
import com.leanplan.types.IntegerType;
import com.leanplan.types.LongType;
import com.leanplan.types.StringType;
import java.math.BigDecimal;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/**
 * Expression representing a literal constant value.
 *
 * <p>Literals are operands that contribute no source table to a columnwise fusion:
 * <pre>
 *   t['amount'] + 1        -- integer literal
 *   t['name'] == 'Alice'   -- string literal
 *   t['price'] * 1.1       -- double literal
 * </pre>
 */
public final class Literal implements Expression {

    private final Object value;
    private final DataType dataType;

    /**
     * Creates a literal expression.
     *
     * @param value the literal value (may be null)
     * @param dataType the data type of the literal
     */
    public Literal(Object value, DataType dataType) {
        this.value = value;
        this.dataType = Objects.requireNonNull(dataType, "dataType must not be null");
    }

    /**
     * Returns the literal value.
     *
     * @return the value, or null for NULL literals
     */
    public Object value() {
        return value;
    }

    public boolean isNull() {
        return value == null;
    }

    @Override
    public DataType dataType() {
        return dataType;
    }

    @Override
    public List<Expression> children() {
        return Collections.emptyList();
    }

    @Override
    public String render(Function<String, String> columnRenderer) {
        if (value == null) {
            return "None";
        }
        if (dataType instanceof StringType) {
            return "'" + value.toString().replace("'", "\\'") + "'";
        }
        return value.toString();
    }

    @Override
    public String toString() {
        return render(Function.identity());
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Literal)) return false;
        Literal that = (Literal) obj;
        return Objects.equals(value, that.value) &&
               Objects.equals(dataType, that.dataType);
    }

    @Override
    public int hashCode() {
        return Objects.hash(value, dataType);
    }

    // ==================== Factory Methods ====================

    public static Literal of(int value) {
        return new Literal(value, IntegerType.get());
    }

    public static Literal of(long value) {
        return new Literal(value, LongType.get());
    }

    public static Literal of(double value) {
        return new Literal(value, DoubleType.get());
    }

    public static Literal of(String value) {
        return new Literal(value, StringType.get());
    }

    public static Literal of(boolean value) {
        return new Literal(value, BooleanType.get());
    }

    /**
     * Wraps a plain Java value in a literal of the matching type.
     *
     * @param value an Integer, Long, Short, Byte, Double, Float, BigDecimal, String or Boolean
     * @return the literal
     * @throws IllegalArgumentException if the value's class has no literal type
     */
    public static Literal fromValue(Object value) {
        if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return of(((Number) value).intValue());
        }
        if (value instanceof Long) {
            return of((long) (Long) value);
        }
        if (value instanceof Double || value instanceof Float || value instanceof BigDecimal) {
            return of(((Number) value).doubleValue());
        }
        if (value instanceof String) {
            return of((String) value);
        }
        if (value instanceof Boolean) {
            return of((boolean) (Boolean) value);
        }
        throw new IllegalArgumentException("Unsupported literal value: " + value
            + (value != null ? " (" + value.getClass().getSimpleName() + ")" : ""));
    }
}
