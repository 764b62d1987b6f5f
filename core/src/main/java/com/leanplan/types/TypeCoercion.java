package com.leanplan.types;

/**
 * Result-type rules for scalar operators and reductions.
 *
 * <h2>Arithmetic</h2>
 * <ul>
 *   <li>float64 wins over float32, float32 over decimal, decimal over int64, int64 over int32</li>
 *   <li>Two decimals unify to the wider integral part and the wider scale</li>
 *   <li>Non-numeric operands keep the left operand's type</li>
 * </ul>
 */
public final class TypeCoercion {

    private TypeCoercion() {
        // Utility class - prevent instantiation
    }

    /**
     * Promotes two numeric types to the common arithmetic result type.
     *
     * @param left the left operand type
     * @param right the right operand type
     * @return the promoted type
     */
    public static DataType promoteNumericTypes(DataType left, DataType right) {
        if (!left.isNumeric() || !right.isNumeric()) {
            return left;
        }
        if (left instanceof DoubleType || right instanceof DoubleType) {
            return DoubleType.get();
        }
        if (left instanceof FloatType || right instanceof FloatType) {
            return FloatType.get();
        }
        if (left instanceof DecimalType || right instanceof DecimalType) {
            return unifyDecimalTypes(toDecimal(left), toDecimal(right));
        }
        if (left instanceof LongType || right instanceof LongType) {
            return LongType.get();
        }
        return IntegerType.get();
    }

    /**
     * Integral types widen to a decimal with enough digits for their range.
     */
    private static DecimalType toDecimal(DataType type) {
        if (type instanceof DecimalType) {
            return (DecimalType) type;
        }
        if (type instanceof LongType) {
            return new DecimalType(20, 0);
        }
        return new DecimalType(10, 0);
    }

    private static DecimalType unifyDecimalTypes(DecimalType left, DecimalType right) {
        int scale = Math.max(left.scale(), right.scale());
        int integral = Math.max(left.precision() - left.scale(), right.precision() - right.scale());
        int precision = Math.min(integral + scale, DecimalType.MAX_PRECISION);
        return new DecimalType(precision, Math.min(scale, precision));
    }
}
