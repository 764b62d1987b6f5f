package com.leanplan.logical;

/**
 * Operator-style methods shared by column-like nodes ({@link Column}, {@link ColumnWise} and
 * {@link Label}).
 *
 * <p>Each method is a thin layer over {@link ColumnFunctions} or {@link Reduction}, so
 * {@code t.column("a").add(1).greaterThan(t.column("b"))} builds one fused
 * {@link ColumnWise} node over {@code t}.
 */
public sealed interface ColumnSyntax permits Column, ColumnWise, Label {

    private LogicalPlan self() {
        return (LogicalPlan) this;
    }

    // ==================== Arithmetic ====================

    default ColumnWise add(Object other) {
        return ColumnFunctions.add(this, other);
    }

    default ColumnWise subtract(Object other) {
        return ColumnFunctions.subtract(this, other);
    }

    default ColumnWise multiply(Object other) {
        return ColumnFunctions.multiply(this, other);
    }

    default ColumnWise divide(Object other) {
        return ColumnFunctions.divide(this, other);
    }

    default ColumnWise modulo(Object other) {
        return ColumnFunctions.modulo(this, other);
    }

    default ColumnWise power(Object other) {
        return ColumnFunctions.power(this, other);
    }

    default ColumnWise negate() {
        return ColumnFunctions.negate(this);
    }

    // ==================== Comparison ====================

    default ColumnWise equalTo(Object other) {
        return ColumnFunctions.equal(this, other);
    }

    default ColumnWise notEqualTo(Object other) {
        return ColumnFunctions.notEqual(this, other);
    }

    default ColumnWise lessThan(Object other) {
        return ColumnFunctions.lessThan(this, other);
    }

    default ColumnWise lessThanOrEqual(Object other) {
        return ColumnFunctions.lessThanOrEqual(this, other);
    }

    default ColumnWise greaterThan(Object other) {
        return ColumnFunctions.greaterThan(this, other);
    }

    default ColumnWise greaterThanOrEqual(Object other) {
        return ColumnFunctions.greaterThanOrEqual(this, other);
    }

    // ==================== Boolean ====================

    default ColumnWise and(Object other) {
        return ColumnFunctions.and(this, other);
    }

    default ColumnWise or(Object other) {
        return ColumnFunctions.or(this, other);
    }

    default ColumnWise not() {
        return ColumnFunctions.not(this);
    }

    // ==================== Reductions ====================

    default Reduction sum() {
        return new Reduction(Reduction.Kind.SUM, self());
    }

    default Reduction min() {
        return new Reduction(Reduction.Kind.MIN, self());
    }

    default Reduction max() {
        return new Reduction(Reduction.Kind.MAX, self());
    }

    default Reduction mean() {
        return new Reduction(Reduction.Kind.MEAN, self());
    }

    default Reduction variance() {
        return new Reduction(Reduction.Kind.VAR, self());
    }

    default Reduction std() {
        return new Reduction(Reduction.Kind.STD, self());
    }

    default Reduction count() {
        return new Reduction(Reduction.Kind.COUNT, self());
    }

    default Reduction nunique() {
        return new Reduction(Reduction.Kind.NUNIQUE, self());
    }

    default Reduction any() {
        return new Reduction(Reduction.Kind.ANY, self());
    }

    default Reduction all() {
        return new Reduction(Reduction.Kind.ALL, self());
    }
}
