package com.leanplan.types;

/**
 * Leading dimension of a {@link Shape}: either variable length ({@code var}) or a fixed
 * number of rows.
 */
public final class Dimension {

    /** A dimension of unknown, variable length. */
    public static final Dimension VAR = new Dimension(-1);

    private final long length;

    private Dimension(long length) {
        this.length = length;
    }

    /**
     * Creates a fixed-length dimension.
     *
     * @param length the number of rows
     * @return the dimension
     */
    public static Dimension fixed(long length) {
        if (length < 0) {
            throw new IllegalArgumentException("length must be non-negative, got: " + length);
        }
        return new Dimension(length);
    }

    public boolean isVar() {
        return length < 0;
    }

    /**
     * Returns the fixed length of this dimension.
     *
     * @return the number of rows
     * @throws IllegalStateException if this dimension is variable
     */
    public long length() {
        if (isVar()) {
            throw new IllegalStateException("var dimension has no fixed length");
        }
        return length;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Dimension)) return false;
        return length == ((Dimension) obj).length;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(length);
    }

    @Override
    public String toString() {
        return isVar() ? "var" : Long.toString(length);
    }
}
