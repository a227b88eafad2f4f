package io.github.cyfko.sqlguard.core.model;

/**
 * Arity a {@link FilterOperator} requires of its operand.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public enum ValueShape {

    /** A single text, integer, decimal or boolean value. */
    SCALAR,

    /** A single text value, used as a pattern. */
    TEXT,

    /** A list of scalars, possibly empty. */
    ARRAY,

    /** Exactly two scalars: lower and upper bound. */
    RANGE,

    /** No operand at all. */
    NONE;

    /**
     * Checks whether {@code value} has this shape.
     *
     * @param value the operand, never {@code null} ({@link FilterValue.Null} stands for "no value")
     * @return true if the operand fits
     */
    public boolean accepts(FilterValue value) {
        return switch (this) {
            case SCALAR -> value instanceof FilterValue.Scalar;
            case TEXT -> value instanceof FilterValue.Text;
            case ARRAY -> value instanceof FilterValue.Array;
            case RANGE -> value instanceof FilterValue.Range;
            case NONE -> value instanceof FilterValue.Null;
        };
    }

    /**
     * @return a short human description used in error messages
     */
    public String describe() {
        return switch (this) {
            case SCALAR -> "a single value";
            case TEXT -> "a text value";
            case ARRAY -> "an array value";
            case RANGE -> "a range of two values";
            case NONE -> "no value";
        };
    }
}
