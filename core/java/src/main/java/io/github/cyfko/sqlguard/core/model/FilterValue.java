package io.github.cyfko.sqlguard.core.model;

import io.github.cyfko.sqlguard.core.exception.FilterDefinitionException;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Operand of a {@link Filter}.
 * <p>
 * The union is closed: four scalar kinds ({@link Text}, {@link Int}, {@link Decimal},
 * {@link Bool}), a list of scalars ({@link Array}), a pair of scalars ({@link Range}) and the
 * absence of a value ({@link Null}). Scalars know how to render themselves as bind-parameter
 * text through {@link Scalar#asText()}:
 * </p>
 * <ul>
 *   <li>text is passed through unchanged</li>
 *   <li>integers render in decimal</li>
 *   <li>decimals render without trailing zeros, so {@code 10.0} becomes {@code "10"}</li>
 *   <li>booleans render as {@code "1"} or {@code "0"}</li>
 * </ul>
 *
 * <pre>{@code
 * FilterValue.scalar("active");              // Text
 * FilterValue.scalar(10);                    // Int
 * FilterValue.array(List.of("a", "b"));      // Array of Text
 * FilterValue.range(1, 100);                 // Range of Int
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public sealed interface FilterValue
        permits FilterValue.Scalar, FilterValue.Array, FilterValue.Range, FilterValue.Null {

    /** The single "no value" instance. */
    Null NULL = new Null();

    /**
     * @return the upper-case kind name used in error messages, e.g. {@code TEXT} or {@code RANGE}
     */
    default String kind() {
        return getClass().getSimpleName().toUpperCase(Locale.ROOT);
    }

    /**
     * A single value that can be bound to one placeholder.
     */
    sealed interface Scalar extends FilterValue permits Text, Int, Decimal, Bool {

        /**
         * @return the bind-parameter text of this value
         */
        String asText();
    }

    record Text(String value) implements Scalar {
        public Text {
            Objects.requireNonNull(value, "text value cannot be null");
        }

        @Override
        public String asText() {
            return value;
        }
    }

    record Int(long value) implements Scalar {
        @Override
        public String asText() {
            return Long.toString(value);
        }
    }

    record Decimal(double value) implements Scalar {
        public Decimal {
            if (Double.isNaN(value) || Double.isInfinite(value)) {
                throw new FilterDefinitionException("Decimal value must be finite, got " + value);
            }
        }

        @Override
        public String asText() {
            return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
        }
    }

    record Bool(boolean value) implements Scalar {
        @Override
        public String asText() {
            return value ? "1" : "0";
        }
    }

    record Array(List<Scalar> values) implements FilterValue {
        public Array {
            values = List.copyOf(values);
        }

        public boolean isEmpty() {
            return values.isEmpty();
        }
    }

    record Range(Scalar from, Scalar to) implements FilterValue {
        public Range {
            Objects.requireNonNull(from, "range lower bound cannot be null");
            Objects.requireNonNull(to, "range upper bound cannot be null");
        }
    }

    record Null() implements FilterValue {
    }

    /**
     * Converts a plain Java value into a scalar.
     *
     * @param value a {@link String}, integral {@link Number}, floating {@link Number},
     *              {@link Boolean} or an existing {@link Scalar}
     * @return the scalar
     * @throws FilterDefinitionException for {@code null}, any other type, or a {@link BigInteger}
     *                                   or {@link BigDecimal} that would lose digits
     */
    static Scalar scalar(Object value) {
        if (value instanceof Scalar s) {
            return s;
        }
        if (value instanceof String s) {
            return new Text(s);
        }
        if (value instanceof Boolean b) {
            return new Bool(b);
        }
        if (value instanceof Long || value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return new Int(((Number) value).longValue());
        }
        if (value instanceof BigInteger big) {
            try {
                return new Int(big.longValueExact());
            } catch (ArithmeticException e) {
                throw new FilterDefinitionException("Integer value " + big + " does not fit in 64 bits", e);
            }
        }
        if (value instanceof BigDecimal big) {
            double d = big.doubleValue();
            if (Double.isInfinite(d) || BigDecimal.valueOf(d).compareTo(big) != 0) {
                throw new FilterDefinitionException("Decimal value " + big.toPlainString()
                        + " cannot be bound without losing precision");
            }
            return new Decimal(d);
        }
        if (value instanceof Number n) {
            return new Decimal(n.doubleValue());
        }
        if (value == null) {
            throw new FilterDefinitionException("Scalar value cannot be null");
        }
        throw new FilterDefinitionException("Unsupported scalar type: " + value.getClass().getName());
    }

    /**
     * Converts every element of {@code values} with {@link #scalar(Object)}.
     *
     * @param values the elements, possibly empty
     * @return the array value
     */
    static Array array(Collection<?> values) {
        Objects.requireNonNull(values, "array values cannot be null");
        List<Scalar> scalars = new ArrayList<>(values.size());
        for (Object v : values) {
            scalars.add(scalar(v));
        }
        return new Array(scalars);
    }

    static Range range(Object from, Object to) {
        return new Range(scalar(from), scalar(to));
    }

    static Text text(String value) {
        return new Text(value);
    }
}
