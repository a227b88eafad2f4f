package io.github.cyfko.sqlguard.core.model;

import io.github.cyfko.sqlguard.core.exception.FilterDefinitionException;

import java.util.Arrays;
import java.util.Collection;

/**
 * Immutable leaf condition of a filter tree: a field, an operator and the operand the
 * operator requires.
 *
 * <h2>Validation Strategy</h2>
 * <p>
 * The canonical constructor checks structure eagerly and throws
 * {@link FilterDefinitionException} on the first problem:
 * </p>
 * <ul>
 *   <li>field must not be null or blank</li>
 *   <li>operator must not be null</li>
 *   <li>operand must have the operator's {@link ValueShape}; a {@code null} operand is read as
 *       {@link FilterValue#NULL}</li>
 * </ul>
 * <p>
 * Whether the field may appear in SQL is <em>not</em> decided here. That is the whitelist's
 * job at render time, where a rejected field is skipped rather than treated as an error.
 * </p>
 *
 * <h2>Usage Examples</h2>
 * <pre>{@code
 * Filter.eq("status", "active");
 * Filter.gte("quantity", 10);
 * Filter.like("name", "chloride");
 * Filter.in("unit", List.of("g", "mg"));
 * Filter.between("expiry_date", "2024-01-01", "2024-12-31");
 * Filter.isNull("expiry_date");
 *
 * // Kept in the tree but never rendered
 * Filter.eq("location", "A-1").withEnabled(false);
 * }</pre>
 *
 * @param field    column reference, possibly alias-qualified
 * @param operator comparison to apply
 * @param value    operand matching {@code operator.getShape()}
 * @param enabled  whether the filter takes part in rendering
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record Filter(String field, FilterOperator operator, FilterValue value, boolean enabled) implements FilterItem {

    public Filter {
        if (field == null || field.isBlank()) {
            throw new FilterDefinitionException("Filter field cannot be null or blank");
        }
        if (operator == null) {
            throw new FilterDefinitionException("Operator cannot be null for field '" + field + "'");
        }
        if (value == null) {
            value = FilterValue.NULL;
        }
        if (!operator.getShape().accepts(value)) {
            throw new FilterDefinitionException("Operator " + operator + " on field '" + field + "' requires "
                    + operator.getShape().describe() + ", got " + value.kind());
        }
    }

    /**
     * Creates an enabled filter.
     */
    public Filter(String field, FilterOperator operator, FilterValue value) {
        this(field, operator, value, true);
    }

    public static Filter of(String field, FilterOperator operator, FilterValue value) {
        return new Filter(field, operator, value, true);
    }

    public static Filter eq(String field, Object value) {
        return scalar(field, FilterOperator.EQ, value);
    }

    public static Filter neq(String field, Object value) {
        return scalar(field, FilterOperator.NEQ, value);
    }

    public static Filter lt(String field, Object value) {
        return scalar(field, FilterOperator.LT, value);
    }

    public static Filter lte(String field, Object value) {
        return scalar(field, FilterOperator.LTE, value);
    }

    public static Filter gt(String field, Object value) {
        return scalar(field, FilterOperator.GT, value);
    }

    public static Filter gte(String field, Object value) {
        return scalar(field, FilterOperator.GTE, value);
    }

    public static Filter like(String field, String text) {
        return new Filter(field, FilterOperator.LIKE, FilterValue.text(text));
    }

    public static Filter notLike(String field, String text) {
        return new Filter(field, FilterOperator.NOT_LIKE, FilterValue.text(text));
    }

    public static Filter startsWith(String field, String text) {
        return new Filter(field, FilterOperator.STARTS_WITH, FilterValue.text(text));
    }

    public static Filter endsWith(String field, String text) {
        return new Filter(field, FilterOperator.ENDS_WITH, FilterValue.text(text));
    }

    public static Filter in(String field, Collection<?> values) {
        return new Filter(field, FilterOperator.IN, FilterValue.array(values));
    }

    public static Filter in(String field, Object... values) {
        return in(field, Arrays.asList(values));
    }

    public static Filter notIn(String field, Collection<?> values) {
        return new Filter(field, FilterOperator.NOT_IN, FilterValue.array(values));
    }

    public static Filter notIn(String field, Object... values) {
        return notIn(field, Arrays.asList(values));
    }

    public static Filter between(String field, Object from, Object to) {
        return new Filter(field, FilterOperator.BETWEEN, FilterValue.range(from, to));
    }

    public static Filter notBetween(String field, Object from, Object to) {
        return new Filter(field, FilterOperator.NOT_BETWEEN, FilterValue.range(from, to));
    }

    public static Filter isNull(String field) {
        return new Filter(field, FilterOperator.IS_NULL, FilterValue.NULL);
    }

    public static Filter isNotNull(String field) {
        return new Filter(field, FilterOperator.IS_NOT_NULL, FilterValue.NULL);
    }

    /**
     * @param enabled whether the copy takes part in rendering
     * @return a copy of this filter with the given flag
     */
    public Filter withEnabled(boolean enabled) {
        return enabled == this.enabled ? this : new Filter(field, operator, value, enabled);
    }

    private static Filter scalar(String field, FilterOperator operator, Object value) {
        return new Filter(field, operator, FilterValue.scalar(value));
    }
}
