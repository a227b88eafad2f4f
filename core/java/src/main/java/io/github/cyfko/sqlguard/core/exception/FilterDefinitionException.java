package io.github.cyfko.sqlguard.core.exception;

/**
 * Exception thrown when a single filter is constructed with an inconsistent shape.
 * <p>
 * This is a hard construction error: the caller combined an operator with a value of the
 * wrong arity (for example {@code IN} with a scalar, {@code BETWEEN} with a single value, or
 * {@code IS_NULL} with a value). It is distinct from a whitelist miss, which is never an error
 * and only causes the filter to be skipped at render time.
 * </p>
 *
 * <p><strong>Typical messages:</strong></p>
 * <pre>{@code
 * Filter.of("qty", FilterOperator.IN, FilterValue.of(5));
 * // -> "Operator IN on field 'qty' requires an array value, got INT"
 *
 * Filter.of("expiry", FilterOperator.IS_NULL, FilterValue.of("x"));
 * // -> "Operator IS_NULL on field 'expiry' takes no value, got TEXT"
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 * @see io.github.cyfko.sqlguard.core.model.Filter
 */
public class FilterDefinitionException extends RuntimeException {

    /**
     * Creates an exception with an explanatory message.
     *
     * @param message the description of the inconsistency
     */
    public FilterDefinitionException(String message) {
        super(message);
    }

    /**
     * Creates an exception with an explanatory message and an underlying cause.
     *
     * @param message the description of the inconsistency
     * @param cause   the original cause
     */
    public FilterDefinitionException(String message, Throwable cause) {
        super(message, cause);
    }
}
