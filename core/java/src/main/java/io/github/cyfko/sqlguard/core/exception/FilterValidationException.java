package io.github.cyfko.sqlguard.core.exception;

import java.util.List;

/**
 * Exception thrown when a filter tree fails validation as a whole.
 * <p>
 * Unlike {@link FilterDefinitionException}, which reports the first inconsistency of a
 * single filter, this exception aggregates every problem found while validating a complete
 * tree (or while reading one from an external representation) so that a caller can report
 * all of them in a single response.
 * </p>
 *
 * <p><strong>Handling example:</strong></p>
 * <pre>{@code
 * try {
 *     FilterGroup group = reader.read(json);
 *     SqlFragment where = FilterBuilder.of(whitelist).build(group);
 * } catch (FilterValidationException e) {
 *     return ResponseEntity.badRequest().body(e.getErrors());
 * }
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 * @see io.github.cyfko.sqlguard.core.model.FilterGroup#validate()
 */
public class FilterValidationException extends RuntimeException {

    private final List<String> errors;

    /**
     * Creates an exception carrying a single error.
     *
     * @param message the description of the problem
     */
    public FilterValidationException(String message) {
        super(message);
        this.errors = List.of(message);
    }

    /**
     * Creates an exception carrying a single error and its underlying cause.
     *
     * @param message the description of the problem
     * @param cause   the original cause
     */
    public FilterValidationException(String message, Throwable cause) {
        super(message, cause);
        this.errors = List.of(message);
    }

    /**
     * Creates an exception carrying every error found, in discovery order.
     *
     * @param errors the collected errors; must not be empty
     * @throws IllegalArgumentException if {@code errors} is empty
     */
    public FilterValidationException(List<String> errors) {
        super(summarize(errors));
        this.errors = List.copyOf(errors);
    }

    /**
     * Returns the individual errors, in the order they were found.
     *
     * @return an unmodifiable list with at least one element
     */
    public List<String> getErrors() {
        return errors;
    }

    private static String summarize(List<String> errors) {
        if (errors == null || errors.isEmpty()) {
            throw new IllegalArgumentException("At least one validation error is required");
        }
        if (errors.size() == 1) {
            return errors.get(0);
        }
        return errors.size() + " filter validation errors: " + String.join("; ", errors);
    }
}
