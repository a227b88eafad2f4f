package io.github.cyfko.sqlguard.core.utils;

import java.util.ArrayList;
import java.util.List;

/**
 * Result of a validation operation.
 * <p>
 * A result is either a success or a failure carrying one or more error messages.
 * Results can be merged, which lets recursive validators (for example a filter tree)
 * collect every problem instead of stopping at the first one.
 * </p>
 *
 * <p>Instances are immutable and created via {@link #success()}, {@link #failure(String)}
 * and {@link #merge(ValidationResult)}.</p>
 *
 * <pre>{@code
 * ValidationResult result = SqlIdentifiers.validate("order", IdentifierPolicy.defaults());
 * if (!result.isValid()) {
 *     logger.warning(result.getErrorMessage()); // "'order' is a reserved SQL word"
 * }
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class ValidationResult {

    private static final ValidationResult SUCCESS = new ValidationResult(List.of());

    private final List<String> errors;

    private ValidationResult(List<String> errors) {
        this.errors = errors;
    }

    /**
     * Creates an instance indicating a successful validation.
     *
     * @return a valid result with no error message
     */
    public static ValidationResult success() {
        return SUCCESS;
    }

    /**
     * Creates an instance indicating a failed validation with an error message.
     *
     * @param errorMessage message explaining the reason for failure
     * @return an invalid result containing the provided error message
     */
    public static ValidationResult failure(String errorMessage) {
        return new ValidationResult(List.of(errorMessage));
    }

    /**
     * Combines this result with another one. The merged result is valid only if both are,
     * and carries the errors of this result followed by those of {@code other}.
     *
     * @param other the result to append
     * @return the combined result
     */
    public ValidationResult merge(ValidationResult other) {
        if (other.isValid()) {
            return this;
        }
        if (this.isValid()) {
            return other;
        }
        List<String> combined = new ArrayList<>(errors.size() + other.errors.size());
        combined.addAll(errors);
        combined.addAll(other.errors);
        return new ValidationResult(List.copyOf(combined));
    }

    /**
     * Indicates whether the validation succeeded.
     *
     * @return true if valid, false otherwise
     */
    public boolean isValid() {
        return errors.isEmpty();
    }

    /**
     * Returns the first error message of a failed validation.
     *
     * @return error message if invalid, or null if valid
     */
    public String getErrorMessage() {
        return errors.isEmpty() ? null : errors.get(0);
    }

    /**
     * Returns every error message, in the order they were recorded.
     *
     * @return an unmodifiable list, empty when valid
     */
    public List<String> getErrors() {
        return errors;
    }

    @Override
    public String toString() {
        return isValid() ? "ValidationResult[valid=true]"
                : "ValidationResult[valid=false, errors=" + errors + "]";
    }
}
