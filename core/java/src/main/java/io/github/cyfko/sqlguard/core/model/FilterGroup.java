package io.github.cyfko.sqlguard.core.model;

import io.github.cyfko.sqlguard.core.config.IdentifierPolicy;
import io.github.cyfko.sqlguard.core.exception.FilterValidationException;
import io.github.cyfko.sqlguard.core.utils.SqlIdentifiers;
import io.github.cyfko.sqlguard.core.utils.ValidationResult;
import io.github.cyfko.sqlguard.core.whitelist.FieldWhitelist;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Ordered list of {@link FilterItem}s joined by one {@link Logic} connective.
 * <p>
 * Groups nest to any depth the caller builds, although renderers refuse trees deeper than
 * {@link #MAX_DEPTH}. A group is immutable once constructed.
 * </p>
 *
 * <pre>{@code
 * // status = 'active' AND (quantity >= 10 OR expiry_date IS NULL)
 * FilterGroup group = FilterGroup.and(
 *     Filter.eq("status", "active"),
 *     FilterGroup.or(
 *         Filter.gte("quantity", 10),
 *         Filter.isNull("expiry_date")));
 * }</pre>
 *
 * <h2>Aggregate validation</h2>
 * <p>
 * Rendering skips fields a whitelist rejects. Callers who prefer to refuse the whole
 * request instead can call {@link #validate(FieldWhitelist)} first; it walks the full tree
 * and reports every rejected field together with its position, e.g.
 * {@code items[1].items[0]: Field 'password' is not in the whitelist of table 'users'}.
 * </p>
 *
 * @param logic connective joining the items
 * @param items child nodes, in rendering order
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record FilterGroup(Logic logic, List<FilterItem> items) implements FilterItem {

    /** Deepest nesting a renderer accepts; the root group is depth 1. */
    public static final int MAX_DEPTH = 32;

    public FilterGroup {
        Objects.requireNonNull(logic, "logic cannot be null");
        Objects.requireNonNull(items, "items cannot be null");
        items = List.copyOf(items);
    }

    public static FilterGroup and(FilterItem... items) {
        return new FilterGroup(Logic.AND, Arrays.asList(items));
    }

    public static FilterGroup or(FilterItem... items) {
        return new FilterGroup(Logic.OR, Arrays.asList(items));
    }

    public static FilterGroup and(List<? extends FilterItem> items) {
        return new FilterGroup(Logic.AND, List.copyOf(items));
    }

    public static FilterGroup or(List<? extends FilterItem> items) {
        return new FilterGroup(Logic.OR, List.copyOf(items));
    }

    /**
     * @return true if the group has no items at all
     */
    public boolean isEmpty() {
        return items.isEmpty();
    }

    /**
     * @return nesting depth, 1 for a group containing only filters
     */
    public int depth() {
        int deepest = 0;
        for (FilterItem item : items) {
            if (item instanceof FilterGroup nested) {
                deepest = Math.max(deepest, nested.depth());
            }
        }
        return deepest + 1;
    }

    /**
     * Validates every field of the tree against {@code whitelist} without rendering anything.
     * Disabled filters are ignored. With a {@code null} whitelist, fields are only
     * shape-checked.
     *
     * @param whitelist the whitelist to apply, or {@code null}
     * @return a result carrying one error per rejected field, plus one if the tree is too deep
     */
    public ValidationResult validate(FieldWhitelist whitelist) {
        ValidationResult result = depth() > MAX_DEPTH
                ? ValidationResult.failure("Filter tree is nested deeper than " + MAX_DEPTH + " levels")
                : ValidationResult.success();
        return result.merge(validateItems(whitelist, ""));
    }

    /**
     * Same as {@link #validate(FieldWhitelist)}, throwing when anything is wrong.
     *
     * @param whitelist the whitelist to apply, or {@code null}
     * @throws FilterValidationException carrying every error found
     */
    public void validateOrThrow(FieldWhitelist whitelist) {
        ValidationResult result = validate(whitelist);
        if (!result.isValid()) {
            throw new FilterValidationException(result.getErrors());
        }
    }

    private ValidationResult validateItems(FieldWhitelist whitelist, String path) {
        ValidationResult result = ValidationResult.success();
        for (int i = 0; i < items.size(); i++) {
            String here = path + "items[" + i + "]";
            FilterItem item = items.get(i);
            if (item instanceof FilterGroup nested) {
                result = result.merge(nested.validateItems(whitelist, here + "."));
            } else if (item instanceof Filter filter && filter.enabled()) {
                ValidationResult field = whitelist != null
                        ? whitelist.validate(filter.field())
                        : SqlIdentifiers.validate(filter.field(), IdentifierPolicy.forQualifiedFields());
                if (!field.isValid()) {
                    result = result.merge(ValidationResult.failure(here + ": " + field.getErrorMessage()));
                }
            }
        }
        return result;
    }
}
