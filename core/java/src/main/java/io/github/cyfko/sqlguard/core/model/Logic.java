package io.github.cyfko.sqlguard.core.model;

import io.github.cyfko.sqlguard.core.exception.FilterDefinitionException;

import java.util.Locale;

/**
 * Connective joining the items of a {@link FilterGroup}.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public enum Logic {
    AND,
    OR;

    /**
     * @return the connective surrounded by single spaces, ready to join rendered items
     */
    public String separator() {
        return " " + name() + " ";
    }

    /**
     * @param value {@code and} or {@code or}, any case
     * @return the matching connective
     * @throws FilterDefinitionException for any other input
     */
    public static Logic fromString(String value) {
        if (value != null) {
            switch (value.trim().toUpperCase(Locale.ROOT)) {
                case "AND":
                    return AND;
                case "OR":
                    return OR;
                default:
                    break;
            }
        }
        throw new FilterDefinitionException("Unknown group logic '" + value + "', expected AND or OR");
    }
}
