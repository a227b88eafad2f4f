package io.github.cyfko.sqlguard.core.pagination;

/**
 * Which way a keyset page moves from its cursor.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public enum Direction {
    NEXT,
    PREV;

    /**
     * @param value {@code prev} in any case selects {@link #PREV}; anything else, including
     *              {@code null}, selects {@link #NEXT}
     */
    public static Direction fromString(String value) {
        return value != null && value.trim().equalsIgnoreCase("prev") ? PREV : NEXT;
    }
}
