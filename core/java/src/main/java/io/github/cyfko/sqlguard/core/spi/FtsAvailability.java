package io.github.cyfko.sqlguard.core.spi;

/**
 * Tells whether a full-text index table can be queried.
 * <p>
 * Implementations must never throw: any failure to determine availability is reported as
 * {@code false}, which makes callers fall back to {@code LIKE} matching.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 * @see io.github.cyfko.sqlguard.core.fts.FtsSearchCondition
 */
@FunctionalInterface
public interface FtsAvailability {

    /**
     * @param indexTable name of the index table
     * @return true if the table exists and can be matched against
     */
    boolean isAvailable(String indexTable);

    /**
     * @return an availability that always answers {@code value}
     */
    static FtsAvailability fixed(boolean value) {
        return indexTable -> value;
    }
}
