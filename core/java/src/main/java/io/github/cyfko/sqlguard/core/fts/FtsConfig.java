package io.github.cyfko.sqlguard.core.fts;

import io.github.cyfko.sqlguard.core.config.IdentifierPolicy;
import io.github.cyfko.sqlguard.core.utils.SqlIdentifiers;

import java.util.List;
import java.util.Objects;

/**
 * Full-text search settings for one entity.
 * <p>
 * Every identifier is validated at construction, since all of them end up verbatim in the
 * generated condition. An invalid one throws
 * {@link io.github.cyfko.sqlguard.core.exception.InvalidIdentifierException}.
 * </p>
 *
 * <pre>{@code
 * FtsConfig reagents = new FtsConfig("reagents_fts", "reagents", "id",
 *         List.of("name", "formula", "cas_number", "manufacturer"));
 * }</pre>
 *
 * @param indexTable     name of the full-text index table
 * @param baseTable      table the index covers
 * @param idField        id column shared by the base table and the index
 * @param fallbackFields columns searched with {@code LIKE} when the index is unavailable
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record FtsConfig(String indexTable, String baseTable, String idField, List<String> fallbackFields) {

    public FtsConfig {
        SqlIdentifiers.requireValid(indexTable, IdentifierPolicy.forTableNames());
        SqlIdentifiers.requireValid(baseTable, IdentifierPolicy.forTableNames());
        SqlIdentifiers.requireValid(idField, IdentifierPolicy.defaults());
        Objects.requireNonNull(fallbackFields, "fallbackFields cannot be null");
        fallbackFields = List.copyOf(fallbackFields);
        for (String field : fallbackFields) {
            SqlIdentifiers.requireValid(field, IdentifierPolicy.defaults());
        }
    }

    /**
     * Config with the conventional {@code id} column.
     */
    public static FtsConfig of(String indexTable, String baseTable, String... fallbackFields) {
        return new FtsConfig(indexTable, baseTable, "id", List.of(fallbackFields));
    }

    public FtsConfig withFallbackFields(List<String> fields) {
        return new FtsConfig(indexTable, baseTable, idField, fields);
    }
}
