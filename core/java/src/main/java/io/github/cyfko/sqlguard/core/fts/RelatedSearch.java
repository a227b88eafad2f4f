package io.github.cyfko.sqlguard.core.fts;

import io.github.cyfko.sqlguard.core.config.IdentifierPolicy;
import io.github.cyfko.sqlguard.core.utils.SqlIdentifiers;

import java.util.List;

/**
 * Child table searched alongside an entity, through a correlated {@code EXISTS}.
 * <p>
 * For reagents with batches, a search for a batch number should find the reagent:
 * </p>
 * <pre>{@code
 * new RelatedSearch("batches", "bs", "reagent_id", List.of("batch_number", "cat_number", "supplier"));
 * // EXISTS (SELECT 1 FROM batches bs WHERE bs.reagent_id = r.id AND (bs.batch_number LIKE ? OR ...))
 * }</pre>
 *
 * @param childTable child table name
 * @param childAlias alias used inside the subquery; must differ from the outer alias
 * @param foreignKey column of the child table referencing the parent id
 * @param fields     child columns matched with {@code LIKE}; at least one
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record RelatedSearch(String childTable, String childAlias, String foreignKey, List<String> fields) {

    public RelatedSearch {
        SqlIdentifiers.requireValid(childTable, IdentifierPolicy.forTableNames());
        SqlIdentifiers.requireValid(childAlias, IdentifierPolicy.defaults());
        SqlIdentifiers.requireValid(foreignKey, IdentifierPolicy.defaults());
        fields = List.copyOf(fields);
        if (fields.isEmpty()) {
            throw new IllegalArgumentException("RelatedSearch on '" + childTable + "' needs at least one field");
        }
        for (String field : fields) {
            SqlIdentifiers.requireValid(field, IdentifierPolicy.defaults());
        }
    }
}
