package io.github.cyfko.sqlguard.core.fts;

import io.github.cyfko.sqlguard.core.config.IdentifierPolicy;
import io.github.cyfko.sqlguard.core.render.SqlFragment;
import io.github.cyfko.sqlguard.core.spi.FtsAvailability;
import io.github.cyfko.sqlguard.core.utils.SqlIdentifiers;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Generates the search condition for one entity, using the full-text index when it is
 * available and an OR of {@code LIKE} clauses otherwise.
 *
 * <h2>Rendered forms</h2>
 * With config {@code reagents_fts} / {@code id} / fallback {@code name, formula} and alias {@code r}:
 * <pre>
 * index:    r.id IN (SELECT reagents_fts.id FROM reagents_fts WHERE reagents_fts MATCH ?)
 * fallback: (r.name LIKE ? OR r.formula LIKE ?)
 * </pre>
 * With a {@link RelatedSearch}, either form is OR-combined with a correlated {@code EXISTS}
 * over the child table and the whole condition is parenthesized.
 *
 * <p>
 * The index form binds the output of {@link FtsQuerySanitizer#buildFtsQuery(String)}; each
 * {@code LIKE} binds {@code %term%} with the wildcards of the trimmed term escaped.
 * A blank term, or one that sanitizes to nothing, yields no condition.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class FtsSearchCondition {
    private static final Logger logger = Logger.getLogger(FtsSearchCondition.class.getName());

    private final FtsConfig config;
    private final RelatedSearch related;

    private FtsSearchCondition(FtsConfig config, RelatedSearch related) {
        this.config = Objects.requireNonNull(config, "config cannot be null");
        this.related = related;
    }

    public static FtsSearchCondition of(FtsConfig config) {
        return new FtsSearchCondition(config, null);
    }

    public FtsSearchCondition withRelated(RelatedSearch related) {
        return new FtsSearchCondition(config, Objects.requireNonNull(related, "related cannot be null"));
    }

    public FtsConfig config() {
        return config;
    }

    /**
     * Builds the condition, asking {@code availability} whether the index can be used.
     */
    public Optional<SqlFragment> build(String term, FtsAvailability availability, String alias) {
        boolean available = availability.isAvailable(config.indexTable());
        if (!available) {
            logger.fine(() -> "Index table '" + config.indexTable() + "' unavailable, using LIKE fallback");
        }
        return build(term, available, alias);
    }

    /**
     * @param term         raw search text
     * @param ftsAvailable whether to use the index
     * @param alias        alias of the base table in the outer query
     * @return the condition, or empty when there is nothing to search for
     */
    public Optional<SqlFragment> build(String term, boolean ftsAvailable, String alias) {
        SqlIdentifiers.requireValid(alias, IdentifierPolicy.defaults());
        if (related != null && related.childAlias().equalsIgnoreCase(alias)) {
            throw new IllegalArgumentException("Child alias '" + related.childAlias()
                    + "' collides with the outer alias '" + alias + "'");
        }
        String trimmed = term == null ? "" : term.trim();
        if (trimmed.isEmpty()) {
            return Optional.empty();
        }
        String pattern = "%" + SqlIdentifiers.escapeLike(trimmed) + "%";

        List<String> parts = new ArrayList<>();
        List<String> params = new ArrayList<>();

        if (ftsAvailable) {
            String query = FtsQuerySanitizer.buildFtsQuery(trimmed);
            if (query.isEmpty()) {
                return Optional.empty();
            }
            String index = config.indexTable();
            parts.add(alias + "." + config.idField() + " IN (SELECT " + index + "." + config.idField()
                    + " FROM " + index + " WHERE " + index + " MATCH ?)");
            params.add(query);
        } else {
            for (String field : config.fallbackFields()) {
                parts.add(alias + "." + field + " LIKE ?");
                params.add(pattern);
            }
        }

        if (related != null) {
            parts.add(existsClause(alias));
            related.fields().forEach(f -> params.add(pattern));
        }

        if (parts.isEmpty()) {
            return Optional.empty();
        }
        boolean single = parts.size() == 1 && ftsAvailable;
        String sql = single ? parts.get(0) : "(" + String.join(" OR ", parts) + ")";
        return Optional.of(new SqlFragment(sql, params));
    }

    private String existsClause(String alias) {
        String ca = related.childAlias();
        List<String> likes = new ArrayList<>();
        for (String field : related.fields()) {
            likes.add(ca + "." + field + " LIKE ?");
        }
        return "EXISTS (SELECT 1 FROM " + related.childTable() + " " + ca
                + " WHERE " + ca + "." + related.foreignKey() + " = " + alias + "." + config.idField()
                + " AND (" + String.join(" OR ", likes) + "))";
    }
}
