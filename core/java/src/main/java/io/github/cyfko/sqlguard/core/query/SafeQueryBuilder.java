package io.github.cyfko.sqlguard.core.query;

import io.github.cyfko.sqlguard.core.pagination.Pagination;
import io.github.cyfko.sqlguard.core.render.SqlFragment;
import io.github.cyfko.sqlguard.core.utils.SqlIdentifiers;

import java.util.logging.Logger;

/**
 * Fluent builder for a parameterized {@code SELECT} and its matching {@code COUNT}.
 * <p>
 * The table (and optional alias) is validated when the builder is created and throws
 * {@link io.github.cyfko.sqlguard.core.exception.InvalidIdentifierException} if malformed.
 * Conditions come from the helpers of {@link AbstractConditionBuilder}; ordering and
 * pagination are added here.
 * </p>
 *
 * <h2>Rendered shape</h2>
 * <pre>
 * SELECT fields FROM table [alias] [WHERE c1 AND c2 ...] [ORDER BY field DIR] [LIMIT n] [OFFSET n]
 * SELECT COUNT(*) FROM table [alias] [WHERE c1 AND c2 ...]
 * </pre>
 * <p>
 * Both statements may be rendered from the same builder; they share the exact same
 * {@code WHERE} clause and parameters, which keeps a page and its total consistent.
 * </p>
 *
 * <pre>{@code
 * SafeQueryBuilder query = SafeQueryBuilder.forTable("batches", "b")
 *     .withWhitelist(batches)
 *     .addExactMatch("b.status", "available")
 *     .addInClause("b.unit", List.of("g", "mg"))
 *     .orderBy("b.expiry_date", "asc")
 *     .paginate(2, 20);
 *
 * SqlFragment page  = query.buildSelect("b.*");
 * SqlFragment total = query.buildCount();
 * }</pre>
 *
 * <p>Builders are mutable and meant to be used by a single thread for a single request.</p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class SafeQueryBuilder extends AbstractConditionBuilder<SafeQueryBuilder> {
    private static final Logger logger = Logger.getLogger(SafeQueryBuilder.class.getName());

    private String orderField;
    private String orderDirection;
    private Integer limit;
    private Long offset;

    private SafeQueryBuilder(String table, String alias) {
        super(table, alias);
    }

    public static SafeQueryBuilder forTable(String table) {
        return new SafeQueryBuilder(table, null);
    }

    public static SafeQueryBuilder forTable(String table, String alias) {
        return new SafeQueryBuilder(table, alias);
    }

    @Override
    protected SafeQueryBuilder self() {
        return this;
    }

    /**
     * Sets the sort. A field that fails the field check leaves any previous sort in place.
     *
     * @param field     column to sort on
     * @param direction {@code asc} selects ascending, anything else descending
     */
    public SafeQueryBuilder orderBy(String field, String direction) {
        if (checkField(field)) {
            this.orderField = field;
            this.orderDirection = SqlIdentifiers.normalizeSortOrder(direction);
        }
        return this;
    }

    public SafeQueryBuilder limit(int limit) {
        if (limit < 0) {
            throw new IllegalArgumentException("limit must not be negative, got " + limit);
        }
        this.limit = limit;
        return this;
    }

    public SafeQueryBuilder offset(long offset) {
        if (offset < 0) {
            throw new IllegalArgumentException("offset must not be negative, got " + offset);
        }
        this.offset = offset;
        return this;
    }

    /**
     * Sets limit and offset from a page number and page size, clamped as by {@link Pagination#of(long, long)}.
     */
    public SafeQueryBuilder paginate(long page, long perPage) {
        return paginate(Pagination.of(page, perPage));
    }

    public SafeQueryBuilder paginate(Pagination pagination) {
        this.limit = pagination.limit();
        this.offset = pagination.offset();
        return this;
    }

    /**
     * Renders the {@code SELECT}.
     *
     * @param fields trusted select list, e.g. {@code "*"} or {@code "b.*, r.name AS reagent_name"}
     * @return the statement and its parameters
     */
    public SqlFragment buildSelect(String fields) {
        StringBuilder sql = new StringBuilder("SELECT ").append(fields).append(" FROM ").append(fromClause());
        sql.append(whereClause());
        if (orderField != null) {
            sql.append(" ORDER BY ").append(orderField).append(' ').append(orderDirection);
        }
        if (limit != null) {
            sql.append(" LIMIT ").append(limit);
        }
        if (offset != null) {
            sql.append(" OFFSET ").append(offset);
        }
        SqlFragment fragment = new SqlFragment(sql.toString(), params());
        logger.fine(() -> "Built select: " + fragment.sql());
        return fragment;
    }

    public SqlFragment buildSelect() {
        return buildSelect("*");
    }

    /**
     * Renders {@code SELECT COUNT(*)} with the same conditions, ignoring order, limit and offset.
     */
    public SqlFragment buildCount() {
        return new SqlFragment("SELECT COUNT(*) FROM " + fromClause() + whereClause(), params());
    }

    public Integer limit() {
        return limit;
    }

    public Long offset() {
        return offset;
    }
}
