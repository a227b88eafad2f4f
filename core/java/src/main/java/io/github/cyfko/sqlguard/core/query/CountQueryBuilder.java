package io.github.cyfko.sqlguard.core.query;

import io.github.cyfko.sqlguard.core.render.SqlFragment;

/**
 * Builder for a standalone {@code SELECT COUNT(*)}.
 * <p>
 * It accepts the same conditions as {@link SafeQueryBuilder} but has no ordering or
 * pagination, so a count can never accidentally be limited.
 * </p>
 *
 * <pre>{@code
 * SqlFragment count = CountQueryBuilder.forTable("batches")
 *     .withWhitelist(batches)
 *     .addExactMatch("status", "expired")
 *     .build();
 * // SELECT COUNT(*) FROM batches WHERE status = ?   [expired]
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class CountQueryBuilder extends AbstractConditionBuilder<CountQueryBuilder> {

    private CountQueryBuilder(String table, String alias) {
        super(table, alias);
    }

    public static CountQueryBuilder forTable(String table) {
        return new CountQueryBuilder(table, null);
    }

    public static CountQueryBuilder forTable(String table, String alias) {
        return new CountQueryBuilder(table, alias);
    }

    @Override
    protected CountQueryBuilder self() {
        return this;
    }

    public String sql() {
        return "SELECT COUNT(*) FROM " + fromClause() + whereClause();
    }

    public SqlFragment build() {
        return new SqlFragment(sql(), params());
    }
}
