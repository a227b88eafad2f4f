package io.github.cyfko.sqlguard.core.pagination;

import io.github.cyfko.sqlguard.core.config.IdentifierPolicy;
import io.github.cyfko.sqlguard.core.model.FilterGroup;
import io.github.cyfko.sqlguard.core.model.FilterValue;
import io.github.cyfko.sqlguard.core.render.FilterBuilder;
import io.github.cyfko.sqlguard.core.render.SqlFragment;
import io.github.cyfko.sqlguard.core.render.SqlSink;
import io.github.cyfko.sqlguard.core.utils.SqlIdentifiers;
import io.github.cyfko.sqlguard.core.whitelist.FieldWhitelist;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * Builds listing queries that page either by offset or by keyset (cursor).
 * <p>
 * Keyset paging orders by a sort column with the id as tie-breaker, and continues from the
 * last row seen with the condition
 * {@code ((col op ?) OR (col = ? AND id op ?))}. It stays fast on deep pages where an
 * {@code OFFSET} would scan every skipped row. The query selects ids in a CTE and joins back
 * to the table, fetching one row more than the limit so the caller can tell whether a
 * following page exists.
 * </p>
 *
 * <h2>Parameter order</h2>
 * <ul>
 *   <li>{@link #buildCount()}: filter parameters only</li>
 *   <li>{@link #buildSimple(long)}: filter parameters, limit, offset</li>
 *   <li>{@link #buildKeyset()}: filter parameters, keyset parameters, limit + 1</li>
 * </ul>
 *
 * <pre>{@code
 * KeysetPaginationBuilder listing = KeysetPaginationBuilder.forTable("reagents")
 *     .withWhitelist(reagents)
 *     .sort("created_at", "desc")
 *     .limit(20)
 *     .addFilters(group);
 *
 * Cursor.decode(request.cursor()).ifPresent(c -> listing.after(c, Direction.fromString(request.direction())));
 * SqlFragment rows  = listing.buildKeyset();
 * SqlFragment total = listing.buildCount();
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class KeysetPaginationBuilder {
    private static final Logger logger = Logger.getLogger(KeysetPaginationBuilder.class.getName());

    private static final String ROW_ALIAS = "t";

    private final String table;
    private FieldWhitelist whitelist;
    private String selectColumns = "*";
    private String idColumn = "id";
    private String sortColumn = "id";
    private String sortOrder = "DESC";
    private int limit = Pagination.DEFAULT_PER_PAGE;
    private Direction direction = Direction.NEXT;

    private final List<String> conditions = new ArrayList<>();
    private final List<FilterValue.Scalar> filterParams = new ArrayList<>();
    private String keysetCondition;
    private final List<FilterValue.Scalar> keysetParams = new ArrayList<>();

    private KeysetPaginationBuilder(String table) {
        this.table = SqlIdentifiers.requireValid(table, IdentifierPolicy.forTableNames());
    }

    public static KeysetPaginationBuilder forTable(String table) {
        return new KeysetPaginationBuilder(table);
    }

    public KeysetPaginationBuilder withWhitelist(FieldWhitelist whitelist) {
        this.whitelist = whitelist;
        return this;
    }

    /**
     * @param columns trusted select list; {@code "*"} selects every column of the table
     */
    public KeysetPaginationBuilder select(String columns) {
        this.selectColumns = columns;
        return this;
    }

    public KeysetPaginationBuilder idColumn(String column) {
        this.idColumn = SqlIdentifiers.unqualified(SqlIdentifiers.requireValid(column, IdentifierPolicy.defaults()));
        return this;
    }

    /**
     * Sets the sort column and order. A column that fails the field check is ignored with a
     * warning and the previous sort column is kept. The query reads a single unaliased table,
     * so an accepted qualified column such as {@code b.quantity} is kept as {@code quantity}.
     */
    public KeysetPaginationBuilder sort(String column, String order) {
        boolean allowed = whitelist != null ? whitelist.isAllowed(column) : SqlIdentifiers.isSafeFieldName(column);
        if (allowed) {
            this.sortColumn = SqlIdentifiers.unqualified(column);
        } else {
            logger.warning(() -> "Ignoring sort on disallowed column '" + column + "', keeping '" + sortColumn + "'");
        }
        this.sortOrder = SqlIdentifiers.normalizeSortOrder(order);
        return this;
    }

    /**
     * @param limit page size, clamped to {@code 1..}{@value Pagination#MAX_PER_PAGE}
     */
    public KeysetPaginationBuilder limit(long limit) {
        this.limit = (int) Pagination.clampPerPage(limit);
        return this;
    }

    public KeysetPaginationBuilder addCondition(SqlFragment condition) {
        if (!condition.isEmpty()) {
            conditions.add(condition.sql());
            condition.params().forEach(p -> filterParams.add(FilterValue.text(p)));
        }
        return this;
    }

    public KeysetPaginationBuilder addFilters(FilterGroup group) {
        FilterBuilder builder = whitelist != null ? FilterBuilder.create().withWhitelist(whitelist) : FilterBuilder.create();
        StringBuilder sql = new StringBuilder();
        List<FilterValue.Scalar> values = new ArrayList<>();
        boolean written = builder.apply(group, new SqlSink() {
            @Override
            public void text(String text) {
                sql.append(text);
            }

            @Override
            public void param(FilterValue.Scalar value) {
                values.add(value);
            }
        });
        if (written) {
            conditions.add("(" + sql + ")");
            filterParams.addAll(values);
        }
        return this;
    }

    /**
     * Continues after {@code cursor} in the given direction.
     */
    public KeysetPaginationBuilder after(Cursor cursor, Direction direction) {
        this.direction = direction;
        boolean desc = sortOrder.equals("DESC");
        String op = (direction == Direction.PREV) == desc ? ">" : "<";

        keysetCondition = "((" + sortColumn + " " + op + " ?) OR (" + sortColumn + " = ? AND " + idColumn + " " + op + " ?))";
        keysetParams.clear();
        FilterValue.Scalar value = typed(cursor.sortValue());
        keysetParams.add(value);
        keysetParams.add(value);
        keysetParams.add(typed(cursor.id()));
        return this;
    }

    public SqlFragment buildCount() {
        return new SqlFragment("SELECT COUNT(*) FROM " + table + where(conditions), text(filterParams));
    }

    /**
     * Offset variant: {@code ... ORDER BY col dir, id dir LIMIT ? OFFSET ?}. Any cursor is ignored.
     */
    public SqlFragment buildSimple(long offset) {
        String sql = "SELECT " + selectColumns + " FROM " + table + where(conditions)
                + " ORDER BY " + orderBy("", sortOrder) + " LIMIT ? OFFSET ?";
        List<FilterValue.Scalar> params = new ArrayList<>(filterParams);
        params.add(new FilterValue.Int(limit));
        params.add(new FilterValue.Int(offset));
        return new SqlFragment(sql, text(params));
    }

    /**
     * Keyset variant using a CTE over ids. Moving backwards reverses the scan order; the
     * caller reverses the fetched rows back to the listing order.
     */
    public SqlFragment buildKeyset() {
        String order = effectiveOrder();
        List<String> parts = new ArrayList<>(conditions);
        if (keysetCondition != null) {
            parts.add(keysetCondition);
        }
        String columns = selectColumns.equals("*") ? ROW_ALIAS + ".*" : selectColumns;

        String keyColumns = sortsById() ? idColumn : idColumn + ", " + sortColumn;

        String sql = "WITH ids AS (SELECT " + keyColumns + " FROM " + table + where(parts)
                + " ORDER BY " + orderBy("", order)
                + " LIMIT ?) SELECT " + columns + " FROM " + table + " " + ROW_ALIAS
                + " INNER JOIN ids ON " + ROW_ALIAS + "." + idColumn + " = ids." + idColumn
                + " ORDER BY " + orderBy("ids.", order);

        List<FilterValue.Scalar> params = typedKeysetParams();
        SqlFragment fragment = new SqlFragment(sql, text(params));
        logger.fine(() -> "Built keyset query with " + fragment.params().size() + " parameter(s)");
        return fragment;
    }

    /**
     * @return parameters of {@link #buildKeyset()} as typed values
     */
    public List<FilterValue.Scalar> typedKeysetParams() {
        List<FilterValue.Scalar> params = new ArrayList<>(filterParams);
        if (keysetCondition != null) {
            params.addAll(keysetParams);
        }
        params.add(new FilterValue.Int(fetchSize()));
        return params;
    }

    /**
     * @return rows to fetch for a keyset page: the limit plus one look-ahead row
     */
    public int fetchSize() {
        return limit + 1;
    }

    /**
     * @param fetchedRows number of rows {@link #buildKeyset()} returned
     * @return true if another page exists in the current direction
     */
    public boolean hasMore(int fetchedRows) {
        return fetchedRows > limit;
    }

    public int limit() {
        return limit;
    }

    public String sortColumn() {
        return sortColumn;
    }

    public String sortOrder() {
        return sortOrder;
    }

    private boolean sortsById() {
        return sortColumn.equals(idColumn);
    }

    // the id tie-breaker is dropped when it is already the sort column
    private String orderBy(String prefix, String order) {
        if (sortsById()) {
            return prefix + idColumn + " " + order;
        }
        return prefix + sortColumn + " " + order + ", " + prefix + idColumn + " " + order;
    }

    private String effectiveOrder() {
        if (direction == Direction.PREV && keysetCondition != null) {
            return sortOrder.equals("DESC") ? "ASC" : "DESC";
        }
        return sortOrder;
    }

    private static String where(List<String> parts) {
        return parts.isEmpty() ? "" : " WHERE " + String.join(" AND ", parts);
    }

    private static List<String> text(List<FilterValue.Scalar> values) {
        List<String> out = new ArrayList<>(values.size());
        values.forEach(v -> out.add(v.asText()));
        return out;
    }

    private static FilterValue.Scalar typed(String raw) {
        try {
            return new FilterValue.Int(Long.parseLong(raw));
        } catch (NumberFormatException notLong) {
            try {
                double d = Double.parseDouble(raw);
                return Double.isFinite(d) ? new FilterValue.Decimal(d) : FilterValue.text(raw);
            } catch (NumberFormatException notDouble) {
                return FilterValue.text(raw);
            }
        }
    }
}
