package io.github.cyfko.sqlguard.jdbc;

import io.github.cyfko.sqlguard.core.pagination.Cursor;
import io.github.cyfko.sqlguard.core.pagination.KeysetPaginationBuilder;
import io.github.cyfko.sqlguard.core.pagination.Pagination;
import io.github.cyfko.sqlguard.core.query.SafeQueryBuilder;
import io.github.cyfko.sqlguard.core.render.SqlFragment;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageImpl;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Slice;
import org.springframework.data.domain.SliceImpl;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

import java.util.List;
import java.util.Objects;
import java.util.function.Function;
import java.util.logging.Logger;

/**
 * Runs the statements rendered by the query builders against a {@link JdbcTemplate}.
 * <p>
 * Offset pagination executes the page query and its count from one {@link SafeQueryBuilder},
 * so both share the same conditions and parameters. Keyset pagination fetches one extra row
 * to tell whether more rows follow, without any count.
 * </p>
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * SafeQueryBuilder query = SafeQueryBuilder.forTable("batches", "b")
 *     .withWhitelist(batches)
 *     .addFilters(group)
 *     .orderBy("b.expiry_date", "asc");
 *
 * Page<Batch> page = executor.findPage(query, "b.*", Pagination.of(page, perPage), batchMapper);
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class PagedQueryExecutor {
    private static final Logger logger = Logger.getLogger(PagedQueryExecutor.class.getName());

    private final JdbcTemplate jdbcTemplate;

    public PagedQueryExecutor(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = Objects.requireNonNull(jdbcTemplate, "jdbcTemplate cannot be null");
    }

    /**
     * Executes one page and the total count.
     *
     * @param query      builder carrying the conditions and ordering; its pagination is overwritten
     * @param fields     trusted select list
     * @param pagination page to fetch
     * @param mapper     row mapper
     * @param <T>        row type
     * @return the page, with a 0-based page number as Spring Data expects
     */
    public <T> Page<T> findPage(SafeQueryBuilder query, String fields, Pagination pagination, RowMapper<T> mapper) {
        long start = System.nanoTime();
        query.paginate(pagination);
        SqlFragment select = query.buildSelect(fields);
        SqlFragment count = query.buildCount();
        Object[] args = JdbcStatementBuilder.toJdbcValues(query.typedParams());

        List<T> rows = jdbcTemplate.query(select.sql(), mapper, args);
        Long total = jdbcTemplate.queryForObject(count.sql(), Long.class, args);

        long elapsedMs = (System.nanoTime() - start) / 1_000_000;
        logger.fine(() -> "Fetched " + rows.size() + " row(s) of " + total + " in " + elapsedMs + " ms");

        PageRequest pageable = PageRequest.of((int) Math.min(pagination.page() - 1, Integer.MAX_VALUE), pagination.perPage());
        return new PageImpl<>(rows, pageable, total == null ? 0 : total);
    }

    /**
     * Counts the rows matching the conditions of {@code query}.
     */
    public long count(SafeQueryBuilder query) {
        SqlFragment count = query.buildCount();
        Long total = jdbcTemplate.queryForObject(count.sql(), Long.class,
                JdbcStatementBuilder.toJdbcValues(query.typedParams()));
        return total == null ? 0 : total;
    }

    /**
     * Executes a keyset page.
     * <p>
     * Rows are returned in the builder's sort order. For a {@code PREV} page the query runs in
     * reverse order; callers wanting display order reverse the content.
     * </p>
     *
     * @param builder configured builder, with its cursor set if any
     * @param mapper  row mapper
     * @param <T>     row type
     * @return at most {@code builder.limit()} rows, with {@code hasNext()} telling whether more follow
     */
    public <T> Slice<T> findSlice(KeysetPaginationBuilder builder, RowMapper<T> mapper) {
        long start = System.nanoTime();
        SqlFragment keyset = builder.buildKeyset();
        List<T> rows = jdbcTemplate.query(keyset.sql(), mapper,
                JdbcStatementBuilder.toJdbcValues(builder.typedKeysetParams()));

        boolean hasMore = builder.hasMore(rows.size());
        List<T> content = hasMore ? rows.subList(0, builder.limit()) : rows;

        long elapsedMs = (System.nanoTime() - start) / 1_000_000;
        logger.fine(() -> "Fetched keyset slice of " + content.size() + " row(s) in " + elapsedMs + " ms");
        return new SliceImpl<>(content, PageRequest.ofSize(builder.limit()), hasMore);
    }

    /**
     * Convenience for building the next cursor from the last row of a slice.
     *
     * @param slice     the fetched slice
     * @param sortValue extracts the sort column value of a row as text
     * @param id        extracts the id of a row as text
     * @param <T>       row type
     * @return the encoded cursor, or {@code null} when the slice has no next page
     */
    public static <T> String nextCursor(Slice<T> slice,
                                        Function<T, String> sortValue,
                                        Function<T, String> id) {
        if (!slice.hasNext() || slice.getContent().isEmpty()) {
            return null;
        }
        T last = slice.getContent().get(slice.getContent().size() - 1);
        return new Cursor(sortValue.apply(last), id.apply(last)).encode();
    }
}
