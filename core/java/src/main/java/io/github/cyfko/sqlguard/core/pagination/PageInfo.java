package io.github.cyfko.sqlguard.core.pagination;

/**
 * Navigation metadata returned alongside a page of rows, for either pagination mode.
 * <p>
 * Offset pages carry {@code page} and {@code totalPages}; keyset pages carry cursors instead
 * and leave those two {@code null}.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record PageInfo(long total,
                       Long page,
                       int perPage,
                       Long totalPages,
                       boolean hasNext,
                       boolean hasPrev,
                       String nextCursor,
                       String prevCursor) {

    public static PageInfo fromPage(long total, Pagination pagination) {
        long perPage = pagination.perPage();
        long totalPages = (total + perPage - 1) / perPage;
        return new PageInfo(total, pagination.page(), pagination.perPage(), totalPages,
                pagination.page() < totalPages, pagination.page() > 1, null, null);
    }

    public static PageInfo fromCursor(long total, int perPage, boolean hasNext, boolean hasPrev,
                                      String nextCursor, String prevCursor) {
        return new PageInfo(total, null, perPage, null, hasNext, hasPrev, nextCursor, prevCursor);
    }
}
