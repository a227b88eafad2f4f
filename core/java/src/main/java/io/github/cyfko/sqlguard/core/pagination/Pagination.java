package io.github.cyfko.sqlguard.core.pagination;

/**
 * Offset pagination parameters, already clamped to safe bounds.
 * <p>
 * Page numbers are 1-based. {@link #of(long, long)} never fails: a page below 1 becomes 1 and
 * a page size outside {@code 1..}{@value #MAX_PER_PAGE} is clamped into that range, so
 * arbitrary request input can be passed straight through.
 * </p>
 *
 * <pre>{@code
 * Pagination.of(0, 500);   // page=1, perPage=100, offset=0
 * Pagination.of(3, 20);    // page=3, perPage=20,  offset=40
 * }</pre>
 *
 * @param page    1-based page number
 * @param perPage page size, between 1 and {@value #MAX_PER_PAGE}
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record Pagination(long page, int perPage) {

    public static final int DEFAULT_PER_PAGE = 50;
    public static final int MAX_PER_PAGE = 100;

    public Pagination {
        if (page < 1) {
            throw new IllegalArgumentException("Page number must be at least 1. Provided: " + page);
        }
        if (perPage < 1 || perPage > MAX_PER_PAGE) {
            throw new IllegalArgumentException(
                    "Page size must be between 1 and " + MAX_PER_PAGE + ". Provided: " + perPage);
        }
    }

    /**
     * Builds a pagination from raw input, clamping instead of failing.
     *
     * @param page    requested page, values below 1 mean the first page
     * @param perPage requested size, clamped to {@code 1..}{@value #MAX_PER_PAGE}
     * @return the clamped pagination
     */
    public static Pagination of(long page, long perPage) {
        return new Pagination(Math.max(page, 1), (int) clampPerPage(perPage));
    }

    /**
     * Same as {@link #of(long, long)} with {@code null} meaning page 1 and {@link #DEFAULT_PER_PAGE}.
     */
    public static Pagination of(Long page, Long perPage) {
        return of(page == null ? 1 : page, perPage == null ? DEFAULT_PER_PAGE : perPage);
    }

    public static Pagination firstPage() {
        return new Pagination(1, DEFAULT_PER_PAGE);
    }

    public static long clampPerPage(long perPage) {
        return Math.min(Math.max(perPage, 1), MAX_PER_PAGE);
    }

    public int limit() {
        return perPage;
    }

    /**
     * @return rows to skip, saturating at {@link Long#MAX_VALUE} for pages too far out to address
     */
    public long offset() {
        long skipped = page - 1;
        return skipped > Long.MAX_VALUE / perPage ? Long.MAX_VALUE : skipped * perPage;
    }
}
