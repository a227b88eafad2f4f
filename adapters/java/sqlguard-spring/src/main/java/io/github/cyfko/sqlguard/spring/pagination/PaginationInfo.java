package io.github.cyfko.sqlguard.spring.pagination;

import io.github.cyfko.sqlguard.core.pagination.PageInfo;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Slice;

/**
 * Pagination metadata for REST responses.
 * <p>
 * Page numbers are 1-based, like the {@code page} request parameter they answer. Offset pages
 * carry totals; keyset slices carry cursors instead, and leave {@code page}, {@code total} and
 * {@code totalPages} {@code null}.
 * </p>
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * Page<BatchDto> page = executor.findPage(query, "b.*", pagination, mapper);
 * PaginationInfo info = PaginationInfo.from(page);
 * }</pre>
 *
 * @param page       current 1-based page, {@code null} for keyset slices
 * @param perPage    page size
 * @param total      total number of matching rows, {@code null} when not counted
 * @param totalPages total number of pages, {@code null} when not counted
 * @param hasNext    if there is a next page
 * @param hasPrev    if there is a previous page
 * @param nextCursor opaque token for the next keyset slice, or {@code null}
 * @param prevCursor opaque token for the previous keyset slice, or {@code null}
 */
public record PaginationInfo(
        Long page,
        int perPage,
        Long total,
        Long totalPages,
        boolean hasNext,
        boolean hasPrev,
        String nextCursor,
        String prevCursor
) {

    /**
     * Creates a {@link PaginationInfo} from a Spring Data {@link Page}, converting its 0-based number.
     *
     * @param page a Spring Data page
     * @return a populated instance
     */
    public static PaginationInfo from(Page<?> page) {
        return new PaginationInfo(
                (long) page.getNumber() + 1,
                page.getSize(),
                page.getTotalElements(),
                (long) page.getTotalPages(),
                page.hasNext(),
                page.hasPrevious(),
                null,
                null);
    }

    /**
     * Creates a {@link PaginationInfo} for a keyset slice.
     *
     * @param slice      the fetched slice
     * @param nextCursor token of the next slice, or {@code null}
     * @param prevCursor token of the previous slice, or {@code null} on the first one
     * @return a populated instance
     */
    public static PaginationInfo from(Slice<?> slice, String nextCursor, String prevCursor) {
        return new PaginationInfo(null, slice.getSize(), null, null,
                slice.hasNext(), prevCursor != null, nextCursor, prevCursor);
    }

    public static PaginationInfo from(PageInfo info) {
        return new PaginationInfo(info.page(), info.perPage(), info.total(), info.totalPages(),
                info.hasNext(), info.hasPrev(), info.nextCursor(), info.prevCursor());
    }
}
