package io.github.cyfko.sqlguard.spring.pagination;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Slice;

import java.util.List;
import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Immutable record holding one page of data and its {@link PaginationInfo}.
 *
 * <h3>Example</h3>
 * <pre>{@code
 * Page<Batch> page = executor.findPage(query, "b.*", Pagination.of(p, perPage), batchMapper);
 * PaginatedData<BatchDto> response = PaginatedData.of(page, BatchDto::from);
 * }</pre>
 *
 * @param <T> the type of data contained in the page
 */
public record PaginatedData<T>(
        List<T> data,
        PaginationInfo pagination
) {
    public PaginatedData(List<T> data, PaginationInfo pagination) {
        this.data = List.copyOf(data);
        this.pagination = pagination;
    }

    public PaginatedData(Stream<T> dataStream, PaginationInfo pagination) {
        this(dataStream.collect(Collectors.toList()), pagination);
    }

    /**
     * Extracts content and pagination metadata from a Spring Data {@link Page}.
     */
    public PaginatedData(Page<T> page) {
        this(page.getContent(), PaginationInfo.from(page));
    }

    /**
     * Transforms the data, keeping the pagination metadata.
     *
     * @param <R>    the target element type
     * @param mapper conversion of each element
     * @return a new instance with mapped content
     */
    public <R> PaginatedData<R> map(Function<T, R> mapper) {
        return new PaginatedData<>(data.stream().map(mapper), pagination);
    }

    public static <U, R> PaginatedData<R> of(Page<U> page, Function<U, R> mapper) {
        return new PaginatedData<>(page.getContent().stream().map(mapper), PaginationInfo.from(page));
    }

    /**
     * Wraps a keyset slice with its cursors.
     */
    public static <U, R> PaginatedData<R> of(Slice<U> slice, String nextCursor, String prevCursor, Function<U, R> mapper) {
        return new PaginatedData<>(slice.getContent().stream().map(mapper), PaginationInfo.from(slice, nextCursor, prevCursor));
    }
}
