package io.github.cyfko.sqlguard.core.model;

/**
 * Node of a filter tree: either a single {@link Filter} or a nested {@link FilterGroup}.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public sealed interface FilterItem permits Filter, FilterGroup {
}
