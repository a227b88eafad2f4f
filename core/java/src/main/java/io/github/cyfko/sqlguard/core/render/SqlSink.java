package io.github.cyfko.sqlguard.core.render;

import io.github.cyfko.sqlguard.core.model.FilterValue;

/**
 * Target a filter tree is rendered into.
 * <p>
 * Text and parameters arrive in order: every {@code ?} passed through {@link #text(String)}
 * is followed by exactly one {@link #param(FilterValue.Scalar)} call for it before any later
 * placeholder is bound. Implementations either accumulate a {@link SqlFragment}
 * ({@link StringSqlSink}) or feed a live statement with typed binds.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 * @see FilterBuilder#apply(io.github.cyfko.sqlguard.core.model.FilterGroup, SqlSink)
 */
public interface SqlSink {

    /**
     * Appends trusted SQL text, possibly containing {@code ?} placeholders.
     *
     * @param sql the text to append
     */
    void text(String sql);

    /**
     * Binds the value of the next pending placeholder.
     *
     * @param value the value
     */
    void param(FilterValue.Scalar value);
}
