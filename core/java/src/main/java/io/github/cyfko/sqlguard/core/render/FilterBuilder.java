package io.github.cyfko.sqlguard.core.render;

import io.github.cyfko.sqlguard.core.exception.FilterValidationException;
import io.github.cyfko.sqlguard.core.model.FilterGroup;
import io.github.cyfko.sqlguard.core.whitelist.FieldWhitelist;

import java.util.Objects;
import java.util.logging.Logger;

/**
 * Compiles a {@link FilterGroup} into a parameterized condition.
 * <p>
 * The same compilation feeds two targets:
 * </p>
 * <ul>
 *   <li>{@link #build(FilterGroup)} returns a {@link SqlFragment} whose parameters are text</li>
 *   <li>{@link #apply(FilterGroup, SqlSink)} writes into any sink, typically a live statement
 *       builder binding typed values</li>
 * </ul>
 * <p>
 * Both produce identical text and the same parameter sequence for the same tree.
 * </p>
 *
 * <h2>Field policy</h2>
 * <p>
 * With a whitelist, a filter whose field the whitelist rejects is skipped and logged at
 * {@code WARNING}. Without one, fields are still shape-checked with
 * {@link io.github.cyfko.sqlguard.core.utils.SqlIdentifiers#isSafeQualifiedField(String)}.
 * Disabled filters are skipped silently.
 * </p>
 *
 * <pre>{@code
 * FilterBuilder builder = FilterBuilder.create().withWhitelist(batches);
 * SqlFragment where = builder.build(FilterGroup.and(
 *     Filter.eq("status", "active"),
 *     FilterGroup.or(Filter.gte("quantity", 10), Filter.isNull("expiry_date"))));
 *
 * where.sql();    // status = ? AND (quantity >= ? OR expiry_date IS NULL)
 * where.params(); // [active, 10]
 * }</pre>
 *
 * <p>Instances are immutable and thread-safe.</p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class FilterBuilder {
    private static final Logger logger = Logger.getLogger(FilterBuilder.class.getName());

    private final FieldWhitelist whitelist;
    private final FilterCompiler compiler;

    private FilterBuilder(FieldWhitelist whitelist) {
        this.whitelist = whitelist;
        this.compiler = new FilterCompiler(whitelist);
    }

    /**
     * @return a builder with no whitelist; fields are only shape-checked
     */
    public static FilterBuilder create() {
        return new FilterBuilder(null);
    }

    /**
     * @param whitelist the whitelist every field must pass
     * @return a new builder using it
     */
    public FilterBuilder withWhitelist(FieldWhitelist whitelist) {
        return new FilterBuilder(Objects.requireNonNull(whitelist, "whitelist cannot be null"));
    }

    public FieldWhitelist whitelist() {
        return whitelist;
    }

    /**
     * Compiles {@code group} to a fragment, without outer parentheses.
     *
     * @param group the tree to compile
     * @return the condition, or {@link SqlFragment#empty()} when nothing is renderable
     * @throws FilterValidationException if the tree is nested deeper than {@link FilterGroup#MAX_DEPTH}
     */
    public SqlFragment build(FilterGroup group) {
        StringSqlSink sink = new StringSqlSink();
        apply(group, sink);
        SqlFragment fragment = sink.toFragment();
        logger.fine(() -> "Compiled filter tree to '" + fragment.sql() + "' with " + fragment.params().size() + " parameter(s)");
        return fragment;
    }

    /**
     * Compiles {@code group} directly into {@code sink}.
     *
     * @param group the tree to compile
     * @param sink  the target
     * @return true if any text was written
     * @throws FilterValidationException if the tree is nested deeper than {@link FilterGroup#MAX_DEPTH}
     */
    public boolean apply(FilterGroup group, SqlSink sink) {
        Objects.requireNonNull(group, "group cannot be null");
        Objects.requireNonNull(sink, "sink cannot be null");
        requireSupportedDepth(group);
        return compiler.compile(group, sink);
    }

    /**
     * Fails fast on a tree {@link #apply(FilterGroup, SqlSink)} would refuse, so callers can check
     * before writing anything of their own into the sink.
     *
     * @param group the tree to check
     * @throws FilterValidationException if the tree is nested deeper than {@link FilterGroup#MAX_DEPTH}
     */
    public void requireSupportedDepth(FilterGroup group) {
        int depth = group.depth();
        if (depth > FilterGroup.MAX_DEPTH) {
            throw new FilterValidationException(
                    "Filter tree is nested " + depth + " levels deep, maximum is " + FilterGroup.MAX_DEPTH);
        }
    }

    /**
     * Tells whether {@code group} would produce any text.
     *
     * @param group the tree to inspect
     * @return true if at least one filter would render
     */
    public boolean hasRenderableFilters(FilterGroup group) {
        return compiler.isRenderable(group);
    }
}
