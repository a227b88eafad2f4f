package io.github.cyfko.sqlguard.core.render;

import io.github.cyfko.sqlguard.core.model.Filter;
import io.github.cyfko.sqlguard.core.model.FilterGroup;
import io.github.cyfko.sqlguard.core.model.FilterItem;
import io.github.cyfko.sqlguard.core.model.FilterOperator;
import io.github.cyfko.sqlguard.core.model.FilterValue;
import io.github.cyfko.sqlguard.core.utils.SqlIdentifiers;
import io.github.cyfko.sqlguard.core.whitelist.FieldWhitelist;

import java.util.Collections;
import java.util.logging.Logger;

/**
 * Single recursive walk turning a filter tree into SQL text and parameters on a {@link SqlSink}.
 * <p>
 * Before any text is written for an item, a side-effect-free pre-pass decides whether that
 * item renders at all. A filter renders when it is enabled and its field is allowed; a group
 * renders when at least one of its items does. Skipped items are therefore dropped together
 * with their connective, and an all-skipped group disappears instead of leaving {@code ()}.
 * </p>
 * <p>
 * Each leaf writes its text and then binds all of its parameters within the same call, so
 * placeholders and parameters can never drift apart.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
final class FilterCompiler {
    private static final Logger logger = Logger.getLogger(FilterCompiler.class.getName());

    private final FieldWhitelist whitelist;

    FilterCompiler(FieldWhitelist whitelist) {
        this.whitelist = whitelist;
    }

    /**
     * Emits the items of {@code group} joined by its connective, without outer parentheses.
     *
     * @return true if anything was written
     */
    boolean compile(FilterGroup group, SqlSink sink) {
        boolean first = true;
        for (FilterItem item : group.items()) {
            if (!isRenderable(item)) {
                reportSkipped(item);
                continue;
            }
            if (!first) {
                sink.text(group.logic().separator());
            }
            first = false;

            if (item instanceof FilterGroup nested) {
                sink.text("(");
                compile(nested, sink);
                sink.text(")");
            } else {
                compileFilter((Filter) item, sink);
            }
        }
        return !first;
    }

    boolean isRenderable(FilterItem item) {
        if (item instanceof Filter filter) {
            return filter.enabled() && isFieldAllowed(filter.field());
        }
        for (FilterItem child : ((FilterGroup) item).items()) {
            if (isRenderable(child)) {
                return true;
            }
        }
        return false;
    }

    private boolean isFieldAllowed(String field) {
        return whitelist != null ? whitelist.isAllowed(field) : SqlIdentifiers.isSafeQualifiedField(field);
    }

    private void reportSkipped(FilterItem item) {
        if (item instanceof FilterGroup nested) {
            nested.items().forEach(this::reportSkipped);
        } else if (item instanceof Filter filter && filter.enabled()) {
            logger.warning(() -> "Skipping filter on disallowed field '" + filter.field() + "'"
                    + (whitelist != null ? " (table '" + whitelist.table() + "')" : ""));
        }
    }

    private void compileFilter(Filter filter, SqlSink sink) {
        String field = filter.field();
        FilterValue value = filter.value();

        switch (filter.operator()) {
            case EQ, NEQ, LT, LTE, GT, GTE -> {
                sink.text(field + " " + filter.operator().getSymbol() + " ?");
                sink.param((FilterValue.Scalar) value);
            }
            case LIKE -> likePattern(sink, field + " LIKE ?", "%" + escaped(value) + "%");
            case NOT_LIKE -> likePattern(sink, field + " NOT LIKE ?", "%" + escaped(value) + "%");
            case STARTS_WITH -> likePattern(sink, field + " LIKE ?", escaped(value) + "%");
            case ENDS_WITH -> likePattern(sink, field + " LIKE ?", "%" + escaped(value));
            case IN, NOT_IN -> {
                FilterValue.Array array = (FilterValue.Array) value;
                boolean negated = filter.operator() == FilterOperator.NOT_IN;
                if (array.isEmpty()) {
                    // IN () matches nothing, NOT IN () matches everything
                    sink.text(negated ? "1=1" : "1=0");
                    return;
                }
                String placeholders = String.join(", ", Collections.nCopies(array.values().size(), "?"));
                sink.text(field + " " + filter.operator().getSymbol() + " (" + placeholders + ")");
                array.values().forEach(sink::param);
            }
            case BETWEEN, NOT_BETWEEN -> {
                FilterValue.Range range = (FilterValue.Range) value;
                sink.text(field + " " + filter.operator().getSymbol() + " ? AND ?");
                sink.param(range.from());
                sink.param(range.to());
            }
            case IS_NULL, IS_NOT_NULL -> sink.text(field + " " + filter.operator().getSymbol());
        }
    }

    private static String escaped(FilterValue value) {
        return SqlIdentifiers.escapeLike(((FilterValue.Text) value).value());
    }

    private static void likePattern(SqlSink sink, String sql, String pattern) {
        sink.text(sql);
        sink.param(new FilterValue.Text(pattern));
    }
}
