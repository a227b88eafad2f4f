package io.github.cyfko.sqlguard.core.query;

import io.github.cyfko.sqlguard.core.config.IdentifierPolicy;
import io.github.cyfko.sqlguard.core.model.FilterGroup;
import io.github.cyfko.sqlguard.core.model.FilterValue;
import io.github.cyfko.sqlguard.core.render.FilterBuilder;
import io.github.cyfko.sqlguard.core.render.SqlFragment;
import io.github.cyfko.sqlguard.core.render.SqlSink;
import io.github.cyfko.sqlguard.core.utils.SqlIdentifiers;
import io.github.cyfko.sqlguard.core.whitelist.FieldWhitelist;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Condition accumulation shared by {@link SafeQueryBuilder} and {@link CountQueryBuilder}.
 * <p>
 * Every helper that takes a field name checks it first: against the whitelist when one is set,
 * otherwise against {@link SqlIdentifiers#isSafeQualifiedField(String)}. A rejected field makes
 * the call a logged no-op, leaving text and parameters untouched. Values are never written into
 * SQL text; they are kept as typed scalars and exposed both as text ({@link #params()}) and as
 * typed values ({@link #typedParams()}).
 * </p>
 * <p>
 * Conditions are joined with {@code AND} in insertion order.
 * </p>
 *
 * @param <B> concrete builder type, returned by every fluent method
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public abstract class AbstractConditionBuilder<B extends AbstractConditionBuilder<B>> {
    private static final Logger logger = Logger.getLogger(AbstractConditionBuilder.class.getName());

    protected final String table;
    protected final String alias;
    private FieldWhitelist whitelist;
    private final List<String> conditions = new ArrayList<>();
    private final List<FilterValue.Scalar> params = new ArrayList<>();

    protected AbstractConditionBuilder(String table, String alias) {
        this.table = SqlIdentifiers.requireValid(table, IdentifierPolicy.forTableNames());
        this.alias = alias == null ? null : SqlIdentifiers.requireValid(alias, IdentifierPolicy.defaults());
    }

    protected abstract B self();

    /**
     * Restricts every field-taking helper to {@code whitelist}.
     */
    public B withWhitelist(FieldWhitelist whitelist) {
        this.whitelist = Objects.requireNonNull(whitelist, "whitelist cannot be null");
        return self();
    }

    /**
     * {@code field = ?}
     */
    public B addExactMatch(String field, Object value) {
        if (checkField(field)) {
            push(field + " = ?", FilterValue.scalar(value));
        }
        return self();
    }

    /**
     * {@code field LIKE ?} bound to {@code %value%}, with the wildcards of {@code value} escaped.
     */
    public B addLike(String field, String value) {
        if (checkField(field)) {
            push(field + " LIKE ?", FilterValue.text("%" + SqlIdentifiers.escapeLike(value) + "%"));
        }
        return self();
    }

    /**
     * {@code field LIKE ?} bound to {@code prefix%}, with the wildcards of {@code prefix} escaped.
     */
    public B addStartsWith(String field, String prefix) {
        if (checkField(field)) {
            push(field + " LIKE ?", FilterValue.text(SqlIdentifiers.escapeLike(prefix) + "%"));
        }
        return self();
    }

    /**
     * {@code field op ?}, where {@code op} must be one of {@code = != <> < <= > >=}.
     * An unknown operator makes the call a no-op.
     */
    public B addComparison(String field, String operator, Object value) {
        if (!SqlIdentifiers.isComparisonOperator(operator)) {
            logger.warning(() -> "Ignoring comparison on '" + field + "' with unsupported operator '" + operator + "'");
            return self();
        }
        if (checkField(field)) {
            push(field + " " + operator + " ?", FilterValue.scalar(value));
        }
        return self();
    }

    public B addIsNull(String field) {
        if (checkField(field)) {
            push(field + " IS NULL");
        }
        return self();
    }

    public B addIsNotNull(String field) {
        if (checkField(field)) {
            push(field + " IS NOT NULL");
        }
        return self();
    }

    /**
     * {@code field IN (?, ...)}. An empty {@code values} adds {@code 1=0}, which matches nothing.
     */
    public B addInClause(String field, Collection<?> values) {
        return membership(field, values, "IN", "1=0");
    }

    /**
     * {@code field NOT IN (?, ...)}. An empty {@code values} adds {@code 1=1}, which matches everything.
     */
    public B addNotInClause(String field, Collection<?> values) {
        return membership(field, values, "NOT IN", "1=1");
    }

    /**
     * {@code field BETWEEN ? AND ?}
     */
    public B addBetween(String field, Object from, Object to) {
        if (checkField(field)) {
            push(field + " BETWEEN ? AND ?", FilterValue.scalar(from), FilterValue.scalar(to));
        }
        return self();
    }

    /**
     * Adds the compiled form of {@code group}, parenthesized. Nothing is added when no filter
     * of the tree renders.
     */
    public B addFilters(FilterGroup group) {
        FilterBuilder builder = whitelist != null ? FilterBuilder.create().withWhitelist(whitelist) : FilterBuilder.create();
        CollectingSink sink = new CollectingSink();
        if (builder.apply(group, sink)) {
            conditions.add("(" + sink.sql + ")");
            params.addAll(sink.values);
        }
        return self();
    }

    /**
     * Adds a pre-built search condition, such as the output of
     * {@link io.github.cyfko.sqlguard.core.fts.FtsSearchCondition}. Empty fragments are ignored.
     */
    public B addSearch(SqlFragment search) {
        if (!search.isEmpty()) {
            addRawCondition(search.sql(), search.params());
        }
        return self();
    }

    /**
     * Adds {@code condition} verbatim, bypassing every check. The caller is responsible for
     * the text being trusted and for {@code params} matching its placeholders.
     */
    public B addRawCondition(String condition, List<String> params) {
        conditions.add(Objects.requireNonNull(condition, "condition cannot be null"));
        for (String p : params) {
            this.params.add(FilterValue.text(p));
        }
        return self();
    }

    public B addRawCondition(String condition, String... params) {
        return addRawCondition(condition, List.of(params));
    }

    public boolean hasConditions() {
        return !conditions.isEmpty();
    }

    /**
     * @return the accumulated conditions, unmodifiable view
     */
    public List<String> conditions() {
        return Collections.unmodifiableList(conditions);
    }

    /**
     * @return the accumulated parameters as bind text, in placeholder order
     */
    public List<String> params() {
        List<String> text = new ArrayList<>(params.size());
        for (FilterValue.Scalar p : params) {
            text.add(p.asText());
        }
        return text;
    }

    /**
     * @return the accumulated parameters as typed scalars, in placeholder order
     */
    public List<FilterValue.Scalar> typedParams() {
        return Collections.unmodifiableList(params);
    }

    public B clearConditions() {
        conditions.clear();
        params.clear();
        return self();
    }

    public FieldWhitelist whitelist() {
        return whitelist;
    }

    /**
     * @return {@code table} or {@code table alias}
     */
    protected String fromClause() {
        return alias == null ? table : table + " " + alias;
    }

    /**
     * @return {@code " WHERE c1 AND c2 ..."} or an empty string
     */
    protected String whereClause() {
        return conditions.isEmpty() ? "" : " WHERE " + String.join(" AND ", conditions);
    }

    protected boolean checkField(String field) {
        boolean allowed = whitelist != null ? whitelist.isAllowed(field) : SqlIdentifiers.isSafeQualifiedField(field);
        if (!allowed) {
            logger.warning(() -> "Ignoring condition on disallowed field '" + field + "' for table '" + table + "'");
        }
        return allowed;
    }

    private B membership(String field, Collection<?> values, String keyword, String whenEmpty) {
        if (!checkField(field)) {
            return self();
        }
        if (values.isEmpty()) {
            push(whenEmpty);
            return self();
        }
        List<FilterValue.Scalar> scalars = FilterValue.array(values).values();
        String placeholders = String.join(", ", Collections.nCopies(scalars.size(), "?"));
        conditions.add(field + " " + keyword + " (" + placeholders + ")");
        params.addAll(scalars);
        return self();
    }

    private void push(String condition, FilterValue.Scalar... values) {
        conditions.add(condition);
        Collections.addAll(params, values);
    }

    private static final class CollectingSink implements SqlSink {
        private final StringBuilder sql = new StringBuilder();
        private final List<FilterValue.Scalar> values = new ArrayList<>();

        @Override
        public void text(String text) {
            sql.append(text);
        }

        @Override
        public void param(FilterValue.Scalar value) {
            values.add(value);
        }
    }
}
