package io.github.cyfko.sqlguard.jdbc;

import io.github.cyfko.sqlguard.core.exception.FilterValidationException;
import io.github.cyfko.sqlguard.core.model.FilterGroup;
import io.github.cyfko.sqlguard.core.model.FilterValue;
import io.github.cyfko.sqlguard.core.render.FilterBuilder;
import io.github.cyfko.sqlguard.core.render.SqlFragment;
import io.github.cyfko.sqlguard.core.render.SqlSink;
import org.springframework.jdbc.core.ArgumentPreparedStatementSetter;
import org.springframework.jdbc.core.PreparedStatementCreator;
import org.springframework.jdbc.core.PreparedStatementSetter;

import java.sql.PreparedStatement;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Live statement builder binding values as they are written.
 * <p>
 * This is the direct-bind counterpart of {@link io.github.cyfko.sqlguard.core.render.StringSqlSink}:
 * a filter tree applied to it produces the same text and the same parameter sequence,
 * but the parameters are kept as JDBC values ready to be set on a {@link PreparedStatement}.
 * </p>
 *
 * <h2>Binding</h2>
 * <ul>
 *   <li>{@code Text} binds as {@link String}</li>
 *   <li>{@code Int} binds as {@link Long}</li>
 *   <li>{@code Decimal} binds as {@link Double}</li>
 *   <li>{@code Bool} binds as {@link Integer} {@code 1} or {@code 0}</li>
 * </ul>
 *
 * <pre>{@code
 * JdbcStatementBuilder stmt = new JdbcStatementBuilder()
 *     .push("SELECT * FROM batches b")
 *     .where(FilterBuilder.create().withWhitelist(batches), group)
 *     .push(" ORDER BY b.expiry_date");
 *
 * List<Batch> rows = jdbcTemplate.query(stmt.toCreator(), batchMapper);
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class JdbcStatementBuilder implements SqlSink {

    private final StringBuilder sql = new StringBuilder();
    private final List<Object> arguments = new ArrayList<>();
    private boolean whereOpened;

    public JdbcStatementBuilder() {
    }

    /**
     * Starts from a rendered fragment, binding its text parameters as strings.
     */
    public JdbcStatementBuilder(SqlFragment fragment) {
        sql.append(fragment.sql());
        arguments.addAll(fragment.params());
    }

    /**
     * Appends trusted text.
     */
    public JdbcStatementBuilder push(String text) {
        sql.append(Objects.requireNonNull(text, "text cannot be null"));
        return this;
    }

    /**
     * Binds the next placeholder.
     */
    public JdbcStatementBuilder bind(FilterValue.Scalar value) {
        arguments.add(toJdbcValue(value));
        return this;
    }

    /**
     * Appends {@code " WHERE "} or {@code " AND "} followed by the parenthesized tree, or nothing
     * when no filter of the tree renders.
     *
     * @param builder compiler carrying the whitelist
     * @param group   the tree to apply
     * @return this builder
     * @throws FilterValidationException if the tree is too deep,
     *         in which case nothing is appended
     */
    public JdbcStatementBuilder where(FilterBuilder builder, FilterGroup group) {
        builder.requireSupportedDepth(group);
        if (!builder.hasRenderableFilters(group)) {
            return this;
        }
        push(whereOpened ? " AND (" : " WHERE (");
        whereOpened = true;
        builder.apply(group, this);
        return push(")");
    }

    /**
     * Same as {@link #where(FilterBuilder, FilterGroup)} for a pre-built condition.
     */
    public JdbcStatementBuilder where(SqlFragment condition) {
        if (condition.isEmpty()) {
            return this;
        }
        push(whereOpened ? " AND " : " WHERE ");
        whereOpened = true;
        push(condition.sql());
        arguments.addAll(condition.params());
        return this;
    }

    @Override
    public void text(String text) {
        push(text);
    }

    @Override
    public void param(FilterValue.Scalar value) {
        bind(value);
    }

    public String sql() {
        return sql.toString();
    }

    /**
     * @return a copy of the bound values, in placeholder order
     */
    public Object[] arguments() {
        return arguments.toArray();
    }

    public PreparedStatementSetter toSetter() {
        return new ArgumentPreparedStatementSetter(arguments());
    }

    public PreparedStatementCreator toCreator() {
        String statement = sql();
        PreparedStatementSetter setter = toSetter();
        return connection -> {
            PreparedStatement ps = connection.prepareStatement(statement);
            setter.setValues(ps);
            return ps;
        };
    }

    /**
     * Converts a scalar to the object handed to JDBC.
     *
     * @param value the scalar
     * @return a {@link String}, {@link Long}, {@link Double} or {@link Integer}
     */
    public static Object toJdbcValue(FilterValue.Scalar value) {
        Objects.requireNonNull(value, "value cannot be null");
        if (value instanceof FilterValue.Text text) {
            return text.value();
        }
        if (value instanceof FilterValue.Int i) {
            return i.value();
        }
        if (value instanceof FilterValue.Decimal d) {
            return d.value();
        }
        return ((FilterValue.Bool) value).value() ? 1 : 0;
    }

    /**
     * Converts typed parameters, as kept by the query builders, to JDBC arguments.
     */
    public static Object[] toJdbcValues(List<FilterValue.Scalar> values) {
        Object[] out = new Object[values.size()];
        for (int i = 0; i < out.length; i++) {
            out[i] = toJdbcValue(values.get(i));
        }
        return out;
    }
}
