package io.github.cyfko.sqlguard.core.render;

import io.github.cyfko.sqlguard.core.model.FilterValue;

import java.util.ArrayList;
import java.util.List;

/**
 * {@link SqlSink} collecting text into a buffer and parameters as their text form.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class StringSqlSink implements SqlSink {

    private final StringBuilder sql = new StringBuilder();
    private final List<String> params = new ArrayList<>();

    @Override
    public void text(String text) {
        sql.append(text);
    }

    @Override
    public void param(FilterValue.Scalar value) {
        params.add(value.asText());
    }

    public SqlFragment toFragment() {
        return new SqlFragment(sql.toString(), params);
    }
}
