package io.github.cyfko.sqlguard.core.render;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * SQL text paired with the positional parameters for its {@code ?} placeholders.
 * <p>
 * The {@code i}-th {@code ?} of {@link #sql()} is bound to {@code params().get(i)}. Every
 * component that produces a fragment upholds that invariant; {@link #placeholderCount()}
 * exists so tests and callers can check it.
 * </p>
 *
 * @param sql    SQL text, possibly empty
 * @param params parameter values in placeholder order
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record SqlFragment(String sql, List<String> params) {

    private static final SqlFragment EMPTY = new SqlFragment("", List.of());

    public SqlFragment {
        Objects.requireNonNull(sql, "sql cannot be null");
        params = List.copyOf(params);
    }

    public static SqlFragment empty() {
        return EMPTY;
    }

    public static SqlFragment of(String sql, String... params) {
        return new SqlFragment(sql, Arrays.asList(params));
    }

    /**
     * @return true if there is no SQL text
     */
    public boolean isEmpty() {
        return sql.isEmpty();
    }

    /**
     * @return the number of {@code ?} characters in {@link #sql()}
     */
    public int placeholderCount() {
        int count = 0;
        for (int i = 0; i < sql.length(); i++) {
            if (sql.charAt(i) == '?') {
                count++;
            }
        }
        return count;
    }

    /**
     * @return this fragment wrapped in parentheses, or itself when empty
     */
    public SqlFragment parenthesized() {
        return isEmpty() ? this : new SqlFragment("(" + sql + ")", params);
    }
}
