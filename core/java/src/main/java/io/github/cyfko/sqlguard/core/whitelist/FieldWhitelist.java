package io.github.cyfko.sqlguard.core.whitelist;

import io.github.cyfko.sqlguard.core.config.IdentifierPolicy;
import io.github.cyfko.sqlguard.core.utils.SqlIdentifiers;
import io.github.cyfko.sqlguard.core.utils.ValidationResult;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Immutable set of column identifiers that may appear verbatim in generated SQL for one table.
 * <p>
 * A whitelist is the gate between user-chosen field names and SQL text. A field is allowed
 * only if it both passes the identifier shape check ({@link IdentifierPolicy#forQualifiedFields()}
 * by default) and is listed. Listing a reserved word or a malformed name therefore never
 * makes it usable.
 * </p>
 *
 * <h2>Qualification</h2>
 * <p>
 * By default matching is qualification-insensitive: a field matches if its full name or its
 * last dot-separated segment is listed, and an unqualified field matches a listed qualified
 * entry with the same column. With {@code batches} listing {@code b.status} and {@code quantity}:
 * </p>
 * <pre>{@code
 * whitelist.isAllowed("b.status");  // true
 * whitelist.isAllowed("status");    // true
 * whitelist.isAllowed("b.quantity");// true
 * whitelist.isAllowed("password");  // false
 * }</pre>
 * <p>
 * For multi-table joins where the same column name exists on several tables, build the
 * whitelist with {@link Builder#qualifiedOnly()} so that only exact entries match.
 * </p>
 *
 * <p>Instances are immutable and safe to share across threads and requests.</p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class FieldWhitelist {

    private final String table;
    private final Set<String> fields;
    private final Set<String> columns;
    private final boolean qualifiedOnly;
    private final IdentifierPolicy policy;

    private FieldWhitelist(Builder builder) {
        this.table = builder.table;
        this.fields = Set.copyOf(builder.fields);
        this.columns = this.fields.stream().map(SqlIdentifiers::unqualified).collect(Collectors.toUnmodifiableSet());
        this.qualifiedOnly = builder.qualifiedOnly;
        this.policy = builder.policy;
    }

    /**
     * Creates a builder for the whitelist of {@code table}.
     *
     * @param table the table the listed fields belong to; used for diagnostics
     * @return a new builder
     */
    public static Builder forTable(String table) {
        return new Builder(table);
    }

    /**
     * Shortcut for a qualification-insensitive whitelist.
     *
     * @param table  the table name
     * @param fields the permitted fields
     * @return the whitelist
     */
    public static FieldWhitelist of(String table, String... fields) {
        return forTable(table).allow(fields).build();
    }

    /**
     * Decides whether {@code field} may appear verbatim in SQL.
     *
     * @param field candidate field, possibly alias-qualified
     * @return true if the field passes the shape check and matches an entry
     */
    public boolean isAllowed(String field) {
        return validate(field).isValid();
    }

    /**
     * Same decision as {@link #isAllowed(String)}, with the reason of a rejection.
     *
     * @param field candidate field
     * @return a success, or a failure describing why the field was rejected
     */
    public ValidationResult validate(String field) {
        ValidationResult shape = SqlIdentifiers.validate(field, policy);
        if (!shape.isValid()) {
            return shape;
        }
        if (fields.contains(field)) {
            return ValidationResult.success();
        }
        if (!qualifiedOnly && columns.contains(SqlIdentifiers.unqualified(field))) {
            return ValidationResult.success();
        }
        return ValidationResult.failure("Field '" + field + "' is not in the whitelist of table '" + table + "'");
    }

    /**
     * Keeps the allowed entries of {@code candidates}, preserving order and duplicates.
     *
     * @param candidates fields to filter
     * @return the allowed subset
     */
    public List<String> filterFields(Collection<String> candidates) {
        return candidates.stream().filter(this::isAllowed).collect(Collectors.toList());
    }

    /**
     * @return the listed entries, unmodifiable
     */
    public Set<String> allowedFields() {
        return fields;
    }

    public String table() {
        return table;
    }

    public boolean isQualifiedOnly() {
        return qualifiedOnly;
    }

    @Override
    public String toString() {
        return "FieldWhitelist[table=" + table + ", fields=" + fields.size()
                + (qualifiedOnly ? ", qualifiedOnly" : "") + "]";
    }

    /**
     * Fluent builder for {@link FieldWhitelist}.
     */
    public static final class Builder {
        private final String table;
        private final Set<String> fields = new LinkedHashSet<>();
        private boolean qualifiedOnly;
        private IdentifierPolicy policy = IdentifierPolicy.forQualifiedFields();

        private Builder(String table) {
            this.table = Objects.requireNonNull(table, "table cannot be null");
        }

        public Builder allow(String... names) {
            for (String name : names) {
                fields.add(Objects.requireNonNull(name, "field cannot be null"));
            }
            return this;
        }

        public Builder allow(Collection<String> names) {
            for (String name : names) {
                fields.add(Objects.requireNonNull(name, "field cannot be null"));
            }
            return this;
        }

        /**
         * Disables qualification-insensitive matching: only exact entries are accepted.
         */
        public Builder qualifiedOnly() {
            this.qualifiedOnly = true;
            return this;
        }

        public Builder qualifiedOnly(boolean enabled) {
            this.qualifiedOnly = enabled;
            return this;
        }

        /**
         * Replaces the shape policy applied to every candidate field.
         */
        public Builder policy(IdentifierPolicy policy) {
            this.policy = Objects.requireNonNull(policy, "policy cannot be null");
            return this;
        }

        public FieldWhitelist build() {
            return new FieldWhitelist(this);
        }
    }
}
