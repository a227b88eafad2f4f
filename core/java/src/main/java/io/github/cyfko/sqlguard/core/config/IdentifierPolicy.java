package io.github.cyfko.sqlguard.core.config;

import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Shape rules applied to a SQL identifier before it may appear verbatim in SQL text.
 * <p>
 * A policy is a plain immutable value; the checks themselves live in
 * {@link io.github.cyfko.sqlguard.core.utils.SqlIdentifiers#validate(String, IdentifierPolicy)}.
 * Reserved words are stored upper-cased and compared case-insensitively.
 * </p>
 *
 * <h2>Presets</h2>
 * <table border="1">
 *   <caption>Built-in policies</caption>
 *   <tr><th>Preset</th><th>Length</th><th>Dot</th><th>Typical use</th></tr>
 *   <tr><td>{@link #defaults()}</td><td>1..64</td><td>no</td><td>plain column names</td></tr>
 *   <tr><td>{@link #forQualifiedFields()}</td><td>1..64</td><td>yes</td><td>{@code alias.column}</td></tr>
 *   <tr><td>{@link #forTableNames()}</td><td>1..128</td><td>yes</td><td>{@code schema.table}</td></tr>
 *   <tr><td>{@link #strict()}</td><td>2..32</td><td>no</td><td>user-facing keys</td></tr>
 * </table>
 *
 * @param minLength              minimum length, at least 1
 * @param maxLength              maximum length, not less than {@code minLength}
 * @param reservedWords          words that may never be used as an identifier
 * @param allowDot               whether {@code .} may appear after the first character
 * @param allowBrackets          whether {@code [} and {@code ]} may appear after the first character
 * @param allowLeadingUnderscore whether an identifier may start (and end) with {@code _}
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record IdentifierPolicy(int minLength,
                               int maxLength,
                               Set<String> reservedWords,
                               boolean allowDot,
                               boolean allowBrackets,
                               boolean allowLeadingUnderscore) {

    /**
     * SQL keywords rejected as identifiers by every preset.
     */
    public static final Set<String> SQL_RESERVED_WORDS = Set.of(
            "SELECT", "FROM", "WHERE", "INSERT", "UPDATE", "DELETE", "DROP", "CREATE",
            "ALTER", "UNION", "JOIN", "ORDER", "GROUP", "HAVING", "EXISTS", "AND",
            "OR", "NOT", "NULL", "AS", "TABLE", "INDEX", "VIEW", "TRIGGER",
            "PROCEDURE", "FUNCTION", "INTO", "VALUES", "SET", "EXEC", "EXECUTE", "DECLARE",
            "GRANT", "REVOKE", "COMMIT", "ROLLBACK", "SAVEPOINT", "TRUNCATE", "REPLACE", "MERGE",
            "CALL", "EXPLAIN", "DESCRIBE", "SHOW", "USE", "BEGIN"
    );

    private static final IdentifierPolicy DEFAULTS =
            new IdentifierPolicy(1, 64, SQL_RESERVED_WORDS, false, false, false);

    public IdentifierPolicy {
        if (minLength < 1) {
            throw new IllegalArgumentException("minLength must be at least 1, got " + minLength);
        }
        if (maxLength < minLength) {
            throw new IllegalArgumentException(
                    "maxLength (" + maxLength + ") must not be less than minLength (" + minLength + ")");
        }
        Objects.requireNonNull(reservedWords, "reservedWords cannot be null");
        reservedWords = reservedWords.stream()
                .map(w -> w.toUpperCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableSet());
    }

    /**
     * Policy for plain column names: 1 to 64 characters, no dots.
     *
     * @return the default policy
     */
    public static IdentifierPolicy defaults() {
        return DEFAULTS;
    }

    /**
     * Policy for table names, which may be schema-qualified and longer.
     *
     * @return a policy allowing dots and up to 128 characters
     */
    public static IdentifierPolicy forTableNames() {
        return DEFAULTS.withMaxLength(128).withDot(true);
    }

    /**
     * Policy for alias-qualified column references such as {@code b.status}.
     *
     * @return a policy allowing dots and up to 64 characters
     */
    public static IdentifierPolicy forQualifiedFields() {
        return DEFAULTS.withDot(true);
    }

    /**
     * Tighter policy for short user-facing keys: 2 to 32 characters.
     *
     * @return the strict policy
     */
    public static IdentifierPolicy strict() {
        return new IdentifierPolicy(2, 32, SQL_RESERVED_WORDS, false, false, false);
    }

    public IdentifierPolicy withMaxLength(int max) {
        return new IdentifierPolicy(minLength, max, reservedWords, allowDot, allowBrackets, allowLeadingUnderscore);
    }

    public IdentifierPolicy withDot(boolean allow) {
        return new IdentifierPolicy(minLength, maxLength, reservedWords, allow, allowBrackets, allowLeadingUnderscore);
    }

    public IdentifierPolicy withBrackets(boolean allow) {
        return new IdentifierPolicy(minLength, maxLength, reservedWords, allowDot, allow, allowLeadingUnderscore);
    }

    public IdentifierPolicy withLeadingUnderscore(boolean allow) {
        return new IdentifierPolicy(minLength, maxLength, reservedWords, allowDot, allowBrackets, allow);
    }

    /**
     * Checks whether {@code word} is reserved under this policy, ignoring case.
     *
     * @param word the candidate
     * @return true if reserved
     */
    public boolean isReserved(String word) {
        return reservedWords.contains(word.toUpperCase(Locale.ROOT));
    }
}
