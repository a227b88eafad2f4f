package io.github.cyfko.sqlguard.core.utils;

import io.github.cyfko.sqlguard.core.config.IdentifierPolicy;
import io.github.cyfko.sqlguard.core.exception.InvalidIdentifierException;

import java.util.Locale;
import java.util.Set;

/**
 * Stateless helpers deciding whether text may appear verbatim in SQL, and escaping text
 * that will be bound as a {@code LIKE} pattern.
 * <p>
 * Nothing here touches a database. Every method is a pure function of its arguments and
 * safe to call concurrently.
 * </p>
 *
 * <h2>Identifier rules</h2>
 * Checks run in a fixed order and the first failing one is reported:
 * <ol>
 *   <li>not empty</li>
 *   <li>not shorter than {@link IdentifierPolicy#minLength()}</li>
 *   <li>not longer than {@link IdentifierPolicy#maxLength()}</li>
 *   <li>not a reserved SQL word (case-insensitive)</li>
 *   <li>no {@code __}</li>
 *   <li>starts with an ASCII letter, or {@code _} when leading underscores are allowed</li>
 *   <li>remaining characters are ASCII letters, digits, {@code _}, or the permitted {@code .} {@code [} {@code ]}</li>
 *   <li>does not end with {@code _} unless leading underscores are allowed</li>
 * </ol>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class SqlIdentifiers {

    private static final Set<String> COMPARISON_OPERATORS = Set.of("=", "!=", "<>", ">", ">=", "<", "<=");

    private SqlIdentifiers() {
        throw new UnsupportedOperationException("Utility class");
    }

    /**
     * Validates {@code name} against {@code policy}.
     *
     * @param name   the candidate identifier, may be {@code null}
     * @param policy the shape rules to apply
     * @return a success, or a failure naming the first violated rule
     */
    public static ValidationResult validate(String name, IdentifierPolicy policy) {
        if (name == null || name.isEmpty()) {
            return ValidationResult.failure("Identifier cannot be empty");
        }
        if (name.length() < policy.minLength()) {
            return ValidationResult.failure(
                    "Identifier '" + name + "' is too short (min: " + policy.minLength() + ")");
        }
        if (name.length() > policy.maxLength()) {
            return ValidationResult.failure(
                    "Identifier '" + abbreviate(name) + "' is too long (max: " + policy.maxLength() + ")");
        }
        if (policy.isReserved(name)) {
            return ValidationResult.failure("'" + name + "' is a reserved SQL word");
        }
        if (name.contains("__")) {
            return ValidationResult.failure("Identifier '" + name + "' contains consecutive underscores");
        }

        char first = name.charAt(0);
        if (!(isAsciiLetter(first) || (first == '_' && policy.allowLeadingUnderscore()))) {
            return ValidationResult.failure("Identifier '" + name + "' must start with a letter");
        }

        for (int i = 1; i < name.length(); i++) {
            char c = name.charAt(i);
            boolean ok = isAsciiLetter(c) || isAsciiDigit(c) || c == '_'
                    || (c == '.' && policy.allowDot())
                    || ((c == '[' || c == ']') && policy.allowBrackets());
            if (!ok) {
                return ValidationResult.failure("Identifier '" + name + "' contains invalid character '" + c + "'");
            }
        }

        if (name.endsWith("_") && !policy.allowLeadingUnderscore()) {
            return ValidationResult.failure("Identifier '" + name + "' cannot end with an underscore");
        }
        return ValidationResult.success();
    }

    /**
     * Validates {@code name} and throws if it is not a safe identifier.
     *
     * @param name   the candidate identifier
     * @param policy the shape rules to apply
     * @return {@code name}, unchanged
     * @throws InvalidIdentifierException if validation fails
     */
    public static String requireValid(String name, IdentifierPolicy policy) {
        ValidationResult result = validate(name, policy);
        if (!result.isValid()) {
            throw new InvalidIdentifierException(name, result.getErrorMessage());
        }
        return name;
    }

    /**
     * @param name candidate column name
     * @return true if {@code name} passes {@link IdentifierPolicy#defaults()}
     */
    public static boolean isSafeFieldName(String name) {
        return validate(name, IdentifierPolicy.defaults()).isValid();
    }

    /**
     * @param name candidate table name, possibly schema-qualified
     * @return true if {@code name} passes {@link IdentifierPolicy#forTableNames()}
     */
    public static boolean isSafeTableName(String name) {
        return validate(name, IdentifierPolicy.forTableNames()).isValid();
    }

    /**
     * @param name candidate column reference, possibly alias-qualified
     * @return true if {@code name} passes {@link IdentifierPolicy#forQualifiedFields()}
     */
    public static boolean isSafeQualifiedField(String name) {
        return validate(name, IdentifierPolicy.forQualifiedFields()).isValid();
    }

    /**
     * Strips any alias or schema qualifier: {@code b.quantity} becomes {@code quantity}.
     *
     * @param name column reference, qualified or not
     * @return the last dot-separated segment of {@code name}
     */
    public static String unqualified(String name) {
        int dot = name.lastIndexOf('.');
        return dot < 0 ? name : name.substring(dot + 1);
    }

    /**
     * Escapes the {@code LIKE} metacharacters of {@code value} with a backslash, so the
     * result matches literally once wrapped in {@code %} wildcards.
     * <pre>{@code
     * SqlIdentifiers.escapeLike("50%_test"); // 50\%\_test
     * }</pre>
     *
     * @param value raw user text
     * @return the escaped text
     */
    public static String escapeLike(String value) {
        StringBuilder sb = new StringBuilder(value.length() + 8);
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case '\\' -> sb.append("\\\\");
                case '%' -> sb.append("\\%");
                case '_' -> sb.append("\\_");
                case '[' -> sb.append("\\[");
                default -> sb.append(c);
            }
        }
        return sb.toString();
    }

    /**
     * @param order candidate sort direction
     * @return true only for {@code ASC} or {@code DESC}, ignoring case
     */
    public static boolean isValidSortOrder(String order) {
        if (order == null) {
            return false;
        }
        String upper = order.toUpperCase(Locale.ROOT);
        return upper.equals("ASC") || upper.equals("DESC");
    }

    /**
     * Maps any input onto a closed sort direction: {@code ASC} when the input is
     * {@code asc} in any case, {@code DESC} otherwise (including {@code null}).
     *
     * @param order raw sort direction
     * @return {@code "ASC"} or {@code "DESC"}
     */
    public static String normalizeSortOrder(String order) {
        return order != null && order.equalsIgnoreCase("ASC") ? "ASC" : "DESC";
    }

    /**
     * @param op candidate comparison symbol
     * @return true if {@code op} is one of {@code = != <> < <= > >=}
     */
    public static boolean isComparisonOperator(String op) {
        return op != null && COMPARISON_OPERATORS.contains(op);
    }

    private static boolean isAsciiLetter(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
    }

    private static boolean isAsciiDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static String abbreviate(String s) {
        return s.length() <= 40 ? s : s.substring(0, 40) + "...";
    }
}
