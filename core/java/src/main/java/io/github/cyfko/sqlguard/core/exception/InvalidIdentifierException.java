package io.github.cyfko.sqlguard.core.exception;

/**
 * Exception thrown when a trusted SQL identifier (table name, alias, index table, id column)
 * does not pass the identifier shape check.
 * <p>
 * Trusted identifiers are the only text that a query builder writes verbatim. They are
 * validated once, when the builder or configuration is created, so a malformed name fails
 * fast instead of producing broken SQL later.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 * @see io.github.cyfko.sqlguard.core.utils.SqlIdentifiers
 */
public class InvalidIdentifierException extends RuntimeException {

    private final String identifier;

    /**
     * Creates an exception for the given rejected identifier.
     *
     * @param identifier the rejected identifier, as supplied
     * @param reason     why it was rejected
     */
    public InvalidIdentifierException(String identifier, String reason) {
        super("Invalid SQL identifier '" + identifier + "': " + reason);
        this.identifier = identifier;
    }

    /**
     * Returns the identifier that was rejected.
     *
     * @return the identifier as supplied, possibly {@code null}
     */
    public String getIdentifier() {
        return identifier;
    }
}
