package io.github.cyfko.sqlguard.core.model;

import io.github.cyfko.sqlguard.core.exception.FilterDefinitionException;

/**
 * Closed set of comparison operators a {@link Filter} may use.
 * <p>
 * Each operator carries the SQL symbol it compiles to, a stable code for external
 * representations (JSON, query strings) and the {@link ValueShape} its operand must have.
 * </p>
 *
 * <table border="1">
 *   <caption>Operators</caption>
 *   <tr><th>Operator</th><th>SQL</th><th>Operand</th></tr>
 *   <tr><td>EQ / NEQ</td><td>{@code = / !=}</td><td>scalar</td></tr>
 *   <tr><td>LT / LTE / GT / GTE</td><td>{@code < <= > >=}</td><td>scalar</td></tr>
 *   <tr><td>LIKE / NOT_LIKE</td><td>{@code LIKE / NOT LIKE}, value wrapped as {@code %v%}</td><td>text</td></tr>
 *   <tr><td>STARTS_WITH</td><td>{@code LIKE}, value as {@code v%}</td><td>text</td></tr>
 *   <tr><td>ENDS_WITH</td><td>{@code LIKE}, value as {@code %v}</td><td>text</td></tr>
 *   <tr><td>IN / NOT_IN</td><td>{@code IN (...) / NOT IN (...)}</td><td>array</td></tr>
 *   <tr><td>BETWEEN / NOT_BETWEEN</td><td>{@code BETWEEN ? AND ?}</td><td>range</td></tr>
 *   <tr><td>IS_NULL / IS_NOT_NULL</td><td>{@code IS NULL / IS NOT NULL}</td><td>none</td></tr>
 * </table>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public enum FilterOperator {

    EQ("=", "EQ", ValueShape.SCALAR),

    NEQ("!=", "NEQ", ValueShape.SCALAR),

    LT("<", "LT", ValueShape.SCALAR),

    LTE("<=", "LTE", ValueShape.SCALAR),

    GT(">", "GT", ValueShape.SCALAR),

    GTE(">=", "GTE", ValueShape.SCALAR),

    LIKE("LIKE", "LIKE", ValueShape.TEXT),

    NOT_LIKE("NOT LIKE", "NOT_LIKE", ValueShape.TEXT),

    STARTS_WITH("LIKE", "STARTS_WITH", ValueShape.TEXT),

    ENDS_WITH("LIKE", "ENDS_WITH", ValueShape.TEXT),

    IN("IN", "IN", ValueShape.ARRAY),

    NOT_IN("NOT IN", "NOT_IN", ValueShape.ARRAY),

    BETWEEN("BETWEEN", "BETWEEN", ValueShape.RANGE),

    NOT_BETWEEN("NOT BETWEEN", "NOT_BETWEEN", ValueShape.RANGE),

    IS_NULL("IS NULL", "IS_NULL", ValueShape.NONE),

    IS_NOT_NULL("IS NOT NULL", "IS_NOT_NULL", ValueShape.NONE);

    private final String symbol;
    private final String code;
    private final ValueShape shape;

    FilterOperator(String symbol, String code, ValueShape shape) {
        this.symbol = symbol;
        this.code = code;
        this.shape = shape;
    }

    /**
     * @return the SQL text this operator compiles to
     */
    public String getSymbol() {
        return symbol;
    }

    /**
     * @return the stable code used in external representations
     */
    public String getCode() {
        return code;
    }

    /**
     * @return the operand shape this operator requires
     */
    public ValueShape getShape() {
        return shape;
    }

    /**
     * Resolves an operator from its code or its SQL symbol, ignoring case and surrounding
     * whitespace. {@code "LIKE"} resolves to {@link #LIKE}; {@code "<>"} to {@link #NEQ}.
     *
     * @param value the code or symbol
     * @return the matching operator
     * @throws FilterDefinitionException if nothing matches
     */
    public static FilterOperator fromString(String value) {
        if (value == null || value.isBlank()) {
            throw new FilterDefinitionException("Operator cannot be null or blank");
        }
        String trimmed = value.trim();
        if (trimmed.equals("<>")) {
            return NEQ;
        }
        for (FilterOperator op : values()) {
            if (op.code.equalsIgnoreCase(trimmed)) return op;
        }
        for (FilterOperator op : values()) {
            if (op.symbol.equalsIgnoreCase(trimmed)) return op;
        }
        throw new FilterDefinitionException("Unknown operator '" + trimmed + "'");
    }

    /**
     * @return true unless the operator takes no operand
     */
    public boolean requiresValue() {
        return shape != ValueShape.NONE;
    }

    /**
     * @return true for the array and range operators
     */
    public boolean supportsMultipleValues() {
        return shape == ValueShape.ARRAY || shape == ValueShape.RANGE;
    }
}
