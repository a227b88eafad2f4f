package io.github.cyfko.sqlguard.core.model;

import io.github.cyfko.sqlguard.core.exception.FilterDefinitionException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

class FilterOperatorTest {

    @ParameterizedTest
    @CsvSource({
            "EQ, EQ",
            "eq, EQ",
            "'=', EQ",
            "'!=', NEQ",
            "'<>', NEQ",
            "'>=', GTE",
            "like, LIKE",
            "starts_with, STARTS_WITH",
            "'not in', NOT_IN",
            "' between ', BETWEEN",
            "'IS NOT NULL', IS_NOT_NULL"
    })
    @DisplayName("Should resolve codes and symbols ignoring case")
    void shouldResolveCodesAndSymbols(String input, FilterOperator expected) {
        assertEquals(expected, FilterOperator.fromString(input));
    }

    @ParameterizedTest
    @ValueSource(strings = {"CONTAINS", "==", "; DROP"})
    @DisplayName("Should reject unknown operators")
    void shouldRejectUnknownOperators(String input) {
        FilterDefinitionException ex = assertThrows(FilterDefinitionException.class, () -> FilterOperator.fromString(input));
        assertTrue(ex.getMessage().startsWith("Unknown operator"));
    }

    @Test
    @DisplayName("Should reject a blank operator")
    void shouldRejectBlankOperator() {
        assertThrows(FilterDefinitionException.class, () -> FilterOperator.fromString("  "));
        assertThrows(FilterDefinitionException.class, () -> FilterOperator.fromString(null));
    }

    @Test
    @DisplayName("Shapes should drive value requirements")
    void shapesShouldDriveValueRequirements() {
        assertFalse(FilterOperator.IS_NULL.requiresValue());
        assertTrue(FilterOperator.EQ.requiresValue());
        assertTrue(FilterOperator.IN.supportsMultipleValues());
        assertTrue(FilterOperator.NOT_BETWEEN.supportsMultipleValues());
        assertFalse(FilterOperator.LIKE.supportsMultipleValues());
        assertEquals(ValueShape.TEXT, FilterOperator.ENDS_WITH.getShape());
    }
}
