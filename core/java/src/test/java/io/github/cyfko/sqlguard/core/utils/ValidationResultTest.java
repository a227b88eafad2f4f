package io.github.cyfko.sqlguard.core.utils;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ValidationResultTest {

    @Test
    @DisplayName("Success should carry no error")
    void successShouldCarryNoError() {
        ValidationResult result = ValidationResult.success();

        assertTrue(result.isValid());
        assertNull(result.getErrorMessage());
        assertTrue(result.getErrors().isEmpty());
    }

    @Test
    @DisplayName("Merging should keep every error in order")
    void mergeShouldKeepErrorsInOrder() {
        // Given
        ValidationResult first = ValidationResult.failure("first");
        ValidationResult second = ValidationResult.failure("second");

        // When
        ValidationResult merged = ValidationResult.success().merge(first).merge(ValidationResult.success()).merge(second);

        // Then
        assertFalse(merged.isValid());
        assertEquals("first", merged.getErrorMessage());
        assertEquals(List.of("first", "second"), merged.getErrors());
    }

    @Test
    @DisplayName("Merging two successes should stay valid")
    void mergeOfSuccessesShouldStayValid() {
        assertTrue(ValidationResult.success().merge(ValidationResult.success()).isValid());
    }
}
