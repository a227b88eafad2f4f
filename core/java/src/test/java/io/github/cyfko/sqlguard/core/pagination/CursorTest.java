package io.github.cyfko.sqlguard.core.pagination;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class CursorTest {

    @Test
    @DisplayName("Should encode as lowercase hex of value and id")
    void shouldEncodeAsHex() {
        assertEquals("31307c3432", new Cursor("10", "42").encode());
    }

    @Test
    @DisplayName("Should decode what it encodes, including non-ASCII text")
    void shouldDecodeWhatItEncodes() {
        Cursor cursor = new Cursor("Éthanol 96°", "a-17");

        assertEquals(Optional.of(cursor), Cursor.decode(cursor.encode()));
        assertEquals(Optional.of(cursor), Cursor.decode(cursor.encode().toUpperCase()));
    }

    @Test
    @DisplayName("Only the first separator should split value and id")
    void firstSeparatorShouldSplit() {
        // "5|a|b"
        Cursor cursor = Cursor.decode("357c617c62").orElseThrow();

        assertEquals("5", cursor.sortValue());
        assertEquals("a|b", cursor.id());
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "abc", "zz7c31", "3130", "ff7c31"})
    @DisplayName("Should refuse malformed tokens")
    void shouldRefuseMalformedTokens(String token) {
        assertTrue(Cursor.decode(token).isEmpty());
    }

    @Test
    @DisplayName("Should refuse a null token")
    void shouldRefuseNullToken() {
        assertTrue(Cursor.decode(null).isEmpty());
    }

    @Test
    @DisplayName("Sort value cannot contain the separator")
    void sortValueCannotContainSeparator() {
        assertThrows(IllegalArgumentException.class, () -> new Cursor("a|b", "1"));
    }

    @Test
    @DisplayName("Should expose numeric and timestamp views")
    void shouldExposeNumericViews() {
        assertEquals(12.5, Cursor.ofNumber(12.50, "1").numericValue().getAsDouble());
        assertEquals("12.5", Cursor.ofNumber(12.50, "1").sortValue());
        assertEquals(1_700_000_000_000_000L, Cursor.ofEpochMicros(1_700_000_000_000_000L, "9").epochMicros().getAsLong());
        assertTrue(new Cursor("acetone", "1").numericValue().isEmpty());
        assertTrue(new Cursor("1.5", "1").epochMicros().isEmpty());
    }
}
