package io.github.cyfko.sqlguard.core.fts;

import io.github.cyfko.sqlguard.core.exception.InvalidIdentifierException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FtsConfigTest {

    @Test
    @DisplayName("Should default the id column")
    void shouldDefaultIdColumn() {
        FtsConfig config = FtsConfig.of("reagents_fts", "reagents", "name", "formula");

        assertEquals("id", config.idField());
        assertEquals(List.of("name", "formula"), config.fallbackFields());
    }

    @Test
    @DisplayName("Should reject unsafe identifiers")
    void shouldRejectUnsafeIdentifiers() {
        assertThrows(InvalidIdentifierException.class, () -> FtsConfig.of("reagents fts", "reagents", "name"));
        assertThrows(InvalidIdentifierException.class, () -> FtsConfig.of("reagents_fts", "reagents;", "name"));
        assertThrows(InvalidIdentifierException.class,
                () -> new FtsConfig("reagents_fts", "reagents", "id--", List.of("name")));
        assertThrows(InvalidIdentifierException.class, () -> FtsConfig.of("reagents_fts", "reagents", "name", "x.y"));
    }

    @Test
    @DisplayName("Should copy fallback fields")
    void shouldCopyFallbackFields() {
        List<String> fields = new ArrayList<>(List.of("name"));
        FtsConfig config = new FtsConfig("reagents_fts", "reagents", "id", fields);

        fields.add("formula");

        assertEquals(List.of("name"), config.fallbackFields());
        assertEquals(List.of("cas_number"), config.withFallbackFields(List.of("cas_number")).fallbackFields());
    }

    @Test
    @DisplayName("Related search needs at least one field")
    void relatedSearchNeedsFields() {
        assertThrows(IllegalArgumentException.class, () -> new RelatedSearch("batches", "bs", "reagent_id", List.of()));
        assertThrows(InvalidIdentifierException.class,
                () -> new RelatedSearch("batches", "bs", "reagent_id", List.of("batch number")));
    }
}
