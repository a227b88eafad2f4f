package io.github.cyfko.sqlguard.core.pagination;

import io.github.cyfko.sqlguard.core.exception.InvalidIdentifierException;
import io.github.cyfko.sqlguard.core.model.Filter;
import io.github.cyfko.sqlguard.core.model.FilterGroup;
import io.github.cyfko.sqlguard.core.model.FilterValue;
import io.github.cyfko.sqlguard.core.render.SqlFragment;
import io.github.cyfko.sqlguard.core.whitelist.FieldWhitelist;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class KeysetPaginationBuilderTest {

    private final FieldWhitelist reagents = FieldWhitelist.of("reagents", "id", "name", "quantity", "created_at", "status");

    @Test
    @DisplayName("Should refuse a malformed table")
    void shouldRefuseMalformedTable() {
        assertThrows(InvalidIdentifierException.class, () -> KeysetPaginationBuilder.forTable("reagents;"));
    }

    // ============================================================================
    // First page
    // ============================================================================

    @Nested
    @DisplayName("Without cursor")
    class WithoutCursor {

        @Test
        @DisplayName("Should select ids first and join back to the rows")
        void shouldSelectIdsFirst() {
            // Given
            KeysetPaginationBuilder builder = KeysetPaginationBuilder.forTable("reagents")
                    .withWhitelist(reagents)
                    .sort("quantity", "desc")
                    .limit(20);

            // When
            SqlFragment fragment = builder.buildKeyset();

            // Then
            assertEquals("WITH ids AS (SELECT id, quantity FROM reagents ORDER BY quantity DESC, id DESC LIMIT ?)"
                    + " SELECT t.* FROM reagents t INNER JOIN ids ON t.id = ids.id"
                    + " ORDER BY ids.quantity DESC, ids.id DESC", fragment.sql());
            assertEquals(List.of("21"), fragment.params());
        }

        @Test
        @DisplayName("Should default to id descending with the default page size")
        void shouldDefaultSort() {
            KeysetPaginationBuilder builder = KeysetPaginationBuilder.forTable("reagents");

            assertEquals("id", builder.sortColumn());
            assertEquals("DESC", builder.sortOrder());
            assertEquals(Pagination.DEFAULT_PER_PAGE, builder.limit());
            assertEquals(Pagination.DEFAULT_PER_PAGE + 1, builder.fetchSize());
        }

        @Test
        @DisplayName("Sorting by the id should select and order by it only once")
        void sortingByIdShouldNotRepeatIt() {
            SqlFragment fragment = KeysetPaginationBuilder.forTable("reagents").limit(2).buildKeyset();

            assertEquals("WITH ids AS (SELECT id FROM reagents ORDER BY id DESC LIMIT ?)"
                    + " SELECT t.* FROM reagents t INNER JOIN ids ON t.id = ids.id"
                    + " ORDER BY ids.id DESC", fragment.sql());
            assertEquals(List.of("3"), fragment.params());
        }

        @Test
        @DisplayName("A qualified sort column should be reduced to its column name")
        void qualifiedSortColumnShouldBeUnqualified() {
            // Given
            FieldWhitelist qualified = FieldWhitelist.forTable("reagents").allow("id", "r.quantity").build();

            // When
            KeysetPaginationBuilder builder = KeysetPaginationBuilder.forTable("reagents")
                    .withWhitelist(qualified)
                    .sort("r.quantity", "asc")
                    .limit(5);

            // Then
            assertEquals("quantity", builder.sortColumn());
            assertEquals("WITH ids AS (SELECT id, quantity FROM reagents ORDER BY quantity ASC, id ASC LIMIT ?)"
                    + " SELECT t.* FROM reagents t INNER JOIN ids ON t.id = ids.id"
                    + " ORDER BY ids.quantity ASC, ids.id ASC", builder.buildKeyset().sql());
        }

        @Test
        @DisplayName("Should keep the previous sort column when the new one is not allowed")
        void shouldKeepPreviousSortColumn() {
            KeysetPaginationBuilder builder = KeysetPaginationBuilder.forTable("reagents")
                    .withWhitelist(reagents)
                    .sort("name", "asc")
                    .sort("password", "asc");

            assertEquals("name", builder.sortColumn());
            assertEquals("ASC", builder.sortOrder());
        }

        @Test
        @DisplayName("Should clamp the page size")
        void shouldClampPageSize() {
            assertEquals(100, KeysetPaginationBuilder.forTable("reagents").limit(1000).limit());
            assertEquals(1, KeysetPaginationBuilder.forTable("reagents").limit(0).limit());
        }
    }

    // ============================================================================
    // Cursor
    // ============================================================================

    @ParameterizedTest
    @CsvSource({
            "desc, next, <, DESC",
            "desc, prev, >, ASC",
            "asc, next, >, ASC",
            "asc, prev, <, DESC"
    })
    @DisplayName("Comparison and order should follow sort order and direction")
    void comparisonShouldFollowDirection(String sortOrder, String direction, String op, String effectiveOrder) {
        // Given
        KeysetPaginationBuilder builder = KeysetPaginationBuilder.forTable("reagents")
                .withWhitelist(reagents)
                .sort("quantity", sortOrder)
                .limit(10)
                .after(new Cursor("12.5", "40"), Direction.fromString(direction));

        // When
        SqlFragment fragment = builder.buildKeyset();

        // Then
        assertTrue(fragment.sql().contains(
                "WHERE ((quantity " + op + " ?) OR (quantity = ? AND id " + op + " ?))"), fragment.sql());
        assertTrue(fragment.sql().endsWith("ORDER BY ids.quantity " + effectiveOrder + ", ids.id " + effectiveOrder));
        assertEquals(List.of("12.5", "12.5", "40", "11"), fragment.params());
    }

    @Test
    @DisplayName("Cursor values should be bound with their numeric type when possible")
    void cursorValuesShouldBeTyped() {
        KeysetPaginationBuilder builder = KeysetPaginationBuilder.forTable("reagents")
                .sort("name", "asc")
                .limit(5)
                .after(new Cursor("acetone", "7"), Direction.NEXT);

        assertEquals(List.of(new FilterValue.Text("acetone"), new FilterValue.Text("acetone"),
                new FilterValue.Int(7), new FilterValue.Int(6)), builder.typedKeysetParams());
    }

    @Test
    @DisplayName("Filter parameters should come before cursor parameters and the limit")
    void filterParametersShouldComeFirst() {
        // Given
        KeysetPaginationBuilder builder = KeysetPaginationBuilder.forTable("reagents")
                .withWhitelist(reagents)
                .addFilters(FilterGroup.and(Filter.eq("status", "active"), Filter.eq("secret", "x")))
                .addCondition(SqlFragment.of("(name LIKE ?)", "%na%"))
                .sort("created_at", "desc")
                .limit(2)
                .after(Cursor.ofEpochMicros(1_700_000_000_000_000L, "3"), Direction.NEXT);

        // When
        SqlFragment keyset = builder.buildKeyset();
        SqlFragment count = builder.buildCount();

        // Then
        assertEquals("WITH ids AS (SELECT id, created_at FROM reagents"
                + " WHERE (status = ?) AND (name LIKE ?)"
                + " AND ((created_at < ?) OR (created_at = ? AND id < ?))"
                + " ORDER BY created_at DESC, id DESC LIMIT ?)"
                + " SELECT t.* FROM reagents t INNER JOIN ids ON t.id = ids.id"
                + " ORDER BY ids.created_at DESC, ids.id DESC", keyset.sql());
        assertEquals(List.of("active", "%na%", "1700000000000000", "1700000000000000", "3", "3"), keyset.params());
        assertEquals("SELECT COUNT(*) FROM reagents WHERE (status = ?) AND (name LIKE ?)", count.sql());
        assertEquals(List.of("active", "%na%"), count.params());
    }

    @Test
    @DisplayName("Offset query should bind limit and offset as parameters")
    void offsetQueryShouldBindLimitAndOffset() {
        SqlFragment fragment = KeysetPaginationBuilder.forTable("reagents")
                .select("id, name")
                .sort("name", "asc")
                .limit(25)
                .buildSimple(50);

        assertEquals("SELECT id, name FROM reagents ORDER BY name ASC, id ASC LIMIT ? OFFSET ?", fragment.sql());
        assertEquals(List.of("25", "50"), fragment.params());
    }

    @Test
    @DisplayName("hasMore should detect the extra fetched row")
    void hasMoreShouldDetectExtraRow() {
        KeysetPaginationBuilder builder = KeysetPaginationBuilder.forTable("reagents").limit(10);

        assertTrue(builder.hasMore(11));
        assertFalse(builder.hasMore(10));
        assertFalse(builder.hasMore(0));
    }
}
