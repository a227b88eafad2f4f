package io.github.cyfko.sqlguard.core.query;

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
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SafeQueryBuilderTest {

    private final FieldWhitelist batches = FieldWhitelist.forTable("batches")
            .allow("status", "quantity", "unit", "expiry_date", "batch_number", "location")
            .build();

    // ============================================================================
    // Construction
    // ============================================================================

    @ParameterizedTest
    @ValueSource(strings = {"", "1batches", "batches;", "DROP", "bat ches", "batches--"})
    @DisplayName("Should refuse malformed table names at construction")
    void shouldRefuseMalformedTables(String table) {
        assertThrows(InvalidIdentifierException.class, () -> SafeQueryBuilder.forTable(table));
    }

    @Test
    @DisplayName("Should refuse a malformed alias")
    void shouldRefuseMalformedAlias() {
        assertThrows(InvalidIdentifierException.class, () -> SafeQueryBuilder.forTable("batches", "b.x"));
    }

    @Test
    @DisplayName("Should accept schema-qualified tables")
    void shouldAcceptSchemaQualifiedTables() {
        SqlFragment fragment = SafeQueryBuilder.forTable("lab.batches", "b").buildSelect();

        assertEquals("SELECT * FROM lab.batches b", fragment.sql());
        assertTrue(fragment.params().isEmpty());
    }

    // ============================================================================
    // Conditions
    // ============================================================================

    @Nested
    @DisplayName("Conditions")
    class Conditions {

        @Test
        @DisplayName("Should join conditions with AND in insertion order")
        void shouldJoinConditionsInOrder() {
            // Given
            SafeQueryBuilder query = SafeQueryBuilder.forTable("batches")
                    .withWhitelist(batches)
                    .addExactMatch("status", "available")
                    .addComparison("quantity", ">=", 10)
                    .addIsNull("expiry_date")
                    .addIsNotNull("location")
                    .addBetween("quantity", 1, 99);

            // When
            SqlFragment fragment = query.buildSelect();

            // Then
            assertEquals("SELECT * FROM batches WHERE status = ? AND quantity >= ? AND expiry_date IS NULL"
                    + " AND location IS NOT NULL AND quantity BETWEEN ? AND ?", fragment.sql());
            assertEquals(List.of("available", "10", "1", "99"), fragment.params());
        }

        @Test
        @DisplayName("Should escape LIKE wildcards in the bound value only")
        void shouldEscapeLikeWildcards() {
            SqlFragment fragment = SafeQueryBuilder.forTable("batches")
                    .addLike("batch_number", "50%_test")
                    .addStartsWith("location", "A_")
                    .buildSelect();

            assertEquals("SELECT * FROM batches WHERE batch_number LIKE ? AND location LIKE ?", fragment.sql());
            assertEquals(List.of("%50\\%\\_test%", "A\\_%"), fragment.params());
        }

        @Test
        @DisplayName("Empty IN should match nothing and empty NOT IN everything")
        void emptyMembershipShouldBeConstant() {
            SqlFragment fragment = SafeQueryBuilder.forTable("batches")
                    .addInClause("unit", List.of())
                    .addNotInClause("unit", List.of())
                    .addInClause("status", List.of("a", "b"))
                    .buildSelect();

            assertEquals("SELECT * FROM batches WHERE 1=0 AND 1=1 AND status IN (?, ?)", fragment.sql());
            assertEquals(List.of("a", "b"), fragment.params());
        }

        @Test
        @DisplayName("Disallowed fields should be ignored without touching parameters")
        void disallowedFieldsShouldBeIgnored() {
            SafeQueryBuilder query = SafeQueryBuilder.forTable("batches")
                    .withWhitelist(batches)
                    .addExactMatch("password", "x")
                    .addLike("status; DROP TABLE batches", "y")
                    .addInClause("secret", List.of(1, 2));

            assertFalse(query.hasConditions());
            assertTrue(query.params().isEmpty());
            assertEquals("SELECT * FROM batches", query.buildSelect().sql());
        }

        @ParameterizedTest
        @ValueSource(strings = {"LIKE", "==", "; DROP", "", "IN"})
        @DisplayName("Unsupported comparison operators should be ignored")
        void unsupportedComparisonOperatorsShouldBeIgnored(String operator) {
            SafeQueryBuilder query = SafeQueryBuilder.forTable("batches").addComparison("quantity", operator, 1);

            assertFalse(query.hasConditions());
        }

        @Test
        @DisplayName("Should keep typed parameters next to their text form")
        void shouldKeepTypedParameters() {
            SafeQueryBuilder query = SafeQueryBuilder.forTable("batches")
                    .addExactMatch("quantity", 5)
                    .addExactMatch("status", "ok")
                    .addComparison("quantity", "<", 2.5);

            assertEquals(List.of(new FilterValue.Int(5), new FilterValue.Text("ok"), new FilterValue.Decimal(2.5)),
                    query.typedParams());
            assertEquals(List.of("5", "ok", "2.5"), query.params());
        }

        @Test
        @DisplayName("Should add a compiled filter tree as one parenthesized condition")
        void shouldAddFilterTree() {
            FilterGroup group = FilterGroup.or(Filter.eq("status", "a"), Filter.eq("password", "x"), Filter.lt("quantity", 3));

            SqlFragment fragment = SafeQueryBuilder.forTable("batches", "b")
                    .withWhitelist(batches)
                    .addExactMatch("unit", "g")
                    .addFilters(group)
                    .buildSelect("b.*");

            assertEquals("SELECT b.* FROM batches b WHERE unit = ? AND (status = ? OR quantity < ?)", fragment.sql());
            assertEquals(List.of("g", "a", "3"), fragment.params());
        }

        @Test
        @DisplayName("A filter tree with nothing renderable should add nothing")
        void emptyFilterTreeShouldAddNothing() {
            SafeQueryBuilder query = SafeQueryBuilder.forTable("batches")
                    .withWhitelist(batches)
                    .addFilters(FilterGroup.and(Filter.eq("password", "x")));

            assertFalse(query.hasConditions());
        }

        @Test
        @DisplayName("Should add search and raw conditions verbatim")
        void shouldAddSearchAndRawConditions() {
            SqlFragment fragment = SafeQueryBuilder.forTable("reagents", "r")
                    .addSearch(SqlFragment.of("(r.name LIKE ? OR r.formula LIKE ?)", "%na%", "%na%"))
                    .addSearch(SqlFragment.empty())
                    .addRawCondition("r.deleted_at IS NULL")
                    .addRawCondition("r.quantity > ?", "0")
                    .buildSelect();

            assertEquals("SELECT * FROM reagents r WHERE (r.name LIKE ? OR r.formula LIKE ?)"
                    + " AND r.deleted_at IS NULL AND r.quantity > ?", fragment.sql());
            assertEquals(List.of("%na%", "%na%", "0"), fragment.params());
        }

        @Test
        @DisplayName("clearConditions should drop conditions and parameters together")
        void clearConditionsShouldDropEverything() {
            SafeQueryBuilder query = SafeQueryBuilder.forTable("batches").addExactMatch("status", "a");

            query.clearConditions();

            assertFalse(query.hasConditions());
            assertTrue(query.params().isEmpty());
            assertTrue(query.conditions().isEmpty());
        }
    }

    // ============================================================================
    // Ordering and pagination
    // ============================================================================

    @ParameterizedTest
    @CsvSource({
            "asc, ASC",
            "ASC, ASC",
            "desc, DESC",
            "sideways, DESC"
    })
    @DisplayName("Should normalize sort direction")
    void shouldNormalizeSortDirection(String direction, String expected) {
        SqlFragment fragment = SafeQueryBuilder.forTable("batches").orderBy("expiry_date", direction).buildSelect();

        assertEquals("SELECT * FROM batches ORDER BY expiry_date " + expected, fragment.sql());
    }

    @Test
    @DisplayName("Should ignore an order field that is not allowed")
    void shouldIgnoreDisallowedOrderField() {
        SqlFragment fragment = SafeQueryBuilder.forTable("batches")
                .withWhitelist(batches)
                .orderBy("quantity", "asc")
                .orderBy("password", "desc")
                .buildSelect();

        assertEquals("SELECT * FROM batches ORDER BY quantity ASC", fragment.sql());
    }

    @Test
    @DisplayName("Should clamp page and page size")
    void shouldClampPagination() {
        SafeQueryBuilder query = SafeQueryBuilder.forTable("batches").paginate(0, 500);

        assertEquals(100, query.limit());
        assertEquals(0L, query.offset());
        assertEquals("SELECT * FROM batches LIMIT 100 OFFSET 0", query.buildSelect().sql());
    }

    @Test
    @DisplayName("Should compute offset from page number")
    void shouldComputeOffsetFromPage() {
        SqlFragment fragment = SafeQueryBuilder.forTable("batches", "b")
                .addExactMatch("b.status", "available")
                .orderBy("b.expiry_date", "asc")
                .paginate(3, 20)
                .buildSelect("b.*");

        assertEquals("SELECT b.* FROM batches b WHERE b.status = ? ORDER BY b.expiry_date ASC LIMIT 20 OFFSET 40",
                fragment.sql());
    }

    @Test
    @DisplayName("A huge page number should not make paginate fail")
    void hugePageShouldNotFail() {
        SafeQueryBuilder query = SafeQueryBuilder.forTable("batches").paginate(Long.MAX_VALUE, 100);

        assertEquals(100, query.limit());
        assertEquals(Long.MAX_VALUE, query.offset());
        assertEquals("SELECT * FROM batches LIMIT 100 OFFSET " + Long.MAX_VALUE, query.buildSelect().sql());
    }

    @Test
    @DisplayName("Should reject negative limit and offset")
    void shouldRejectNegativeLimitAndOffset() {
        SafeQueryBuilder query = SafeQueryBuilder.forTable("batches");

        assertThrows(IllegalArgumentException.class, () -> query.limit(-1));
        assertThrows(IllegalArgumentException.class, () -> query.offset(-5));
    }

    @Test
    @DisplayName("Count should share the WHERE clause but drop order and pagination")
    void countShouldShareWhereClause() {
        // Given
        SafeQueryBuilder query = SafeQueryBuilder.forTable("batches", "b")
                .addExactMatch("b.status", "available")
                .addInClause("b.unit", List.of("g", "mg"))
                .orderBy("b.expiry_date", "desc")
                .paginate(2, 10);

        // When
        SqlFragment select = query.buildSelect();
        SqlFragment count = query.buildCount();

        // Then
        assertEquals("SELECT COUNT(*) FROM batches b WHERE b.status = ? AND b.unit IN (?, ?)", count.sql());
        assertEquals(select.params(), count.params());
        assertFalse(count.sql().contains("LIMIT"));
        assertFalse(count.sql().contains("ORDER BY"));
    }
}
