package io.github.cyfko.sqlguard.jdbc;

import io.github.cyfko.sqlguard.core.exception.FilterValidationException;
import io.github.cyfko.sqlguard.core.model.Filter;
import io.github.cyfko.sqlguard.core.model.FilterGroup;
import io.github.cyfko.sqlguard.core.model.FilterValue;
import io.github.cyfko.sqlguard.core.render.FilterBuilder;
import io.github.cyfko.sqlguard.core.render.SqlFragment;
import io.github.cyfko.sqlguard.core.whitelist.FieldWhitelist;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class JdbcStatementBuilderTest {

    private final FilterBuilder filters = FilterBuilder.create()
            .withWhitelist(FieldWhitelist.of("batches", "status", "quantity", "unit", "expiry_date"));

    @Test
    @DisplayName("Should produce the same text and sequence as string rendering")
    void shouldMatchStringRendering() {
        // Given
        FilterGroup group = FilterGroup.and(
                Filter.eq("status", "active"),
                FilterGroup.or(Filter.gte("quantity", 10), Filter.isNull("expiry_date")),
                Filter.in("unit", List.of("g", "mg")));

        // When
        JdbcStatementBuilder stmt = new JdbcStatementBuilder();
        filters.apply(group, stmt);
        SqlFragment fragment = filters.build(group);

        // Then
        assertEquals(fragment.sql(), stmt.sql());
        assertArrayEquals(new Object[]{"active", 10L, "g", "mg"}, stmt.arguments());
    }

    @Test
    @DisplayName("A tree that is too deep should leave the statement untouched")
    void tooDeepTreeShouldLeaveStatementUntouched() {
        // Given
        FilterGroup group = FilterGroup.and(Filter.eq("status", "active"));
        for (int i = 0; i < FilterGroup.MAX_DEPTH; i++) {
            group = FilterGroup.and(group);
        }
        FilterGroup tooDeep = group;
        JdbcStatementBuilder stmt = new JdbcStatementBuilder().push("SELECT * FROM batches");

        // When
        assertThrows(FilterValidationException.class, () -> stmt.where(filters, tooDeep));

        // Then
        assertEquals("SELECT * FROM batches", stmt.sql());
        assertEquals(0, stmt.arguments().length);
        stmt.where(filters, FilterGroup.and(Filter.eq("unit", "g")));
        assertEquals("SELECT * FROM batches WHERE (unit = ?)", stmt.sql());
    }

    @Test
    @DisplayName("Should bind scalars with their JDBC type")
    void shouldBindTypedValues() {
        JdbcStatementBuilder stmt = new JdbcStatementBuilder()
                .push("SELECT * FROM batches WHERE a = ? AND b = ? AND c = ? AND d = ?")
                .bind(FilterValue.text("x"))
                .bind(new FilterValue.Int(7))
                .bind(new FilterValue.Decimal(2.5))
                .bind(new FilterValue.Bool(true));

        assertArrayEquals(new Object[]{"x", 7L, 2.5, 1}, stmt.arguments());
    }

    @Test
    @DisplayName("where should open with WHERE then continue with AND")
    void whereShouldOpenThenContinue() {
        JdbcStatementBuilder stmt = new JdbcStatementBuilder()
                .push("SELECT * FROM batches")
                .where(filters, FilterGroup.and(Filter.eq("password", "x")))
                .where(filters, FilterGroup.and(Filter.eq("status", "a")))
                .where(SqlFragment.of("quantity > ?", "3"))
                .where(SqlFragment.empty());

        assertEquals("SELECT * FROM batches WHERE (status = ?) AND quantity > ?", stmt.sql());
        assertArrayEquals(new Object[]{"a", "3"}, stmt.arguments());
    }

    @Test
    @DisplayName("The creator should prepare the statement and set every argument")
    void creatorShouldPrepareAndBind() throws Exception {
        // Given
        Connection connection = mock(Connection.class);
        PreparedStatement ps = mock(PreparedStatement.class);
        when(connection.prepareStatement("SELECT * FROM batches WHERE status = ?")).thenReturn(ps);
        JdbcStatementBuilder stmt = new JdbcStatementBuilder()
                .push("SELECT * FROM batches")
                .where(SqlFragment.of("status = ?", "active"));

        // When
        PreparedStatement created = stmt.toCreator().createPreparedStatement(connection);

        // Then
        assertSame(ps, created);
        verify(ps).setString(1, "active");
    }
}
