package io.github.cyfko.sqlguard.jdbc;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DriverManagerDataSource;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class SqliteFtsAvailabilityProbeTest {

    @Mock
    private JdbcTemplate jdbcTemplate;

    private SqliteFtsAvailabilityProbe probe;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        probe = new SqliteFtsAvailabilityProbe(jdbcTemplate);
    }

    @Test
    @DisplayName("Should report an index table found in the catalog")
    void shouldReportExistingIndex() {
        when(jdbcTemplate.queryForObject(SqliteFtsAvailabilityProbe.CATALOG_QUERY, Long.class, "reagents_fts"))
                .thenReturn(1L);

        assertTrue(probe.isAvailable("reagents_fts"));
    }

    @Test
    @DisplayName("Should report a missing index table")
    void shouldReportMissingIndex() {
        when(jdbcTemplate.queryForObject(eq(SqliteFtsAvailabilityProbe.CATALOG_QUERY), eq(Long.class), eq("reagents_fts")))
                .thenReturn(0L);

        assertFalse(probe.isAvailable("reagents_fts"));
    }

    @Test
    @DisplayName("Should treat a database error as unavailable")
    void shouldTreatErrorAsUnavailable() {
        when(jdbcTemplate.queryForObject(SqliteFtsAvailabilityProbe.CATALOG_QUERY, Long.class, "reagents_fts"))
                .thenThrow(new DataAccessResourceFailureException("database is locked"));

        assertFalse(probe.isAvailable("reagents_fts"));
    }

    @Test
    @DisplayName("A database without sqlite_master should fall back to unavailable")
    void databaseWithoutCatalogShouldBeUnavailable() {
        DriverManagerDataSource dataSource = new DriverManagerDataSource("jdbc:h2:mem:probe;DB_CLOSE_DELAY=-1", "sa", "");

        assertFalse(new SqliteFtsAvailabilityProbe(new JdbcTemplate(dataSource)).isAvailable("reagents_fts"));
    }
}
