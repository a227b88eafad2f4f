package io.github.cyfko.sqlguard.jdbc;

import io.github.cyfko.sqlguard.core.spi.FtsAvailability;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;

import java.util.Objects;
import java.util.logging.Logger;

/**
 * {@link FtsAvailability} backed by the SQLite catalog.
 * <p>
 * The index table is looked up in {@code sqlite_master} on every call, so an index created or
 * dropped at runtime is picked up immediately. Any database error is logged and reported as
 * unavailable.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class SqliteFtsAvailabilityProbe implements FtsAvailability {
    private static final Logger logger = Logger.getLogger(SqliteFtsAvailabilityProbe.class.getName());

    static final String CATALOG_QUERY = "SELECT COUNT(*) FROM sqlite_master WHERE type = 'table' AND name = ?";

    private final JdbcTemplate jdbcTemplate;

    public SqliteFtsAvailabilityProbe(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = Objects.requireNonNull(jdbcTemplate, "jdbcTemplate cannot be null");
    }

    @Override
    public boolean isAvailable(String indexTable) {
        try {
            Long count = jdbcTemplate.queryForObject(CATALOG_QUERY, Long.class, indexTable);
            return count != null && count > 0;
        } catch (DataAccessException e) {
            logger.warning(() -> "Could not check index table '" + indexTable + "', assuming unavailable: " + e.getMessage());
            return false;
        }
    }
}
