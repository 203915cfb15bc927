package one.nothere.runner;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

/**
 * Verifies the database answers before any command runs; startup aborts otherwise.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class DatastoreStartupCheck implements CommandLineRunner {

    private static final Logger log = LoggerFactory.getLogger(DatastoreStartupCheck.class);

    private final JdbcTemplate jdbcTemplate;

    public DatastoreStartupCheck(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public void run(String... args) {
        try {
            jdbcTemplate.queryForObject("SELECT 1", Integer.class);
            log.info("Database connection verified");
        } catch (DataAccessException e) {
            log.error("Database unavailable at startup: {}", e.getMessage());
            throw new IllegalStateException("Cannot connect to the database", e);
        }
    }
}
