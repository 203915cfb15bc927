package one.nothere.adapters.persistence;

import java.util.List;
import java.util.Optional;
import one.nothere.application.frontier.FrontierStore;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

/**
 * Frontier shared by every crawler process through Postgres.
 *
 * <p>Membership lives in {@code frontier_members} and the FIFO in
 * {@code frontier_queue}. Dequeue claims the oldest row with
 * {@code FOR UPDATE SKIP LOCKED} so concurrent workers never pop the same URL.</p>
 */
@Repository
@ConditionalOnProperty(prefix = "crawler.frontier", name = "store", havingValue = "jdbc", matchIfMissing = true)
public class JdbcFrontierStore implements FrontierStore {

    private final JdbcTemplate jdbcTemplate;

    public JdbcFrontierStore(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    @Transactional
    public boolean offer(String normalizedUrl) {
        int added = jdbcTemplate.update(
            "INSERT INTO frontier_members (url) VALUES (?) ON CONFLICT (url) DO NOTHING",
            normalizedUrl
        );
        if (added == 0) {
            return false;
        }
        jdbcTemplate.update("INSERT INTO frontier_queue (url) VALUES (?)", normalizedUrl);
        return true;
    }

    @Override
    @Transactional
    public Optional<String> poll() {
        List<String> urls = jdbcTemplate.queryForList(
            """
            DELETE FROM frontier_queue
            WHERE id = (
                SELECT id FROM frontier_queue
                ORDER BY id
                LIMIT 1
                FOR UPDATE SKIP LOCKED
            )
            RETURNING url
            """,
            String.class
        );
        return urls.stream().findFirst();
    }

    @Override
    @Transactional(readOnly = true)
    public boolean isMember(String normalizedUrl) {
        Boolean member = jdbcTemplate.queryForObject(
            "SELECT EXISTS (SELECT 1 FROM frontier_members WHERE url = ?)",
            Boolean.class,
            normalizedUrl
        );
        return Boolean.TRUE.equals(member);
    }

    @Override
    @Transactional(readOnly = true)
    public long queueSize() {
        Long size = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM frontier_queue", Long.class);
        return size == null ? 0 : size;
    }

    @Override
    @Transactional(readOnly = true)
    public long memberCount() {
        Long size = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM frontier_members", Long.class);
        return size == null ? 0 : size;
    }

    @Override
    @Transactional
    public void clear() {
        jdbcTemplate.update("DELETE FROM frontier_queue");
        jdbcTemplate.update("DELETE FROM frontier_members");
    }
}
