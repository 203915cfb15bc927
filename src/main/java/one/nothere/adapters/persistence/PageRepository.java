package one.nothere.adapters.persistence;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import one.nothere.domain.crawl.ExtractedLink;
import one.nothere.domain.crawl.PageRecord;
import one.nothere.domain.scoring.ScorablePage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

/**
 * Postgres adapter for the {@code pages} and {@code links} tables.
 *
 * <p>Writes are idempotent: pages upsert on {@code url_hash} and links skip
 * rows already recorded for the same source page, so concurrent or repeated
 * crawls of one URL converge on a single page row.</p>
 */
@Repository
public class PageRepository {

    private static final Logger log = LoggerFactory.getLogger(PageRepository.class);

    private static final RowMapper<ScorablePage> SCORABLE_PAGE_MAPPER = (rs, rowNum) -> {
        Timestamp crawledAt = rs.getTimestamp("crawled_at");
        return new ScorablePage(
            rs.getLong("id"),
            rs.getString("url"),
            rs.getString("domain"),
            rs.getString("title"),
            rs.getString("content"),
            crawledAt != null ? crawledAt.toInstant() : null
        );
    };

    private final JdbcTemplate jdbcTemplate;

    public PageRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    /**
     * Whether a page with this URL hash has been persisted.
     */
    @Transactional(readOnly = true)
    public boolean existsByUrlHash(String urlHash) {
        Boolean exists = jdbcTemplate.queryForObject(
            "SELECT EXISTS (SELECT 1 FROM pages WHERE url_hash = ?)",
            Boolean.class,
            urlHash
        );
        return Boolean.TRUE.equals(exists);
    }

    /**
     * Upserts the page and records its outbound links in one transaction.
     *
     * @return id of the inserted or updated page row
     */
    @Transactional
    public long savePageWithLinks(PageRecord page, List<ExtractedLink> links) {
        long pageId = upsertPage(page);
        int inserted = insertLinks(pageId, links);
        log.debug("Saved page {} ({}) with {} new links", pageId, page.url(), inserted);
        return pageId;
    }

    long upsertPage(PageRecord page) {
        String sql = """
            INSERT INTO pages (url, url_hash, domain, title, content, crawled_at)
            VALUES (?, ?, ?, ?, ?, ?)
            ON CONFLICT (url_hash) DO UPDATE
            SET title = EXCLUDED.title,
                content = EXCLUDED.content,
                crawled_at = EXCLUDED.crawled_at
            RETURNING id
            """;
        Long id = jdbcTemplate.queryForObject(
            sql,
            Long.class,
            page.url(),
            page.urlHash(),
            page.domain(),
            page.title(),
            page.content(),
            Timestamp.from(page.crawledAt())
        );
        if (id == null) {
            throw new IllegalStateException("Page upsert returned no id for " + page.url());
        }
        return id;
    }

    int insertLinks(long sourcePageId, List<ExtractedLink> links) {
        if (links == null || links.isEmpty()) {
            return 0;
        }
        List<Object[]> batch = new ArrayList<>(links.size());
        for (ExtractedLink link : links) {
            batch.add(new Object[] {sourcePageId, link.targetUrl(), link.linkText()});
        }
        int[] counts = jdbcTemplate.batchUpdate(
            """
            INSERT INTO links (source_page_id, target_url, link_text)
            VALUES (?, ?, ?)
            ON CONFLICT (source_page_id, target_url) DO NOTHING
            """,
            batch
        );
        int inserted = 0;
        for (int count : counts) {
            if (count > 0) {
                inserted += count;
            }
        }
        return inserted;
    }

    /**
     * Loads the fields the scoring engine needs for one page.
     */
    @Transactional(readOnly = true)
    public Optional<ScorablePage> findScorablePage(long pageId) {
        List<ScorablePage> pages = jdbcTemplate.query(
            "SELECT id, url, domain, title, content, crawled_at FROM pages WHERE id = ?",
            SCORABLE_PAGE_MAPPER,
            pageId
        );
        return pages.stream().findFirst();
    }

    /**
     * Ids of pages with content, never-scored pages first, then oldest score first.
     *
     * @param limit maximum ids to return, null for all
     */
    @Transactional(readOnly = true)
    public List<Long> findIdsForRescoring(Integer limit) {
        String sql = """
            SELECT id FROM pages
            WHERE content IS NOT NULL
            ORDER BY scored_at ASC NULLS FIRST, id ASC
            """;
        if (limit != null) {
            return jdbcTemplate.queryForList(sql + " LIMIT ?", Long.class, limit);
        }
        return jdbcTemplate.queryForList(sql, Long.class);
    }

    /**
     * Earliest crawl timestamp recorded for a {@code pages.domain} value.
     */
    @Transactional(readOnly = true)
    public Optional<Instant> findFirstCrawlOfDomain(String domain) {
        Timestamp firstSeen = jdbcTemplate.queryForObject(
            "SELECT MIN(crawled_at) FROM pages WHERE domain = ?",
            Timestamp.class,
            domain
        );
        return Optional.ofNullable(firstSeen).map(Timestamp::toInstant);
    }
}
