package one.nothere.adapters.persistence;

import java.util.List;
import java.util.Optional;
import one.nothere.domain.scoring.EquityRecord;
import one.nothere.domain.scoring.OrgBlocklistRecord;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

/**
 * Read-only lookups of per-domain and per-URL signals used by the scorers:
 * organisation flags, equity certifications and inbound link counts.
 */
@Repository
@Transactional(readOnly = true)
public class DomainSignalRepository {

    private final JdbcTemplate jdbcTemplate;

    public DomainSignalRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public Optional<OrgBlocklistRecord> findOrgBlocklist(String bareDomain) {
        List<OrgBlocklistRecord> rows = jdbcTemplate.query(
            """
            SELECT domain, splc_flagged, aclu_flagged, cair_flagged, adl_flagged, other_org_flagged, reason
            FROM org_blocklist
            WHERE domain = ?
            """,
            (rs, rowNum) -> new OrgBlocklistRecord(
                rs.getString("domain"),
                rs.getBoolean("splc_flagged"),
                rs.getBoolean("aclu_flagged"),
                rs.getBoolean("cair_flagged"),
                rs.getBoolean("adl_flagged"),
                rs.getBoolean("other_org_flagged"),
                rs.getString("reason")
            ),
            bareDomain
        );
        return rows.stream().findFirst();
    }

    public Optional<EquityRecord> findEquity(String bareDomain) {
        List<EquityRecord> rows = jdbcTemplate.query(
            """
            SELECT domain, minority_owned, women_owned, veteran_owned, b_corp, lgbtq_owned, disability_owned
            FROM equity_domains
            WHERE domain = ?
            """,
            (rs, rowNum) -> new EquityRecord(
                rs.getString("domain"),
                rs.getBoolean("minority_owned"),
                rs.getBoolean("women_owned"),
                rs.getBoolean("veteran_owned"),
                rs.getBoolean("b_corp"),
                rs.getBoolean("lgbtq_owned"),
                rs.getBoolean("disability_owned")
            ),
            bareDomain
        );
        return rows.stream().findFirst();
    }

    /**
     * Distinct pages linking to exactly {@code targetUrl}.
     */
    public long countBacklinks(String targetUrl) {
        Long count = jdbcTemplate.queryForObject(
            "SELECT COUNT(DISTINCT source_page_id) FROM links WHERE target_url = ?",
            Long.class,
            targetUrl
        );
        return count == null ? 0 : count;
    }

    /**
     * Distinct referring domains ending in {@code suffix} (for example {@code .edu}) that link to {@code targetUrl}.
     */
    public long countReferringDomainsWithSuffix(String targetUrl, String suffix) {
        Long count = jdbcTemplate.queryForObject(
            """
            SELECT COUNT(DISTINCT p.domain)
            FROM links l
            JOIN pages p ON l.source_page_id = p.id
            WHERE l.target_url = ?
              AND p.domain LIKE ?
            """,
            Long.class,
            targetUrl,
            "%" + suffix
        );
        return count == null ? 0 : count;
    }
}
